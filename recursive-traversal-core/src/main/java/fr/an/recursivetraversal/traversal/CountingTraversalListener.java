package fr.an.recursivetraversal.traversal;

import lombok.Getter;

public class CountingTraversalListener<K,V> extends TraversalListener<K,V> {

	@Getter
	private int iterationCount;

	@Getter
	private int endIterationCount;

	@Getter
	private int beginChildrenCount;

	@Getter
	private int endChildrenCount;

	@Getter
	private int elementCount;

	@Getter
	private int maxDepthSeen;

	@Override
	public void beginIteration(RecursiveTraversal<K,V> traversal) {
		iterationCount++;
	}

	@Override
	public void endIteration(RecursiveTraversal<K,V> traversal) {
		endIterationCount++;
	}

	@Override
	public void beginChildren(RecursiveTraversal<K,V> traversal, int depth) {
		beginChildrenCount++;
		maxDepthSeen = Math.max(maxDepthSeen, depth);
	}

	@Override
	public void endChildren(RecursiveTraversal<K,V> traversal, int depth) {
		endChildrenCount++;
	}

	@Override
	public void nextElement(RecursiveTraversal<K,V> traversal) {
		elementCount++;
	}

}
