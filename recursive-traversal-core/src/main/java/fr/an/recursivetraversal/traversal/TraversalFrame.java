package fr.an.recursivetraversal.traversal;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;
import lombok.Setter;

public class TraversalFrame<K,V> {

	@Getter
	private final RecursiveNode<K,V> node;

	@Getter @Setter
	private FrameState state = FrameState.START;

	public TraversalFrame(RecursiveNode<K,V> node) {
		this.node = node;
	}

	@Override
	public String toString() {
		return "TraversalFrame [" + state + ", " + node + "]";
	}

}
