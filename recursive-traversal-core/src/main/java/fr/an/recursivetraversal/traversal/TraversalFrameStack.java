package fr.an.recursivetraversal.traversal;

import java.util.ArrayList;
import java.util.List;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;

/**
 * one frame per active depth, depth 0 being the root
 */
public class TraversalFrameStack<K,V> {

	private final List<TraversalFrame<K,V>> frames = new ArrayList<>();

	/** -1 for unlimited */
	@Getter
	private int maxDepth = -1;

	// ------------------------------------------------------------------------

	/** 
	 * @return index of the top frame, -1 when empty 
	 */
	public int getDepth() {
		return frames.size() - 1;
	}

	public boolean isEmpty() {
		return frames.isEmpty();
	}

	/** negative values mean unlimited */
	public void setMaxDepth(int maxDepth) {
		this.maxDepth = (maxDepth < 0)? -1 : maxDepth;
	}

	public void seed(RecursiveNode<K,V> root) {
		frames.clear();
		frames.add(new TraversalFrame<>(root));
	}

	public TraversalFrame<K,V> push(RecursiveNode<K,V> node) {
		TraversalFrame<K,V> frame = new TraversalFrame<>(node);
		frames.add(frame);
		return frame;
	}

	/**
	 * @return false (and do nothing) at depth 0 or when empty
	 */
	public boolean pop() {
		int depth = getDepth();
		if (depth <= 0) {
			return false;
		}
		frames.remove(depth);
		return true;
	}

	/**
	 * @return true when a descent from the current depth would go past maxDepth
	 */
	public boolean exceedsMaxDepth() {
		return maxDepth >= 0 && getDepth() >= maxDepth;
	}

	public TraversalFrame<K,V> top() {
		return frames.isEmpty()? null : frames.get(frames.size() - 1);
	}

	public TraversalFrame<K,V> get(int level) {
		return (level >= 0 && level < frames.size())? frames.get(level) : null;
	}

	public void clear() {
		frames.clear();
	}

}
