package fr.an.recursivetraversal.traversal;

/**
 * callbacks fired by RecursiveTraversal while it moves through the frames
 */
public abstract class TraversalListener<K,V> {

	/** on rewind(), once the root frame is seeded */
	public abstract void beginIteration(RecursiveTraversal<K,V> traversal);

	/** once, when the traversal gets exhausted */
	public abstract void endIteration(RecursiveTraversal<K,V> traversal);

	/** after a children frame was pushed and rewound, <code>depth</code> being its depth */
	public abstract void beginChildren(RecursiveTraversal<K,V> traversal, int depth);

	/** before the frame at <code>depth</code> is popped */
	public abstract void endChildren(RecursiveTraversal<K,V> traversal, int depth);

	/** on each position made visible */
	public abstract void nextElement(RecursiveTraversal<K,V> traversal);

	
	// ------------------------------------------------------------------------
	
	public static class DefaultTraversalListener<K,V> extends TraversalListener<K,V> {
		@Override
		public void beginIteration(RecursiveTraversal<K,V> traversal) {
			// do nothing
		}

		@Override
		public void endIteration(RecursiveTraversal<K,V> traversal) {
			// do nothing
		}

		@Override
		public void beginChildren(RecursiveTraversal<K,V> traversal, int depth) {
			// do nothing
		}

		@Override
		public void endChildren(RecursiveTraversal<K,V> traversal, int depth) {
			// do nothing
		}

		@Override
		public void nextElement(RecursiveTraversal<K,V> traversal) {
			// do nothing
		}
	}

}
