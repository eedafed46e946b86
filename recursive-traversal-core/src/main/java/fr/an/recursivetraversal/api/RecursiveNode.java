package fr.an.recursivetraversal.api;

/**
 * capability of a cursor whose current position may itself hold a nested sub-tree
 */
public interface RecursiveNode<K,V> extends NodeCursor<K,V> {

	/** 
	 * @return true when the current position holds nested content, false when invalid.
	 * must not move the cursor
	 */
	public boolean hasChildren();

	/**
	 * @return a new node, independently positioned, over the nested content of the current position.
	 * Look-ahead wrappers (CachingNode) return the node cached for the current position instead
	 * @throws IllegalStateException when <code>hasChildren()</code> is false
	 */
	public RecursiveNode<K,V> getChildren();

}
