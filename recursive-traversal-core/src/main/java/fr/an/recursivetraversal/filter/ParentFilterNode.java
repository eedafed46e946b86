package fr.an.recursivetraversal.filter;

import fr.an.recursivetraversal.api.RecursiveNode;

/**
 * exposes only positions having children
 */
public class ParentFilterNode<K,V> extends FilterNode<K,V> {

	public ParentFilterNode(RecursiveNode<K,V> inner) {
		super(inner);
	}

	@Override
	public boolean accept() {
		return inner.hasChildren();
	}

	@Override
	protected ParentFilterNode<K,V> newChildFilter(RecursiveNode<K,V> innerChildren) {
		return new ParentFilterNode<>(innerChildren);
	}

	@Override
	public ParentFilterNode<K,V> getChildren() {
		return newChildFilter(inner.getChildren());
	}

}
