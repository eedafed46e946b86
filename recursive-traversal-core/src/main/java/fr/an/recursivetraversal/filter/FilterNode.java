package fr.an.recursivetraversal.filter;

import com.google.common.base.Preconditions;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;

/**
 * RecursiveNode exposing only the positions of an inner node that <code>accept()</code> 
 * 
 * after rewind() or next(), this node is either invalid or positioned on an accepted position.
 * children of the inner node are wrapped again with <code>newChildFilter()</code>, 
 * so the same filtering applies at every depth
 */
public abstract class FilterNode<K,V> implements RecursiveNode<K,V> {

	@Getter
	protected final RecursiveNode<K,V> inner;

	// ------------------------------------------------------------------------

	protected FilterNode(RecursiveNode<K,V> inner) {
		Preconditions.checkArgument(inner != null, "inner node must not be null");
		this.inner = inner;
	}

	/** admission predicate, evaluated on the current position of the inner node */
	public abstract boolean accept();

	/** @return a filter of the same kind and configuration, over <code>innerChildren</code> */
	protected abstract FilterNode<K,V> newChildFilter(RecursiveNode<K,V> innerChildren);

	// ------------------------------------------------------------------------

	@Override
	public void rewind() {
		inner.rewind();
		fetchAccepted();
	}

	@Override
	public void next() {
		inner.next();
		fetchAccepted();
	}

	protected void fetchAccepted() {
		while (inner.valid() && ! accept()) {
			inner.next();
		}
	}

	@Override
	public boolean valid() {
		return inner.valid();
	}

	@Override
	public V current() {
		return inner.current();
	}

	@Override
	public K key() {
		return inner.key();
	}

	@Override
	public boolean hasChildren() {
		return inner.hasChildren();
	}

	@Override
	public FilterNode<K,V> getChildren() {
		return newChildFilter(inner.getChildren());
	}

}
