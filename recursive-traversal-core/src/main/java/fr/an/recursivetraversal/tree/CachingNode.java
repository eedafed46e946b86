package fr.an.recursivetraversal.tree;

import com.google.common.base.Preconditions;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;

/**
 * RecursiveNode wrapper staying one position ahead of its inner node, to answer <code>hasNext()</code>
 * 
 * current position values, including its children node, are copied before the inner node moves on
 */
public class CachingNode<K,V> implements RecursiveNode<K,V> {

	@Getter
	private final RecursiveNode<K,V> inner;

	private boolean cachedValid;
	private V cachedCurrent;
	private K cachedKey;
	private CachingNode<K,V> cachedChildren;

	// ------------------------------------------------------------------------

	public CachingNode(RecursiveNode<K,V> inner) {
		Preconditions.checkArgument(inner != null, "inner node must not be null");
		this.inner = inner;
	}

	// ------------------------------------------------------------------------

	@Override
	public void rewind() {
		inner.rewind();
		fetch();
	}

	@Override
	public void next() {
		fetch();
	}

	protected void fetch() {
		if (! inner.valid()) {
			this.cachedValid = false;
			this.cachedCurrent = null;
			this.cachedKey = null;
			this.cachedChildren = null;
			return;
		}
		this.cachedValid = true;
		this.cachedCurrent = inner.current();
		this.cachedKey = inner.key();
		this.cachedChildren = (inner.hasChildren())? new CachingNode<>(inner.getChildren()) : null;
		inner.next();
	}

	/** @return true when a position follows the current one */
	public boolean hasNext() {
		return inner.valid();
	}

	@Override
	public boolean valid() {
		return cachedValid;
	}

	@Override
	public V current() {
		return cachedCurrent;
	}

	@Override
	public K key() {
		return cachedKey;
	}

	@Override
	public boolean hasChildren() {
		return cachedChildren != null;
	}

	/**
	 * @return the children node cached when this position was fetched. 
	 * Unlike other RecursiveNode, the same instance is returned on each call for the same position:
	 * the inner node has already moved on, so its children can not be read again
	 */
	@Override
	public CachingNode<K,V> getChildren() {
		if (cachedChildren == null) {
			throw new IllegalStateException("no children at " + ((cachedValid)? "key " + cachedKey : "invalid position"));
		}
		return cachedChildren;
	}

}
