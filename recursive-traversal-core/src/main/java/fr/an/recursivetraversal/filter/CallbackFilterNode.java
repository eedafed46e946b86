package fr.an.recursivetraversal.filter;

import com.google.common.base.Preconditions;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;

/**
 * exposes positions accepted by a NodeFilterCallback
 * 
 * the callback also decides for containers: a rejected container hides its whole sub-tree
 */
public class CallbackFilterNode<K,V> extends FilterNode<K,V> {

	@Getter
	private final NodeFilterCallback<K,V> callback;

	public CallbackFilterNode(RecursiveNode<K,V> inner, NodeFilterCallback<K,V> callback) {
		super(inner);
		Preconditions.checkArgument(callback != null, "callback must not be null");
		this.callback = callback;
	}

	@Override
	public boolean accept() {
		return callback.accept(inner.current(), inner.key(), inner);
	}

	@Override
	protected CallbackFilterNode<K,V> newChildFilter(RecursiveNode<K,V> innerChildren) {
		return new CallbackFilterNode<>(innerChildren, callback);
	}

	@Override
	public CallbackFilterNode<K,V> getChildren() {
		return newChildFilter(inner.getChildren());
	}

}
