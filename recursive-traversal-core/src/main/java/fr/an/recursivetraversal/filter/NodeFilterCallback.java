package fr.an.recursivetraversal.filter;

import fr.an.recursivetraversal.api.RecursiveNode;

@FunctionalInterface
public interface NodeFilterCallback<K,V> {

	public boolean accept(V current, K key, RecursiveNode<K,V> node);

}
