package fr.an.recursivetraversal.api;

/**
 * flat iteration protocol: a cursor over (key, current) positions
 * 
 * <code>current()</code> and <code>key()</code> return null when not <code>valid()</code>
 */
public interface NodeCursor<K,V> {

	public V current();

	public K key();

	public boolean valid();

	public void next();

	public void rewind();

}
