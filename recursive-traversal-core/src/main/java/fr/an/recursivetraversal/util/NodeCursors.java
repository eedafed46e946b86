package fr.an.recursivetraversal.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Maps;

import fr.an.recursivetraversal.api.NodeCursor;

/**
 * helpers to consume a NodeCursor as java collections
 * 
 * all methods rewind the cursor first
 */
public class NodeCursors {

	private NodeCursors() {
	}

	/**
	 * @return Iterable of (key, current) entries. Each call to iterator() rewinds the cursor,
	 * so iterators of the same cursor must not be interleaved
	 */
	public static <K,V> Iterable<Map.Entry<K,V>> entries(NodeCursor<K,V> cursor) {
		return () -> iterator(cursor);
	}

	public static <K,V> Iterator<Map.Entry<K,V>> iterator(NodeCursor<K,V> cursor) {
		cursor.rewind();
		return new AbstractIterator<Map.Entry<K,V>>() {
			private boolean first = true;
			@Override
			protected Map.Entry<K,V> computeNext() {
				if (first) {
					first = false;
				} else {
					cursor.next();
				}
				if (! cursor.valid()) {
					return endOfData();
				}
				return Maps.immutableEntry(cursor.key(), cursor.current());
			}
		};
	}

	public static <K,V> List<Map.Entry<K,V>> toList(NodeCursor<K,V> cursor) {
		List<Map.Entry<K,V>> res = new ArrayList<>();
		for(Map.Entry<K,V> e : entries(cursor)) {
			res.add(e);
		}
		return res;
	}

	public static <K,V> List<K> keys(NodeCursor<K,V> cursor) {
		List<K> res = new ArrayList<>();
		for(cursor.rewind(); cursor.valid(); cursor.next()) {
			res.add(cursor.key());
		}
		return res;
	}

	public static <K,V> List<V> values(NodeCursor<K,V> cursor) {
		List<V> res = new ArrayList<>();
		for(cursor.rewind(); cursor.valid(); cursor.next()) {
			res.add(cursor.current());
		}
		return res;
	}

	public static int count(NodeCursor<?,?> cursor) {
		int count = 0;
		for(cursor.rewind(); cursor.valid(); cursor.next()) {
			count++;
		}
		return count;
	}

}
