package fr.an.recursivetraversal.array;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.val;

/**
 * RecursiveNode over an in-memory container: a <code>Map</code> with Long/Integer/String keys, 
 * or a <code>List</code> (keys are indexes)
 * 
 * key/value pairs are copied at construction, in key order (see ArrayKeys.sortedKeys)
 * a value is a child when it is itself a <code>Map</code> or a <code>List</code>
 */
public class ArrayNode implements RecursiveNode<Object,Object> {

	private final ImmutableList<Object> keys;

	// may contain null values
	private final List<Object> values;

	private int position;

	// ------------------------------------------------------------------------

	public ArrayNode(Map<?,?> array) {
		Preconditions.checkArgument(array != null, "array must not be null");
		val normalized = new HashMap<Object,Object>();
		for(Map.Entry<?,?> e : array.entrySet()) {
			val key = ArrayKeys.normalizeKey(e.getKey());
			Preconditions.checkArgument(! normalized.containsKey(key), 
					"duplicate key %s after normalization of %s", key, e.getKey());
			normalized.put(key, e.getValue());
		}
		this.keys = ArrayKeys.sortedKeys(normalized.keySet());
		val sortedValues = new ArrayList<Object>(keys.size());
		for(val key : keys) {
			sortedValues.add(normalized.get(key));
		}
		this.values = Collections.unmodifiableList(sortedValues);
	}

	public ArrayNode(List<?> list) {
		Preconditions.checkArgument(list != null, "list must not be null");
		val indexKeys = ImmutableList.<Object>builder();
		for(long i = 0; i < list.size(); i++) {
			indexKeys.add(i);
		}
		this.keys = indexKeys.build();
		this.values = Collections.unmodifiableList(new ArrayList<Object>(list));
	}

	/** @return a node over <code>container</code>, which must be a Map or a List */
	public static ArrayNode of(Object container) {
		if (container instanceof Map) {
			return new ArrayNode((Map<?,?>) container);
		} else if (container instanceof List) {
			return new ArrayNode((List<?>) container);
		}
		throw new IllegalArgumentException("not a container: " 
				+ ((container != null)? container.getClass().getName() : "null"));
	}

	// ------------------------------------------------------------------------

	@Override
	public Object current() {
		return valid()? values.get(position) : null;
	}

	@Override
	public Object key() {
		return valid()? keys.get(position) : null;
	}

	@Override
	public boolean valid() {
		return position >= 0 && position < keys.size();
	}

	@Override
	public void next() {
		if (position < keys.size()) {
			position++;
		}
	}

	@Override
	public void rewind() {
		position = 0;
	}

	@Override
	public boolean hasChildren() {
		return valid() && ArrayKeys.isContainer(values.get(position));
	}

	@Override
	public ArrayNode getChildren() {
		if (! hasChildren()) {
			throw new IllegalStateException("no children at position " + position 
					+ ((valid())? " (key " + keys.get(position) + ")" : " (invalid)"));
		}
		return of(values.get(position));
	}

	// ------------------------------------------------------------------------

	public int count() {
		return keys.size();
	}

	/** @return the snapshot keys, in iteration order */
	public ImmutableList<Object> keys() {
		return keys;
	}

	@Override
	public String toString() {
		return "ArrayNode [" + keys.size() + " entries" 
				+ ((valid())? ", at " + keys.get(position) : "") 
				+ "]";
	}

}
