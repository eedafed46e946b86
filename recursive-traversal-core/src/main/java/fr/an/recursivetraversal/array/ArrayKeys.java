package fr.an.recursivetraversal.array;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import lombok.val;

/**
 * key helpers for in-memory containers: integer keys (normalized to Long) and String keys
 */
public class ArrayKeys {

	private ArrayKeys() {
	}

	/**
	 * @return true for values traversed as nested containers
	 */
	public static boolean isContainer(Object value) {
		return value instanceof Map || value instanceof List;
	}

	public static Object normalizeKey(Object key) {
		if (key instanceof Long || key instanceof String) {
			return key;
		}
		if (key instanceof Integer || key instanceof Short || key instanceof Byte) {
			return ((Number) key).longValue();
		}
		throw new IllegalArgumentException("unsupported container key type: " 
				+ ((key != null)? key.getClass().getName() : "null"));
	}

	/**
	 * integer keys ascending, then String keys lexicographically ascending
	 */
	public static ImmutableList<Object> sortedKeys(Collection<?> keys) {
		val intKeys = new ArrayList<Long>();
		val stringKeys = new ArrayList<String>();
		for(Object key : keys) {
			val normKey = normalizeKey(key);
			if (normKey instanceof Long) {
				intKeys.add((Long) normKey);
			} else {
				stringKeys.add((String) normKey);
			}
		}
		intKeys.sort(Ordering.natural());
		stringKeys.sort(Ordering.natural());
		return ImmutableList.<Object>builder().addAll(intKeys).addAll(stringKeys).build();
	}

}
