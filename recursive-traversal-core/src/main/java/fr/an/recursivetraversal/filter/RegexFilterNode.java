package fr.an.recursivetraversal.filter;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;

/**
 * exposes positions whose value (or key, with USE_KEY) contains a match of a regular expression
 * 
 * non-empty Map/List values are always accepted, so that their sub-tree can still be traversed 
 */
public class RegexFilterNode<K,V> extends FilterNode<K,V> {

	public static final int USE_KEY = 1;
	public static final int INVERT_MATCH = 2;

	@Getter
	private final Pattern pattern;

	@Getter
	private final int flags;

	// ------------------------------------------------------------------------

	public RegexFilterNode(RecursiveNode<K,V> inner, String regex) {
		this(inner, Pattern.compile(regex), 0);
	}

	public RegexFilterNode(RecursiveNode<K,V> inner, Pattern pattern, int flags) {
		super(inner);
		Preconditions.checkArgument(pattern != null, "pattern must not be null");
		this.pattern = pattern;
		this.flags = flags;
	}

	// ------------------------------------------------------------------------

	@Override
	public boolean accept() {
		Object value = inner.current();
		if (value instanceof Map) {
			return ! ((Map<?,?>) value).isEmpty();
		} else if (value instanceof List) {
			return ! ((List<?>) value).isEmpty();
		}
		Object subject = ((flags & USE_KEY) != 0)? inner.key() : value;
		boolean found = pattern.matcher(String.valueOf(subject)).find();
		return ((flags & INVERT_MATCH) != 0)? ! found : found;
	}

	@Override
	protected RegexFilterNode<K,V> newChildFilter(RecursiveNode<K,V> innerChildren) {
		return new RegexFilterNode<>(innerChildren, pattern, flags);
	}

	@Override
	public RegexFilterNode<K,V> getChildren() {
		return newChildFilter(inner.getChildren());
	}

}
