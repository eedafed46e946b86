package fr.an.recursivetraversal.tree;

import java.util.List;
import java.util.Map;

import fr.an.recursivetraversal.api.NodeCursor;
import fr.an.recursivetraversal.api.RecursiveNode;
import fr.an.recursivetraversal.api.TraversalMode;
import fr.an.recursivetraversal.traversal.RecursiveTraversal;
import lombok.Getter;
import lombok.Setter;

/**
 * renders a RecursiveNode tree as text lines, one per position, prefixed with ASCII tree graphics
 * 
 * <PRE>
 * |-a
 * |-b
 * | |-b1
 * | \-b2
 * \-c
 * </PRE>
 */
public class TreeRenderer<K,V> implements NodeCursor<Object,Object> {

	public static final int BYPASS_CURRENT = 4;
	public static final int BYPASS_KEY = 8;

	public static final int PREFIX_LEFT = 0;
	public static final int PREFIX_MID_HAS_NEXT = 1;
	public static final int PREFIX_MID_LAST = 2;
	public static final int PREFIX_END_HAS_NEXT = 3;
	public static final int PREFIX_END_LAST = 4;
	public static final int PREFIX_RIGHT = 5;

	private final RecursiveTraversal<K,V> traversal;

	@Getter
	private final int flags;

	private final String[] prefixParts = { "", "| ", "  ", "|-", "\\-", "" };

	@Getter @Setter
	private String postfix = "";

	// ------------------------------------------------------------------------

	public TreeRenderer(RecursiveNode<K,V> root) {
		this(root, 0, TraversalMode.SELF_FIRST);
	}

	public TreeRenderer(RecursiveNode<K,V> root, int flags, TraversalMode mode) {
		this.traversal = new RecursiveTraversal<>(new CachingNode<>(root), mode);
		this.flags = flags;
	}

	// ------------------------------------------------------------------------

	public void setPrefixPart(int part, String value) {
		if (part < PREFIX_LEFT || part > PREFIX_RIGHT) {
			throw new IllegalArgumentException("prefix part must be in [" + PREFIX_LEFT + ", " + PREFIX_RIGHT + "], got " + part);
		}
		prefixParts[part] = (value != null)? value : "";
	}

	public String getPrefix() {
		if (! traversal.valid()) {
			return "";
		}
		int depth = traversal.getDepth();
		StringBuilder sb = new StringBuilder();
		sb.append(prefixParts[PREFIX_LEFT]);
		for(int level = 0; level < depth; level++) {
			sb.append(subNodeAt(level).hasNext()? prefixParts[PREFIX_MID_HAS_NEXT] : prefixParts[PREFIX_MID_LAST]);
		}
		sb.append(subNodeAt(depth).hasNext()? prefixParts[PREFIX_END_HAS_NEXT] : prefixParts[PREFIX_END_LAST]);
		sb.append(prefixParts[PREFIX_RIGHT]);
		return sb.toString();
	}

	public String getEntry() {
		if (! traversal.valid()) {
			return null;
		}
		Object value = traversal.current();
		if (value instanceof Map || value instanceof List) {
			return "Array";
		}
		return String.valueOf(value);
	}

	@SuppressWarnings("unchecked")
	private CachingNode<K,V> subNodeAt(int level) {
		// root and all children are CachingNode, see constructor and CachingNode.getChildren()
		return (CachingNode<K,V>) traversal.getSubNode(level);
	}

	public int getDepth() {
		return traversal.getDepth();
	}

	public int getMaxDepth() {
		return traversal.getMaxDepth();
	}

	public void setMaxDepth(int maxDepth) {
		traversal.setMaxDepth(maxDepth);
	}

	// implements NodeCursor
	// ------------------------------------------------------------------------

	@Override
	public Object current() {
		if (! traversal.valid()) {
			return null;
		}
		if ((flags & BYPASS_CURRENT) != 0) {
			return traversal.current();
		}
		return getPrefix() + getEntry() + postfix;
	}

	@Override
	public Object key() {
		if (! traversal.valid()) {
			return null;
		}
		if ((flags & BYPASS_KEY) != 0) {
			return traversal.key();
		}
		return getPrefix() + traversal.key() + postfix;
	}

	@Override
	public boolean valid() {
		return traversal.valid();
	}

	@Override
	public void next() {
		traversal.next();
	}

	@Override
	public void rewind() {
		traversal.rewind();
	}

}
