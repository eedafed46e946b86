package fr.an.recursivetraversal.api;

import lombok.Getter;

/**
 * order in which a recursive traversal emits positions
 */
public enum TraversalMode {

	/** only positions without children (or at the depth limit) */
	LEAVES_ONLY(0),
	
	/** pre-order: a container, then its sub-tree */
	SELF_FIRST(1),
	
	/** post-order: a sub-tree, then its container */
	CHILD_FIRST(2);

	@Getter
	private final int code;

	private TraversalMode(int code) {
		this.code = code;
	}

	public static TraversalMode fromCode(int code) {
		for(TraversalMode mode : values()) {
			if (mode.code == code) {
				return mode;
			}
		}
		throw new IllegalArgumentException("unknown traversal mode code: " + code);
	}

	/** containers are emitted before being expanded */
	public boolean isEmitBeforeChildren() {
		return this == SELF_FIRST;
	}

	/** containers are emitted once their sub-tree has been emitted */
	public boolean isEmitAfterChildren() {
		return this == CHILD_FIRST;
	}

}
