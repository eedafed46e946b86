package fr.an.recursivetraversal.traversal;

/**
 * what remains to be done for the current position of a frame
 */
public enum FrameState {
	/** node just rewound or advanced: check validity */
	START,
	/** check whether the current position is a container */
	TEST,
	/** emit the container itself */
	SELF,
	/** descend into the container */
	CHILD,
	/** position done: advance the node */
	NEXT
}
