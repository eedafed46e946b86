package fr.an.recursivetraversal.api;

import lombok.Getter;

/**
 * failure to build a node over its backing data, for example a directory that does not exist
 */
public class NodeAccessException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	@Getter
	private final NodeErrorKind kind;

	@Getter
	private final String path;

	// ------------------------------------------------------------------------

	public NodeAccessException(NodeErrorKind kind, String path, String message) {
		this(kind, path, message, null);
	}

	public NodeAccessException(NodeErrorKind kind, String path, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.path = path;
	}

}
