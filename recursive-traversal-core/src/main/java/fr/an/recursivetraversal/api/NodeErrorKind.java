package fr.an.recursivetraversal.api;

public enum NodeErrorKind {
	INVALID_PATH,
	NOT_FOUND,
	NOT_A_DIRECTORY,
	PERMISSION_DENIED,
	READ_FAILED
}
