package fr.an.recursivetraversal.fs;

public enum FsEntryType {
	FILE,
	DIR,
	SYMLINK,
	OTHER
}
