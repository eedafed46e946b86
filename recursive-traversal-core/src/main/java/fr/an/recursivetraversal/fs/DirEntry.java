package fr.an.recursivetraversal.fs;

import lombok.AllArgsConstructor;

/**
 * one entry of a directory listing, as read at listing time
 */
@AllArgsConstructor
public class DirEntry {

	public static final String DOT = ".";
	public static final String DOT_DOT = "..";

	public final String name;
	public final FsEntryType type;

	/** for SYMLINK entries: whether the link target is a directory */
	public final boolean linkToDir;

	// ------------------------------------------------------------------------

	public static DirEntry dot(String name) {
		return new DirEntry(name, FsEntryType.DIR, false);
	}

	public boolean isDot() {
		return DOT.equals(name) || DOT_DOT.equals(name);
	}

	public boolean isDirectory() {
		return type == FsEntryType.DIR || (type == FsEntryType.SYMLINK && linkToDir);
	}

	public boolean isSymlink() {
		return type == FsEntryType.SYMLINK;
	}

	@Override
	public String toString() {
		return name + " (" + type + ")";
	}

}
