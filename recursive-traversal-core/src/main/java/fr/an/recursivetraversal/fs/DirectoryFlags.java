package fr.an.recursivetraversal.fs;

/**
 * bitmask flags of DirectoryNode
 */
public final class DirectoryFlags {

	private DirectoryFlags() {
	}

	public static final int CURRENT_AS_FILEINFO = 0;
	public static final int CURRENT_AS_SELF = 16;
	public static final int CURRENT_AS_PATHNAME = 32;
	public static final int CURRENT_MODE_MASK = 240;

	public static final int KEY_AS_PATHNAME = 0;
	public static final int KEY_AS_FILENAME = 256;
	public static final int FOLLOW_SYMLINKS = 512;
	public static final int KEY_MODE_MASK = 3840;

	public static final int NEW_CURRENT_AND_KEY = KEY_AS_FILENAME | CURRENT_AS_FILEINFO;

	public static final int SKIP_DOTS = 4096;
	public static final int UNIX_PATHS = 8192;

	public static boolean isSet(int flags, int flag) {
		return (flags & flag) != 0;
	}

}
