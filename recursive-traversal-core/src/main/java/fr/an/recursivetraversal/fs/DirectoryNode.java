package fr.an.recursivetraversal.fs;

import java.io.File;
import java.nio.file.Paths;

import com.google.common.collect.ImmutableList;

import fr.an.recursivetraversal.api.NodeAccessException;
import fr.an.recursivetraversal.api.NodeErrorKind;
import fr.an.recursivetraversal.api.RecursiveNode;
import lombok.Getter;
import lombok.Setter;
import lombok.val;

/**
 * RecursiveNode over a directory of the file system
 *
 * entries are listed once, at construction, and iterated from this snapshot.
 * key() and current() rendering depend on the DirectoryFlags given as <code>flags</code>
 */
public class DirectoryNode implements RecursiveNode<String,Object> {

	@Getter
	private final String path;

	/** path relative to the directory where the recursion started, "" for the start directory */
	@Getter
	private final String subPath;

	@Getter @Setter
	private int flags;

	private final ImmutableList<DirEntry> entries;

	private int position;

	// ------------------------------------------------------------------------

	public DirectoryNode(String path) {
		this(path, 0);
	}

	public DirectoryNode(String path, int flags) {
		this(path, flags, "");
	}

	protected DirectoryNode(String path, int flags, String subPath) {
		if (path == null || path.isEmpty()) {
			throw new NodeAccessException(NodeErrorKind.INVALID_PATH, path, "Path cannot be empty");
		}
		this.path = stripTrailingSeparator(path);
		this.flags = flags;
		this.subPath = subPath;
		val listed = JavaNIODirectoryLister.list(Paths.get(this.path));
		val entriesBuilder = ImmutableList.<DirEntry>builder();
		if (! DirectoryFlags.isSet(flags, DirectoryFlags.SKIP_DOTS)) {
			entriesBuilder.add(DirEntry.dot(DirEntry.DOT));
			entriesBuilder.add(DirEntry.dot(DirEntry.DOT_DOT));
		}
		this.entries = entriesBuilder.addAll(listed).build();
	}

	private static String stripTrailingSeparator(String path) {
		String res = path;
		while (res.length() > 1 && (res.endsWith("/") || res.endsWith(File.separator))) {
			res = res.substring(0, res.length() - 1);
		}
		return res;
	}

	// ------------------------------------------------------------------------

	@Override
	public Object current() {
		if (! valid()) {
			return null;
		}
		switch (flags & DirectoryFlags.CURRENT_MODE_MASK) {
		case DirectoryFlags.CURRENT_AS_PATHNAME:
			return getPathname();
		case DirectoryFlags.CURRENT_AS_SELF:
			return this;
		default:
			return getFileInfo();
		}
	}

	@Override
	public String key() {
		if (! valid()) {
			return null;
		}
		if (DirectoryFlags.isSet(flags, DirectoryFlags.KEY_AS_FILENAME)) {
			return getFilename();
		}
		return getPathname();
	}

	@Override
	public boolean valid() {
		return position >= 0 && position < entries.size();
	}

	@Override
	public void next() {
		if (position < entries.size()) {
			position++;
		}
	}

	@Override
	public void rewind() {
		position = 0;
	}

	@Override
	public boolean hasChildren() {
		if (! valid()) {
			return false;
		}
		val entry = entries.get(position);
		if (entry.isDot() || ! entry.isDirectory()) {
			return false;
		}
		return ! entry.isSymlink() || DirectoryFlags.isSet(flags, DirectoryFlags.FOLLOW_SYMLINKS);
	}

	@Override
	public DirectoryNode getChildren() {
		if (! hasChildren()) {
			throw new IllegalStateException("Cannot get children of "
					+ ((valid())? getPathname() : "invalid position") + " in " + path);
		}
		return new DirectoryNode(getPathname(), flags, getSubPathname());
	}

	// ------------------------------------------------------------------------

	public DirEntry getEntry() {
		return valid()? entries.get(position) : null;
	}

	public String getFilename() {
		return valid()? entries.get(position).name : null;
	}

	public String getPathname() {
		return valid()? childPath(entries.get(position).name) : null;
	}

	protected String childPath(String name) {
		// root directory "/" already ends with a separator
		if (path.endsWith("/") || path.endsWith(File.separator)) {
			return path + name;
		}
		return path + separator() + name;
	}

	public FileInfo getFileInfo() {
		return valid()? FileInfo.read(getPathname(), entries.get(position)) : null;
	}

	/** @return sub-path of the current entry, relative to the start directory */
	public String getSubPathname() {
		if (! valid()) {
			return null;
		}
		val name = entries.get(position).name;
		return subPath.isEmpty()? name : subPath + separator() + name;
	}

	public boolean isDot() {
		return valid() && entries.get(position).isDot();
	}

	public int count() {
		return entries.size();
	}

	protected char separator() {
		return DirectoryFlags.isSet(flags, DirectoryFlags.UNIX_PATHS)? '/' : File.separatorChar;
	}

	@Override
	public String toString() {
		return "DirectoryNode [" + path + ", " + entries.size() + " entries"
				+ ((valid())? ", at " + entries.get(position).name : "")
				+ "]";
	}

}
