package fr.an.recursivetraversal.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import fr.an.recursivetraversal.api.NodeAccessException;
import fr.an.recursivetraversal.api.NodeErrorKind;
import lombok.val;
import lombok.extern.slf4j.Slf4j;

/**
 * one-shot directory listing using java.nio, in the order returned by the file system
 */
@Slf4j
public class JavaNIODirectoryLister {

	public static List<DirEntry> list(Path dirPath) {
		val pathText = dirPath.toString();
		if (! Files.exists(dirPath)) {
			throw new NodeAccessException(NodeErrorKind.NOT_FOUND, pathText, 
					"Failed to open directory " + pathText + ": No such file or directory");
		}
		if (! Files.isDirectory(dirPath)) {
			throw new NodeAccessException(NodeErrorKind.NOT_A_DIRECTORY, pathText, 
					"Failed to open directory " + pathText + ": Not a directory");
		}
		val res = new ArrayList<DirEntry>();
		Stream<Path> childLs = null;
		try {
			childLs = Files.list(dirPath);
			childLs.forEach(child -> res.add(toDirEntry(child)));
		} catch (AccessDeniedException ex) {
			throw new NodeAccessException(NodeErrorKind.PERMISSION_DENIED, pathText, 
					"Failed to open directory " + pathText + ": Permission denied", ex);
		} catch (IOException ex) {
			throw new NodeAccessException(NodeErrorKind.READ_FAILED, pathText, "Failed to list " + pathText, ex);
		} catch (UncheckedIOException ex) {
			throw new NodeAccessException(NodeErrorKind.READ_FAILED, pathText, "Failed to list " + pathText, ex.getCause());
		} finally {
			if (childLs != null) {
				childLs.close();
			}
		}
		log.debug("listed dir " + pathText + " => " + res.size() + " entries");
		return res;
	}

	protected static DirEntry toDirEntry(Path child) {
		val name = child.getFileName().toString();
		BasicFileAttributes attrs;
		try {
			attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
		} catch (IOException ex) {
			log.warn("Failed to read attributes of " + child + ", keep entry as " + FsEntryType.OTHER, ex);
			return new DirEntry(name, FsEntryType.OTHER, false);
		}
		if (attrs.isSymbolicLink()) {
			return new DirEntry(name, FsEntryType.SYMLINK, Files.isDirectory(child));
		} else if (attrs.isDirectory()) {
			return new DirEntry(name, FsEntryType.DIR, false);
		} else if (attrs.isRegularFile()) {
			return new DirEntry(name, FsEntryType.FILE, false);
		} else {
			return new DirEntry(name, FsEntryType.OTHER, false);
		}
	}

}
