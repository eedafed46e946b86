package fr.an.recursivetraversal.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * immutable description of a directory entry, returned as current() by DirectoryNode
 */
@Slf4j
@Getter
public class FileInfo {

	private final String path;

	private final String fileName;

	private final FsEntryType type;

	/** 0 for directories, or when attributes could not be read */
	private final long size;

	private final long creationTime;

	private final long lastModifiedTime;

	// ------------------------------------------------------------------------

	public FileInfo(String path, String fileName, FsEntryType type, 
			long size, long creationTime, long lastModifiedTime) {
		this.path = path;
		this.fileName = fileName;
		this.type = type;
		this.size = size;
		this.creationTime = creationTime;
		this.lastModifiedTime = lastModifiedTime;
	}

	public static FileInfo read(String path, DirEntry entry) {
		long size = 0;
		long creationTime = 0;
		long lastModifiedTime = 0;
		try {
			BasicFileAttributes attrs = Files.readAttributes(Paths.get(path), BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
			if (attrs.isRegularFile()) {
				size = attrs.size();
			}
			creationTime = attrs.creationTime().toMillis();
			lastModifiedTime = attrs.lastModifiedTime().toMillis();
		} catch (IOException ex) {
			log.debug("Failed to read attributes of " + path + ": " + ex.getMessage());
		}
		return new FileInfo(path, entry.name, entry.type, size, creationTime, lastModifiedTime);
	}

	// ------------------------------------------------------------------------

	public boolean isDir() {
		return type == FsEntryType.DIR;
	}

	public boolean isFile() {
		return type == FsEntryType.FILE;
	}

	public boolean isLink() {
		return type == FsEntryType.SYMLINK;
	}

	public boolean isDot() {
		return DirEntry.DOT.equals(fileName) || DirEntry.DOT_DOT.equals(fileName);
	}

	@Override
	public String toString() {
		return path;
	}

}
