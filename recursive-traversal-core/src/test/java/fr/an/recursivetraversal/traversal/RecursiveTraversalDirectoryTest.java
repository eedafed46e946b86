package fr.an.recursivetraversal.traversal;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import fr.an.recursivetraversal.api.TraversalMode;
import fr.an.recursivetraversal.fs.DirectoryFlags;
import fr.an.recursivetraversal.fs.DirectoryNode;
import fr.an.recursivetraversal.fs.FileInfo;
import lombok.val;

public class RecursiveTraversalDirectoryTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private String rootPath;

	@Before
	public void setup() throws IOException {
		File rootDir = tmp.newFolder("root");
		rootPath = rootDir.getPath();
		write(new File(rootDir, "a.txt"), "a");
		File dir1 = new File(rootDir, "dir1");
		dir1.mkdir();
		write(new File(dir1, "f1.txt"), "f1");
		File dir2 = new File(dir1, "dir2");
		dir2.mkdir();
		write(new File(dir2, "f2.txt"), "f2");
		new File(rootDir, "empty").mkdir();
	}

	private static void write(File file, String content) throws IOException {
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
	}

	private static List<String> subPathnames(RecursiveTraversal<String,Object> sut) {
		List<String> res = new ArrayList<>();
		for(sut.rewind(); sut.valid(); sut.next()) {
			val node = (DirectoryNode) sut.getSubNode();
			res.add(node.getSubPathname());
		}
		Collections.sort(res);
		return res;
	}

	@Test
	public void testLeavesOnly() {
		val root = new DirectoryNode(rootPath, DirectoryFlags.SKIP_DOTS | DirectoryFlags.UNIX_PATHS);
		val sut = new RecursiveTraversal<String,Object>(root);
		Assert.assertEquals(Arrays.asList("a.txt", "dir1/dir2/f2.txt", "dir1/f1.txt"), subPathnames(sut));
		for(sut.rewind(); sut.valid(); sut.next()) {
			val fileInfo = (FileInfo) sut.current();
			Assert.assertTrue(fileInfo.isFile());
			Assert.assertEquals(sut.key(), fileInfo.getPath());
		}
	}

	@Test
	public void testSelfFirst() {
		val root = new DirectoryNode(rootPath, DirectoryFlags.SKIP_DOTS | DirectoryFlags.UNIX_PATHS);
		val sut = new RecursiveTraversal<String,Object>(root, TraversalMode.SELF_FIRST);
		Assert.assertEquals(Arrays.asList("a.txt", "dir1", "dir1/dir2", "dir1/dir2/f2.txt", "dir1/f1.txt", "empty"),
				subPathnames(sut));
	}

	@Test
	public void testChildFirst_directoryAfterContent() {
		val root = new DirectoryNode(rootPath, DirectoryFlags.SKIP_DOTS | DirectoryFlags.UNIX_PATHS);
		val sut = new RecursiveTraversal<String,Object>(root, TraversalMode.CHILD_FIRST);
		List<String> ordered = new ArrayList<>();
		for(sut.rewind(); sut.valid(); sut.next()) {
			ordered.add(((DirectoryNode) sut.getSubNode()).getSubPathname());
		}
		Assert.assertEquals(6, ordered.size());
		Assert.assertTrue(ordered.indexOf("dir1/dir2/f2.txt") < ordered.indexOf("dir1/dir2"));
		Assert.assertTrue(ordered.indexOf("dir1/dir2") < ordered.indexOf("dir1"));
		Assert.assertTrue(ordered.indexOf("dir1/f1.txt") < ordered.indexOf("dir1"));
	}

	@Test
	public void testWithDots_notDescended() {
		val root = new DirectoryNode(rootPath, DirectoryFlags.KEY_AS_FILENAME);
		val sut = new RecursiveTraversal<String,Object>(root);
		List<String> names = new ArrayList<>();
		for(sut.rewind(); sut.valid(); sut.next()) {
			names.add(sut.key());
		}
		Collections.sort(names);
		// ".", ".." in root, dir1, dir2 and empty
		Assert.assertEquals(Arrays.asList(".", ".", ".", ".", "..", "..", "..", "..",
				"a.txt", "f1.txt", "f2.txt"), names);
	}

	@Test
	public void testMaxDepth() {
		val root = new DirectoryNode(rootPath, DirectoryFlags.SKIP_DOTS | DirectoryFlags.UNIX_PATHS);
		val sut = new RecursiveTraversal<String,Object>(root,
				TraversalParams.builder().mode(TraversalMode.LEAVES_ONLY).maxDepth(1));
		// "empty" is descended into at depth 0, but has nothing to emit
		Assert.assertEquals(Arrays.asList("a.txt", "dir1/dir2", "dir1/f1.txt"), subPathnames(sut));
	}

}
