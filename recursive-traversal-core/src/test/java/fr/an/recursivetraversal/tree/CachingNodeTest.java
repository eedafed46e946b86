package fr.an.recursivetraversal.tree;

import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import fr.an.recursivetraversal.array.ArrayNode;
import lombok.val;

public class CachingNodeTest {

	@Test
	public void testHasNext() {
		val sut = new CachingNode<Object,Object>(new ArrayNode(ImmutableList.of(1, 2, 3)));
		sut.rewind();
		Assert.assertTrue(sut.valid());
		Assert.assertEquals(1, sut.current());
		Assert.assertEquals(0L, sut.key());
		Assert.assertTrue(sut.hasNext());
		sut.next();
		Assert.assertEquals(2, sut.current());
		Assert.assertTrue(sut.hasNext());
		sut.next();
		Assert.assertEquals(3, sut.current());
		Assert.assertEquals(2L, sut.key());
		Assert.assertFalse(sut.hasNext());
		sut.next();
		Assert.assertFalse(sut.valid());
		Assert.assertNull(sut.current());
		Assert.assertNull(sut.key());
		Assert.assertFalse(sut.hasNext());

		sut.rewind();
		Assert.assertEquals(1, sut.current());
	}

	@Test
	public void testEmpty() {
		val sut = new CachingNode<Object,Object>(new ArrayNode(ImmutableList.of()));
		sut.rewind();
		Assert.assertFalse(sut.valid());
		Assert.assertFalse(sut.hasNext());
		Assert.assertFalse(sut.hasChildren());
	}

	@Test
	public void testChildren_cachedBeforeInnerMoves() {
		Map<String,Object> data = ImmutableMap.<String,Object>of("a", ImmutableMap.of("a1", 1, "a2", 2), "b", 3);
		val sut = new CachingNode<Object,Object>(new ArrayNode(data));
		sut.rewind();
		// inner node is already positioned on "b"
		Assert.assertEquals("b", sut.getInner().key());
		Assert.assertEquals("a", sut.key());
		Assert.assertTrue(sut.hasChildren());
		val children = sut.getChildren();
		Assert.assertSame(children, sut.getChildren());
		children.rewind();
		Assert.assertEquals("a1", children.key());
		Assert.assertTrue(children.hasNext());
		children.next();
		Assert.assertEquals("a2", children.key());
		Assert.assertFalse(children.hasNext());

		sut.next();
		Assert.assertEquals("b", sut.key());
		Assert.assertFalse(sut.hasChildren());
		Assert.assertEquals(3, sut.current());
	}

	@Test(expected = IllegalStateException.class)
	public void testGetChildren_onLeaf() {
		val sut = new CachingNode<Object,Object>(new ArrayNode(ImmutableList.of(1)));
		sut.rewind();
		sut.getChildren();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullInner() {
		new CachingNode<Object,Object>(null);
	}

}
