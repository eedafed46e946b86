package fr.an.recursivetraversal.util;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import fr.an.recursivetraversal.array.ArrayNode;
import lombok.val;

public class NodeCursorsTest {

	private static final Map<String,Object> DATA = ImmutableMap.<String,Object>of("y", 2, "x", 1);

	@Test
	public void testEntries_rewindsOnEachIterator() {
		val node = new ArrayNode(DATA);
		val entries = NodeCursors.entries(node);
		for(int i = 0; i < 2; i++) {
			Iterator<Map.Entry<Object,Object>> iter = entries.iterator();
			Assert.assertTrue(iter.hasNext());
			Assert.assertEquals(Maps.immutableEntry("x", 1), iter.next());
			Assert.assertEquals(Maps.immutableEntry("y", 2), iter.next());
			Assert.assertFalse(iter.hasNext());
		}
	}

	@Test
	public void testCollect() {
		val node = new ArrayNode(DATA);
		Assert.assertEquals(Arrays.<Object>asList("x", "y"), NodeCursors.keys(node));
		Assert.assertEquals(Arrays.<Object>asList(1, 2), NodeCursors.values(node));
		Assert.assertEquals(2, NodeCursors.count(node));
		Assert.assertEquals(2, NodeCursors.toList(node).size());
	}

	@Test
	public void testEmpty() {
		val node = new ArrayNode(ImmutableMap.of());
		Assert.assertFalse(NodeCursors.iterator(node).hasNext());
		Assert.assertEquals(0, NodeCursors.count(node));
		Assert.assertTrue(NodeCursors.toList(node).isEmpty());
	}

}
