/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package ordtree.util;

import junit.framework.TestCase;
import static ordtree.util.Generators.rand;
import static ordtree.util.Generators.rndStr;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;

/**
** Tests for the enumeration and order queries of a tree, whatever ordering
** it was made with. Expected results come from a {@link TreeMap} using the
** same comparator.
*/
abstract public class OrderedTreeTestSkeleton extends TestCase {

	protected AVLTree<String, Integer> testtree;
	protected TreeMap<String, Integer> backmap;

	abstract protected AVLTree<String, Integer> makeTestTree();

	public void fillTestTree() {
		testtree = makeTestTree();
		backmap = new TreeMap<String, Integer>(testtree.comparator());
		for (int i=0; i<0x1000; ++i) {
			String k = rndStr();
			Integer v = rand.nextInt();
			testtree.insert(k, v);
			backmap.put(k, v);
		}
		testtree.verifyTreeIntegrity();
	}

	public void testEntryOrder() {
		fillTestTree();
		Iterator<Map.Entry<String, Integer>> it = backmap.entrySet().iterator();
		int i = 0;
		for (Map.Entry<String, Integer> en: testtree) {
			Map.Entry<String, Integer> ex = it.next();
			assertEquals(ex.getKey(), en.getKey());
			assertEquals(ex.getValue(), en.getValue());
			++i;
		}
		assertFalse(it.hasNext());
		assertEquals(backmap.size(), i);
	}

	public void testKeysAndValues() {
		fillTestTree();
		Iterator<String> kit = backmap.keySet().iterator();
		for (String k: testtree.keys()) {
			assertEquals(kit.next(), k);
		}
		assertFalse(kit.hasNext());
		Iterator<Integer> vit = backmap.values().iterator();
		for (Integer v: testtree.values()) {
			assertEquals(vit.next(), v);
		}
		assertFalse(vit.hasNext());
	}

	public void testFirstLastKey() {
		fillTestTree();
		assertEquals(backmap.firstKey(), testtree.firstKey());
		assertEquals(backmap.lastKey(), testtree.lastKey());
		assertEquals(backmap.firstEntry(), testtree.firstEntry());
		assertEquals(backmap.lastEntry(), testtree.lastEntry());
		testtree.clear();
		try {
			testtree.firstKey();
			fail();
		} catch (NoSuchElementException e) { }
		try {
			testtree.lastKey();
			fail();
		} catch (NoSuchElementException e) { }
	}

	public void testIndexes() {
		fillTestTree();
		int i = 0;
		for (String k: backmap.keySet()) {
			assertEquals(k, testtree.getEntry(i).getKey());
			assertEquals(i, testtree.indexOf(k));
			++i;
		}
		assertEquals(-1, testtree.indexOf("not a uuid"));
		try {
			testtree.getEntry(testtree.size());
			fail();
		} catch (IndexOutOfBoundsException e) { }
		try {
			testtree.getEntry(-1);
			fail();
		} catch (IndexOutOfBoundsException e) { }
	}

	public void testEntrySetValue() {
		fillTestTree();
		String k = testtree.firstKey();
		Map.Entry<String, Integer> entry = testtree.iterator().next();
		entry.setValue(124);
		assertEquals(Integer.valueOf(124), testtree.find(k).get());
		assertEquals(backmap.size(), testtree.size());
	}

	public void testIteratorRemove() {
		fillTestTree();
		// remove every other entry
		Iterator<Map.Entry<String, Integer>> it = testtree.iterator();
		int i = 0;
		while (it.hasNext()) {
			Map.Entry<String, Integer> en = it.next();
			if (i++ % 2 == 0) {
				it.remove();
				backmap.remove(en.getKey());
			}
		}
		testtree.verifyTreeIntegrity();
		assertEquals(backmap.size(), testtree.size());
		assertEquals(backmap.keySet().iterator().next(), testtree.firstKey());

		// remove the rest
		Iterator<String> kit = testtree.keys().iterator();
		while (kit.hasNext()) {
			String k = kit.next();
			assertEquals(k, testtree.firstKey());
			kit.remove();
		}
		assertEquals(0, testtree.size());
		testtree.verifyTreeIntegrity();
	}

	public void testIteratorRemoveTwice() {
		fillTestTree();
		Iterator<Map.Entry<String, Integer>> it = testtree.iterator();
		try {
			it.remove();
			fail();
		} catch (IllegalStateException e) { }
		it.next();
		it.remove();
		try {
			it.remove();
			fail();
		} catch (IllegalStateException e) { }
	}

	public void testIteratorFailFast() {
		fillTestTree();
		Iterator<Map.Entry<String, Integer>> it = testtree.iterator();
		it.next();
		testtree.insert(rndStr(), 0);
		try {
			it.next();
			fail();
		} catch (ConcurrentModificationException e) { }

		// replacing a value is not a structural change
		it = testtree.iterator();
		Map.Entry<String, Integer> en = it.next();
		testtree.insert(en.getKey(), 1);
		it.next();
	}

	public void testIteratorExhausted() {
		testtree = makeTestTree();
		Iterator<Map.Entry<String, Integer>> it = testtree.iterator();
		assertFalse(it.hasNext());
		try {
			it.next();
			fail();
		} catch (NoSuchElementException e) { }
	}

}
