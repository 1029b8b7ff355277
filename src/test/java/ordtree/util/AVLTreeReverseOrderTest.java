/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package ordtree.util;

import java.util.Collections;

public class AVLTreeReverseOrderTest extends OrderedTreeTestSkeleton {

	@Override public AVLTree<String, Integer> makeTestTree() {
		return new AVLTree<String, Integer>(Collections.<String>reverseOrder());
	}

	public void testDescending() {
		fillTestTree();
		String prev = null;
		for (String k: testtree.keys()) {
			assertTrue(prev == null || prev.compareTo(k) > 0);
			prev = k;
		}
	}

}
