/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package ordtree.util;

import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
** General purpose AVL tree implementation, mapping keys to values in the
** order given by a {@link Comparator}.
**
** From [http://en.wikipedia.org/wiki/AVL_tree wikipedia]: In an AVL tree, the
** heights of the two child subtrees of any node differ by at most one; if at
** any time they differ by more than one, rebalancing is done to restore this
** property. Lookup, insertion, and deletion all take O(log n) time in both the
** average and worst cases, where n is the number of nodes in the tree prior
** to the operation.
**
** This tree keeps the following properties after every public operation:
**
** * for every node, all keys in its left subtree compare less than its key,
**   and all keys in its right subtree compare greater.
** * for every node, the heights of its two subtrees differ by at most one.
** * every node's {@link Node#height} is one more than the greater height of
**   its subtrees, an absent subtree having height 0.
** * every node's {@link Node#size} is one more than the sizes of its
**   subtrees added together, and the size of the root equals {@link #size()}.
** * no two keys compare equal.
**
** Mutators return the tree itself, so that calls can be chained:
**
**   tree.insert(2, "two").insert(3, "three").remove(2);
**
** Keys must not be {@code null}. Values may be {@code null}; use {@link
** #find(Object)} rather than {@link #get(Object)} to tell a {@code null} value
** apart from a missing key.
**
** Note: this implementation, like {@link java.util.TreeMap}, is not
** thread-safe. Callers sharing a tree between threads must synchronize
** externally. Iterators are fail-fast on a best-effort basis.
**
** @see Comparator
** @see Comparable
*/
public class AVLTree<K, V> implements Iterable<Map.Entry<K, V>> {

	/** Logger. */
	private static final Logger logger = Logger.getLogger(AVLTree.class.getName());

	/**
	** Separator between the values in {@link #toString()}.
	*/
	final public static String SEPARATOR = " | ";

	/**
	** Comparator for this tree.
	*/
	final protected Comparator<? super K> comparator;

	/**
	** Root node of the tree, or {@code null} if the tree is empty.
	*/
	protected Node root;

	/**
	** Number of entries currently in the tree.
	*/
	protected int size = 0;

	/**
	** Number of structural modifications made to the tree. Changing the value
	** of an existing entry is not a structural modification.
	*/
	protected transient int modCount = 0;

	/**
	** Creates a new empty tree, sorted according to the given comparator.
	**
	** @param cmp The comparator for the tree
	** @throws NullPointerException if {@code cmp} is {@code null}; use {@link
	**         #natural()} for keys with a natural ordering
	*/
	public AVLTree(Comparator<? super K> cmp) {
		if (cmp == null) {
			throw new NullPointerException("An AVLTree needs a comparator; use AVLTree.natural() for Comparable keys");
		}
		comparator = cmp;
	}

	/**
	** Creates a new empty tree, sorted according to the keys' {@link
	** Comparable natural} ordering.
	*/
	public static <K extends Comparable<? super K>, V> AVLTree<K, V> natural() {
		return new AVLTree<K, V>(Comparators.<K>natural());
	}

	/**
	** A node of the tree. Each node owns its two subtrees outright; there are
	** no parent pointers, and rotations only relink existing nodes.
	**
	** Nodes are also the entries handed out by {@link #iterator()}.
	*/
	protected class Node implements Map.Entry<K, V> {

		final protected K key;

		protected V value;

		/**
		** Height of the subtree rooted here. A leaf has height 1.
		*/
		protected int height = 1;

		/**
		** Number of nodes in the subtree rooted here.
		*/
		protected int size = 1;

		protected Node left;

		protected Node right;

		protected Node(K k, V v) {
			key = k;
			value = v;
		}

		public K getKey() {
			return key;
		}

		public V getValue() {
			return value;
		}

		public V setValue(V v) {
			V o = value;
			value = v;
			return o;
		}

		@Override public boolean equals(Object o) {
			if (o == this) { return true; }
			if (!(o instanceof Map.Entry)) { return false; }
			Map.Entry<?, ?> en = (Map.Entry<?, ?>)o;
			return key.equals(en.getKey()) &&
			       (value == null? en.getValue() == null: value.equals(en.getValue()));
		}

		@Override public int hashCode() {
			return key.hashCode() ^ (value == null? 0: value.hashCode());
		}

		@Override public String toString() {
			return key + "=" + value;
		}

		public String toTreeString(String istr) {
			String nistr = istr + "\t";
			StringBuilder s = new StringBuilder();
			if (left != null) { s.append(left.toTreeString(nistr)); }
			s.append(istr).append(key).append(" : ").append(value)
			 .append(" (h=").append(height).append(", n=").append(size).append(')').append('\n');
			if (right != null) { s.append(right.toTreeString(nistr)); }
			return s.toString();
		}

	}

	/**
	** Creates a new node. The node is not linked into the tree.
	*/
	protected Node newNode(K k, V v) {
		return new Node(k, v);
	}

	public Comparator<? super K> comparator() {
		return comparator;
	}

	/**
	** Compares two keys using the comparator for this tree.
	**
	** @throws ClassCastException if the keys cannot be compared by the
	**         comparator
	*/
	public int compare(K key1, K key2) {
		return comparator.compare(key1, key2);
	}

	private static void checkKey(Object key, String op) {
		if (key == null) {
			throw new NullPointerException("null key passed to " + op + "()");
		}
	}

	/*========================================================================
	  node bookkeeping and rotations
	 ========================================================================*/

	final int height(Node n) {
		return (n == null)? 0: n.height;
	}

	final int size(Node n) {
		return (n == null)? 0: n.size;
	}

	final int balance(Node n) {
		return (n == null)? 0: height(n.left) - height(n.right);
	}

	/**
	** Recomputes the height and size of a node from those of its subtrees.
	*/
	final void update(Node n) {
		n.height = 1 + Math.max(height(n.left), height(n.right));
		n.size = 1 + size(n.left) + size(n.right);
	}

	/**
	** Rotates the subtree rooted at {@code n} to the right, and returns the
	** new root of the subtree (the old left child).
	*/
	final Node rotateRight(Node n) {
		Node l = n.left;
		if (logger.isLoggable(Level.FINEST)) {
			logger.finest("rotate right at " + n.key + " (left child " + l.key + ")");
		}
		n.left = l.right;
		l.right = n;
		update(n);
		update(l);
		return l;
	}

	/**
	** Rotates the subtree rooted at {@code n} to the left, and returns the
	** new root of the subtree (the old right child).
	*/
	final Node rotateLeft(Node n) {
		Node r = n.right;
		if (logger.isLoggable(Level.FINEST)) {
			logger.finest("rotate left at " + n.key + " (right child " + r.key + ")");
		}
		n.right = r.left;
		r.left = n;
		update(n);
		update(r);
		return r;
	}

	/**
	** Recomputes the height and size of {@code n}, then restores the balance
	** property at {@code n} if its subtrees' heights differ by two. Both
	** subtrees must already be balanced.
	**
	** @return The new root of the subtree
	*/
	final Node rebalance(Node n) {
		update(n);
		int b = balance(n);
		if (b > 1) {
			if (balance(n.left) < 0) {
				n.left = rotateLeft(n.left);
			}
			return rotateRight(n);
		} else if (b < -1) {
			if (balance(n.right) > 0) {
				n.right = rotateRight(n.right);
			}
			return rotateLeft(n);
		}
		return n;
	}

	/*========================================================================
	  insert, find, remove
	 ========================================================================*/

	/**
	** Associates the given value with the given key. If the key is already
	** present, its value is replaced and the shape of the tree is unchanged.
	**
	** @return This tree
	** @throws NullPointerException if {@code key} is {@code null}
	** @throws ClassCastException if the key cannot be compared with the keys
	**         currently in the tree
	*/
	public AVLTree<K, V> insert(K key, V value) {
		checkKey(key, "insert");
		root = insert(root, key, value);
		return this;
	}

	private Node insert(Node n, K key, V value) {
		if (n == null) {
			++size;
			++modCount;
			return newNode(key, value);
		}
		int c = compare(key, n.key);
		if (c == 0) {
			n.value = value;
			return n;
		}
		// a subtree that kept its size only had a value replaced
		if (c < 0) {
			int s = size(n.left);
			n.left = insert(n.left, key, value);
			if (size(n.left) == s) { return n; }
		} else {
			int s = size(n.right);
			n.right = insert(n.right, key, value);
			if (size(n.right) == s) { return n; }
		}
		return rebalance(n);
	}

	/**
	** Inserts every mapping of the given map, in its iteration order.
	**
	** @return This tree
	*/
	public AVLTree<K, V> insertAll(Map<? extends K, ? extends V> m) {
		for (Map.Entry<? extends K, ? extends V> en: m.entrySet()) {
			insert(en.getKey(), en.getValue());
		}
		return this;
	}

	/**
	** Returns the node holding the given key, or {@code null}.
	*/
	protected Node getNode(K key) {
		Node n = root;
		while (n != null) {
			int c = compare(key, n.key);
			if (c == 0) { return n; }
			n = (c < 0)? n.left: n.right;
		}
		return null;
	}

	/**
	** Looks up the value for the given key.
	**
	** @return {@link Lookup#of(Object)} the value if the key is present, even
	**         when that value is {@code null}; otherwise {@link
	**         Lookup#absent()}
	** @throws NullPointerException if {@code key} is {@code null}
	*/
	public Lookup<V> find(K key) {
		checkKey(key, "find");
		Node n = getNode(key);
		return (n == null)? Lookup.<V>absent(): Lookup.of(n.value);
	}

	/**
	** Returns the value for the given key, or {@code null} if the key is not
	** present. This cannot distinguish a {@code null} value from a missing
	** key; {@link #find(Object)} can.
	*/
	public V get(K key) {
		checkKey(key, "get");
		Node n = getNode(key);
		return (n == null)? null: n.value;
	}

	public boolean containsKey(K key) {
		checkKey(key, "containsKey");
		return getNode(key) != null;
	}

	/**
	** Removes the given key and its value. Does nothing if the key is not
	** present.
	**
	** A node with two children is replaced by its in-order successor node,
	** which is unlinked from the right subtree and relinked in its place.
	** Keys and values are never copied between nodes, so the resulting shape
	** is the same as copying the successor's entry into the removed node.
	**
	** @return This tree
	** @throws NullPointerException if {@code key} is {@code null}
	*/
	public AVLTree<K, V> remove(K key) {
		checkKey(key, "remove");
		root = remove(root, key);
		return this;
	}

	private Node remove(Node n, K key) {
		if (n == null) { return null; }
		int c = compare(key, n.key);
		if (c < 0) {
			int s = size(n.left);
			n.left = remove(n.left, key);
			return (size(n.left) == s)? n: rebalance(n);
		} else if (c > 0) {
			int s = size(n.right);
			n.right = remove(n.right, key);
			return (size(n.right) == s)? n: rebalance(n);
		}

		--size;
		++modCount;
		if (n.left == null) { return n.right; }
		if (n.right == null) { return n.left; }

		// two children: the in-order successor takes this node's place. It is
		// unlinked from the right subtree where it has no left child.
		Node succ = n.right;
		while (succ.left != null) { succ = succ.left; }
		succ.right = removeLeftmost(n.right);
		succ.left = n.left;
		n.left = n.right = null;
		return rebalance(succ);
	}

	/**
	** Unlinks the leftmost node of the subtree rooted at {@code n}.
	**
	** @return The new root of the subtree
	*/
	private Node removeLeftmost(Node n) {
		if (n.left == null) { return n.right; }
		n.left = removeLeftmost(n.left);
		return rebalance(n);
	}

	/**
	** Removes all entries from the tree.
	*/
	public void clear() {
		if (logger.isLoggable(Level.FINE)) {
			logger.fine("Clearing tree of " + size + " entries");
		}
		root = null;
		size = 0;
		++modCount;
	}

	/*========================================================================
	  size and order queries
	 ========================================================================*/

	/**
	** @return Number of entries in the tree
	*/
	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	** @return Height of the tree; 0 when empty
	*/
	public int height() {
		return height(root);
	}

	/**
	** Returns the entry with the smallest key.
	**
	** @throws NoSuchElementException if the tree is empty
	*/
	public Map.Entry<K, V> firstEntry() {
		if (root == null) { throw new NoSuchElementException("tree is empty"); }
		Node n = root;
		while (n.left != null) { n = n.left; }
		return n;
	}

	/**
	** Returns the entry with the greatest key.
	**
	** @throws NoSuchElementException if the tree is empty
	*/
	public Map.Entry<K, V> lastEntry() {
		if (root == null) { throw new NoSuchElementException("tree is empty"); }
		Node n = root;
		while (n.right != null) { n = n.right; }
		return n;
	}

	/**
	** @throws NoSuchElementException if the tree is empty
	*/
	public K firstKey() {
		return firstEntry().getKey();
	}

	/**
	** @throws NoSuchElementException if the tree is empty
	*/
	public K lastKey() {
		return lastEntry().getKey();
	}

	/**
	** Returns the entry at a particular (zero-based) index in key order.
	**
	** @throws IndexOutOfBoundsException if {@code i < 0 || i >= size()}
	*/
	public Map.Entry<K, V> getEntry(int i) {
		if (i < 0 || i >= size) {
			throw new IndexOutOfBoundsException("Index: " + i + ", Size: " + size);
		}
		Node n = root;
		for (;;) {
			int s = size(n.left);
			if (i < s) {
				n = n.left;
			} else if (i == s) {
				return n;
			} else {
				i -= s + 1;
				n = n.right;
			}
		}
	}

	/**
	** Returns the (zero-based) index of the given key in key order.
	**
	** @return The index, or {@code -1} if the key is not present
	*/
	public int indexOf(K key) {
		checkKey(key, "indexOf");
		int i = 0;
		Node n = root;
		while (n != null) {
			int c = compare(key, n.key);
			if (c < 0) {
				n = n.left;
			} else if (c == 0) {
				return i + size(n.left);
			} else {
				i += size(n.left) + 1;
				n = n.right;
			}
		}
		return -1;
	}

	/*========================================================================
	  iteration
	 ========================================================================*/

	/**
	** Iterates through the nodes in key order, keeping the path still to be
	** visited on a stack.
	*/
	protected class EntryIterator implements Iterator<Map.Entry<K, V>> {

		final Stack<Node> stack = new Stack<Node>();
		Node last;
		int expectedModCount = modCount;

		protected EntryIterator() {
			for (Node n = root; n != null; n = n.left) {
				stack.push(n);
			}
		}

		public boolean hasNext() {
			return !stack.isEmpty();
		}

		public Map.Entry<K, V> next() {
			if (modCount != expectedModCount) { throw new ConcurrentModificationException(); }
			if (stack.isEmpty()) { throw new NoSuchElementException(); }
			Node n = stack.pop();
			for (Node m = n.right; m != null; m = m.left) {
				stack.push(m);
			}
			last = n;
			return n;
		}

		public void remove() {
			if (last == null) { throw new IllegalStateException(); }
			if (modCount != expectedModCount) { throw new ConcurrentModificationException(); }
			K key = last.key;
			AVLTree.this.remove(key);
			expectedModCount = modCount;
			last = null;
			// the removal may have rotated nodes on the stack; find the path to
			// the successor again
			stack.clear();
			Node n = root;
			while (n != null) {
				if (compare(key, n.key) < 0) {
					stack.push(n);
					n = n.left;
				} else {
					n = n.right;
				}
			}
		}

	}

	/**
	** Returns an iterator over the entries in key order. Setting the value of
	** an entry writes through to the tree.
	*/
	public Iterator<Map.Entry<K, V>> iterator() {
		return new EntryIterator();
	}

	/**
	** Returns the keys in order.
	*/
	public Iterable<K> keys() {
		return new Iterable<K>() {
			public Iterator<K> iterator() {
				final Iterator<Map.Entry<K, V>> it = new EntryIterator();
				return new Iterator<K>() {
					public boolean hasNext() { return it.hasNext(); }
					public K next() { return it.next().getKey(); }
					public void remove() { it.remove(); }
				};
			}
		};
	}

	/**
	** Returns the values in the order of their keys.
	*/
	public Iterable<V> values() {
		return new Iterable<V>() {
			public Iterator<V> iterator() {
				final Iterator<Map.Entry<K, V>> it = new EntryIterator();
				return new Iterator<V>() {
					public boolean hasNext() { return it.hasNext(); }
					public V next() { return it.next().getValue(); }
					public void remove() { it.remove(); }
				};
			}
		};
	}

	/*========================================================================
	  string forms and debugging
	 ========================================================================*/

	/**
	** Returns the values in key order, each rendered with {@link
	** String#valueOf(Object)}, separated by {@link #SEPARATOR}. An empty tree
	** gives the empty string.
	*/
	@Override public String toString() {
		StringBuilder s = new StringBuilder();
		boolean first = true;
		for (V v: values()) {
			if (!first) { s.append(SEPARATOR); }
			s.append(String.valueOf(v));
			first = false;
		}
		return s.toString();
	}

	/**
	** Returns the structure of the tree, one node per line, children indented
	** one level deeper than their parent.
	*/
	public String toTreeString() {
		return (root == null)? "": root.toTreeString("");
	}

	/**
	** Simulates an assertion.
	**
	** @param b The test condition
	** @throws IllegalStateException if the test condition is false
	*/
	final static void verify(boolean b) {
		if (!b) { throw new IllegalStateException("Verification failed"); }
	}

	/**
	** Package-private debugging method. This one checks the constraints for
	** the subtree rooted at a given node:
	**
	** * lo < key < hi for every key, where {@code null} bounds are open
	** * the heights of the two subtrees differ by at most one
	** * the stored height and size match those of the subtrees
	**
	** @return height of the subtree
	** @throws IllegalStateException if the constraints are not satisfied
	*/
	final int verifyTreeIntegrity(Node n, K lo, K hi) {
		if (n == null) { return 0; }
		verify(lo == null || compare(lo, n.key) < 0);
		verify(hi == null || compare(n.key, hi) < 0);
		int hl = verifyTreeIntegrity(n.left, lo, n.key);
		int hr = verifyTreeIntegrity(n.right, n.key, hi);
		verify(Math.abs(hl - hr) <= 1);
		verify(n.height == 1 + Math.max(hl, hr));
		verify(n.size == 1 + size(n.left) + size(n.right));
		return n.height;
	}

	/**
	** Package-private debugging method. This one checks the constraints for
	** the entire tree, and that the root's size matches {@link #size()}.
	**
	** @throws IllegalStateException if the constraints are not satisfied
	*/
	final void verifyTreeIntegrity() {
		verifyTreeIntegrity(root, null, null);
		verify(size == size(root));
	}

}
