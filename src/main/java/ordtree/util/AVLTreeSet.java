/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package ordtree.util;

import java.util.Comparator;
import java.util.Iterator;

/**
** An ordered set backed by an {@link AVLTree} in which every element is
** mapped to itself. {@link #find(Object)} returns the element reference held
** by the set, which is the one most recently inserted for its key.
*/
public class AVLTreeSet<E> implements Iterable<E> {

	/**
	** {@link AVLTree} backing this set.
	*/
	final protected AVLTree<E, E> bktree;

	/**
	** Creates a new empty set, sorted according to the given comparator.
	**
	** @param cmp The comparator for the set
	** @throws NullPointerException if {@code cmp} is {@code null}
	*/
	public AVLTreeSet(Comparator<? super E> cmp) {
		this(new AVLTree<E, E>(cmp));
	}

	/**
	** Protected constructor for sets backed by a particular tree.
	**
	** Note: this assumes that all of the mappings in the given tree are
	** self-mappings. It is up to the calling code to ensure that this holds.
	*/
	protected AVLTreeSet(AVLTree<E, E> t) {
		bktree = t;
	}

	/**
	** Creates a new empty set, sorted according to the elements' {@link
	** Comparable natural} ordering.
	*/
	public static <E extends Comparable<? super E>> AVLTreeSet<E> natural() {
		return new AVLTreeSet<E>(AVLTree.<E, E>natural());
	}

	/**
	** Adds the element, replacing any element that compares equal to it.
	**
	** @return This set
	*/
	public AVLTreeSet<E> insert(E e) {
		bktree.insert(e, e);
		return this;
	}

	/**
	** Removes the element comparing equal to {@code e}, if there is one.
	**
	** @return This set
	*/
	public AVLTreeSet<E> remove(E e) {
		bktree.remove(e);
		return this;
	}

	/**
	** Returns the element in the set that compares equal to {@code e}.
	*/
	public Lookup<E> find(E e) {
		return bktree.find(e);
	}

	public boolean contains(E e) {
		return bktree.containsKey(e);
	}

	public int size() {
		return bktree.size();
	}

	public boolean isEmpty() {
		return bktree.isEmpty();
	}

	public void clear() {
		bktree.clear();
	}

	public Comparator<? super E> comparator() {
		return bktree.comparator();
	}

	/**
	** Returns the smallest element, as most recently inserted for its key.
	**
	** @throws java.util.NoSuchElementException if the set is empty
	*/
	public E first() {
		return bktree.firstEntry().getValue();
	}

	/**
	** Returns the greatest element, as most recently inserted for its key.
	**
	** @throws java.util.NoSuchElementException if the set is empty
	*/
	public E last() {
		return bktree.lastEntry().getValue();
	}

	/**
	** Returns the element at a particular (zero-based) index.
	*/
	public E get(int i) {
		return bktree.getEntry(i).getValue();
	}

	public Iterator<E> iterator() {
		return bktree.values().iterator();
	}

	/**
	** Same format as {@link AVLTree#toString()}.
	*/
	@Override public String toString() {
		return bktree.toString();
	}

}
