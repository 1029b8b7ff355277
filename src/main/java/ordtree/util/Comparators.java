/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package ordtree.util;

import java.util.Comparator;

/**
** Methods for comparators.
*/
final public class Comparators {

	private Comparators() {}

	/**
	** Comparator imposing the {@link Comparable natural} ordering of its
	** arguments. Only handed out typed to keys {@link Comparable} to
	** themselves.
	*/
	@SuppressWarnings("rawtypes")
	final private static Comparator NATURAL = new Comparator<Comparable<Object>>() {
		public int compare(Comparable<Object> c1, Comparable<Object> c2) {
			return c1.compareTo(c2);
		}

		@Override public String toString() {
			return "natural";
		}
	};

	/**
	** Returns a comparator that orders keys by their {@link
	** Comparable#compareTo(Object)} method.
	**
	** @throws NullPointerException (from the comparator) if either argument
	**         is {@code null}
	*/
	@SuppressWarnings("unchecked")
	public static <T extends Comparable<? super T>> Comparator<T> natural() {
		return (Comparator<T>)NATURAL;
	}

}
