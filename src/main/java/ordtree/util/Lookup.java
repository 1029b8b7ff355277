/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package ordtree.util;

import java.util.NoSuchElementException;

/**
** Result of a key lookup: either a value that was found, or the absence of
** one. A found value may itself be {@code null}, {@code 0}, {@code false} or
** empty; only {@link #isFound()} says whether the key was present.
**
** Instances are immutable.
*/
final public class Lookup<V> {

	final private static Lookup<?> ABSENT = new Lookup<Object>(false, null);

	final private boolean found;
	final private V value;

	private Lookup(boolean f, V v) {
		found = f;
		value = v;
	}

	/**
	** Returns a result for a key that was present and mapped to the given
	** value (which may be {@code null}).
	*/
	public static <V> Lookup<V> of(V v) {
		return new Lookup<V>(true, v);
	}

	/**
	** Returns the result for a key that was not present.
	*/
	@SuppressWarnings("unchecked")
	public static <V> Lookup<V> absent() {
		return (Lookup<V>)ABSENT;
	}

	public boolean isFound() {
		return found;
	}

	/**
	** @return The value that was found
	** @throws NoSuchElementException if nothing was found
	*/
	public V get() {
		if (!found) { throw new NoSuchElementException("key not present"); }
		return value;
	}

	/**
	** @return The value that was found, or {@code other} if nothing was found
	*/
	public V orElse(V other) {
		return found? value: other;
	}

	@Override public boolean equals(Object o) {
		if (o == this) { return true; }
		if (!(o instanceof Lookup)) { return false; }
		Lookup<?> l = (Lookup<?>)o;
		return found == l.found && (value == null? l.value == null: value.equals(l.value));
	}

	@Override public int hashCode() {
		return found? (value == null? 1: value.hashCode() + 1): 0;
	}

	@Override public String toString() {
		return found? "Found(" + value + ")": "Absent";
	}

}
