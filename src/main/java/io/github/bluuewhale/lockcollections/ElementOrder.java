package io.github.bluuewhale.lockcollections;

import java.util.Comparator;
import java.util.Objects;

/**
 * Positions elements of a sorted list relative to a search key.
 *
 * <p>{@link #locate} is negative while {@code item} sorts before {@code key}, zero when {@code item}
 * is the element {@code key} denotes, and positive once {@code item} sorts after it. Traversals
 * advance while the result is negative, so the first non-negative node brackets the key.
 */
@FunctionalInterface
interface ElementOrder<T> {

	int locate(T item, T key);

	static <T> ElementOrder<T> comparing(Comparator<? super T> comparator) {
		Objects.requireNonNull(comparator, "comparator");
		return comparator::compare;
	}

	@SuppressWarnings("unchecked")
	static ElementOrder<Object> natural() {
		return (item, key) -> ((Comparable<Object>) item).compareTo(key);
	}

	/**
	 * Orders by {@code hashCode()}. Distinct elements that share a hash code form a run that is
	 * scanned with {@code equals}; an unequal member of the run counts as preceding the key, so new
	 * elements are appended at the end of their run.
	 */
	static ElementOrder<Object> byHashCode() {
		return (item, key) -> {
			int c = Integer.compare(item.hashCode(), key.hashCode());
			if (c != 0) return c;
			return item.equals(key) ? 0 : -1;
		};
	}
}
