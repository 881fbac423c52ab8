package io.github.bluuewhale.lockcollections;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Iterates a point-in-time copy of a container. {@link #remove()} is forwarded to the live
 * container, so it is as atomic as the container's own removal.
 */
final class SnapshotIterator<T> implements Iterator<T> {
	private final List<T> snap;
	private final Consumer<? super T> remover;
	private int idx = 0;
	private T last;
	private boolean canRemove;

	SnapshotIterator(List<T> snap, Consumer<? super T> remover) {
		this.snap = snap;
		this.remover = remover;
	}

	@Override
	public boolean hasNext() {
		return idx < snap.size();
	}

	@Override
	public T next() {
		if (!hasNext()) throw new NoSuchElementException();
		last = snap.get(idx++);
		canRemove = true;
		return last;
	}

	@Override
	public void remove() {
		if (!canRemove) throw new IllegalStateException();
		remover.accept(last);
		canRemove = false;
	}
}
