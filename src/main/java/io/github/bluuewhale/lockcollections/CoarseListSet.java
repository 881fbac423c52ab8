package io.github.bluuewhale.lockcollections;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Sorted linked-list set guarded by a single lock for the whole structure.
 *
 * Design notes:
 * - The list is bounded by immutable head/tail sentinels; elements sit strictly between them in
 *   ascending order, so traversal never needs a null-successor check.
 * - One {@link ReentrantReadWriteLock} covers every link: {@code add}/{@code remove}/{@code clear}
 *   take the write lock, {@code contains}/{@code size}/iteration take the read lock. Acquiring the
 *   lock is the linearization point.
 * - Element callbacks ({@code compareTo}/{@code compare}/{@code equals}) run before the first link
 *   mutation, so a callback exception leaves the set unchanged.
 * - Iteration works on a snapshot taken under the read lock.
 */
public final class CoarseListSet<E> extends AbstractSet<E> {

	private static final class Node<E> {
		final E item;
		Node<E> next;

		Node(E item, Node<E> next) {
			this.item = item;
			this.next = next;
		}
	}

	private final ElementOrder<? super E> order;
	private final Node<E> head;
	private final Node<E> tail;
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
	private int size;

	/** Creates a set ordered by the elements' natural ordering. */
	public CoarseListSet() {
		this(ElementOrder.natural());
	}

	public CoarseListSet(Comparator<? super E> comparator) {
		this(ElementOrder.comparing(comparator));
	}

	private CoarseListSet(ElementOrder<? super E> order) {
		this.order = order;
		this.tail = new Node<>(null, null);
		this.head = new Node<>(null, tail);
	}

	/** Creates a set positioned by {@code hashCode()}, for element types without a natural ordering. */
	public static <E> CoarseListSet<E> hashOrdered() {
		return new CoarseListSet<>(ElementOrder.byHashCode());
	}

	@Override
	public boolean add(E item) {
		checkElement(item);
		lock.writeLock().lock();
		try {
			Node<E> pred = head;
			Node<E> curr = pred.next;
			int c;
			while ((c = position(curr, item)) < 0) {
				pred = curr;
				curr = curr.next;
			}
			if (c == 0) return false;
			pred.next = new Node<>(item, curr);
			size++;
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public boolean remove(Object o) {
		E key = castElement(o);
		lock.writeLock().lock();
		try {
			Node<E> pred = head;
			Node<E> curr = pred.next;
			int c;
			while ((c = position(curr, key)) < 0) {
				pred = curr;
				curr = curr.next;
			}
			if (c != 0) return false;
			pred.next = curr.next;
			size--;
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public boolean contains(Object o) {
		E key = castElement(o);
		lock.readLock().lock();
		try {
			Node<E> curr = head.next;
			int c;
			while ((c = position(curr, key)) < 0) {
				curr = curr.next;
			}
			return c == 0;
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public int size() {
		lock.readLock().lock();
		try {
			return size;
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public boolean isEmpty() {
		return size() == 0;
	}

	@Override
	public void clear() {
		lock.writeLock().lock();
		try {
			head.next = tail;
			size = 0;
		} finally {
			lock.writeLock().unlock();
		}
	}

	/** Returns an ascending iterator over a snapshot of the set. */
	@Override
	public Iterator<E> iterator() {
		ArrayList<E> snap;
		lock.readLock().lock();
		try {
			snap = new ArrayList<>(size);
			for (Node<E> curr = head.next; curr != tail; curr = curr.next) {
				snap.add(curr.item);
			}
		} finally {
			lock.readLock().unlock();
		}
		return new SnapshotIterator<>(snap, this::remove);
	}

	/* The tail sentinel sorts after every key. */
	private int position(Node<E> node, E key) {
		return (node == tail) ? 1 : order.locate(node.item, key);
	}

	private static void checkElement(Object item) {
		if (item == null) throw new NullPointerException("Null elements not supported");
	}

	@SuppressWarnings("unchecked")
	private static <T> T castElement(Object o) {
		checkElement(o);
		return (T) o;
	}
}
