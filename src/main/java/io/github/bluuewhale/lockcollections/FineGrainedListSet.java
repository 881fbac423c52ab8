package io.github.bluuewhale.lockcollections;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sorted linked-list set with one lock per node and hand-over-hand (lock-coupling) traversal.
 *
 * Design notes:
 * - Traversal locks the head sentinel, then locks each successor before releasing its
 *   predecessor. At most two adjacent nodes are locked at a time and locks are always taken in
 *   list order, so two operations can never wait on each other in a cycle.
 * - A node's {@code next} link is read and written only while that node is locked. A thread can
 *   only wait on a node's lock while holding the predecessor's lock, so the thread that unlinks a
 *   node (holding both) knows no other traversal is resting on it.
 * - Removal is physical: the predecessor is redirected past the target while both are locked.
 *   That redirection (or the insertion link for {@code add}) is the linearization point.
 * - Operations on disjoint regions of the list proceed in parallel.
 * - Element callbacks run before any link mutation; a callback exception releases the held locks
 *   and leaves the set unchanged.
 */
public final class FineGrainedListSet<E> extends AbstractSet<E> {

	private static final class Node<E> {
		final E item;
		Node<E> next;
		private final ReentrantLock lock = new ReentrantLock();

		Node(E item, Node<E> next) {
			this.item = item;
			this.next = next;
		}

		void lock() {
			lock.lock();
		}

		void unlock() {
			lock.unlock();
		}
	}

	private final ElementOrder<? super E> order;
	private final Node<E> head;
	private final Node<E> tail;
	private final LongAdder liveSize = new LongAdder();

	/** Creates a set ordered by the elements' natural ordering. */
	public FineGrainedListSet() {
		this(ElementOrder.natural());
	}

	public FineGrainedListSet(Comparator<? super E> comparator) {
		this(ElementOrder.comparing(comparator));
	}

	private FineGrainedListSet(ElementOrder<? super E> order) {
		this.order = order;
		this.tail = new Node<>(null, null);
		this.head = new Node<>(null, tail);
	}

	/** Creates a set positioned by {@code hashCode()}, for element types without a natural ordering. */
	public static <E> FineGrainedListSet<E> hashOrdered() {
		return new FineGrainedListSet<>(ElementOrder.byHashCode());
	}

	@Override
	public boolean add(E item) {
		checkElement(item);
		head.lock();
		Node<E> pred = head;
		try {
			Node<E> curr = pred.next;
			curr.lock();
			try {
				int c;
				while ((c = position(curr, item)) < 0) {
					pred.unlock();
					pred = curr;
					curr = curr.next;
					curr.lock();
				}
				if (c == 0) return false;
				pred.next = new Node<>(item, curr);
				liveSize.increment();
				return true;
			} finally {
				curr.unlock();
			}
		} finally {
			pred.unlock();
		}
	}

	@Override
	public boolean remove(Object o) {
		E key = castElement(o);
		head.lock();
		Node<E> pred = head;
		try {
			Node<E> curr = pred.next;
			curr.lock();
			try {
				int c;
				while ((c = position(curr, key)) < 0) {
					pred.unlock();
					pred = curr;
					curr = curr.next;
					curr.lock();
				}
				if (c != 0) return false;
				pred.next = curr.next;
				liveSize.decrement();
				return true;
			} finally {
				curr.unlock();
			}
		} finally {
			pred.unlock();
		}
	}

	@Override
	public boolean contains(Object o) {
		E key = castElement(o);
		head.lock();
		Node<E> pred = head;
		try {
			Node<E> curr = pred.next;
			curr.lock();
			try {
				int c;
				while ((c = position(curr, key)) < 0) {
					pred.unlock();
					pred = curr;
					curr = curr.next;
					curr.lock();
				}
				return c == 0;
			} finally {
				curr.unlock();
			}
		} finally {
			pred.unlock();
		}
	}

	/** Number of live elements; exact when no mutation is in flight. */
	@Override
	public int size() {
		long n = sumCount();
		return (n > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) n;
	}

	@Override
	public boolean isEmpty() {
		return sumCount() == 0L;
	}

	/**
	 * Unlinks elements one at a time from the front of the list. Each unlink is atomic; the clear as
	 * a whole is not, so elements added concurrently behind the cursor may survive.
	 */
	@Override
	public void clear() {
		head.lock();
		try {
			for (;;) {
				Node<E> first = head.next;
				if (first == tail) return;
				first.lock();
				try {
					head.next = first.next;
					liveSize.decrement();
				} finally {
					first.unlock();
				}
			}
		} finally {
			head.unlock();
		}
	}

	/**
	 * Returns an ascending iterator over a snapshot collected by one coupled traversal. Each element
	 * was present when the traversal passed it.
	 */
	@Override
	public Iterator<E> iterator() {
		ArrayList<E> snap = new ArrayList<>();
		head.lock();
		Node<E> pred = head;
		try {
			Node<E> curr = pred.next;
			curr.lock();
			try {
				while (curr != tail) {
					snap.add(curr.item);
					pred.unlock();
					pred = curr;
					curr = curr.next;
					curr.lock();
				}
			} finally {
				curr.unlock();
			}
		} finally {
			pred.unlock();
		}
		return new SnapshotIterator<>(snap, this::remove);
	}

	/* The adder is not an atomic snapshot; ignore transient negative values. */
	private long sumCount() {
		long n = liveSize.sum();
		return (n < 0L) ? 0L : n;
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
