package io.github.bluuewhale.lockcollections;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Chained hash map guarded by a fixed bank of striped locks (null keys and values NOT allowed).
 *
 * Design notes:
 * - The lock bank has {@code S} locks, fixed at construction. Lock {@code i} owns every bucket whose
 *   index is congruent to {@code i} modulo {@code S}.
 * - The bucket count is always {@code S * 2^k}. Because {@code S} divides the bucket count,
 *   {@code (hash mod bucketCount) mod S == hash mod S}, so a key's stripe never changes across
 *   resizes and can be chosen before the table is read.
 * - get/put/remove lock exactly one stripe. Disjoint stripes proceed in parallel.
 * - Resize (doubling) is triggered after an insertion observes {@code size > loadFactor * buckets}.
 *   The resizer acquires every stripe in increasing index order, re-checks the installed table against
 *   the threshold (another thread may have resized it already), rehashes every entry into a new array
 *   and installs it, then releases the stripes. Since resize holds all stripes, no operation overlaps it or sees
 *   a partially migrated table.
 * - Key callbacks run before any mutation and rehashing never calls them; a callback exception
 *   leaves the map unchanged.
 *
 * Limitations:
 * - Resizing is stop-the-world; a copy-on-write table swap would shorten the pause.
 */
public final class StripedHashMap<K, V> extends AbstractMap<K, V> implements ConcurrentMap<K, V> {

	/* Defaults */
	private static final int DEFAULT_INITIAL_BUCKET_COUNT = 16;
	private static final int DEFAULT_STRIPE_COUNT = 16;
	private static final double DEFAULT_LOAD_FACTOR = 0.75d;

	private final ReentrantLock[] locks;
	private final double loadFactor;
	private final LongAdder liveSize = new LongAdder();

	/** Written only while every stripe is held; read under any one stripe. */
	private volatile Bucket<K, V>[] table;

	public StripedHashMap() {
		this(DEFAULT_INITIAL_BUCKET_COUNT, DEFAULT_STRIPE_COUNT, DEFAULT_LOAD_FACTOR);
	}

	public StripedHashMap(int initialBucketCount) {
		this(initialBucketCount, DEFAULT_STRIPE_COUNT, DEFAULT_LOAD_FACTOR);
	}

	public StripedHashMap(int initialBucketCount, int stripeCount) {
		this(initialBucketCount, stripeCount, DEFAULT_LOAD_FACTOR);
	}

	/**
	 * @param initialBucketCount lower bound on the initial bucket count; rounded up to {@code stripeCount * 2^k}
	 * @param stripeCount number of locks, fixed for the life of the map
	 * @param loadFactor entries per bucket above which the table doubles
	 */
	public StripedHashMap(int initialBucketCount, int stripeCount, double loadFactor) {
		Hashing.validatePositive("initialBucketCount", initialBucketCount);
		Hashing.validatePositive("stripeCount", stripeCount);
		if (stripeCount > Hashing.MAX_TABLE_SIZE) {
			throw new IllegalArgumentException("stripeCount must not exceed " + Hashing.MAX_TABLE_SIZE + ": " + stripeCount);
		}
		Hashing.validateLoadFactor(loadFactor);
		this.loadFactor = loadFactor;
		this.locks = new ReentrantLock[stripeCount];
		for (int i = 0; i < stripeCount; i++) locks[i] = new ReentrantLock();
		this.table = Bucket.newTable(Hashing.stripedTableSizeFor(initialBucketCount, stripeCount));
	}

	/** Creates a map with the default stripe count, sized so that {@code expectedEntries} insertions never trigger a resize. */
	public static <K, V> StripedHashMap<K, V> withExpectedSize(int expectedEntries) {
		return withExpectedSize(expectedEntries, DEFAULT_STRIPE_COUNT);
	}

	public static <K, V> StripedHashMap<K, V> withExpectedSize(int expectedEntries, int stripeCount) {
		return new StripedHashMap<>(Hashing.expectedTableSize(expectedEntries, DEFAULT_LOAD_FACTOR), stripeCount, DEFAULT_LOAD_FACTOR);
	}

	/* ------------ Map API ------------ */

	@Override
	public V get(Object key) {
		int h = Hashing.smearedHashNonNull(key);
		ReentrantLock lock = stripeFor(h);
		lock.lock();
		try {
			Bucket.Node<K, V> e = bucketFor(h).find(key, h);
			return (e == null) ? null : e.value;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public boolean containsKey(Object key) {
		return get(key) != null;
	}

	@Override
	public V put(K key, V value) {
		return putVal(key, value, false);
	}

	@Override
	public V putIfAbsent(K key, V value) {
		return putVal(key, value, true);
	}

	@Override
	public V remove(Object key) {
		int h = Hashing.smearedHashNonNull(key);
		ReentrantLock lock = stripeFor(h);
		lock.lock();
		try {
			V old = bucketFor(h).remove(key, h, null);
			if (old != null) liveSize.decrement();
			return old;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public boolean remove(Object key, Object value) {
		int h = Hashing.smearedHashNonNull(key);
		if (value == null) return false;
		ReentrantLock lock = stripeFor(h);
		lock.lock();
		try {
			if (bucketFor(h).remove(key, h, value) == null) return false;
			liveSize.decrement();
			return true;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public boolean replace(K key, V oldValue, V newValue) {
		int h = Hashing.smearedHashNonNull(key);
		checkValue(oldValue);
		checkValue(newValue);
		ReentrantLock lock = stripeFor(h);
		lock.lock();
		try {
			Bucket.Node<K, V> e = bucketFor(h).find(key, h);
			if (e == null || !(e.value == oldValue || e.value.equals(oldValue))) return false;
			e.value = newValue;
			return true;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public V replace(K key, V value) {
		int h = Hashing.smearedHashNonNull(key);
		checkValue(value);
		ReentrantLock lock = stripeFor(h);
		lock.lock();
		try {
			Bucket.Node<K, V> e = bucketFor(h).find(key, h);
			if (e == null) return null;
			V old = e.value;
			e.value = value;
			return old;
		} finally {
			lock.unlock();
		}
	}

	/** Number of live entries; exact when no mutation is in flight. */
	@Override
	public int size() {
		long n = sumCount();
		return (n > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) n;
	}

	@Override
	public boolean isEmpty() {
		return sumCount() == 0L;
	}

	/** Empties every bucket under the full stripe set; keeps the current bucket count. */
	@Override
	public void clear() {
		lockAll();
		try {
			for (Bucket<K, V> b : table) b.clear();
			liveSize.reset();
		} finally {
			unlockAll();
		}
	}

	/** Returns a view whose iterators walk an atomic snapshot taken under the full stripe set. */
	@Override
	public Set<Entry<K, V>> entrySet() {
		return new AbstractSet<>() {
			@Override
			public int size() {
				return StripedHashMap.this.size();
			}

			@Override
			public Iterator<Entry<K, V>> iterator() {
				return new SnapshotIterator<>(snapshotEntries(), e -> StripedHashMap.this.remove(e.getKey()));
			}
		};
	}

	/** Current number of buckets; always a multiple of {@link #stripeCount()}. */
	public int bucketCount() {
		return table.length;
	}

	public int stripeCount() {
		return locks.length;
	}

	public double loadFactor() {
		return loadFactor;
	}

	/* ------------ internals ------------ */

	private V putVal(K key, V value, boolean onlyIfAbsent) {
		int h = Hashing.smearedHashNonNull(key);
		checkValue(value);
		ReentrantLock lock = stripeFor(h);
		Bucket<K, V>[] observed;
		V old;
		lock.lock();
		try {
			observed = table;
			old = observed[Hashing.indexFor(h, observed.length)].put(key, h, value, onlyIfAbsent);
			if (old == null) liveSize.increment();
		} finally {
			lock.unlock();
		}
		if (old == null && Hashing.needsResizing(sumCount(), observed.length, loadFactor)) {
			resize();
		}
		return old;
	}

	private void resize() {
		lockAll();
		try {
			Bucket<K, V>[] current = table;
			long size = sumCount();
			int newLength = current.length;
			// Usually one doubling; more only if inserts raced past several thresholds.
			while (Hashing.needsResizing(size, newLength, loadFactor)) newLength <<= 1;
			if (newLength == current.length) return;
			table = Bucket.rehash(current, newLength);
		} finally {
			unlockAll();
		}
	}

	/* The adder is not an atomic snapshot; ignore transient negative values. */
	private long sumCount() {
		long n = liveSize.sum();
		return (n < 0L) ? 0L : n;
	}

	/* Canonical order: increasing stripe index. */
	private void lockAll() {
		for (ReentrantLock lock : locks) lock.lock();
	}

	private void unlockAll() {
		for (int i = locks.length - 1; i >= 0; i--) locks[i].unlock();
	}

	/* hash mod S, equal to stripeOf(bucketIndex) for every legal bucket count. */
	private ReentrantLock stripeFor(int hash) {
		return locks[Hashing.indexFor(hash, locks.length)];
	}

	/* Caller holds the key's stripe. */
	private Bucket<K, V> bucketFor(int hash) {
		Bucket<K, V>[] tab = table;
		return tab[Hashing.indexFor(hash, tab.length)];
	}

	private ArrayList<Entry<K, V>> snapshotEntries() {
		lockAll();
		try {
			ArrayList<Entry<K, V>> out = new ArrayList<>(size());
			for (Bucket<K, V> b : table) b.snapshotInto(this, out);
			return out;
		} finally {
			unlockAll();
		}
	}

	private static void checkValue(Object value) {
		if (value == null) throw new NullPointerException("Null values not supported");
	}
}
