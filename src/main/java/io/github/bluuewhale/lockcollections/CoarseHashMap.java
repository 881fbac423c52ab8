package io.github.bluuewhale.lockcollections;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Chained hash map guarded by one lock for the entire table (null keys and values NOT allowed).
 *
 * Design notes:
 * - Every operation, including resize, runs under the single {@link ReentrantLock}; acquiring it is
 *   the linearization point.
 * - {@code bucketIndex(key) = hash(key) mod bucketCount}; bucket counts are powers of two.
 * - When an insertion pushes {@code size / bucketCount} above the load factor the table is doubled
 *   inline, still under the lock, so no caller ever observes a partially rehashed table.
 * - Key callbacks ({@code hashCode}/{@code equals}) run before any mutation; a callback exception
 *   leaves the map unchanged.
 */
public final class CoarseHashMap<K, V> extends AbstractMap<K, V> implements ConcurrentMap<K, V> {

	/* Defaults */
	private static final int DEFAULT_INITIAL_BUCKET_COUNT = 16;
	private static final double DEFAULT_LOAD_FACTOR = 0.75d;

	private final ReentrantLock lock = new ReentrantLock();
	private final double loadFactor;
	private Bucket<K, V>[] table;
	private int size;

	public CoarseHashMap() {
		this(DEFAULT_INITIAL_BUCKET_COUNT, DEFAULT_LOAD_FACTOR);
	}

	public CoarseHashMap(int initialBucketCount) {
		this(initialBucketCount, DEFAULT_LOAD_FACTOR);
	}

	public CoarseHashMap(int initialBucketCount, double loadFactor) {
		Hashing.validatePositive("initialBucketCount", initialBucketCount);
		Hashing.validateLoadFactor(loadFactor);
		this.loadFactor = loadFactor;
		this.table = Bucket.newTable(Hashing.tableSizeFor(initialBucketCount));
	}

	/** Creates a map sized so that {@code expectedEntries} insertions never trigger a resize. */
	public static <K, V> CoarseHashMap<K, V> withExpectedSize(int expectedEntries) {
		return new CoarseHashMap<>(Hashing.expectedTableSize(expectedEntries, DEFAULT_LOAD_FACTOR), DEFAULT_LOAD_FACTOR);
	}

	/* ------------ Map API ------------ */

	@Override
	public V get(Object key) {
		int h = Hashing.smearedHashNonNull(key);
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
		lock.lock();
		try {
			V old = bucketFor(h).remove(key, h, null);
			if (old != null) size--;
			return old;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public boolean remove(Object key, Object value) {
		int h = Hashing.smearedHashNonNull(key);
		if (value == null) return false;
		lock.lock();
		try {
			if (bucketFor(h).remove(key, h, value) == null) return false;
			size--;
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

	@Override
	public int size() {
		lock.lock();
		try {
			return size;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public boolean isEmpty() {
		return size() == 0;
	}

	@Override
	public void clear() {
		lock.lock();
		try {
			for (Bucket<K, V> b : table) b.clear();
			size = 0;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		return new AbstractSet<>() {
			@Override
			public int size() {
				return CoarseHashMap.this.size();
			}

			@Override
			public Iterator<Entry<K, V>> iterator() {
				return new SnapshotIterator<>(snapshotEntries(), e -> CoarseHashMap.this.remove(e.getKey()));
			}
		};
	}

	/** Current number of buckets. */
	public int bucketCount() {
		lock.lock();
		try {
			return table.length;
		} finally {
			lock.unlock();
		}
	}

	public double loadFactor() {
		return loadFactor;
	}

	/* ------------ internals ------------ */

	private V putVal(K key, V value, boolean onlyIfAbsent) {
		int h = Hashing.smearedHashNonNull(key);
		checkValue(value);
		lock.lock();
		try {
			V old = bucketFor(h).put(key, h, value, onlyIfAbsent);
			if (old == null && Hashing.needsResizing(++size, table.length, loadFactor)) {
				table = Bucket.rehash(table, table.length << 1);
			}
			return old;
		} finally {
			lock.unlock();
		}
	}

	private Bucket<K, V> bucketFor(int hash) {
		return table[Hashing.indexFor(hash, table.length)];
	}

	private ArrayList<Entry<K, V>> snapshotEntries() {
		lock.lock();
		try {
			ArrayList<Entry<K, V>> out = new ArrayList<>(size);
			for (Bucket<K, V> b : table) b.snapshotInto(this, out);
			return out;
		} finally {
			lock.unlock();
		}
	}

	private static void checkValue(Object value) {
		if (value == null) throw new NullPointerException("Null values not supported");
	}
}
