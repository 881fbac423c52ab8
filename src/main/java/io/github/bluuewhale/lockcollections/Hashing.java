package io.github.bluuewhale.lockcollections;

/**
 * Static helpers based on the hash utilities authored by Guava contributors.
 * Original code by Kevin Bourrillion, Jesse Wilson, and Austin Appleby,
 * derived from the MurmurHash3 intermediate step (public domain).
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Use longs to preserve precision (mirrors the Guava implementation).
	 */
	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	/*
	 * Upper bound on the bucket count of any table.
	 * Matches Guava's Ints.MAX_POWER_OF_TWO (1 << 30).
	 */
	static final int MAX_TABLE_SIZE = 1 << 30;

	/*
	 * This method was rewritten in Java from an intermediate step of the Murmur hash function in
	 * http://code.google.com/p/smhasher/source/browse/trunk/MurmurHash3.cpp, which contained the
	 * following header:
	 *
	 * MurmurHash3 was written by Austin Appleby, and is placed in the public domain. The author
	 * hereby disclaims copyright to this source code.
	 */
	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	static int smearedHashNonNull(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return smear(key.hashCode());
	}

	/** {@code hash mod tableSize}, never negative. */
	static int indexFor(int hash, int tableSize) {
		return Math.floorMod(hash, tableSize);
	}

	/** Smallest power of two that is {@code >= requested}, clamped to [1, MAX_TABLE_SIZE]. */
	static int tableSizeFor(int requested) {
		if (requested <= 1) return 1;
		if (requested >= MAX_TABLE_SIZE) return MAX_TABLE_SIZE;
		return Integer.highestOneBit(requested - 1) << 1;
	}

	/** Smallest {@code stripes * 2^k} that is {@code >= requested}; the result is always a multiple of {@code stripes}. */
	static int stripedTableSizeFor(int requested, int stripes) {
		int size = stripes;
		while (size < requested && size <= (MAX_TABLE_SIZE >> 1)) size <<= 1;
		return size;
	}

	/**
	 * Bucket count that holds {@code expectedEntries} without crossing {@code loadFactor}:
	 * {@code ceil(expectedEntries / loadFactor)}, clamped to [1, MAX_TABLE_SIZE].
	 */
	static int expectedTableSize(int expectedEntries, double loadFactor) {
		if (expectedEntries < 0) throw new IllegalArgumentException("expectedEntries must not be negative: " + expectedEntries);
		validateLoadFactor(loadFactor);
		double buckets = Math.ceil(expectedEntries / loadFactor);
		if (buckets >= MAX_TABLE_SIZE) return MAX_TABLE_SIZE;
		return Math.max(1, (int) buckets);
	}

	static boolean needsResizing(long size, int tableSize, double loadFactor) {
		return size > loadFactor * tableSize && tableSize <= (MAX_TABLE_SIZE >> 1);
	}

	static void validateLoadFactor(double loadFactor) {
		if (!(loadFactor > 0.0d && Double.isFinite(loadFactor))) {
			throw new IllegalArgumentException("loadFactor must be positive and finite: " + loadFactor);
		}
	}

	static void validatePositive(String name, int value) {
		if (value <= 0) throw new IllegalArgumentException(name + " must be positive: " + value);
	}
}
