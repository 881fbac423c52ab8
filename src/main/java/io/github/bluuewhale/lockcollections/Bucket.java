package io.github.bluuewhale.lockcollections;

import java.util.List;
import java.util.Map;

/**
 * Chain of entries sharing one hash slot. Not thread-safe: every call must hold the lock that owns
 * the bucket.
 *
 * Keys in a chain are unique. Nodes cache the smeared hash, so relinking into a larger table never
 * calls back into {@code hashCode()}.
 */
final class Bucket<K, V> {

	static final class Node<K, V> {
		final int hash;
		final K key;
		V value;
		Node<K, V> next;

		Node(int hash, K key, V value, Node<K, V> next) {
			this.hash = hash;
			this.key = key;
			this.value = value;
			this.next = next;
		}
	}

	private Node<K, V> head;

	@SuppressWarnings("unchecked")
	static <K, V> Bucket<K, V>[] newTable(int length) {
		Bucket<K, V>[] table = (Bucket<K, V>[]) new Bucket[length];
		for (int i = 0; i < length; i++) table[i] = new Bucket<>();
		return table;
	}

	/**
	 * Allocates a table of {@code newLength} buckets and moves every node of {@code old} into it.
	 * The caller must hold every lock guarding {@code old} and must not use {@code old} afterwards.
	 */
	static <K, V> Bucket<K, V>[] rehash(Bucket<K, V>[] old, int newLength) {
		Bucket<K, V>[] table = newTable(newLength);
		for (Bucket<K, V> b : old) {
			Node<K, V> e = b.head;
			while (e != null) {
				Node<K, V> next = e.next;
				Bucket<K, V> dst = table[Hashing.indexFor(e.hash, newLength)];
				e.next = dst.head;
				dst.head = e;
				e = next;
			}
			b.head = null;
		}
		return table;
	}

	Node<K, V> find(Object key, int hash) {
		for (Node<K, V> e = head; e != null; e = e.next) {
			if (e.hash == hash && (e.key == key || e.key.equals(key))) return e;
		}
		return null;
	}

	/**
	 * Maps {@code key} to {@code value}, or only inserts when {@code onlyIfAbsent}.
	 * Returns the previous value, or null if a new node was linked.
	 */
	V put(K key, int hash, V value, boolean onlyIfAbsent) {
		Node<K, V> e = find(key, hash);
		if (e != null) {
			V old = e.value;
			if (!onlyIfAbsent) e.value = value;
			return old;
		}
		head = new Node<>(hash, key, value, head);
		return null;
	}

	/**
	 * Unlinks the node for {@code key} if present and, when {@code expectedValue} is non-null, mapped
	 * to an equal value. Returns the unlinked node's value, or null if nothing was removed.
	 */
	V remove(Object key, int hash, Object expectedValue) {
		Node<K, V> pred = null;
		for (Node<K, V> e = head; e != null; pred = e, e = e.next) {
			if (e.hash == hash && (e.key == key || e.key.equals(key))) {
				if (expectedValue != null && !(e.value == expectedValue || e.value.equals(expectedValue))) return null;
				if (pred == null) head = e.next;
				else pred.next = e.next;
				return e.value;
			}
		}
		return null;
	}

	void clear() {
		head = null;
	}

	void snapshotInto(Map<K, V> owner, List<Map.Entry<K, V>> out) {
		for (Node<K, V> e = head; e != null; e = e.next) {
			out.add(new SnapshotEntry<>(owner, e.key, e.value));
		}
	}
}
