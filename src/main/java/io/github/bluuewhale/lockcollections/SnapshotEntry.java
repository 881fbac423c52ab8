package io.github.bluuewhale.lockcollections;

import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;

/** Entry copied out of a map snapshot; {@link #setValue} writes through to the owning map. */
final class SnapshotEntry<K, V> implements Entry<K, V> {
	private final Map<K, V> owner;
	private final K key;
	private V value;

	SnapshotEntry(Map<K, V> owner, K key, V value) {
		this.owner = owner;
		this.key = key;
		this.value = value;
	}

	@Override
	public K getKey() {
		return key;
	}

	@Override
	public V getValue() {
		return value;
	}

	@Override
	public V setValue(V newValue) {
		if (newValue == null) throw new NullPointerException("Null values not supported");
		V old = owner.put(key, newValue);
		this.value = newValue;
		return old;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Entry<?, ?> e)) return false;
		return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(key) ^ Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return key + "=" + value;
	}
}
