package works.glint.util;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Objects.requireNonNull;

/**
 * A persistent map whose keys are unique and whose iteration order
 * is the order in which the keys were inserted.
 * <p>
 * Insertion order is part of the map's identity:
 * two maps with the same entries in different orders are not {@link #equals equal}.
 * <p>
 * Nothing here ever replaces an existing entry.
 * Every operation that would insert a duplicate key returns empty instead,
 * including {@link #unions}.
 */
public final class OrderedMap<K, V> {
	private final PVector<K> keys;
	private final PMap<K, V> map;

	private OrderedMap(PVector<K> keys, PMap<K, V> map) {
		this.keys = keys;
		this.map = map;
	}

	@SuppressWarnings("unchecked")
	public static <K, V> OrderedMap<K, V> empty() {
		return (OrderedMap<K, V>) EMPTY;
	}

	/**
	 * @return a map of the given entries in the given order,
	 * or empty if any key appears more than once.
	 */
	public static <K, V> Optional<OrderedMap<K, V>> orderedMap(List<? extends Map.Entry<? extends K, ? extends V>> entries) {
		PVector<K> keys = TreePVector.empty();
		PMap<K, V> map = HashTreePMap.empty();
		for (var entry : entries) {
			K key = requireNonNull(entry.getKey());
			if (map.containsKey(key)) {
				return Optional.empty();
			}
			keys = keys.plus(key);
			map = map.plus(key, requireNonNull(entry.getValue()));
		}
		return Optional.of(new OrderedMap<>(keys, map));
	}

	/**
	 * Concatenates the given maps, preserving their order and the order of their entries.
	 * <p>
	 * If a key appears in more than one of the maps, the result is empty.
	 * No map is ever preferred over another.
	 */
	public static <K, V> Optional<OrderedMap<K, V>> unions(List<OrderedMap<K, V>> maps) {
		PVector<K> keys = TreePVector.empty();
		PMap<K, V> map = HashTreePMap.empty();
		for (OrderedMap<K, V> m : maps) {
			for (K key : m.keys) {
				if (map.containsKey(key)) {
					return Optional.empty();
				}
				keys = keys.plus(key);
				map = map.plus(key, m.map.get(key));
			}
		}
		return Optional.of(new OrderedMap<>(keys, map));
	}

	/**
	 * @return this map with the given entry appended, or empty if <code>key</code> is already present.
	 */
	public Optional<OrderedMap<K, V>> plus(K key, V value) {
		if (map.containsKey(requireNonNull(key))) {
			return Optional.empty();
		}
		return Optional.of(new OrderedMap<>(keys.plus(key), map.plus(key, requireNonNull(value))));
	}

	public Optional<V> get(K key) {
		return Optional.ofNullable(map.get(key));
	}

	public boolean containsKey(K key) {
		return map.containsKey(key);
	}

	public List<K> keys() {
		return keys;
	}

	public List<V> values() {
		return keys.stream().map(map::get).toList();
	}

	public List<Map.Entry<K, V>> entries() {
		return keys.stream()
			.<Map.Entry<K, V>>map(k -> new SimpleImmutableEntry<>(k, map.get(k)))
			.toList();
	}

	public int size() {
		return keys.size();
	}

	public boolean isEmpty() {
		return keys.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		OrderedMap<?, ?> that = (OrderedMap<?, ?>) o;
		return keys.equals(that.keys) && map.equals(that.map);
	}

	@Override
	public int hashCode() {
		return 31 * keys.hashCode() + map.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		String separator = "";
		for (K key : keys) {
			sb.append(separator).append(key).append('=').append(map.get(key));
			separator = ", ";
		}
		return sb.append('}').toString();
	}

	private static final OrderedMap<?, ?> EMPTY = new OrderedMap<>(TreePVector.empty(), HashTreePMap.empty());
}
