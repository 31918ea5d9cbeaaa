package works.glint;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.glint.util.OrderedMap;

/**
 * A literal GraphQL object: the payload of an {@link ObjectValue}.
 * <p>
 * Field names are unique, and the order in which fields were supplied is preserved.
 * That order participates in {@link #equals equality} and is the order
 * in which fields are serialized.
 * <p>
 * (GraphQL calls these "maps" when describing responses,
 * but everywhere else it calls them objects.)
 */
public final class GqlObject implements Comparable<GqlObject> {
	private final OrderedMap<Name, Value> fields;

	private GqlObject(OrderedMap<Name, Value> fields) {
		this.fields = fields;
	}

	public static GqlObject empty() {
		return EMPTY;
	}

	/**
	 * @return an object with the given fields in the given order,
	 * or empty if two fields have the same name.
	 */
	public static Optional<GqlObject> make(List<ObjectField> fields) {
		return fromEntries(fields.stream()
			.map(f -> Map.entry(f.name(), f.value()))
			.toList());
	}

	/**
	 * Same as {@link #make} but takes name/value pairs.
	 */
	public static Optional<GqlObject> fromEntries(List<? extends Map.Entry<Name, ? extends Value>> entries) {
		return OrderedMap.<Name, Value>orderedMap(entries).map(GqlObject::new);
	}

	/**
	 * Combines the fields of all the given objects, in order.
	 *
	 * @return the combined object, or empty if any name occurs in more than one of the objects.
	 * @see OrderedMap#unions
	 */
	public static Optional<GqlObject> union(List<GqlObject> objects) {
		return OrderedMap.unions(objects.stream().map(o -> o.fields).toList())
			.map(GqlObject::new);
	}

	/**
	 * @return the fields in insertion order
	 */
	public List<ObjectField> fields() {
		return fields.entries().stream()
			.map(e -> new ObjectField(e.getKey(), e.getValue()))
			.toList();
	}

	public List<Name> names() {
		return fields.keys();
	}

	public Optional<Value> get(Name name) {
		return fields.get(name);
	}

	public int size() {
		return fields.size();
	}

	public boolean isEmpty() {
		return fields.isEmpty();
	}

	@Override
	public int compareTo(GqlObject other) {
		return ValueOrdering.compareFields(this.fields(), other.fields());
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		GqlObject that = (GqlObject) o;
		return ValueOrdering.compareFields(this.fields(), that.fields()) == 0;
	}

	@Override
	public int hashCode() {
		return ValueOrdering.hash(new ObjectValue(this));
	}

	@Override
	public String toString() {
		return ValueRendering.render(new ObjectValue(this), GqlList.TO_STRING_LIMIT);
	}

	private static final GqlObject EMPTY = new GqlObject(OrderedMap.empty());
}
