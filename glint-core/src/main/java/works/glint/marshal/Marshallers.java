package works.glint.marshal;

import java.util.List;
import java.util.Optional;
import works.glint.BooleanValue;
import works.glint.EnumValue;
import works.glint.FloatValue;
import works.glint.GqlList;
import works.glint.GqlObject;
import works.glint.GqlString;
import works.glint.IntValue;
import works.glint.ListValue;
import works.glint.Name;
import works.glint.ObjectValue;
import works.glint.StringValue;
import works.glint.Value;
import works.glint.exceptions.WrongTypeException;
import works.glint.util.NonEmptyList;

/**
 * The built-in {@link Marshaller}s.
 * <p>
 * Each scalar marshaller accepts exactly one {@link Value} variant and reports
 * any other with a {@link WrongTypeException} naming the type it wanted.
 * The structural ones ({@link #list}, {@link #nonEmptyList}, {@link #optional})
 * work for any element type that has a marshaller of its own.
 */
public final class Marshallers {
	private Marshallers() {}

	public static final Marshaller<Boolean> BOOLEAN = Marshaller.of(
		BooleanValue::new,
		value -> {
			if (value instanceof BooleanValue b) {
				return b.value();
			}
			throw new WrongTypeException("Bool", value);
		});

	public static final Marshaller<Integer> INT = Marshaller.of(
		IntValue::new,
		value -> {
			if (value instanceof IntValue i) {
				return i.value();
			}
			throw new WrongTypeException("Int", value);
		});

	public static final Marshaller<Double> FLOAT = Marshaller.of(
		FloatValue::new,
		value -> {
			if (value instanceof FloatValue f) {
				return f.value();
			}
			throw new WrongTypeException("Double", value);
		});

	/**
	 * The {@link GqlString} wrapper.
	 */
	public static final Marshaller<GqlString> GQL_STRING = Marshaller.of(
		StringValue::new,
		value -> {
			if (value instanceof StringValue s) {
				return s.string();
			}
			throw new WrongTypeException("String", value);
		});

	/**
	 * Plain Java text, as a GraphQL string.
	 */
	public static final Marshaller<String> STRING = Marshaller.of(
		Value::of,
		value -> GQL_STRING.fromValue(value).text());

	public static final Marshaller<Name> ENUM = Marshaller.of(
		EnumValue::new,
		value -> {
			if (value instanceof EnumValue e) {
				return e.name();
			}
			throw new WrongTypeException("Enum", value);
		});

	public static final Marshaller<GqlList> LIST = Marshaller.of(
		ListValue::new,
		value -> {
			if (value instanceof ListValue l) {
				return l.list();
			}
			throw new WrongTypeException("List", value);
		});

	public static final Marshaller<GqlObject> OBJECT = Marshaller.of(
		ObjectValue::new,
		value -> value.toObject().orElseThrow(() -> new WrongTypeException("Object", value)));

	public static final Marshaller<Value> VALUE = Marshaller.of(v -> v, v -> v);

	public static <T> Marshaller<List<T>> list(Marshaller<T> elements) {
		return Marshaller.of(ToValue.list(elements), FromValue.list(elements));
	}

	public static <T> Marshaller<NonEmptyList<T>> nonEmptyList(Marshaller<T> elements) {
		return Marshaller.of(ToValue.nonEmptyList(elements), FromValue.nonEmptyList(elements));
	}

	public static <T> Marshaller<Optional<T>> optional(Marshaller<T> present) {
		return Marshaller.of(ToValue.optional(present), FromValue.optional(present));
	}
}
