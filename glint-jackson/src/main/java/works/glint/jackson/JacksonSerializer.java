package works.glint.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonParser.NumberType;
import tools.jackson.core.JsonToken;
import tools.jackson.core.Version;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.DeserializationConfig;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.deser.Deserializers;
import tools.jackson.databind.ser.Serializers;
import works.glint.BooleanValue;
import works.glint.EnumValue;
import works.glint.FloatValue;
import works.glint.GqlList;
import works.glint.GqlObject;
import works.glint.GqlString;
import works.glint.IntValue;
import works.glint.ListValue;
import works.glint.Name;
import works.glint.NullValue;
import works.glint.ObjectField;
import works.glint.ObjectValue;
import works.glint.StringValue;
import works.glint.Value;
import works.glint.jackson.JacksonSerializerSettings.IntegerOverflowMode;
import works.glint.jackson.JacksonSerializerSettings.NonFiniteFloatMode;

import static java.util.Objects.requireNonNull;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Provides JSON serialization/deserialization of {@link Value}s using Jackson.
 * <p>
 * {@link GqlObject} fields are written in their stored order, and read in document order.
 * Enum values are written as strings; since JSON can't tell the two apart,
 * reading JSON never produces an {@link EnumValue}.
 * <p>
 * Neither direction recurses on the structure of the value,
 * though Jackson's own nesting limits still apply.
 */
public final class JacksonSerializer {
	private final JacksonSerializerSettings settings;

	public JacksonSerializer() {
		this(JacksonSerializerSettings.defaults());
	}

	public JacksonSerializer(JacksonSerializerSettings settings) {
		this.settings = requireNonNull(settings);
	}

	public JacksonSerializerSettings settings() {
		return settings;
	}

	/**
	 * @return a module to register with a {@link tools.jackson.databind.json.JsonMapper JsonMapper} builder
	 */
	public JacksonModule module() {
		LOGGER.debug("Creating Jackson module with {}", settings);
		return new JacksonModule() {
			@Override
			public String getModuleName() {
				return MODULE_NAME;
			}

			@Override
			public Version version() {
				return MODULE_VERSION;
			}

			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new GlintSerializers());
				context.addDeserializers(new GlintDeserializers());
			}
		};
	}

	private final class GlintSerializers extends Serializers.Base {
		private final Map<JavaType, ValueSerializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			return memo.computeIfAbsent(type, t -> getValueSerializer(t));
		}

		private ValueSerializer<?> getValueSerializer(JavaType type) {
			Class<?> theClass = type.getRawClass();
			if (Value.class.isAssignableFrom(theClass)) {
				return valueSerializer();
			} else if (GqlObject.class.isAssignableFrom(theClass)) {
				return objectSerializer();
			} else if (GqlList.class.isAssignableFrom(theClass)) {
				return listSerializer();
			} else if (GqlString.class.isAssignableFrom(theClass)) {
				return gqlStringSerializer();
			} else if (Name.class.isAssignableFrom(theClass)) {
				return nameSerializer();
			} else {
				return null;
			}
		}

		private ValueSerializer<Value> valueSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Value value, JsonGenerator gen, SerializationContext serializers) {
					writeValue(value, gen);
				}
			};
		}

		private ValueSerializer<GqlObject> objectSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(GqlObject value, JsonGenerator gen, SerializationContext serializers) {
					writeValue(new ObjectValue(value), gen);
				}
			};
		}

		private ValueSerializer<GqlList> listSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(GqlList value, JsonGenerator gen, SerializationContext serializers) {
					writeValue(new ListValue(value), gen);
				}
			};
		}

		private ValueSerializer<GqlString> gqlStringSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(GqlString value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeString(value.text());
				}
			};
		}

		private ValueSerializer<Name> nameSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Name value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeString(value.text());
				}
			};
		}
	}

	private final class GlintDeserializers extends Deserializers.Base {
		private final Map<JavaType, ValueDeserializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription.Supplier beanDescRef) {
			return memo.computeIfAbsent(type, t -> getValueDeserializer(t.getRawClass()));
		}

		@Override
		public boolean hasDeserializerFor(DeserializationConfig config, Class<?> valueType) {
			return null != getValueDeserializer(valueType);
		}

		private ValueDeserializer<?> getValueDeserializer(Class<?> theClass) {
			// Only the exact types: a subtype like IntValue can't promise what the JSON holds
			if (theClass == Value.class) {
				return valueDeserializer();
			} else if (theClass == GqlObject.class) {
				return objectDeserializer();
			} else if (theClass == GqlList.class) {
				return listDeserializer();
			} else if (theClass == Name.class) {
				return nameDeserializer();
			} else {
				return null;
			}
		}

		private ValueDeserializer<Value> valueDeserializer() {
			return new ValueDeserializer<>() {
				@Override
				public Value deserialize(JsonParser p, DeserializationContext ctxt) {
					return readValue(p);
				}

				@Override
				public Value getNullValue(DeserializationContext ctxt) {
					return NullValue.NULL;
				}
			};
		}

		private ValueDeserializer<GqlObject> objectDeserializer() {
			return new ValueDeserializer<>() {
				@Override
				public GqlObject deserialize(JsonParser p, DeserializationContext ctxt) {
					expect(JsonToken.START_OBJECT, p);
					return readValue(p).toObject().orElseThrow();
				}
			};
		}

		private ValueDeserializer<GqlList> listDeserializer() {
			return new ValueDeserializer<>() {
				@Override
				public GqlList deserialize(JsonParser p, DeserializationContext ctxt) {
					expect(JsonToken.START_ARRAY, p);
					return ((ListValue) readValue(p)).list();
				}
			};
		}

		private ValueDeserializer<Name> nameDeserializer() {
			return new ValueDeserializer<>() {
				@Override
				public Name deserialize(JsonParser p, DeserializationContext ctxt) {
					expect(VALUE_STRING, p);
					return parseName(p.getString(), p);
				}
			};
		}
	}

	/**
	 * Writes <code>root</code> using an explicit stack of the lists and objects still open.
	 */
	void writeValue(Value root, JsonGenerator gen) {
		Deque<OpenComposite> stack = new ArrayDeque<>();
		writeNode(root, gen, stack);
		while (!stack.isEmpty()) {
			OpenComposite top = stack.peek();
			if (top.fields() != null) {
				if (top.fields().hasNext()) {
					ObjectField field = top.fields().next();
					gen.writeName(field.name().text());
					writeNode(field.value(), gen, stack);
				} else {
					stack.pop();
					gen.writeEndObject();
				}
			} else {
				if (top.elements().hasNext()) {
					writeNode(top.elements().next(), gen, stack);
				} else {
					stack.pop();
					gen.writeEndArray();
				}
			}
		}
	}

	private void writeNode(Value value, JsonGenerator gen, Deque<OpenComposite> stack) {
		if (value instanceof IntValue v) {
			gen.writeNumber(v.value());
		} else if (value instanceof FloatValue v) {
			writeFloat(v.value(), gen);
		} else if (value instanceof BooleanValue v) {
			gen.writeBoolean(v.value());
		} else if (value instanceof StringValue v) {
			gen.writeString(v.text());
		} else if (value instanceof EnumValue v) {
			gen.writeString(v.name().text());
		} else if (value instanceof ListValue v) {
			gen.writeStartArray();
			stack.push(new OpenComposite(null, v.list().values().iterator()));
		} else if (value instanceof ObjectValue v) {
			gen.writeStartObject();
			stack.push(new OpenComposite(v.object().fields().iterator(), null));
		} else {
			gen.writeNull();
		}
	}

	private void writeFloat(double value, JsonGenerator gen) {
		if (Double.isFinite(value)) {
			gen.writeNumber(value);
		} else if (settings.getNonFiniteFloats() == NonFiniteFloatMode.WRITE_AS_STRING) {
			gen.writeString(Double.toString(value));
		} else {
			throw new IllegalArgumentException("Cannot serialize non-finite float " + value + " as JSON");
		}
	}

	/**
	 * Exactly one of the iterators is non-null.
	 */
	private record OpenComposite(Iterator<ObjectField> fields, Iterator<Value> elements) { }

	/**
	 * Reads the value starting at the parser's current token,
	 * leaving the parser on that value's last token.
	 */
	Value readValue(JsonParser p) {
		Deque<PartialComposite> stack = new ArrayDeque<>();
		JsonToken token = p.currentToken();
		while (true) {
			Value completed;
			switch (token) {
				case START_ARRAY -> {
					stack.push(new PartialComposite(false));
					token = p.nextToken();
					continue;
				}
				case START_OBJECT -> {
					stack.push(new PartialComposite(true));
					token = p.nextToken();
					continue;
				}
				case PROPERTY_NAME -> {
					requireNonNull(stack.peek()).pendingName = parseName(p.currentName(), p);
					token = p.nextToken();
					continue;
				}
				case END_ARRAY -> completed = new ListValue(new GqlList(requireNonNull(stack.pop()).elements));
				case END_OBJECT -> completed = requireNonNull(stack.pop()).completeObject(p);
				case VALUE_STRING -> completed = Value.of(p.getString());
				case VALUE_NUMBER_INT -> completed = readInteger(p);
				case VALUE_NUMBER_FLOAT -> completed = new FloatValue(p.getDoubleValue());
				case VALUE_TRUE -> completed = new BooleanValue(true);
				case VALUE_FALSE -> completed = new BooleanValue(false);
				case VALUE_NULL -> completed = NullValue.NULL;
				default -> throw new StreamReadException(p, "Unexpected token " + token);
			}

			PartialComposite parent = stack.peek();
			if (parent == null) {
				return completed;
			}
			parent.add(completed);
			token = p.nextToken();
		}
	}

	private Value readInteger(JsonParser p) {
		if (p.getNumberType() == NumberType.INT) {
			return new IntValue(p.getIntValue());
		} else if (settings.getIntegerOverflow() == IntegerOverflowMode.READ_AS_FLOAT) {
			return new FloatValue(p.getDoubleValue());
		} else {
			throw new StreamReadException(p, "Integer out of range for GraphQL Int: " + p.getString());
		}
	}

	/**
	 * An array or object whose contents have been partly read.
	 */
	private static final class PartialComposite {
		final boolean isObject;
		final List<Value> elements = new ArrayList<>();
		final List<ObjectField> fields = new ArrayList<>();
		Name pendingName;

		PartialComposite(boolean isObject) {
			this.isObject = isObject;
		}

		void add(Value value) {
			if (isObject) {
				fields.add(new ObjectField(requireNonNull(pendingName), value));
				pendingName = null;
			} else {
				elements.add(value);
			}
		}

		ObjectValue completeObject(JsonParser p) {
			return GqlObject.make(fields)
				.map(ObjectValue::new)
				.orElseThrow(() -> new StreamReadException(p, "Duplicate field name in object: " + fields.stream().map(ObjectField::name).toList()));
		}
	}

	private static Name parseName(String text, JsonParser p) {
		return Name.parse(text)
			.orElseThrow(() -> new StreamReadException(p, "Not a valid GraphQL name: \"" + text + "\""));
	}

	public static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}

	public static final String MODULE_NAME = "glint-jackson";
	private static final Version MODULE_VERSION = new Version(0, 1, 0, "SNAPSHOT", "works.glint", "glint-jackson");
	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonSerializer.class);
}
