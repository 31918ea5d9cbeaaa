package works.glint.jackson;

import java.util.List;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.glint.FloatValue;
import works.glint.GqlList;
import works.glint.GqlObject;
import works.glint.GqlString;
import works.glint.Name;
import works.glint.ObjectField;
import works.glint.ObjectValue;
import works.glint.Value;
import works.glint.jackson.JacksonSerializerSettings.IntegerOverflowMode;
import works.glint.jackson.JacksonSerializerSettings.NonFiniteFloatMode;
import works.glint.testing.ArbitraryValues;
import works.glint.testing.GeneratorSettings;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonSerializerTest {
	static final Name A = Name.of("a");
	static final Name B = Name.of("b");

	private ObjectMapper mapper;

	@BeforeEach
	void setUpJackson() {
		mapper = mapperFor(new JacksonSerializer());
	}

	@ParameterizedTest
	@MethodSource("jsonCases")
	void value_matchesJson(Value value, String json) {
		assertEquals(json, mapper.writeValueAsString(value));
		assertEquals(value, mapper.readValue(json, Value.class));
	}

	static Stream<Arguments> jsonCases() {
		return Stream.of(
			Arguments.of(Value.of(42), "42"),
			Arguments.of(Value.of(-7), "-7"),
			Arguments.of(Value.of(2.5), "2.5"),
			Arguments.of(Value.of(1.0), "1.0"),
			Arguments.of(Value.of(true), "true"),
			Arguments.of(Value.of(false), "false"),
			Arguments.of(Value.of("hello"), "\"hello\""),
			Arguments.of(Value.of("line\nbreak \"quoted\""), "\"line\\nbreak \\\"quoted\\\"\""),
			Arguments.of(Value.nullValue(), "null"),
			Arguments.of(Value.list(), "[]"),
			Arguments.of(Value.list(Value.of(1), Value.of("two"), Value.nullValue()), "[1,\"two\",null]"),
			Arguments.of(new ObjectValue(GqlObject.empty()), "{}"),
			Arguments.of(object(B, Value.of(1), A, Value.list(object(A, Value.of(true)))), "{\"b\":1,\"a\":[{\"a\":true}]}")
		);
	}

	@Test
	void object_keepsDocumentOrder() {
		Value value = mapper.readValue("{\"b\":1,\"a\":2}", Value.class);
		assertThat(value.toObject().orElseThrow().names(), contains(B, A));
		assertEquals("{\"b\":1,\"a\":2}", mapper.writeValueAsString(value));
	}

	@Test
	void enum_writtenAsString() {
		Value value = Value.enumOf(Name.of("RED"));
		String json = mapper.writeValueAsString(value);
		assertEquals("\"RED\"", json);
		assertEquals(Value.of("RED"), mapper.readValue(json, Value.class));
	}

	@Test
	void nonFiniteFloat_failsByDefault() {
		RuntimeException e = assertThrows(RuntimeException.class,
			() -> mapper.writeValueAsString(Value.list(new FloatValue(Double.NaN))));
		assertTrue(messagesOf(e).contains("non-finite"), messagesOf(e));
	}

	@Test
	void nonFiniteFloat_writtenAsString() {
		ObjectMapper lenient = mapperFor(new JacksonSerializer(JacksonSerializerSettings.builder()
			.nonFiniteFloats(NonFiniteFloatMode.WRITE_AS_STRING)
			.build()));
		assertEquals("[\"NaN\",\"Infinity\",\"-Infinity\"]", lenient.writeValueAsString(Value.list(
			new FloatValue(Double.NaN),
			new FloatValue(Double.POSITIVE_INFINITY),
			new FloatValue(Double.NEGATIVE_INFINITY))));
	}

	@Test
	void integerOverflow_failsByDefault() {
		assertThrows(JacksonException.class, () -> mapper.readValue("[2147483648]", Value.class));
		assertThrows(JacksonException.class, () -> mapper.readValue("-99999999999999999999", Value.class));
	}

	@Test
	void integerOverflow_readAsFloat() {
		ObjectMapper lenient = mapperFor(new JacksonSerializer(JacksonSerializerSettings.builder()
			.integerOverflow(IntegerOverflowMode.READ_AS_FLOAT)
			.build()));
		assertEquals(new FloatValue(3_000_000_000.0), lenient.readValue("3000000000", Value.class));
		assertEquals(Value.of(Integer.MIN_VALUE), lenient.readValue("-2147483648", Value.class));
	}

	@Test
	void duplicateKey_rejected() {
		JacksonException e = assertThrows(JacksonException.class,
			() -> mapper.readValue("{\"a\":1,\"b\":2,\"a\":3}", Value.class));
		assertThat(e.getMessage(), containsString("Duplicate"));
	}

	@Test
	void invalidName_rejected() {
		JacksonException e = assertThrows(JacksonException.class,
			() -> mapper.readValue("{\"not a name\":1}", Value.class));
		assertThat(e.getMessage(), containsString("not a name"));
		assertThrows(JacksonException.class, () -> mapper.readValue("\"9lives\"", Name.class));
	}

	@Test
	void payloadTypes_readAndWritten() {
		GqlObject object = mapper.readValue("{\"a\":[1,2]}", GqlObject.class);
		assertEquals(object(A, Value.list(Value.of(1), Value.of(2))).toObject().orElseThrow(), object);
		assertEquals("{\"a\":[1,2]}", mapper.writeValueAsString(object));

		GqlList list = mapper.readValue("[\"x\",{}]", GqlList.class);
		assertEquals(GqlList.of(Value.of("x"), new ObjectValue(GqlObject.empty())), list);
		assertEquals("[\"x\",{}]", mapper.writeValueAsString(list));

		assertEquals(Name.of("_id"), mapper.readValue("\"_id\"", Name.class));
		assertEquals("\"_id\"", mapper.writeValueAsString(Name.of("_id")));
		assertEquals("\"text\"", mapper.writeValueAsString(new GqlString("text")));
	}

	@Test
	void payloadTypes_rejectWrongShape() {
		assertThrows(JacksonException.class, () -> mapper.readValue("[1]", GqlObject.class));
		assertThrows(JacksonException.class, () -> mapper.readValue("{}", GqlList.class));
		assertThrows(JacksonException.class, () -> mapper.readValue("1", Name.class));
	}

	@Test
	void module_isNamedForGlint() {
		assertEquals(JacksonSerializer.MODULE_NAME, new JacksonSerializer().module().getModuleName());
		assertEquals("works.glint", new JacksonSerializer().module().version().getGroupId());
	}

	@ParameterizedTest
	@MethodSource("seeds")
	void randomValues_roundTrip(long seed) {
		ArbitraryValues values = new ArbitraryValues(seed, GeneratorSettings.builder()
			.includeEnums(false)
			.includeNonFiniteFloats(false)
			.build());
		for (int i = 0; i < 50; i++) {
			Value value = values.value();
			String json = mapper.writeValueAsString(value);
			assertEquals(value, mapper.readValue(json, Value.class), () -> "Seed " + seed + ": " + json);
		}
	}

	static LongStream seeds() {
		return LongStream.range(0, 20);
	}

	private static ObjectMapper mapperFor(JacksonSerializer serializer) {
		return JsonMapper.builder()
			.addModule(serializer.module())
			.build();
	}

	private static Value object(Name n1, Value v1, Name n2, Value v2) {
		return new ObjectValue(GqlObject.make(List.of(new ObjectField(n1, v1), new ObjectField(n2, v2))).orElseThrow());
	}

	private static Value object(Name n, Value v) {
		return new ObjectValue(GqlObject.make(List.of(new ObjectField(n, v))).orElseThrow());
	}

	private static String messagesOf(Throwable e) {
		StringBuilder sb = new StringBuilder();
		for (Throwable t = e; t != null; t = t.getCause()) {
			sb.append(t.getMessage()).append('\n');
		}
		return sb.toString();
	}
}
