package works.glint.testing;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import works.glint.BooleanValue;
import works.glint.EnumValue;
import works.glint.FloatValue;
import works.glint.GqlList;
import works.glint.GqlObject;
import works.glint.IntValue;
import works.glint.ListValue;
import works.glint.Name;
import works.glint.NullValue;
import works.glint.ObjectField;
import works.glint.ObjectValue;
import works.glint.Value;
import works.glint.ast.AstObjectField;
import works.glint.ast.AstValue;
import works.glint.ast.BooleanLiteral;
import works.glint.ast.EnumLiteral;
import works.glint.ast.FloatLiteral;
import works.glint.ast.IntLiteral;
import works.glint.ast.ListLiteral;
import works.glint.ast.NullLiteral;
import works.glint.ast.ObjectLiteral;
import works.glint.ast.StringLiteral;
import works.glint.ast.VariableReference;

import static java.util.Objects.requireNonNull;

/**
 * Generates random {@link Value}s, {@link GqlObject}s and {@link AstValue}s
 * for property-style tests.
 * <p>
 * Generation is deterministic for a given seed and {@link GeneratorSettings},
 * so a failing case can be reproduced from its seed alone.
 * <p>
 * Generated lists may be heterogeneous. GraphQL doesn't allow that,
 * but the value model does, so it needs testing.
 */
public final class ArbitraryValues {
	private final Random random;
	private final GeneratorSettings settings;

	public ArbitraryValues(long seed) {
		this(seed, GeneratorSettings.defaults());
	}

	public ArbitraryValues(long seed, GeneratorSettings settings) {
		this.random = new Random(seed);
		this.settings = requireNonNull(settings);
	}

	/**
	 * @return a value nested no deeper than {@link GeneratorSettings#getMaxDepth()}
	 */
	public Value value() {
		return value(settings.getMaxDepth());
	}

	/**
	 * @return a value whose lists and objects nest at most <code>depth</code> levels
	 */
	public Value value(int depth) {
		if (depth <= 0) {
			return scalar();
		}
		return switch (random.nextInt(3)) {
			case 0 -> new ObjectValue(object(depth - 1));
			case 1 -> new ListValue(list(depth - 1));
			default -> scalar();
		};
	}

	public Value scalar() {
		int choices = settings.isIncludeEnums() ? 6 : 5;
		return switch (random.nextInt(choices)) {
			case 0 -> new IntValue(random.nextInt());
			case 1 -> new FloatValue(floatingPoint());
			case 2 -> new BooleanValue(random.nextBoolean());
			case 3 -> Value.of(text());
			case 4 -> NullValue.NULL;
			default -> new EnumValue(name());
		};
	}

	public GqlList list(int depth) {
		int length = random.nextInt(settings.getMaxListLength() + 1);
		List<Value> elements = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			elements.add(value(depth));
		}
		return new GqlList(elements);
	}

	/**
	 * @return an object whose field values nest at most <code>depth</code> levels
	 */
	public GqlObject object(int depth) {
		List<ObjectField> fields = new ArrayList<>();
		for (Name name : distinctNames(random.nextInt(settings.getMaxFields() + 1))) {
			fields.add(new ObjectField(name, value(depth)));
		}
		return GqlObject.make(fields).orElseThrow();
	}

	/**
	 * Unlike {@link #value()}, the result may contain variables
	 * and objects with repeated field names, as a parser could produce.
	 */
	public AstValue ast() {
		return ast(settings.getMaxDepth());
	}

	public AstValue ast(int depth) {
		if (depth <= 0) {
			return astScalar();
		}
		return switch (random.nextInt(3)) {
			case 0 -> astObject(depth - 1);
			case 1 -> astList(depth - 1);
			default -> astScalar();
		};
	}

	public Name name() {
		int length = random.nextInt(8);
		StringBuilder sb = new StringBuilder(length + 1);
		sb.append(NAME_START.charAt(random.nextInt(NAME_START.length())));
		for (int i = 0; i < length; i++) {
			sb.append(NAME_CONTINUE.charAt(random.nextInt(NAME_CONTINUE.length())));
		}
		return Name.of(sb.toString());
	}

	/**
	 * @return text that includes, now and then, control characters,
	 * non-ASCII characters, and characters outside the Basic Multilingual Plane
	 */
	public String text() {
		int length = random.nextInt(12);
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < length; i++) {
			int codePoint = switch (random.nextInt(10)) {
				case 0 -> random.nextInt(0x20);
				case 1 -> 0x00A0 + random.nextInt(0xD7FF - 0x00A0);
				case 2 -> 0x10000 + random.nextInt(0x10FFFF - 0x10000);
				default -> 0x20 + random.nextInt(0x7F - 0x20);
			};
			sb.appendCodePoint(codePoint);
		}
		return sb.toString();
	}

	private double floatingPoint() {
		return switch (random.nextInt(settings.isIncludeNonFiniteFloats() ? 8 : 5)) {
			case 0 -> 0.0;
			case 1 -> -0.0;
			case 2 -> random.nextDouble();
			case 3 -> (random.nextDouble() - 0.5) * Math.pow(10, random.nextInt(600) - 300);
			case 4 -> random.nextInt(1000);
			case 5 -> Double.NaN;
			case 6 -> Double.POSITIVE_INFINITY;
			default -> Double.NEGATIVE_INFINITY;
		};
	}

	private AstValue astScalar() {
		if (random.nextDouble() < settings.getVariableRate()) {
			return new VariableReference(name());
		}
		return switch (random.nextInt(settings.isIncludeEnums() ? 6 : 5)) {
			case 0 -> new IntLiteral(random.nextInt());
			case 1 -> new FloatLiteral(floatingPoint());
			case 2 -> new BooleanLiteral(random.nextBoolean());
			case 3 -> new StringLiteral(text());
			case 4 -> NullLiteral.NULL;
			default -> new EnumLiteral(name());
		};
	}

	private AstValue astList(int depth) {
		int length = random.nextInt(settings.getMaxListLength() + 1);
		List<AstValue> elements = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			elements.add(ast(depth));
		}
		return new ListLiteral(elements);
	}

	private AstValue astObject(int depth) {
		int size = random.nextInt(settings.getMaxFields() + 1);
		List<AstObjectField> fields = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			Name name;
			if (!fields.isEmpty() && random.nextDouble() < settings.getDuplicateNameRate()) {
				name = fields.get(random.nextInt(fields.size())).name();
			} else {
				name = name();
			}
			fields.add(new AstObjectField(name, ast(depth)));
		}
		return new ObjectLiteral(fields);
	}

	private Set<Name> distinctNames(int count) {
		Set<Name> result = new LinkedHashSet<>();
		while (result.size() < count) {
			result.add(name());
		}
		return result;
	}

	private static final String NAME_START = "_ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
	private static final String NAME_CONTINUE = NAME_START + "0123456789";
}
