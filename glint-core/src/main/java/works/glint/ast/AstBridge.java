package works.glint.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import works.glint.StringValue;
import works.glint.Value;

/**
 * Converts between the parser's {@link AstValue} nodes and canonical {@link Value}s.
 * <p>
 * Both directions walk the tree with an explicit stack rather than recursion,
 * so untrusted input can't exhaust the call stack no matter how deeply it nests.
 */
public final class AstBridge {
	private AstBridge() {}

	/**
	 * Convert an AST value into a literal value.
	 *
	 * @return the equivalent {@link Value}, or empty if <code>ast</code> is not a literal:
	 * that is, if it contains a {@link VariableReference}, or an {@link ObjectLiteral}
	 * that repeats a field name.
	 */
	public static Optional<Value> astToValue(AstValue ast) {
		Deque<Frame<AstValue, Value>> stack = new ArrayDeque<>();
		AstValue current = ast;
		while (true) {
			Value result = null;
			if (current instanceof ListLiteral l) {
				stack.push(new Frame<>(l, l.elements()));
			} else if (current instanceof ObjectLiteral o) {
				stack.push(new Frame<>(o, o.fields().stream().map(AstObjectField::value).toList()));
			} else {
				Optional<Value> scalar = scalarToValue(current);
				if (scalar.isEmpty()) {
					return Optional.empty();
				}
				result = scalar.get();
			}

			// Hand the result to the enclosing node, completing any nodes that are now full
			while (true) {
				if (result != null) {
					if (stack.isEmpty()) {
						return Optional.of(result);
					}
					stack.peek().converted.add(result);
					result = null;
				}
				Frame<AstValue, Value> top = stack.peek();
				if (top.hasNext()) {
					current = top.nextChild();
					break;
				}
				stack.pop();
				Optional<Value> completed = completeValue(top);
				if (completed.isEmpty()) {
					return Optional.empty();
				}
				result = completed.get();
			}
		}
	}

	/**
	 * Convert a literal value into an AST value.
	 * <p>
	 * This is the inverse of {@link #astToValue}: for any {@link Value} <code>v</code>,
	 * <code>astToValue(valueToAst(v))</code> is <code>v</code>.
	 */
	public static AstValue valueToAst(Value value) {
		Deque<Frame<Value, AstValue>> stack = new ArrayDeque<>();
		Value current = value;
		while (true) {
			AstValue result = null;
			if (current instanceof ListValue l) {
				stack.push(new Frame<>(l, l.list().values()));
			} else if (current instanceof ObjectValue o) {
				stack.push(new Frame<>(o, o.object().fields().stream().map(ObjectField::value).toList()));
			} else {
				result = scalarToAst(current);
			}

			while (true) {
				if (result != null) {
					if (stack.isEmpty()) {
						return result;
					}
					stack.peek().converted.add(result);
					result = null;
				}
				Frame<Value, AstValue> top = stack.peek();
				if (top.hasNext()) {
					current = top.nextChild();
					break;
				}
				stack.pop();
				result = completeAst(top);
			}
		}
	}

	private static Optional<Value> scalarToValue(AstValue ast) {
		if (ast instanceof IntLiteral i) {
			return Optional.of(new IntValue(i.value()));
		} else if (ast instanceof FloatLiteral f) {
			return Optional.of(new FloatValue(f.value()));
		} else if (ast instanceof BooleanLiteral b) {
			return Optional.of(new BooleanValue(b.value()));
		} else if (ast instanceof StringLiteral s) {
			return Optional.of(Value.of(s.value()));
		} else if (ast instanceof EnumLiteral e) {
			return Optional.of(new EnumValue(e.name()));
		} else if (ast instanceof NullLiteral) {
			return Optional.of(NullValue.NULL);
		} else if (ast instanceof VariableReference v) {
			LOGGER.trace("Variable ${} has no literal value", v.name());
			return Optional.empty();
		} else {
			throw new IllegalStateException("Unexpected AST node: " + ast);
		}
	}

	private static Optional<Value> completeValue(Frame<AstValue, Value> frame) {
		if (frame.node instanceof ObjectLiteral o) {
			List<ObjectField> fields = new ArrayList<>(o.fields().size());
			for (int i = 0; i < o.fields().size(); i++) {
				fields.add(new ObjectField(o.fields().get(i).name(), frame.converted.get(i)));
			}
			Optional<GqlObject> object = GqlObject.make(fields);
			if (object.isEmpty()) {
				LOGGER.trace("Object literal repeats a field name: {}", o.fields().stream().map(AstObjectField::name).toList());
			}
			return object.map(ObjectValue::new);
		} else {
			return Optional.of(new ListValue(new GqlList(frame.converted)));
		}
	}

	private static AstValue scalarToAst(Value value) {
		if (value instanceof IntValue i) {
			return new IntLiteral(i.value());
		} else if (value instanceof FloatValue f) {
			return new FloatLiteral(f.value());
		} else if (value instanceof BooleanValue b) {
			return new BooleanLiteral(b.value());
		} else if (value instanceof StringValue s) {
			return new StringLiteral(s.text());
		} else if (value instanceof EnumValue e) {
			return new EnumLiteral(e.name());
		} else if (value instanceof NullValue) {
			return NullLiteral.NULL;
		} else {
			throw new IllegalStateException("Unexpected composite value: " + value);
		}
	}

	private static AstValue completeAst(Frame<Value, AstValue> frame) {
		if (frame.node instanceof ObjectValue o) {
			List<Name> names = o.object().names();
			List<AstObjectField> fields = new ArrayList<>(names.size());
			for (int i = 0; i < names.size(); i++) {
				fields.add(new AstObjectField(names.get(i), frame.converted.get(i)));
			}
			return new ObjectLiteral(fields);
		} else {
			return new ListLiteral(frame.converted);
		}
	}

	/**
	 * A list or object whose children are partway through conversion.
	 */
	private static final class Frame<N, R> {
		final N node;
		final List<N> children;
		final List<R> converted;

		Frame(N node, List<N> children) {
			this.node = node;
			this.children = children;
			this.converted = new ArrayList<>(children.size());
		}

		boolean hasNext() {
			return converted.size() < children.size();
		}

		N nextChild() {
			return children.get(converted.size());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AstBridge.class);
}
