package works.glint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Writes values in GraphQL literal syntax, for messages and {@code toString}.
 */
final class ValueRendering {
	private ValueRendering() {}

	static String render(Value root, int maxLength) {
		StringBuilder sb = new StringBuilder();
		Deque<Open> stack = new ArrayDeque<>();
		renderNode(root, sb, stack);
		while (!stack.isEmpty()) {
			if (sb.length() > maxLength) {
				sb.setLength(maxLength);
				return sb.append("...").toString();
			}
			Open top = stack.peek();
			if (top.fields() != null) {
				if (top.fields().hasNext()) {
					ObjectField field = top.fields().next();
					sb.append(top.started ? ", " : "").append(field.name().text()).append(": ");
					top.started = true;
					renderNode(field.value(), sb, stack);
				} else {
					stack.pop();
					sb.append('}');
				}
			} else {
				if (top.elements().hasNext()) {
					sb.append(top.started ? ", " : "");
					top.started = true;
					renderNode(top.elements().next(), sb, stack);
				} else {
					stack.pop();
					sb.append(']');
				}
			}
		}
		if (sb.length() > maxLength) {
			sb.setLength(maxLength);
			sb.append("...");
		}
		return sb.toString();
	}

	private static void renderNode(Value value, StringBuilder sb, Deque<Open> stack) {
		if (value instanceof IntValue v) {
			sb.append(v.value());
		} else if (value instanceof FloatValue v) {
			sb.append(v.value());
		} else if (value instanceof BooleanValue v) {
			sb.append(v.value());
		} else if (value instanceof StringValue v) {
			appendQuoted(v.text(), sb);
		} else if (value instanceof EnumValue v) {
			sb.append(v.name().text());
		} else if (value instanceof ListValue v) {
			sb.append('[');
			stack.push(new Open(null, v.list().values().iterator()));
		} else if (value instanceof ObjectValue v) {
			sb.append('{');
			stack.push(new Open(v.object().fields().iterator(), null));
		} else {
			sb.append("null");
		}
	}

	private static void appendQuoted(String text, StringBuilder sb) {
		sb.append('"');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '"' -> sb.append("\\\"");
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04X", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		sb.append('"');
	}

	/**
	 * A list or object whose opening bracket has been written.
	 * Exactly one of the iterators is non-null.
	 */
	private static final class Open {
		private final Iterator<ObjectField> fields;
		private final Iterator<Value> elements;
		boolean started = false;

		Open(Iterator<ObjectField> fields, Iterator<Value> elements) {
			this.fields = fields;
			this.elements = elements;
		}

		Iterator<ObjectField> fields() {
			return fields;
		}

		Iterator<Value> elements() {
			return elements;
		}
	}
}
