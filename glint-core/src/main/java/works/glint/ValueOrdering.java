package works.glint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The total order behind {@link Value#compareTo}, and the equality and hashing
 * consistent with it.
 * <p>
 * Values can nest far deeper than the call stack allows,
 * so everything here walks the tree with an explicit stack.
 */
final class ValueOrdering {
	private ValueOrdering() {}

	static int compare(Value a, Value b) {
		Deque<Step> steps = new ArrayDeque<>();
		steps.push(new Values(a, b));
		return run(steps);
	}

	static int compareElements(List<Value> a, List<Value> b) {
		Deque<Step> steps = new ArrayDeque<>();
		pushElements(a, b, steps);
		return run(steps);
	}

	static int compareFields(List<ObjectField> a, List<ObjectField> b) {
		Deque<Step> steps = new ArrayDeque<>();
		pushFields(a, b, steps);
		return run(steps);
	}

	/**
	 * Agrees with {@link #compare}: values that compare equal have the same hash.
	 */
	static int hash(Value root) {
		int result = 1;
		Deque<Value> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			Value v = stack.pop();
			if (v instanceof ListValue l) {
				List<Value> values = l.list().values();
				result = 31 * result + LIST_MARKER + values.size();
				for (int i = values.size() - 1; i >= 0; i--) {
					stack.push(values.get(i));
				}
			} else if (v instanceof ObjectValue o) {
				List<ObjectField> fields = o.object().fields();
				result = 31 * result + OBJECT_MARKER + fields.size();
				for (int i = fields.size() - 1; i >= 0; i--) {
					stack.push(fields.get(i).value());
				}
				for (ObjectField field : fields) {
					result = 31 * result + field.name().hashCode();
				}
			} else {
				result = 31 * result + v.hashCode();
			}
		}
		return result;
	}

	private static int run(Deque<Step> steps) {
		while (!steps.isEmpty()) {
			Step step = steps.pop();
			int c;
			if (step instanceof Sizes s) {
				c = Integer.compare(s.a(), s.b());
			} else if (step instanceof Names n) {
				c = n.a().compareTo(n.b());
			} else {
				Values pair = (Values) step;
				c = compareShallow(pair.a(), pair.b(), steps);
			}
			if (c != 0) {
				return c;
			}
		}
		return 0;
	}

	/**
	 * Compares everything but the children of lists and objects,
	 * which are pushed onto <code>steps</code> instead.
	 */
	private static int compareShallow(Value a, Value b, Deque<Step> steps) {
		int byVariant = Integer.compare(rank(a), rank(b));
		if (byVariant != 0) {
			return byVariant;
		}
		if (a instanceof IntValue x && b instanceof IntValue y) {
			return Integer.compare(x.value(), y.value());
		} else if (a instanceof FloatValue x && b instanceof FloatValue y) {
			return Double.compare(x.value(), y.value());
		} else if (a instanceof BooleanValue x && b instanceof BooleanValue y) {
			return Boolean.compare(x.value(), y.value());
		} else if (a instanceof StringValue x && b instanceof StringValue y) {
			return x.string().compareTo(y.string());
		} else if (a instanceof EnumValue x && b instanceof EnumValue y) {
			return x.name().compareTo(y.name());
		} else if (a instanceof ListValue x && b instanceof ListValue y) {
			pushElements(x.list().values(), y.list().values(), steps);
			return 0;
		} else if (a instanceof ObjectValue x && b instanceof ObjectValue y) {
			pushFields(x.object().fields(), y.object().fields(), steps);
			return 0;
		} else {
			// Both null
			return 0;
		}
	}

	/**
	 * Pushed in reverse so the first pair pops first and the length comparison pops last.
	 */
	private static void pushElements(List<Value> a, List<Value> b, Deque<Step> steps) {
		steps.push(new Sizes(a.size(), b.size()));
		for (int i = Math.min(a.size(), b.size()) - 1; i >= 0; i--) {
			steps.push(new Values(a.get(i), b.get(i)));
		}
	}

	private static void pushFields(List<ObjectField> a, List<ObjectField> b, Deque<Step> steps) {
		steps.push(new Sizes(a.size(), b.size()));
		for (int i = Math.min(a.size(), b.size()) - 1; i >= 0; i--) {
			steps.push(new Values(a.get(i).value(), b.get(i).value()));
			steps.push(new Names(a.get(i).name(), b.get(i).name()));
		}
	}

	private static int rank(Value v) {
		if (v instanceof IntValue) {
			return 0;
		} else if (v instanceof FloatValue) {
			return 1;
		} else if (v instanceof BooleanValue) {
			return 2;
		} else if (v instanceof StringValue) {
			return 3;
		} else if (v instanceof EnumValue) {
			return 4;
		} else if (v instanceof ListValue) {
			return 5;
		} else if (v instanceof ObjectValue) {
			return 6;
		} else {
			return 7;
		}
	}

	private sealed interface Step permits Values, Names, Sizes { }
	private record Values(Value a, Value b) implements Step { }
	private record Names(Name a, Name b) implements Step { }
	private record Sizes(int a, int b) implements Step { }

	private static final int LIST_MARKER = 0x4C000000;
	private static final int OBJECT_MARKER = 0x4F000000;
}
