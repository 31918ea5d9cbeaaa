package works.glint.ast;

import java.util.List;

public record ListLiteral(List<AstValue> elements) implements AstValue {
	public ListLiteral {
		elements = List.copyOf(elements);
	}

	public static ListLiteral of(AstValue... elements) {
		return new ListLiteral(List.of(elements));
	}
}
