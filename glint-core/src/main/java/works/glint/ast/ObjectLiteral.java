package works.glint.ast;

import java.util.List;

/**
 * An object as written in a query.
 * Field names are not checked for uniqueness; that's a job for validation.
 */
public record ObjectLiteral(List<AstObjectField> fields) implements AstValue {
	public ObjectLiteral {
		fields = List.copyOf(fields);
	}

	public static ObjectLiteral of(AstObjectField... fields) {
		return new ObjectLiteral(List.of(fields));
	}
}
