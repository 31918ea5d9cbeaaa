package works.glint.ast;

/**
 * A value as it appears in the syntax of a parsed query.
 * <p>
 * These nodes belong to whatever parser produced them.
 * Unlike {@link works.glint.Value Value}, they may contain {@link VariableReference variables},
 * and an {@link ObjectLiteral} may repeat a field name.
 *
 * @see AstBridge
 */
public sealed interface AstValue permits
	IntLiteral,
	FloatLiteral,
	BooleanLiteral,
	StringLiteral,
	EnumLiteral,
	ListLiteral,
	ObjectLiteral,
	NullLiteral,
	VariableReference
{
}
