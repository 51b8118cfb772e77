package org.javai.specmark.type;

/**
 * A named or primitive type such as {@code Number}, {@code ECMAScript language value}
 * or a literal value like {@code *undefined*}.
 */
public record NamedType(String name) implements Type {

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitNamed(this);
	}
}
