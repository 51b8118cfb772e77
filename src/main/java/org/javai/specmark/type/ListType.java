package org.javai.specmark.type;

/**
 * A List, optionally with a known element type.
 *
 * @param elementType the element type, or null for "a List" without qualification
 */
public record ListType(Type elementType) implements Type {

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitList(this);
	}
}
