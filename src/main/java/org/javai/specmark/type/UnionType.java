package org.javai.specmark.type;

import java.util.List;

/**
 * Any one of two or more member types.
 */
public record UnionType(List<Type> types) implements Type {

	public UnionType {
		if (types == null || types.size() < 2) {
			throw new IllegalArgumentException("union needs at least two members");
		}
		types = List.copyOf(types);
	}

	/**
	 * True when the union has both completion and non-completion members.
	 */
	public boolean mixesCompletions() {
		boolean anyCompletion = types.stream().anyMatch(Type::isCompletion);
		boolean anyOther = types.stream().anyMatch(t -> !t.isCompletion());
		return anyCompletion && anyOther;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitUnion(this);
	}
}
