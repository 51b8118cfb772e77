package org.javai.specmark.type;

/**
 * A Completion Record wrapper.
 *
 * @param kind whether the completion is normal, abrupt or unconstrained
 * @param valueType the type carried by a normal completion, or null
 */
public record CompletionType(CompletionKind kind, Type valueType) implements Type {

	public enum CompletionKind {
		NORMAL,
		ABRUPT,
		MIXED
	}

	@Override
	public boolean isCompletion() {
		return true;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitCompletion(this);
	}
}
