package org.javai.specmark.type;

/**
 * A compiled type expression, as written in algorithm headers.
 */
public sealed interface Type permits NamedType, ListType, RecordType, UnionType, CompletionType {

	<R> R accept(TypeVisitor<R> visitor);

	default boolean isCompletion() {
		return false;
	}
}
