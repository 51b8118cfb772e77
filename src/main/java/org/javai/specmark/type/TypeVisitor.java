package org.javai.specmark.type;

/**
 * Visitor over compiled {@link Type} trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface TypeVisitor<R> {

	R visitNamed(NamedType type);

	R visitList(ListType type);

	R visitRecord(RecordType type);

	R visitUnion(UnionType type);

	R visitCompletion(CompletionType type);
}
