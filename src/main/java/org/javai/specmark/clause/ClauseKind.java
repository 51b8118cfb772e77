package org.javai.specmark.clause;

import java.util.Arrays;
import java.util.Optional;

/**
 * The declared kind of a clause, taken from its {@code type} attribute.
 */
public enum ClauseKind {
	ABSTRACT_OPERATION("abstract operation", true),
	SYNTAX_DIRECTED_OPERATION("syntax-directed operation", true),
	HOST_DEFINED_ABSTRACT_OPERATION("host-defined abstract operation", true),
	IMPLEMENTATION_DEFINED_ABSTRACT_OPERATION("implementation-defined abstract operation", true),
	NUMERIC_METHOD("numeric method", true),
	INTERNAL_METHOD("internal method", false),
	CONCRETE_METHOD("concrete method", false),
	NONE("", false);

	private final String attributeValue;
	private final boolean algorithmLike;

	ClauseKind(String attributeValue, boolean algorithmLike) {
		this.attributeValue = attributeValue;
		this.algorithmLike = algorithmLike;
	}

	/**
	 * The canonical attribute spelling, e.g. {@code abstract operation}.
	 */
	public String attributeValue() {
		return attributeValue;
	}

	/**
	 * Kinds whose compiled header name becomes the clause's aoid.
	 */
	public boolean isAlgorithmLike() {
		return algorithmLike;
	}

	/**
	 * Kinds rendered as "the X method of Receiver".
	 */
	public boolean hasReceiver() {
		return this == INTERNAL_METHOD || this == CONCRETE_METHOD;
	}

	/**
	 * Resolves a {@code type} attribute. A null or empty value is {@link #NONE};
	 * {@code sdo} is accepted as shorthand for syntax-directed operations.
	 *
	 * @return the kind, or empty when the value names no known kind
	 */
	public static Optional<ClauseKind> fromAttribute(String value) {
		if (value == null || value.isEmpty()) {
			return Optional.of(NONE);
		}
		if (value.equals("sdo")) {
			return Optional.of(SYNTAX_DIRECTED_OPERATION);
		}
		return Arrays.stream(values())
				.filter(kind -> kind != NONE && kind.attributeValue.equals(value))
				.findFirst();
	}
}
