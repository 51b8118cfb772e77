package org.javai.specmark.type;

import java.util.List;

/**
 * The typed signature compiled from a structured header.
 *
 * @param parameters required parameters in declaration order
 * @param optionalParameters optional parameters in declaration order
 * @param returnType the declared return type, or null
 */
public record Signature(List<Parameter> parameters, List<Parameter> optionalParameters, Type returnType) {

	public Signature {
		parameters = List.copyOf(parameters);
		optionalParameters = List.copyOf(optionalParameters);
	}

	/**
	 * True when the return type is a union of completion and non-completion members.
	 */
	public boolean returnsMixedCompletionUnion() {
		return returnType instanceof UnionType union && union.mixesCompletions();
	}
}
