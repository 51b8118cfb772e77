package org.javai.specmark.header;

import java.util.List;

/**
 * The result of running the header grammar over a header's source.
 *
 * @param prefix a leading {@code Static Semantics: } style prefix, or the empty string
 * @param name the operation name
 * @param hasParameterList whether the header carried a parenthesised parameter list
 * @param parameters required parameters in order
 * @param optionalParameters optional parameters in order
 * @param returnType the raw return type annotation, or null
 * @param returnTypeOffset offset of the return type within the header source
 * @param wrappingTag revision markup around the whole header, or null
 */
public record ParsedHeader(String prefix, String name, boolean hasParameterList, List<HeaderParameter> parameters,
		List<HeaderParameter> optionalParameters, String returnType, int returnTypeOffset, WrappingTag wrappingTag) {

	public ParsedHeader {
		parameters = List.copyOf(parameters);
		optionalParameters = List.copyOf(optionalParameters);
	}
}
