package org.javai.specmark.header;

/**
 * A parameter as written in a header, before its type is compiled.
 *
 * @param name the parameter name without underscores
 * @param type the raw type annotation, or null
 * @param typeOffset offset of the type annotation within the header source
 * @param wrappingTag revision markup around the parameter, or null
 */
public record HeaderParameter(String name, String type, int typeOffset, WrappingTag wrappingTag) {

	/**
	 * True when the parameter belongs to a removed revision and must not enter the signature.
	 */
	public boolean isDeleted() {
		return wrappingTag == WrappingTag.DEL;
	}

	/**
	 * The parameter as it is rendered in a header: {@code _name_}, inside its wrapper if any.
	 */
	public String rendered() {
		String var = "_" + name + "_";
		return wrappingTag == null ? var : wrappingTag.wrap(var);
	}
}
