package org.javai.specmark.type;

import org.javai.specmark.SpecParseException;

/**
 * Thrown when a type expression does not match the type grammar.
 */
public class TypeParseException extends SpecParseException {

	public TypeParseException(String message, int offset) {
		super(message, offset);
	}
}
