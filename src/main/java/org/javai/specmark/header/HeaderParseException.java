package org.javai.specmark.header;

import org.javai.specmark.SpecParseException;

/**
 * Thrown when header source does not match the header grammar.
 */
public class HeaderParseException extends SpecParseException {

	public HeaderParseException(String message, int offset) {
		super(message, offset);
	}
}
