package org.javai.specmark;

/**
 * Exception thrown when parsing a header or type expression fails.
 * <p>
 * The offset is relative to the string that was handed to the parser. Callers
 * that parsed a substring are expected to shift it with {@link #shift(int)}
 * before mapping it onto the surrounding document.
 */
public class SpecParseException extends RuntimeException {

	private int offset;

	public SpecParseException(String message, int offset) {
		super(message);
		this.offset = offset;
	}

	public SpecParseException(String message, int offset, Throwable cause) {
		super(message, cause);
		this.offset = offset;
	}

	/**
	 * Character offset of the failure within the parsed input.
	 */
	public int offset() {
		return offset;
	}

	/**
	 * Moves the offset by {@code delta}, returning this exception for rethrowing.
	 */
	public SpecParseException shift(int delta) {
		this.offset += delta;
		return this;
	}
}
