package org.javai.specmark;

/**
 * Unrecoverable failure while compiling a document: unreadable configuration,
 * or a clause without any header when strict header checking is enabled.
 */
public class SpecCompilationException extends RuntimeException {

	public SpecCompilationException(String message) {
		super(message);
	}

	public SpecCompilationException(String message, Throwable cause) {
		super(message, cause);
	}
}
