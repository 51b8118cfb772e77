package org.javai.specmark.diag;

/**
 * Receives diagnostics as they are produced. Reporting never aborts compilation.
 */
@FunctionalInterface
public interface DiagnosticSink {

	void report(Diagnostic diagnostic);

	/**
	 * Returns a sink that forwards every diagnostic to this sink and then to {@code other}.
	 */
	default DiagnosticSink andThen(DiagnosticSink other) {
		return diagnostic -> {
			report(diagnostic);
			other.report(diagnostic);
		};
	}
}
