package org.javai.specmark.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every reported diagnostic in report order.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	@Override
	public void report(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
	}

	public List<Diagnostic> diagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> withRule(String ruleId) {
		return diagnostics.stream()
				.filter(d -> d.ruleId().equals(ruleId))
				.toList();
	}

	public boolean isEmpty() {
		return diagnostics.isEmpty();
	}
}
