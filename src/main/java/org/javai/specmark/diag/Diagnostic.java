package org.javai.specmark.diag;

import java.util.Objects;
import org.jsoup.nodes.Element;

/**
 * A single non-fatal problem found while compiling a document.
 *
 * @param category the broad classification
 * @param ruleId stable identifier of the rule that fired, e.g. {@code duplicate-definition}
 * @param message human readable description
 * @param node the element the problem is attached to (may be null for detached input)
 * @param line 1-based line in the original source, or null when unknown
 * @param column 1-based column in the original source, or null when unknown
 */
public record Diagnostic(DiagnosticCategory category, String ruleId, String message, Element node,
		Integer line, Integer column) {

	public Diagnostic {
		Objects.requireNonNull(category, "category must not be null");
		Objects.requireNonNull(ruleId, "ruleId must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public static Diagnostic of(DiagnosticCategory category, String ruleId, String message, Element node) {
		return new Diagnostic(category, ruleId, message, node, null, null);
	}

	public static Diagnostic at(DiagnosticCategory category, String ruleId, String message, Element node,
			SourcePosition position) {
		return position == null
				? of(category, ruleId, message, node)
				: new Diagnostic(category, ruleId, message, node, position.line(), position.column());
	}

	public boolean hasPosition() {
		return line != null && column != null;
	}

	@Override
	public String toString() {
		String where = hasPosition() ? " (" + line + ":" + column + ")" : "";
		String tag = node != null ? " <" + node.tagName() + (node.id().isEmpty() ? "" : " id=" + node.id()) + ">" : "";
		return category + " " + ruleId + where + tag + ": " + message;
	}
}
