package org.javai.specmark.diag;

/**
 * Broad classification of a diagnostic.
 */
public enum DiagnosticCategory {
	/** Missing id, missing or misplaced header, misplaced clause. */
	STRUCTURAL,
	/** Header grammar or type grammar failure. */
	PARSE,
	/** Well-formed input that violates a document rule. */
	SEMANTIC
}
