package org.javai.specmark.diag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each diagnostic to the log at WARN level.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

	private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

	@Override
	public void report(Diagnostic diagnostic) {
		if (diagnostic.hasPosition()) {
			logger.warn("[{}] {} at {}:{}: {}", diagnostic.category(), diagnostic.ruleId(),
					diagnostic.line(), diagnostic.column(), diagnostic.message());
		} else {
			logger.warn("[{}] {}: {}", diagnostic.category(), diagnostic.ruleId(), diagnostic.message());
		}
	}
}
