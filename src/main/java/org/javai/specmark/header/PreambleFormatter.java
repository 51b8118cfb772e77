package org.javai.specmark.header;

import java.util.ArrayList;
import java.util.List;
import org.javai.specmark.clause.ClauseKind;
import org.javai.specmark.diag.Diagnostic;
import org.javai.specmark.diag.DiagnosticCategory;
import org.javai.specmark.diag.DiagnosticSink;
import org.jsoup.nodes.Element;

/**
 * Builds the prose paragraph that replaces a structured header's description list,
 * e.g. "The abstract operation Foo takes argument _x_ (a Number) and returns a String."
 */
public class PreambleFormatter {

	public static final String UNKNOWN_NAME = "UNKNOWN";
	public static final String UNPARSEABLE_ARGUMENTS = "UNPARSEABLE ARGUMENTS";

	private final DiagnosticSink sink;

	public PreambleFormatter(DiagnosticSink sink) {
		this.sink = sink;
	}

	/**
	 * Renders the "takes ..." phrase for a parameter list.
	 */
	public static String formatParameters(List<HeaderParameter> required, List<HeaderParameter> optional) {
		if (required.isEmpty() && optional.isEmpty()) {
			return "no arguments";
		}
		List<String> parts = new ArrayList<>();
		if (!required.isEmpty()) {
			parts.add((required.size() == 1 ? "argument " : "arguments ") + joinList(required));
		}
		if (!optional.isEmpty()) {
			parts.add((optional.size() == 1 ? "optional argument " : "optional arguments ") + joinList(optional));
		}
		return String.join(" and ", parts);
	}

	private static String joinList(List<HeaderParameter> parameters) {
		List<String> rendered = parameters.stream().map(PreambleFormatter::formatParameter).toList();
		if (rendered.size() == 1) {
			return rendered.get(0);
		}
		if (rendered.size() == 2) {
			return rendered.get(0) + " and " + rendered.get(1);
		}
		return String.join(", ", rendered.subList(0, rendered.size() - 1)) + ", and " + rendered.get(rendered.size() - 1);
	}

	private static String formatParameter(HeaderParameter parameter) {
		String text = "_" + parameter.name() + "_" + (parameter.type() == null ? "" : " (" + parameter.type() + ")");
		return parameter.wrappingTag() == null ? text : parameter.wrappingTag().wrap(text);
	}

	/**
	 * Builds the preamble paragraphs.
	 *
	 * @param dl the description list being replaced, used as the diagnostic location
	 * @param name the operation name, or {@link #UNKNOWN_NAME}
	 * @param parameters the rendered "takes" phrase, or {@link #UNPARSEABLE_ARGUMENTS}
	 * @param returnType the raw return type, or null
	 * @return inner HTML of each paragraph, in order
	 */
	public List<String> format(Element dl, ClauseKind kind, String name, String parameters, String returnType,
			HeaderFields fields) {
		StringBuilder para = new StringBuilder();
		switch (kind) {
			case ABSTRACT_OPERATION, NUMERIC_METHOD -> para.append("The abstract operation ").append(name);
			case HOST_DEFINED_ABSTRACT_OPERATION -> para.append("The host-defined abstract operation ").append(name);
			case IMPLEMENTATION_DEFINED_ABSTRACT_OPERATION ->
					para.append("The implementation-defined abstract operation ").append(name);
			case SYNTAX_DIRECTED_OPERATION -> para.append("The syntax-directed operation ").append(name);
			case INTERNAL_METHOD, CONCRETE_METHOD -> {
				String receiver = fields.receiver();
				if (receiver == null) {
					sink.report(Diagnostic.of(DiagnosticCategory.SEMANTIC, "header-format",
							"missing \"for\" entry for " + kind.attributeValue(), dl));
					receiver = "MISSING";
				}
				para.append("The ").append(name).append(' ').append(kind.attributeValue()).append(" of ").append(receiver);
			}
			case NONE -> {
				sink.report(Diagnostic.of(DiagnosticCategory.SEMANTIC, "header-format",
						"clauses with structured headers should have a type", dl));
				para.append("The operation ").append(name);
			}
		}

		para.append(" takes ").append(parameters);
		if (returnType != null) {
			para.append(" and returns ").append(returnType);
		}
		para.append('.');

		if (fields.description() != null) {
			para.append(' ').append(fields.description());
		} else if (kind == ClauseKind.SYNTAX_DIRECTED_OPERATION) {
			para.append(" It is defined piecewise over the following productions:");
		} else if (kind.isAlgorithmLike() || kind.hasReceiver()) {
			para.append(" It performs the following steps when called:");
		}
		return List.of(para.toString());
	}
}
