package org.javai.specmark.header;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.specmark.SpecDocument;
import org.javai.specmark.SpecDocument.ContentLocation;
import org.javai.specmark.clause.ClauseKind;
import org.javai.specmark.diag.Diagnostic;
import org.javai.specmark.diag.DiagnosticCategory;
import org.javai.specmark.diag.DiagnosticSink;
import org.javai.specmark.diag.SourcePosition;
import org.javai.specmark.type.Parameter;
import org.javai.specmark.type.Signature;
import org.javai.specmark.type.Type;
import org.javai.specmark.type.TypeParseException;
import org.javai.specmark.type.TypeParser;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a clause header followed by a {@code <dl class="header">} into a typed
 * signature, rewrites the header into its display form and replaces the
 * description list with a synthesized preamble.
 * <p>
 * Failures never abort: a header that does not parse keeps its literal content
 * and yields no signature, and a type that does not parse is reported at its
 * line and column in the original document.
 */
public class StructuredHeaderCompiler {

	private static final Logger logger = LoggerFactory.getLogger(StructuredHeaderCompiler.class);

	private final SpecDocument document;
	private final DiagnosticSink sink;
	private final HeaderFieldsParser fieldsParser;
	private final PreambleFormatter preambleFormatter;

	public StructuredHeaderCompiler(SpecDocument document, DiagnosticSink sink, Set<String> knownEffects) {
		this.document = document;
		this.sink = sink;
		this.fieldsParser = new HeaderFieldsParser(sink, knownEffects);
		this.preambleFormatter = new PreambleFormatter(sink);
	}

	/**
	 * Finds the structured header description list following {@code headerSurrogate},
	 * skipping deleted or inserted markup and empty placeholders.
	 *
	 * @return the {@code dl}, or null when the header is not structured
	 */
	public static Element findDescriptionList(Element headerSurrogate) {
		Element next = headerSurrogate.nextElementSibling();
		while (next != null && isSkippable(next)) {
			next = next.nextElementSibling();
		}
		if (next == null || !next.tagName().equals("dl") || !next.hasClass("header")) {
			return null;
		}
		return next;
	}

	private static boolean isSkippable(Element element) {
		String tag = element.tagName();
		if (tag.equals("del") || tag.equals("ins")) {
			return true;
		}
		return (tag.equals("span") || tag.equals("a")) && element.childrenSize() == 0 && element.text().isBlank();
	}

	/**
	 * Compiles the header if it is structured.
	 *
	 * @param header the {@code h1} element
	 * @param headerSurrogate the element standing in for the header among its siblings
	 *        (an {@code ins} wrapping the {@code h1}, or the {@code h1} itself)
	 * @param kind the clause kind
	 * @return the compiled header, or empty when no structured header description list follows
	 */
	public Optional<CompiledHeader> compile(Element header, Element headerSurrogate, ClauseKind kind) {
		Element dl = findDescriptionList(headerSurrogate);
		if (dl == null) {
			return Optional.empty();
		}

		Optional<ContentLocation> location = document.locate(header);
		String source = document.innerSource(header);

		ParsedHeader parsed = null;
		try {
			parsed = HeaderParser.parse(source);
		}
		catch (HeaderParseException e) {
			report(DiagnosticCategory.PARSE, "header-format", e.getMessage(), header, location, source, e.offset());
		}

		Signature signature = null;
		if (parsed != null) {
			try {
				signature = toSignature(parsed);
			}
			catch (TypeParseException e) {
				report(DiagnosticCategory.PARSE, "type-parsing", e.getMessage(), header, location, source, e.offset());
			}
		}

		String name = parsed != null ? parsed.name() : null;
		if (kind == ClauseKind.NUMERIC_METHOD && name != null && !name.contains("::")) {
			report(DiagnosticCategory.SEMANTIC, "numeric-method-for",
					"numeric methods should be of the form `Type::operation`", header, location, source,
					leadingWhitespace(source));
		}

		renderHeader(header, parsed, kind);

		HeaderFields fields = fieldsParser.parse(dl, kind);
		String parameters;
		if (parsed == null) {
			parameters = PreambleFormatter.UNPARSEABLE_ARGUMENTS;
		} else {
			parameters = PreambleFormatter.formatParameters(parsed.parameters(), parsed.optionalParameters());
		}
		List<String> paragraphs = preambleFormatter.format(dl, kind,
				name != null ? name : PreambleFormatter.UNKNOWN_NAME, parameters,
				parsed != null ? parsed.returnType() : null, fields);
		for (String paragraph : paragraphs) {
			dl.before("<p>" + paragraph + "</p>");
		}
		dl.remove();

		logger.debug("Compiled structured header {} ({})", name, signature != null ? "typed" : "untyped");
		return Optional.of(new CompiledHeader(name, signature, fields));
	}

	/**
	 * Builds the display form of a parsed header: {@code Name ( _x_, _y_ [ , _z_ ] )}.
	 */
	public static String formatHeader(ParsedHeader parsed) {
		StringBuilder sb = new StringBuilder(parsed.prefix()).append(parsed.name());
		if (parsed.hasParameterList()) {
			sb.append(" (");
			List<String> required = parsed.parameters().stream().map(HeaderParameter::rendered).toList();
			if (!required.isEmpty()) {
				sb.append(' ').append(String.join(", ", required));
			}
			List<HeaderParameter> optional = parsed.optionalParameters();
			for (int i = 0; i < optional.size(); i++) {
				sb.append(i == 0 && required.isEmpty() ? " [ " : " [ , ").append(optional.get(i).rendered());
			}
			sb.append(" ]".repeat(optional.size()));
			sb.append(" )");
		}
		String rendered = sb.toString();
		return parsed.wrappingTag() == null ? rendered : parsed.wrappingTag().wrap(rendered);
	}

	private void renderHeader(Element header, ParsedHeader parsed, ClauseKind kind) {
		if (parsed != null) {
			if (kind == ClauseKind.SYNTAX_DIRECTED_OPERATION) {
				// parameters of syntax-directed operations are shown through grammar notation instead
				String nameOnly = parsed.prefix() + parsed.name();
				header.html(parsed.wrappingTag() == null ? nameOnly : parsed.wrappingTag().wrap(nameOnly));
			} else {
				header.html(formatHeader(parsed));
			}
			return;
		}
		if (kind == ClauseKind.SYNTAX_DIRECTED_OPERATION) {
			String current = header.html();
			int open = current.indexOf('(');
			int close = current.lastIndexOf(')');
			if (open >= 0 && close > open) {
				header.html((current.substring(0, open) + current.substring(close + 1)).trim());
			}
		}
	}

	private static Signature toSignature(ParsedHeader parsed) {
		List<Parameter> parameters = parsed.parameters().stream()
				.filter(p -> !p.isDeleted())
				.map(StructuredHeaderCompiler::toParameter)
				.toList();
		List<Parameter> optionalParameters = parsed.optionalParameters().stream()
				.filter(p -> !p.isDeleted())
				.map(StructuredHeaderCompiler::toParameter)
				.toList();
		Type returnType = parsed.returnType() == null
				? null
				: parseType(parsed.returnType(), parsed.returnTypeOffset());
		return new Signature(parameters, optionalParameters, returnType);
	}

	private static Parameter toParameter(HeaderParameter parameter) {
		Type type = parameter.type() == null ? null : parseType(parameter.type(), parameter.typeOffset());
		return new Parameter(parameter.name(), type);
	}

	private static Type parseType(String type, int offset) {
		try {
			return TypeParser.parse(type);
		}
		catch (TypeParseException e) {
			throw e.shift(offset);
		}
	}

	private void report(DiagnosticCategory category, String ruleId, String message, Element header,
			Optional<ContentLocation> location, String source, int offset) {
		SourcePosition position = location
				.map(l -> document.positionOf(l.start() + offset))
				.orElseGet(() -> SourcePosition.fromOffset(source, offset));
		sink.report(Diagnostic.at(category, ruleId, message, header, position));
	}

	private static int leadingWhitespace(String source) {
		int i = 0;
		while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
			i++;
		}
		return i;
	}
}
