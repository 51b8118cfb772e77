package org.javai.specmark.header;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the source of an algorithm header such as
 * {@code Example.Op ( _x_: a Number, _y_ [ , _z_ ] ): a Boolean}.
 * <p>
 * Optional parameters are either grouped in a trailing bracket group or
 * introduced by the keyword {@code optional}. Parameters may be wrapped in
 * {@code <ins>}, {@code <del>} or {@code <mark>}. All offsets reported, in
 * results and in exceptions, are relative to the source passed in.
 */
public class HeaderParser {

	private static final Pattern PREFIX = Pattern.compile("(Static|Runtime) Semantics:\\s*");

	private final String input;
	private int pos;
	private int end;

	public HeaderParser(String input) {
		this.input = input != null ? input : "";
		this.pos = 0;
		this.end = this.input.length();
	}

	public static ParsedHeader parse(String input) {
		return new HeaderParser(input).parse();
	}

	/**
	 * Parses the whole header.
	 *
	 * @throws HeaderParseException if the header does not match the grammar
	 */
	public ParsedHeader parse() {
		skipWhitespace();
		trimTrailingWhitespace();
		WrappingTag headerWrapper = consumeHeaderWrapper();

		String prefix = "";
		Matcher prefixMatcher = PREFIX.matcher(input).region(pos, end);
		if (prefixMatcher.lookingAt()) {
			prefix = prefixMatcher.group();
			pos = prefixMatcher.end();
		}

		String name = scanName();
		skipWhitespace();

		if (isAtEnd()) {
			return new ParsedHeader(prefix, name, false, List.of(), List.of(), null, -1, headerWrapper);
		}
		if (peek() != '(') {
			throw new HeaderParseException("expected '(' after the name " + name + ", found '" + peek() + "'", pos);
		}
		advance(); // consume '('

		List<HeaderParameter> required = new ArrayList<>();
		List<HeaderParameter> optional = new ArrayList<>();
		parseParameters(required, optional);

		skipWhitespace();
		String returnType = null;
		int returnTypeOffset = -1;
		if (!isAtEnd()) {
			if (peek() != ':') {
				throw new HeaderParseException("unexpected text after the parameter list", pos);
			}
			advance(); // consume ':'
			skipWhitespace();
			if (isAtEnd()) {
				throw new HeaderParseException("expected a return type after ':'", pos);
			}
			returnTypeOffset = pos;
			returnType = input.substring(pos, end);
			pos = end;
		}

		return new ParsedHeader(prefix, name, true, required, optional, returnType, returnTypeOffset, headerWrapper);
	}

	private WrappingTag consumeHeaderWrapper() {
		Optional<WrappingTag> tag = WrappingTag.openingAt(input, pos);
		if (tag.isEmpty()) {
			return null;
		}
		String close = tag.get().close();
		int closeAt = end - close.length();
		if (closeAt <= pos || !input.regionMatches(true, closeAt, close, 0, close.length())) {
			// only part of the header is wrapped; parameters handle their own wrappers
			return null;
		}
		pos += tag.get().open().length();
		end = closeAt;
		skipWhitespace();
		trimTrailingWhitespace();
		return tag.get();
	}

	private String scanName() {
		int start = pos;
		while (!isAtEnd() && isNameChar(peek())) {
			advance();
		}
		if (start == pos) {
			throw new HeaderParseException("expected an operation name", start);
		}
		return input.substring(start, pos);
	}

	private void parseParameters(List<HeaderParameter> required, List<HeaderParameter> optional) {
		boolean inOptional = false;
		int openGroups = 0;
		WrappingTag wrapper = null;

		while (true) {
			skipWhitespace();
			if (isAtEnd()) {
				throw new HeaderParseException("unterminated parameter list: expected ')'", pos);
			}
			char c = peek();
			if (c == ')') {
				if (openGroups > 0) {
					throw new HeaderParseException("unclosed '[' in parameter list", pos);
				}
				advance();
				return;
			}
			if (c == '[') {
				openGroups++;
				inOptional = true;
				advance();
				continue;
			}
			if (c == ']') {
				if (openGroups == 0) {
					throw new HeaderParseException("unexpected ']' in parameter list", pos);
				}
				openGroups--;
				advance();
				continue;
			}
			if (c == ',') {
				advance();
				continue;
			}
			if (wrapper != null && startsWith(wrapper.close())) {
				pos += wrapper.close().length();
				wrapper = null;
				continue;
			}
			Optional<WrappingTag> opening = WrappingTag.openingAt(input, pos);
			if (opening.isPresent()) {
				if (wrapper != null) {
					throw new HeaderParseException("nested " + opening.get().open() + " in parameter list", pos);
				}
				wrapper = opening.get();
				pos += wrapper.open().length();
				continue;
			}
			if (startsWith("optional") && pos + 8 < end && Character.isWhitespace(input.charAt(pos + 8))) {
				inOptional = true;
				pos += 8;
				continue;
			}

			HeaderParameter parameter = parseParameter(wrapper);
			if (inOptional) {
				optional.add(parameter);
			} else {
				if (!optional.isEmpty()) {
					throw new HeaderParseException("required parameter _" + parameter.name()
							+ "_ follows an optional parameter", pos);
				}
				required.add(parameter);
			}
		}
	}

	private HeaderParameter parseParameter(WrappingTag wrapper) {
		int start = pos;
		if (peek() != '_') {
			throw new HeaderParseException("expected a parameter name like _x_", start);
		}
		advance();
		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}
		if (isAtEnd() || peek() != '_' || pos == start + 1) {
			throw new HeaderParseException("malformed parameter name; expected _name_", start);
		}
		String name = input.substring(start + 1, pos);
		advance(); // closing '_'

		skipWhitespace();
		if (isAtEnd() || peek() != ':') {
			return new HeaderParameter(name, null, -1, wrapper);
		}
		advance(); // consume ':'
		skipWhitespace();
		int typeStart = pos;
		String type = scanParameterType(wrapper).strip();
		if (type.isEmpty()) {
			throw new HeaderParseException("expected a type for parameter _" + name + "_", typeStart);
		}
		return new HeaderParameter(name, type, typeStart, wrapper);
	}

	/**
	 * Scans a parameter type up to the next top-level parameter boundary.
	 */
	private String scanParameterType(WrappingTag wrapper) {
		int start = pos;
		int depth = 0;
		while (!isAtEnd()) {
			char c = peek();
			if (startsWith("[[")) {
				int close = input.indexOf("]]", pos + 2);
				if (close < 0 || close >= end) {
					throw new HeaderParseException("unterminated field name in type", pos);
				}
				pos = close + 2;
				continue;
			}
			if (c == '(') {
				depth++;
			}
			else if (c == ')') {
				if (depth == 0) {
					break;
				}
				depth--;
			}
			else if (depth == 0 && (c == '[' || c == ']')) {
				break;
			}
			else if (depth == 0 && c == ',' && startsNextParameter(pos + 1)) {
				break;
			}
			else if (depth == 0 && wrapper != null && startsWith(wrapper.close())) {
				break;
			}
			advance();
		}
		return input.substring(start, pos);
	}

	private boolean startsNextParameter(int from) {
		int i = from;
		while (i < end && Character.isWhitespace(input.charAt(i))) {
			i++;
		}
		if (i >= end) {
			return true;
		}
		char c = input.charAt(i);
		if (c == '[' && i + 1 < end && input.charAt(i + 1) == '[') {
			// a record field name, not an optional group
			return false;
		}
		return c == '_' || c == '[' || c == ']' || c == ')' || c == '<'
				|| input.startsWith("optional", i);
	}

	private boolean startsWith(String text) {
		return pos + text.length() <= end && input.startsWith(text, pos);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private void trimTrailingWhitespace() {
		while (end > pos && Character.isWhitespace(input.charAt(end - 1))) {
			end--;
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private void advance() {
		pos++;
	}

	private boolean isAtEnd() {
		return pos >= end;
	}

	private static boolean isNameChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '%' || c == '.' || c == ':'
				|| c == '[' || c == ']' || c == '@';
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '$';
	}
}
