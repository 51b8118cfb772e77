package org.javai.specmark.type;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for type expressions such as {@code a List of Numbers} or
 * {@code either a normal completion containing a String or a throw completion}.
 */
public class TypeTokenizer {

	private final String input;
	private int pos = 0;

	public TypeTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws TypeParseException if an unexpected character is encountered
	 */
	public List<TypeToken> tokenize() {
		List<TypeToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new TypeToken(TypeToken.TokenType.EOF, "", pos));
		return tokens;
	}

	private TypeToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '|' -> {
				advance();
				yield new TypeToken(TypeToken.TokenType.PIPE, "|", start);
			}
			case ',' -> {
				advance();
				yield new TypeToken(TypeToken.TokenType.COMMA, ",", start);
			}
			case '(' -> {
				advance();
				yield new TypeToken(TypeToken.TokenType.LPAREN, "(", start);
			}
			case ')' -> {
				advance();
				yield new TypeToken(TypeToken.TokenType.RPAREN, ")", start);
			}
			case '[' -> scanField();
			case '*', '~' -> scanValue(c);
			default -> {
				if (isWordChar(c)) {
					yield scanWord();
				}
				throw new TypeParseException("unexpected character '" + c + "'", pos);
			}
		};
	}

	private TypeToken scanField() {
		int start = pos;
		if (!input.startsWith("[[", pos)) {
			throw new TypeParseException("expected '[[' to open a field name", pos);
		}
		int close = input.indexOf("]]", pos + 2);
		if (close < 0) {
			throw new TypeParseException("unterminated field name", start);
		}
		String name = input.substring(pos + 2, close).trim();
		if (name.isEmpty()) {
			throw new TypeParseException("empty field name", start);
		}
		pos = close + 2;
		return new TypeToken(TypeToken.TokenType.FIELD, name, start);
	}

	private TypeToken scanValue(char delimiter) {
		int start = pos;
		advance(); // opening delimiter
		while (!isAtEnd() && peek() != delimiter) {
			advance();
		}
		if (isAtEnd()) {
			throw new TypeParseException("unterminated value literal", start);
		}
		advance(); // closing delimiter
		return new TypeToken(TypeToken.TokenType.VALUE, input.substring(start, pos), start);
	}

	private TypeToken scanWord() {
		int start = pos;

		while (!isAtEnd() && isWordChar(peek())) {
			advance();
		}

		return new TypeToken(TypeToken.TokenType.WORD, input.substring(start, pos), start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '%' || c == '.'
				|| c == '\'' || c == '@' || c == ':';
	}
}
