package org.javai.specmark.type;

/**
 * A token of the type expression grammar.
 *
 * @param type the token type
 * @param value the token text; for FIELD the name between the brackets
 * @param position the character position in the input string
 */
public record TypeToken(TokenType type, String value, int position) {

	public enum TokenType {
		WORD,      // Number, List, of, ...
		VALUE,     // *undefined*, ~unused~
		FIELD,     // [[Name]]
		PIPE,      // |
		COMMA,     // ,
		LPAREN,    // (
		RPAREN,    // )
		EOF        // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case WORD, VALUE -> type + "(" + value + ")";
			case FIELD -> "FIELD([[" + value + "]])";
			default -> type.toString();
		};
	}

	public boolean isWord(String expected) {
		return type == TokenType.WORD && value.equals(expected);
	}
}
