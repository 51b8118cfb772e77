package org.javai.specmark.type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.specmark.type.CompletionType.CompletionKind;

/**
 * Compiles a type expression into a {@link Type} tree.
 * <p>
 * Unions bind loosest: {@code a List of Numbers or a String} is a union of a list
 * and a String. Members are separated by {@code |}, {@code or}, or commas.
 *
 * <pre>
 * Type t = TypeParser.parse("either a normal completion containing a Number or a throw completion");
 * </pre>
 */
public class TypeParser {

	private static final Set<String> ABRUPT_COMPLETIONS = Set.of("abrupt", "throw", "return", "break", "continue");

	private final ParserState state;

	public TypeParser(List<TypeToken> tokens) {
		this.state = new ParserState(tokens);
	}

	/**
	 * Tokenizes and parses {@code input}.
	 *
	 * @throws TypeParseException with an offset into {@code input} on failure
	 */
	public static Type parse(String input) {
		return new TypeParser(new TypeTokenizer(input).tokenize()).parse();
	}

	/**
	 * Parses the whole token list as a single type.
	 */
	public Type parse() {
		if (state.isAtEnd()) {
			throw new TypeParseException("expected a type", state.getCurrentPosition());
		}
		Type type = parseType();
		if (!state.isAtEnd()) {
			TypeToken unexpected = state.peek();
			throw new TypeParseException("unexpected " + unexpected + " after type", unexpected.position());
		}
		return type;
	}

	private Type parseType() {
		if (state.peek().isWord("either")) {
			state.advance();
		}
		List<Type> members = new ArrayList<>();
		addMember(members, parseAlternative());

		while (!state.isAtEnd()) {
			if (state.check(TypeToken.TokenType.PIPE)) {
				state.advance();
				addMember(members, parseAlternative());
			}
			else if (state.peek().isWord("or")) {
				state.advance();
				addMember(members, parseAlternative());
			}
			else if (state.check(TypeToken.TokenType.COMMA) && startsMember(state.peekAhead(1))) {
				state.advance(); // consume ','
				if (state.peek().isWord("or")) {
					state.advance();
				}
				addMember(members, parseAlternative());
			}
			else {
				break;
			}
		}

		return members.size() == 1 ? members.get(0) : new UnionType(members);
	}

	private void addMember(List<Type> members, Type member) {
		if (member instanceof UnionType nested) {
			members.addAll(nested.types());
		} else {
			members.add(member);
		}
	}

	private boolean startsMember(TypeToken token) {
		return token.type() == TypeToken.TokenType.VALUE
				|| (token.type() == TypeToken.TokenType.WORD && !token.value().equals("and"));
	}

	private Type parseAlternative() {
		TypeToken first = state.peek();
		if (first.isWord("a") || first.isWord("an")) {
			state.advance();
		}

		TypeToken token = state.peek();
		return switch (token.type()) {
			case VALUE -> {
				state.advance();
				yield new NamedType(token.value());
			}
			case WORD -> parseWordType();
			case LPAREN -> {
				state.advance();
				Type inner = parseType();
				expect(TypeToken.TokenType.RPAREN, "')'");
				yield inner;
			}
			default -> throw new TypeParseException("expected a type but found " + token, token.position());
		};
	}

	private Type parseWordType() {
		TypeToken token = state.peek();
		String word = token.value();

		if (word.equals("Completion") && state.peekAhead(1).isWord("Record")) {
			state.advance();
			state.advance();
			return new CompletionType(CompletionKind.MIXED, null);
		}
		if (word.equals("normal") && state.peekAhead(1).isWord("completion")) {
			state.advance();
			state.advance();
			Type value = null;
			if (state.peek().isWord("containing")) {
				state.advance();
				value = parseAlternative();
			}
			return new CompletionType(CompletionKind.NORMAL, value);
		}
		if (ABRUPT_COMPLETIONS.contains(word) && state.peekAhead(1).isWord("completion")) {
			state.advance();
			state.advance();
			return new CompletionType(CompletionKind.ABRUPT, null);
		}
		if (word.equals("List")) {
			state.advance();
			if (state.peek().isWord("of")) {
				state.advance();
				return new ListType(parseAlternative());
			}
			return new ListType(null);
		}
		if (word.equals("Record") && state.peekAhead(1).isWord("with")) {
			state.advance();
			state.advance();
			return parseRecordFields(token.position());
		}
		return parseNamed();
	}

	private Type parseRecordFields(int recordStart) {
		if (state.peek().isWord("fields")) {
			state.advance();
		}
		Map<String, Type> fields = new LinkedHashMap<>();
		do {
			TypeToken field = state.peek();
			if (field.type() != TypeToken.TokenType.FIELD) {
				throw new TypeParseException("expected a field name like [[Value]] but found " + field,
						field.position());
			}
			state.advance();
			Type fieldType = null;
			if (state.check(TypeToken.TokenType.LPAREN)) {
				state.advance();
				fieldType = parseType();
				expect(TypeToken.TokenType.RPAREN, "')' to close the type of field [[" + field.value() + "]]");
			}
			if (fields.containsKey(field.value())) {
				throw new TypeParseException("duplicate field [[" + field.value() + "]]", field.position());
			}
			fields.put(field.value(), fieldType);
		} while (consumeFieldSeparator());

		if (fields.isEmpty()) {
			throw new TypeParseException("record has no fields", recordStart);
		}
		return new RecordType(fields);
	}

	private boolean consumeFieldSeparator() {
		int lookahead = 0;
		if (state.peekAhead(lookahead).type() == TypeToken.TokenType.COMMA) {
			lookahead++;
		}
		if (state.peekAhead(lookahead).isWord("and")) {
			lookahead++;
		}
		if (lookahead == 0 || state.peekAhead(lookahead).type() != TypeToken.TokenType.FIELD) {
			return false;
		}
		for (int i = 0; i < lookahead; i++) {
			state.advance();
		}
		return true;
	}

	private Type parseNamed() {
		StringBuilder name = new StringBuilder();
		while (state.check(TypeToken.TokenType.WORD)) {
			TypeToken word = state.peek();
			if (word.value().equals("or")) {
				break;
			}
			if (word.value().equals("and") && state.peekAhead(1).type() == TypeToken.TokenType.FIELD) {
				break;
			}
			if (name.length() > 0) {
				name.append(' ');
			}
			name.append(word.value());
			state.advance();
		}
		if (name.length() == 0) {
			TypeToken token = state.peek();
			throw new TypeParseException("expected a type name but found " + token, token.position());
		}
		return new NamedType(name.toString());
	}

	private void expect(TypeToken.TokenType type, String description) {
		if (!state.check(type)) {
			TypeToken found = state.peek();
			throw new TypeParseException("expected " + description + " but found " + found, found.position());
		}
		state.advance();
	}

	/**
	 * Cursor over the token list.
	 */
	static class ParserState {
		private final List<TypeToken> tokens;
		private int current = 0;

		ParserState(List<TypeToken> tokens) {
			this.tokens = tokens != null && !tokens.isEmpty()
					? tokens
					: List.of(new TypeToken(TypeToken.TokenType.EOF, "", 0));
		}

		TypeToken peek() {
			return peekAhead(0);
		}

		TypeToken peekAhead(int distance) {
			int index = Math.min(current + distance, tokens.size() - 1);
			return tokens.get(index);
		}

		TypeToken advance() {
			TypeToken token = peek();
			if (!isAtEnd()) {
				current++;
			}
			return token;
		}

		boolean check(TypeToken.TokenType type) {
			return peek().type() == type;
		}

		boolean isAtEnd() {
			return current >= tokens.size() || peek().type() == TypeToken.TokenType.EOF;
		}

		int getCurrentPosition() {
			return peek().position();
		}
	}
}
