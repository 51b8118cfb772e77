package org.javai.specmark.type;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.specmark.type.CompletionType.CompletionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TypeParser")
class TypeParserTest {

	@Nested
	@DisplayName("Named types")
	class NamedTypes {

		@Test
		@DisplayName("drops the leading article")
		void dropsArticle() {
			assertThat(TypeParser.parse("a Number")).isEqualTo(new NamedType("Number"));
			assertThat(TypeParser.parse("an ECMAScript language value"))
					.isEqualTo(new NamedType("ECMAScript language value"));
		}

		@Test
		@DisplayName("keeps value literals verbatim")
		void valueLiteral() {
			assertThat(TypeParser.parse("*undefined*")).isEqualTo(new NamedType("*undefined*"));
			assertThat(TypeParser.parse("~empty~")).isEqualTo(new NamedType("~empty~"));
		}

		@Test
		@DisplayName("parenthesised types are grouped")
		void parentheses() {
			assertThat(TypeParser.parse("(a String)")).isEqualTo(new NamedType("String"));
		}
	}

	@Nested
	@DisplayName("Unions")
	class Unions {

		@Test
		void pipeSeparated() {
			Type type = TypeParser.parse("a Number | a String");

			assertThat(type).isEqualTo(new UnionType(List.of(new NamedType("Number"), new NamedType("String"))));
		}

		@Test
		void commaAndOrSeparated() {
			Type type = TypeParser.parse("a Number, a BigInt, or a String");

			assertThat(type).isInstanceOf(UnionType.class);
			assertThat(((UnionType) type).types()).containsExactly(
					new NamedType("Number"), new NamedType("BigInt"), new NamedType("String"));
		}

		@Test
		@DisplayName("either ... or ... with completions")
		void eitherCompletions() {
			Type type = TypeParser.parse("either a normal completion containing a Number or a throw completion");

			UnionType union = (UnionType) type;
			assertThat(union.types()).containsExactly(
					new CompletionType(CompletionKind.NORMAL, new NamedType("Number")),
					new CompletionType(CompletionKind.ABRUPT, null));
			assertThat(union.mixesCompletions()).isFalse();
		}

		@Test
		@DisplayName("a Completion Record next to a plain type is a mixed union")
		void mixedUnion() {
			UnionType union = (UnionType) TypeParser.parse("a Completion Record | a Number");

			assertThat(union.types().get(0)).isEqualTo(new CompletionType(CompletionKind.MIXED, null));
			assertThat(union.mixesCompletions()).isTrue();
		}

		@Test
		@DisplayName("nested groups are flattened into one union")
		void flattened() {
			UnionType union = (UnionType) TypeParser.parse("a Number or (a String or a Symbol)");

			assertThat(union.types()).hasSize(3);
		}
	}

	@Nested
	@DisplayName("Lists and records")
	class Structured {

		@Test
		void listOf() {
			assertThat(TypeParser.parse("a List of Strings")).isEqualTo(new ListType(new NamedType("Strings")));
		}

		@Test
		void bareList() {
			assertThat(TypeParser.parse("a List")).isEqualTo(new ListType(null));
		}

		@Test
		void listBindsTighterThanUnion() {
			UnionType union = (UnionType) TypeParser.parse("a List of Numbers or a String");

			assertThat(union.types()).containsExactly(new ListType(new NamedType("Numbers")), new NamedType("String"));
		}

		@Test
		void recordWithTypedFields() {
			Type type = TypeParser.parse(
					"a Record with fields [[Key]] (a String) and [[Value]] (an ECMAScript language value)");

			RecordType record = (RecordType) type;
			assertThat(record.fields()).containsOnlyKeys("Key", "Value");
			assertThat(record.fields().keySet()).containsExactly("Key", "Value");
			assertThat(record.fields().get("Key")).isEqualTo(new NamedType("String"));
			assertThat(record.fields().get("Value")).isEqualTo(new NamedType("ECMAScript language value"));
		}

		@Test
		void recordWithUntypedFields() {
			RecordType record = (RecordType) TypeParser.parse("a Record with fields [[Done]], [[Value]]");

			assertThat(record.fields()).containsKeys("Done", "Value");
			assertThat(record.fields().get("Done")).isNull();
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		void emptyInput() {
			assertThatThrownBy(() -> TypeParser.parse("  "))
					.isInstanceOf(TypeParseException.class);
		}

		@Test
		@DisplayName("missing element type is reported at the end of input")
		void missingElementType() {
			assertThatThrownBy(() -> TypeParser.parse("a List of"))
					.isInstanceOf(TypeParseException.class)
					.extracting(e -> ((TypeParseException) e).offset())
					.isEqualTo(9);
		}

		@Test
		@DisplayName("trailing garbage is reported at its offset")
		void trailingParen() {
			assertThatThrownBy(() -> TypeParser.parse("Number )"))
					.isInstanceOf(TypeParseException.class)
					.extracting(e -> ((TypeParseException) e).offset())
					.isEqualTo(7);
		}

		@Test
		void duplicateRecordField() {
			assertThatThrownBy(() -> TypeParser.parse("a Record with fields [[A]] and [[A]]"))
					.isInstanceOf(TypeParseException.class)
					.hasMessageContaining("duplicate field");
		}

		@Test
		@DisplayName("shifting moves the offset into the enclosing text")
		void shiftedOffset() {
			TypeParseException e = new TypeParseException("bad", 3);

			assertThat(e.shift(10).offset()).isEqualTo(13);
		}
	}
}
