package org.javai.specmark.header;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HeaderParser")
class HeaderParserTest {

	@Nested
	@DisplayName("Parameters")
	class Parameters {

		@Test
		@DisplayName("required and bracketed optional parameters")
		void requiredAndOptional() {
			ParsedHeader header = HeaderParser.parse("Example.Op ( _x_, _y_ [ , _z_ ] ) : a Number");

			assertThat(header.name()).isEqualTo("Example.Op");
			assertThat(header.parameters()).extracting(HeaderParameter::name).containsExactly("x", "y");
			assertThat(header.optionalParameters()).extracting(HeaderParameter::name).containsExactly("z");
			assertThat(header.returnType()).isEqualTo("a Number");
		}

		@Test
		@DisplayName("typed parameters keep their offsets")
		void typedParameters() {
			String source = "ToLength ( _argument_: an ECMAScript language value, _n_: a Number ): a Number";
			ParsedHeader header = HeaderParser.parse(source);

			HeaderParameter first = header.parameters().get(0);
			assertThat(first.type()).isEqualTo("an ECMAScript language value");
			assertThat(source.substring(first.typeOffset())).startsWith("an ECMAScript language value");
			assertThat(header.parameters().get(1).type()).isEqualTo("a Number");
			assertThat(source.substring(header.returnTypeOffset())).isEqualTo("a Number");
		}

		@Test
		@DisplayName("record types with commas stay in one parameter")
		void recordTypeWithCommas() {
			ParsedHeader header = HeaderParser.parse(
					"Make ( _r_: a Record with fields [[A]], [[B]], _s_: a String )");

			assertThat(header.parameters()).extracting(HeaderParameter::type)
					.containsExactly("a Record with fields [[A]], [[B]]", "a String");
		}

		@Test
		@DisplayName("the optional keyword starts the optional parameters")
		void optionalKeyword() {
			ParsedHeader header = HeaderParser.parse("F ( _a_: a Number, optional _b_: a String )");

			assertThat(header.parameters()).extracting(HeaderParameter::name).containsExactly("a");
			assertThat(header.optionalParameters()).extracting(HeaderParameter::name).containsExactly("b");
		}

		@Test
		@DisplayName("an empty parameter list")
		void noParameters() {
			ParsedHeader header = HeaderParser.parse("HostGetSupportedImportAttributes ( )");

			assertThat(header.hasParameterList()).isTrue();
			assertThat(header.parameters()).isEmpty();
			assertThat(header.returnType()).isNull();
		}

		@Test
		@DisplayName("revision markup around a parameter")
		void wrappedParameter() {
			ParsedHeader header = HeaderParser.parse("F ( _a_, <del>_b_</del>, <ins>_c_: a Number</ins> )");

			assertThat(header.parameters()).extracting(HeaderParameter::wrappingTag)
					.containsExactly(null, WrappingTag.DEL, WrappingTag.INS);
			assertThat(header.parameters().get(1).isDeleted()).isTrue();
			assertThat(header.parameters().get(2).type()).isEqualTo("a Number");
			assertThat(header.parameters().get(2).rendered()).isEqualTo("<ins>_c_</ins>");
		}
	}

	@Nested
	@DisplayName("Names and prefixes")
	class Names {

		@Test
		void semanticsPrefix() {
			ParsedHeader header = HeaderParser.parse("Static Semantics: BoundNames");

			assertThat(header.prefix()).isEqualTo("Static Semantics: ");
			assertThat(header.name()).isEqualTo("BoundNames");
			assertThat(header.hasParameterList()).isFalse();
		}

		@Test
		void internalMethodName() {
			ParsedHeader header = HeaderParser.parse("[[GetPrototypeOf]] ( )");

			assertThat(header.name()).isEqualTo("[[GetPrototypeOf]]");
		}

		@Test
		void wholeHeaderWrapper() {
			ParsedHeader header = HeaderParser.parse("<ins>NewOp ( _x_ )</ins>");

			assertThat(header.wrappingTag()).isEqualTo(WrappingTag.INS);
			assertThat(header.name()).isEqualTo("NewOp");
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		void unterminatedParameterList() {
			assertThatThrownBy(() -> HeaderParser.parse("F ( _x_"))
					.isInstanceOf(HeaderParseException.class)
					.hasMessageContaining("expected ')'");
		}

		@Test
		void malformedParameterName() {
			assertThatThrownBy(() -> HeaderParser.parse("F ( x )"))
					.isInstanceOf(HeaderParseException.class)
					.extracting(e -> ((HeaderParseException) e).offset())
					.isEqualTo(4);
		}

		@Test
		void unbalancedBracket() {
			assertThatThrownBy(() -> HeaderParser.parse("F ( _a_ ] )"))
					.isInstanceOf(HeaderParseException.class)
					.hasMessageContaining("unexpected ']'");
		}

		@Test
		void missingReturnType() {
			assertThatThrownBy(() -> HeaderParser.parse("F ( ):"))
					.isInstanceOf(HeaderParseException.class)
					.hasMessageContaining("return type");
		}
	}
}
