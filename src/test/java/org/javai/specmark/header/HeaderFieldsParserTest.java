package org.javai.specmark.header;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.javai.specmark.clause.ClauseKind;
import org.javai.specmark.diag.CollectingDiagnosticSink;
import org.javai.specmark.diag.Diagnostic;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HeaderFieldsParserTest {

	private CollectingDiagnosticSink sink;
	private HeaderFieldsParser parser;

	@BeforeEach
	void setUp() {
		sink = new CollectingDiagnosticSink();
		parser = new HeaderFieldsParser(sink, Set.of("user-code"));
	}

	private static Element dl(String entries) {
		return Jsoup.parseBodyFragment("<dl class=\"header\">" + entries + "</dl>").selectFirst("dl");
	}

	@Test
	void shouldReadAllKnownEntries() {
		HeaderFields fields = parser.parse(dl("""
				<dt>description</dt><dd>Returns <var>x</var>.</dd>
				<dt>effects</dt><dd>user-code</dd>
				<dt>redefinition</dt><dd>true</dd>
				<dt>skip global checks</dt><dd>true</dd>
				<dt>skip return checks</dt><dd>false</dd>
				"""), ClauseKind.ABSTRACT_OPERATION);

		assertThat(fields.description()).isEqualTo("Returns <var>x</var>.");
		assertThat(fields.effects()).containsExactly("user-code");
		assertThat(fields.redefinition()).isTrue();
		assertThat(fields.skipGlobalChecks()).isTrue();
		assertThat(fields.skipReturnChecks()).isFalse();
		assertThat(sink.isEmpty()).isTrue();
	}

	@Test
	void shouldRecordUnknownEffectsWithDiagnostic() {
		HeaderFields fields = parser.parse(dl("<dt>effects</dt><dd>user-code, allocation</dd>"),
				ClauseKind.ABSTRACT_OPERATION);

		assertThat(fields.effects()).containsExactly("user-code", "allocation");
		assertThat(sink.withRule("unknown-effect")).extracting(Diagnostic::message)
				.containsExactly("unknown effect allocation");
	}

	@Test
	void shouldReadReceiverForInternalMethods() {
		HeaderFields fields = parser.parse(dl("<dt>for</dt><dd>an ordinary object <var>O</var></dd>"),
				ClauseKind.INTERNAL_METHOD);

		assertThat(fields.receiver()).isEqualTo("an ordinary object <var>O</var>");
		assertThat(sink.isEmpty()).isTrue();
	}

	@Test
	void shouldWarnAboutReceiverOnAbstractOperation() {
		parser.parse(dl("<dt>for</dt><dd>an Object</dd>"), ClauseKind.ABSTRACT_OPERATION);

		assertThat(sink.withRule("header-format")).hasSize(1);
	}

	@Test
	void shouldWarnAboutUnknownDuplicateAndInvalidEntries() {
		HeaderFields fields = parser.parse(dl("""
				<dt>description</dt><dd>first</dd>
				<dt>Description</dt><dd>second</dd>
				<dt>colour</dt><dd>blue</dd>
				<dt>redefinition</dt><dd>yes</dd>
				"""), ClauseKind.ABSTRACT_OPERATION);

		assertThat(fields.description()).isEqualTo("first");
		assertThat(fields.redefinition()).isFalse();
		assertThat(sink.withRule("header-format")).extracting(Diagnostic::message).containsExactly(
				"duplicate \"description\" entry in structured header",
				"unknown structured header entry type \"colour\"",
				"unknown value for \"redefinition\": expected true or false, found \"yes\"");
	}

	@Test
	void shouldWarnAboutEntryWithoutValue() {
		parser.parse(dl("<dt>description</dt>"), ClauseKind.ABSTRACT_OPERATION);

		assertThat(sink.withRule("header-format")).extracting(Diagnostic::message)
				.containsExactly("missing value for structured header entry \"description\"");
	}
}
