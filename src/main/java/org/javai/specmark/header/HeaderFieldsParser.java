package org.javai.specmark.header;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.javai.specmark.clause.ClauseKind;
import org.javai.specmark.diag.Diagnostic;
import org.javai.specmark.diag.DiagnosticCategory;
import org.javai.specmark.diag.DiagnosticSink;
import org.jsoup.nodes.Element;

/**
 * Reads the {@code dt}/{@code dd} pairs of a structured header's description list.
 */
public class HeaderFieldsParser {

	private final DiagnosticSink sink;
	private final Set<String> knownEffects;

	public HeaderFieldsParser(DiagnosticSink sink, Set<String> knownEffects) {
		this.sink = sink;
		this.knownEffects = Set.copyOf(knownEffects);
	}

	public HeaderFields parse(Element dl, ClauseKind kind) {
		String description = null;
		String receiver = null;
		List<String> effects = new ArrayList<>();
		boolean redefinition = false;
		boolean skipGlobalChecks = false;
		boolean skipReturnChecks = false;

		Set<String> seen = new HashSet<>();
		String pendingKey = null;
		Element pendingDt = null;

		for (Element child : dl.children()) {
			String tag = child.tagName();
			if (tag.equals("dt")) {
				if (pendingKey != null) {
					warn("missing value for structured header entry \"" + pendingKey + "\"", pendingDt);
				}
				pendingKey = child.text().trim().toLowerCase(Locale.ROOT);
				pendingDt = child;
				continue;
			}
			if (!tag.equals("dd")) {
				warn("unexpected <" + tag + "> in structured header", child);
				continue;
			}
			if (pendingKey == null) {
				warn("<dd> without a preceding <dt> in structured header", child);
				continue;
			}
			String key = pendingKey;
			pendingKey = null;
			if (!seen.add(key)) {
				warn("duplicate \"" + key + "\" entry in structured header", pendingDt);
				continue;
			}
			String value = child.html().trim();

			switch (key) {
				case "description" -> description = value;
				case "for" -> {
					if (!kind.hasReceiver()) {
						warn("\"for\" is only meaningful for internal and concrete methods", pendingDt);
					}
					receiver = value;
				}
				case "effects" -> {
					for (String effect : child.text().split(",")) {
						String name = effect.trim();
						if (name.isEmpty()) {
							continue;
						}
						if (!knownEffects.contains(name)) {
							sink.report(Diagnostic.of(DiagnosticCategory.SEMANTIC, "unknown-effect",
									"unknown effect " + name, child));
						}
						effects.add(name);
					}
				}
				case "redefinition" -> redefinition = parseBoolean(key, child);
				case "skip global checks" -> skipGlobalChecks = parseBoolean(key, child);
				case "skip return checks" -> skipReturnChecks = parseBoolean(key, child);
				default -> warn("unknown structured header entry type \"" + key + "\"", pendingDt);
			}
		}
		if (pendingKey != null) {
			warn("missing value for structured header entry \"" + pendingKey + "\"", pendingDt);
		}

		return new HeaderFields(description, receiver, effects, redefinition, skipGlobalChecks, skipReturnChecks);
	}

	private boolean parseBoolean(String key, Element dd) {
		String value = dd.text().trim();
		if (value.equals("true")) {
			return true;
		}
		if (!value.equals("false")) {
			warn("unknown value for \"" + key + "\": expected true or false, found \"" + value + "\"", dd);
		}
		return false;
	}

	private void warn(String message, Element node) {
		sink.report(Diagnostic.of(DiagnosticCategory.SEMANTIC, "header-format", message, node));
	}
}
