package org.javai.specmark.clause;

import java.util.Arrays;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Attributes marking a clause as optional, legacy or deprecated.
 */
public enum SpecialKind {
	NORMATIVE_OPTIONAL("normative-optional", "Normative Optional"),
	LEGACY("legacy", "Legacy"),
	DEPRECATED("deprecated", "Deprecated");

	private final String attribute;
	private final String label;

	SpecialKind(String attribute, String label) {
		this.attribute = attribute;
		this.label = label;
	}

	public String attribute() {
		return attribute;
	}

	public String label() {
		return label;
	}

	/**
	 * The special kinds present on {@code node}, in declaration order of this enum.
	 */
	public static List<SpecialKind> presentOn(Element node) {
		return Arrays.stream(values())
				.filter(kind -> node.hasAttr(kind.attribute))
				.toList();
	}
}
