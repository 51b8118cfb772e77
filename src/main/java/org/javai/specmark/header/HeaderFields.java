package org.javai.specmark.header;

import java.util.List;

/**
 * Metadata declared in the description list that follows a structured header.
 *
 * @param description free-text description, or null
 * @param receiver the {@code for} entry naming the receiver type, or null
 * @param effects declared effect names in declaration order
 * @param redefinition whether the clause redefines an operation declared elsewhere
 * @param skipGlobalChecks suppresses document-wide consistency checks for this clause
 * @param skipReturnChecks suppresses return-type checks for this clause
 */
public record HeaderFields(String description, String receiver, List<String> effects, boolean redefinition,
		boolean skipGlobalChecks, boolean skipReturnChecks) {

	public HeaderFields {
		effects = List.copyOf(effects);
	}

	public static HeaderFields empty() {
		return new HeaderFields(null, null, List.of(), false, false, false);
	}
}
