package org.javai.specmark.biblio;

import java.util.List;
import org.javai.specmark.clause.ClauseKind;
import org.javai.specmark.type.Signature;

/**
 * An algorithm or operation, addressable by aoid.
 *
 * @param aoid the operation's lookup key
 * @param refId id of the clause defining it
 * @param kind the algorithm kind, or null when the clause declares none
 * @param signature the compiled signature, or null
 * @param effects effect names declared directly on the operation
 * @param skipGlobalChecks whether document-wide consistency checks are suppressed
 * @param skipReturnChecks whether return-type checks are suppressed
 */
public record OpEntry(String aoid, String refId, ClauseKind kind, Signature signature, List<String> effects,
		boolean skipGlobalChecks, boolean skipReturnChecks) implements BiblioEntry {

	public OpEntry {
		effects = List.copyOf(effects);
	}

	@Override
	public String key() {
		return aoid;
	}
}
