package org.javai.specmark.biblio;

/**
 * An entry of the bibliography: either a clause or an operation.
 */
public sealed interface BiblioEntry permits ClauseEntry, OpEntry {

	/**
	 * The key the entry is registered under: the clause id or the operation's aoid.
	 */
	String key();
}
