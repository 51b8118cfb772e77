package org.javai.specmark.biblio;

/**
 * A clause, addressable by id.
 *
 * @param id the clause id (may be empty when the clause has none)
 * @param aoid the clause's aoid, or null
 * @param title plain-text title
 * @param titleHtml title markup
 * @param number section number, empty for unnumbered clauses
 */
public record ClauseEntry(String id, String aoid, String title, String titleHtml, String number)
		implements BiblioEntry {

	@Override
	public String key() {
		return id;
	}
}
