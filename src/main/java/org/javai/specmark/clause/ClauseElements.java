package org.javai.specmark.clause;

import java.util.Set;
import org.jsoup.nodes.Element;

/**
 * Element names the clause tree is built from.
 */
public final class ClauseElements {

	public static final String INTRO = "emu-intro";
	public static final String CLAUSE = "emu-clause";
	public static final String ANNEX = "emu-annex";
	public static final String NOTE = "emu-note";
	public static final String EXAMPLE = "emu-example";

	private static final Set<String> CLAUSE_LIKE = Set.of(INTRO, CLAUSE, ANNEX);

	private ClauseElements() {}

	public static boolean isClauseLike(Element element) {
		return CLAUSE_LIKE.contains(element.tagName());
	}

	public static boolean isIntroduction(Element element) {
		return INTRO.equals(element.tagName());
	}

	public static boolean isAnnex(Element element) {
		return ANNEX.equals(element.tagName());
	}
}
