package org.javai.specmark.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Replaces the text runs of an element with their rendered inline markup.
 * <p>
 * Leading and trailing whitespace of each run is kept verbatim. Opaque elements
 * (code, nested clauses, grammar and algorithm blocks) are never descended into.
 */
public class InlineMarkupPass {

	static final Set<String> OPAQUE_ELEMENTS = Set.of(
			"pre", "code", "emu-clause", "emu-annex", "emu-intro", "emu-production", "emu-grammar", "emu-alg");

	private final InlineRenderer renderer;

	public InlineMarkupPass(InlineRenderer renderer) {
		this.renderer = renderer;
	}

	/**
	 * Renders the text runs under {@code root}, excluding {@code root}'s opaque descendants.
	 *
	 * @return the number of runs that were replaced
	 */
	public int apply(Element root) {
		List<TextNode> runs = new ArrayList<>();
		collectTextRuns(root, runs);
		int replaced = 0;
		for (TextNode run : runs) {
			if (renderRun(run)) {
				replaced++;
			}
		}
		return replaced;
	}

	private void collectTextRuns(Element element, List<TextNode> runs) {
		for (Node child : element.childNodes()) {
			if (child instanceof TextNode text) {
				runs.add(text);
			} else if (child instanceof Element nested && !OPAQUE_ELEMENTS.contains(nested.tagName())) {
				collectTextRuns(nested, runs);
			}
		}
	}

	private boolean renderRun(TextNode run) {
		String text = run.getWholeText();
		String content = text.strip();
		if (content.isEmpty()) {
			return false;
		}
		int leading = text.indexOf(content);
		String before = text.substring(0, leading);
		String after = text.substring(leading + content.length());

		String rendered = renderer.render(content);
		if (rendered.equals(Entities.escape(content))) {
			return false;
		}
		run.before(before + rendered + after);
		run.remove();
		return true;
	}
}
