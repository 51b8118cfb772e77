package org.javai.specmark;

import org.javai.specmark.clause.Clause;
import org.jsoup.nodes.TextNode;

/**
 * A text node inserted after the traversal passed its position, queued so that a
 * later cross-linking pass still scans it.
 *
 * @param node the text node
 * @param clause the clause it belongs to
 */
public record LinkableText(TextNode node, Clause clause) {
}
