package org.javai.specmark.clause;

import java.util.ArrayList;
import org.jsoup.nodes.Element;

/**
 * An {@code emu-example} inside a clause, with an optional author caption.
 */
public class Example {

	private final Element node;
	private String caption;

	public Example(Element node) {
		this.node = node;
	}

	public Element node() {
		return node;
	}

	/**
	 * The rendered caption, or null before the enclosing clause is complete.
	 */
	public String caption() {
		return caption;
	}

	/**
	 * Renders the caption and wraps the example's content.
	 *
	 * @param number the 1-based caption number, or null for an unnumbered example
	 * @return the caption text
	 */
	String build(Integer number) {
		String caption = number == null ? "Example" : "Example " + number;
		if (node.hasAttr("caption")) {
			caption += ": " + node.attr("caption");
		}
		Element contents = new Element("div").addClass("example-contents");
		contents.appendChildren(new ArrayList<>(node.childNodes()));
		node.appendChild(new Element("span").addClass("caption").text(caption));
		node.appendChild(contents);
		this.caption = caption;
		return caption;
	}
}
