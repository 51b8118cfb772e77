package org.javai.specmark.clause;

import java.util.ArrayList;
import org.jsoup.nodes.Element;

/**
 * An {@code emu-note} inside a clause. Editor's notes are never numbered.
 */
public class Note {

	private final Element node;
	private String label;
	private final boolean editorNote;

	public Note(Element node) {
		this.node = node;
		this.editorNote = "editor".equals(node.attr("type"));
	}

	public Element node() {
		return node;
	}

	/**
	 * The rendered label, or null before the enclosing clause is complete.
	 */
	public String label() {
		return label;
	}

	public boolean isEditorNote() {
		return editorNote;
	}

	/**
	 * Renders the label and wraps the note's content.
	 *
	 * @param number the 1-based label number, or null for an unnumbered note
	 * @return the label text
	 */
	String build(Integer number) {
		String label;
		if (editorNote) {
			label = "Editor's Note";
		} else {
			label = number == null ? "Note" : "Note " + number;
		}
		Element contents = new Element("div").addClass("note-contents");
		contents.appendChildren(new ArrayList<>(node.childNodes()));
		node.appendChild(new Element("span").addClass("note").text(label));
		node.appendChild(contents);
		this.label = label;
		return label;
	}
}
