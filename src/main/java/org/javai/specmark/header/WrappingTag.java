package org.javai.specmark.header;

import java.util.Optional;

/**
 * Revision markup that may wrap a parameter or a whole header.
 */
public enum WrappingTag {
	INS("ins"),
	DEL("del"),
	MARK("mark");

	private final String tagName;

	WrappingTag(String tagName) {
		this.tagName = tagName;
	}

	public String tagName() {
		return tagName;
	}

	public String open() {
		return "<" + tagName + ">";
	}

	public String close() {
		return "</" + tagName + ">";
	}

	public String wrap(String html) {
		return open() + html + close();
	}

	/**
	 * Returns the tag whose opening markup starts {@code source} at {@code offset}.
	 */
	public static Optional<WrappingTag> openingAt(String source, int offset) {
		for (WrappingTag tag : values()) {
			if (source.regionMatches(true, offset, tag.open(), 0, tag.open().length())) {
				return Optional.of(tag);
			}
		}
		return Optional.empty();
	}
}
