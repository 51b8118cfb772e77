package org.javai.specmark;

import java.util.Objects;
import java.util.Optional;
import org.javai.specmark.diag.SourcePosition;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Range;
import org.jsoup.parser.Parser;

/**
 * A parsed source document together with the original source text, so that
 * elements can be mapped back to exact offsets in what the author wrote.
 */
public final class SpecDocument {

	private final String source;
	private final Document document;

	private SpecDocument(String source, Document document) {
		this.source = source;
		this.document = document;
	}

	/**
	 * Parses {@code source} with element position tracking enabled.
	 */
	public static SpecDocument parse(String source) {
		Objects.requireNonNull(source, "source must not be null");
		Parser parser = Parser.htmlParser().setTrackPosition(true);
		return new SpecDocument(source, Jsoup.parse(source, "", parser));
	}

	public String source() {
		return source;
	}

	public Document document() {
		return document;
	}

	/**
	 * Locates the content of {@code element} in the original source: the offset
	 * just after its start tag and the offset of its end tag.
	 *
	 * @return the location, or empty when the element was not parsed from source
	 *         or has no explicit end tag
	 */
	public Optional<ContentLocation> locate(Element element) {
		Range start = element.sourceRange();
		Range end = element.endSourceRange();
		if (!start.isTracked() || !end.isTracked()) {
			return Optional.empty();
		}
		int contentStart = start.end().pos();
		int contentEnd = end.start().pos();
		if (contentStart > contentEnd || contentEnd > source.length()) {
			return Optional.empty();
		}
		return Optional.of(new ContentLocation(contentStart, contentEnd));
	}

	/**
	 * The raw source between an element's start and end tags, or its serialized
	 * inner HTML when the element cannot be located.
	 */
	public String innerSource(Element element) {
		return locate(element)
				.map(location -> source.substring(location.start(), location.end()))
				.orElseGet(element::html);
	}

	/**
	 * Line and column of an offset in the original source.
	 */
	public SourcePosition positionOf(int offset) {
		return SourcePosition.fromOffset(source, offset);
	}

	/**
	 * Offsets of an element's content within the original source.
	 */
	public record ContentLocation(int start, int end) {
	}
}
