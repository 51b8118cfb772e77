package org.javai.specmark.render;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Entities;

/**
 * A small renderer for the common inline shorthands of specification prose:
 * {@code _x_} variables, {@code *v*} values, {@code ~c~} constants,
 * {@code |N|} nonterminals and backtick code spans.
 */
public class EmdLiteRenderer implements InlineRenderer {

	private static final Pattern VARIABLE = Pattern.compile("(?<![\\w])_([A-Za-z][A-Za-z0-9$]*)_(?![\\w])");
	private static final Pattern VALUE = Pattern.compile("(?<![\\w*])\\*([^*\\s](?:[^*]*[^*\\s])?)\\*(?![\\w*])");
	private static final Pattern CONSTANT = Pattern.compile("~([A-Za-z0-9][\\w-]*)~");
	private static final Pattern NONTERMINAL = Pattern.compile("\\|([A-Z][A-Za-z0-9]*(?:\\[[^\\]|]*\\])?)\\|");

	@Override
	public String render(String text) {
		List<String> segments = new ArrayList<>(Arrays.asList(text.split("`", -1)));
		if (segments.size() % 2 == 0) {
			// an unmatched backtick stays literal
			String last = segments.remove(segments.size() - 1);
			segments.set(segments.size() - 1, segments.get(segments.size() - 1) + "`" + last);
		}
		StringBuilder out = new StringBuilder();
		for (int i = 0; i < segments.size(); i++) {
			if (i % 2 == 1) {
				out.append("<code>").append(Entities.escape(segments.get(i))).append("</code>");
			} else {
				out.append(renderProse(segments.get(i)));
			}
		}
		return out.toString();
	}

	private String renderProse(String text) {
		String html = Entities.escape(text);
		html = replace(VARIABLE, html, "<var>$1</var>");
		html = replace(VALUE, html, "<emu-val>$1</emu-val>");
		html = replace(CONSTANT, html, "<emu-const>$1</emu-const>");
		html = replace(NONTERMINAL, html, "<emu-nt>$1</emu-nt>");
		return html;
	}

	private static String replace(Pattern pattern, String html, String replacement) {
		Matcher matcher = pattern.matcher(html);
		return matcher.replaceAll(replacement);
	}
}
