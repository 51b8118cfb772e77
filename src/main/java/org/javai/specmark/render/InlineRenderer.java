package org.javai.specmark.render;

/**
 * Renders a run of authored text into inline markup.
 */
@FunctionalInterface
public interface InlineRenderer {

	/**
	 * Renders {@code text}, which has no leading or trailing whitespace.
	 *
	 * @return HTML for the run; plain text must come back escaped
	 */
	String render(String text);
}
