package org.javai.specmark.diag;

/**
 * A 1-based line and column in some source text.
 */
public record SourcePosition(int line, int column) {

	/**
	 * Maps a character offset in {@code source} to its line and column. Offsets
	 * past the end are clamped to the end of the text.
	 */
	public static SourcePosition fromOffset(String source, int offset) {
		int end = Math.max(0, Math.min(offset, source.length()));
		int line = 1;
		int column = 1;
		for (int i = 0; i < end; i++) {
			if (source.charAt(i) == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
		}
		return new SourcePosition(line, column);
	}
}
