package org.javai.specmark.header;

import org.javai.specmark.type.Signature;

/**
 * The outcome of compiling a structured header.
 *
 * @param name the parsed operation name, or null when the header grammar failed
 * @param signature the typed signature, or null when the header or one of its types failed to parse
 * @param fields metadata read from the description list
 */
public record CompiledHeader(String name, Signature signature, HeaderFields fields) {
}
