package org.javai.specmark.type;

/**
 * A formal parameter of an algorithm.
 *
 * @param name the parameter name without its surrounding underscores
 * @param type the declared type, or null when the header gives none
 */
public record Parameter(String name, Type type) {
}
