package org.javai.specmark.effect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.specmark.clause.Clause;

/**
 * Append-only record of which clauses declared which effects, in document order.
 * <p>
 * Only direct declarations are collected here; propagating effects through the
 * call graph is left to a later pass that consumes this structure.
 */
public final class EffectWorklist {

	private final Map<String, List<Clause>> declarations = new LinkedHashMap<>();

	public void add(String effect, Clause clause) {
		Objects.requireNonNull(effect, "effect must not be null");
		Objects.requireNonNull(clause, "clause must not be null");
		declarations.computeIfAbsent(effect, k -> new ArrayList<>()).add(clause);
	}

	/**
	 * Clauses that declared {@code effect}, in document order.
	 */
	public List<Clause> clausesFor(String effect) {
		List<Clause> clauses = declarations.get(effect);
		return clauses == null ? List.of() : Collections.unmodifiableList(clauses);
	}

	/**
	 * Effect names in order of first declaration.
	 */
	public Set<String> effectNames() {
		return Collections.unmodifiableSet(declarations.keySet());
	}

	public boolean isEmpty() {
		return declarations.isEmpty();
	}
}
