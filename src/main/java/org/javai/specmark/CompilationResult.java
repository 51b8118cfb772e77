package org.javai.specmark;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.javai.specmark.biblio.BiblioRegistry;
import org.javai.specmark.clause.Clause;
import org.javai.specmark.diag.Diagnostic;
import org.javai.specmark.effect.EffectWorklist;
import org.jsoup.nodes.Document;

/**
 * Everything a compile run produced: the rewritten document, the clause tree,
 * the bibliography, the effect worklist and the diagnostics, in report order.
 */
public final class CompilationResult {

	private final CompileContext context;
	private final List<Diagnostic> diagnostics;

	CompilationResult(CompileContext context, List<Diagnostic> diagnostics) {
		this.context = context;
		this.diagnostics = List.copyOf(diagnostics);
	}

	public Document document() {
		return context.document().document();
	}

	public List<Clause> rootClauses() {
		return context.rootClauses();
	}

	public BiblioRegistry biblio() {
		return context.biblio();
	}

	public EffectWorklist effects() {
		return context.effects();
	}

	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}

	public List<Diagnostic> diagnostics(String ruleId) {
		return diagnostics.stream()
				.filter(d -> d.ruleId().equals(ruleId))
				.toList();
	}

	public List<LinkableText> linkableText(String namespace) {
		return context.linkableText(namespace);
	}

	/**
	 * Finds a clause by id anywhere in the tree, in document order.
	 */
	public Optional<Clause> findClause(String id) {
		Deque<Clause> pending = new ArrayDeque<>();
		List<Clause> roots = context.rootClauses();
		for (int i = roots.size() - 1; i >= 0; i--) {
			pending.push(roots.get(i));
		}
		while (!pending.isEmpty()) {
			Clause clause = pending.pop();
			if (clause.id().equals(id)) {
				return Optional.of(clause);
			}
			List<Clause> children = clause.subclauses();
			for (int i = children.size() - 1; i >= 0; i--) {
				pending.push(children.get(i));
			}
		}
		return Optional.empty();
	}
}
