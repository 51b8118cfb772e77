package org.javai.specmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.specmark.biblio.BiblioRegistry;
import org.javai.specmark.clause.Clause;
import org.javai.specmark.diag.DiagnosticSink;
import org.javai.specmark.effect.EffectWorklist;
import org.javai.specmark.render.InlineRenderer;

/**
 * State shared by every component of a single compile run.
 * <p>
 * A fresh context is created per run, so independent compiles in one process
 * never see each other's bibliography or effect declarations.
 */
public final class CompileContext {

	private final CompilerOptions options;
	private final SpecDocument document;
	private final BiblioRegistry biblio;
	private final EffectWorklist effects;
	private final DiagnosticSink diagnostics;
	private final InlineRenderer renderer;
	private final List<Clause> rootClauses = new ArrayList<>();
	private final Map<String, List<LinkableText>> linkableText = new LinkedHashMap<>();

	public CompileContext(CompilerOptions options, SpecDocument document, DiagnosticSink diagnostics,
			InlineRenderer renderer) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.document = Objects.requireNonNull(document, "document must not be null");
		this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.biblio = new BiblioRegistry(options.namespace());
		this.effects = new EffectWorklist();
	}

	public CompilerOptions options() {
		return options;
	}

	public SpecDocument document() {
		return document;
	}

	public BiblioRegistry biblio() {
		return biblio;
	}

	public EffectWorklist effects() {
		return effects;
	}

	public DiagnosticSink diagnostics() {
		return diagnostics;
	}

	public InlineRenderer renderer() {
		return renderer;
	}

	/**
	 * Top-level clauses in document order.
	 */
	public List<Clause> rootClauses() {
		return Collections.unmodifiableList(rootClauses);
	}

	public void addRootClause(Clause clause) {
		rootClauses.add(clause);
	}

	public void registerLinkableText(String namespace, LinkableText text) {
		linkableText.computeIfAbsent(namespace, k -> new ArrayList<>()).add(text);
	}

	/**
	 * Text queued for cross-linking in {@code namespace}, in registration order.
	 */
	public List<LinkableText> linkableText(String namespace) {
		List<LinkableText> texts = linkableText.get(namespace);
		return texts == null ? List.of() : Collections.unmodifiableList(texts);
	}
}
