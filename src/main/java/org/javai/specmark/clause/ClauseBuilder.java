package org.javai.specmark.clause;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.specmark.CompileContext;
import org.javai.specmark.LinkableText;
import org.javai.specmark.SpecCompilationException;
import org.javai.specmark.biblio.BiblioRegistry;
import org.javai.specmark.biblio.ClauseEntry;
import org.javai.specmark.biblio.OpEntry;
import org.javai.specmark.diag.Diagnostic;
import org.javai.specmark.diag.DiagnosticCategory;
import org.javai.specmark.header.CompiledHeader;
import org.javai.specmark.header.HeaderFields;
import org.javai.specmark.header.StructuredHeaderCompiler;
import org.javai.specmark.render.InlineMarkupPass;
import org.javai.specmark.type.Signature;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the clause tree from enter/exit events delivered in document order.
 * <p>
 * {@link #enter(Element)} numbers the clause, resolves its namespace and aoid and
 * pushes it; {@link #exit(Element)} compiles its header, labels its notes and
 * examples, registers its bibliography entries and pops it.
 */
public class ClauseBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ClauseBuilder.class);

	private static final String UNKNOWN_TITLE = "UNKNOWN";

	private final CompileContext context;
	private final ClauseNumberer numberer = new ClauseNumberer();
	private final Deque<Clause> stack = new ArrayDeque<>();
	private final StructuredHeaderCompiler headerCompiler;
	private final InlineMarkupPass inlineMarkup;

	public ClauseBuilder(CompileContext context) {
		this.context = context;
		this.headerCompiler = new StructuredHeaderCompiler(context.document(), context.diagnostics(),
				Set.copyOf(context.options().knownEffects()));
		this.inlineMarkup = context.options().inlineMarkup() ? new InlineMarkupPass(context.renderer()) : null;
	}

	/**
	 * The innermost open clause, or null outside any clause.
	 */
	public Clause current() {
		return stack.peek();
	}

	public Clause enter(Element node) {
		if (!ClauseElements.isClauseLike(node)) {
			throw new IllegalArgumentException("Not a clause element: <" + node.tagName() + ">");
		}
		String id = node.id();
		if (id.isEmpty()) {
			report(DiagnosticCategory.STRUCTURAL, "missing-id", "clause doesn't have an id", node);
		}

		Clause parent = stack.peek();
		String number = "";
		if (!ClauseElements.isIntroduction(node)) {
			boolean annex = ClauseElements.isAnnex(node);
			int depth = stack.size();
			if (depth == 0 && !annex && numberer.inAnnex()) {
				report(DiagnosticCategory.STRUCTURAL, "clause-after-annex", "clauses cannot follow annexes", node);
			}
			if (parent != null && annex && !parent.isAnnex()) {
				report(DiagnosticCategory.STRUCTURAL, "annex-nesting",
						"annexes may not be nested under non-annex clauses", node);
			}
			number = numberer.next(depth, annex);
		}

		String namespace = resolveNamespace(node, parent);

		String aoid = null;
		if (node.hasAttr("aoid")) {
			aoid = node.attr("aoid");
			if (aoid.isEmpty()) {
				// a bare aoid attribute names the clause by its own id
				aoid = id.isEmpty() ? null : id;
			}
		}

		ClauseKind kind = ClauseKind.fromAttribute(node.attr("type")).orElseGet(() -> {
			report(DiagnosticCategory.SEMANTIC, "unknown-clause-type",
					"unknown clause type " + node.attr("type"), node);
			return ClauseKind.NONE;
		});

		Clause clause = new Clause(node, id, namespace, parent, number, aoid, kind);
		if (parent != null) {
			parent.addSubclause(clause);
		} else {
			context.addRootClause(clause);
		}
		stack.push(clause);
		logger.debug("Entered clause {} numbered '{}' in namespace {}", id, number, namespace);
		return clause;
	}

	public void addNote(Element node) {
		Clause clause = stack.peek();
		if (clause == null) {
			report(DiagnosticCategory.STRUCTURAL, "note-outside-clause", "note is not inside any clause", node);
			return;
		}
		clause.addNote(new Note(node));
	}

	public void addExample(Element node) {
		Clause clause = stack.peek();
		if (clause == null) {
			report(DiagnosticCategory.STRUCTURAL, "example-outside-clause", "example is not inside any clause", node);
			return;
		}
		clause.addExample(new Example(node));
	}

	public Clause exit(Element node) {
		Clause clause = stack.peek();
		if (clause == null || clause.node() != node) {
			throw new IllegalStateException("Exit of <" + node.tagName() + " id=" + node.id()
					+ "> does not match the innermost open clause");
		}

		Element header = compileHeader(clause);
		buildExamples(clause);
		buildNotes(clause);
		if (inlineMarkup != null) {
			inlineMarkup.apply(node);
		}
		if (header != null) {
			clause.setHeader(header, header.text(), header.html());
			insertSectionLabel(clause, header);
		} else {
			clause.setHeader(null, UNKNOWN_TITLE, UNKNOWN_TITLE);
		}
		labelSpecialKinds(clause);
		addBiblioEntries(clause);

		stack.pop();
		logger.debug("Completed clause {} '{}'", clause.id(), clause.title());
		return clause;
	}

	private String resolveNamespace(Element node, Clause parent) {
		String parentNamespace = parent != null ? parent.namespace() : context.biblio().documentNamespace();
		if (!node.hasAttr("namespace")) {
			return parentNamespace;
		}
		String declared = node.attr("namespace");
		try {
			context.biblio().createNamespace(declared, parentNamespace);
			return declared;
		} catch (IllegalStateException e) {
			report(DiagnosticCategory.SEMANTIC, "namespace-conflict", e.getMessage(), node);
			return parentNamespace;
		}
	}

	/**
	 * Locates the header and compiles it if structured.
	 *
	 * @return the {@code h1}, or null when the clause has no usable header
	 */
	private Element compileHeader(Clause clause) {
		Element node = clause.node();
		Element surrogate = node.firstElementChild();
		while (surrogate != null && isSkippedBeforeHeader(surrogate)) {
			surrogate = surrogate.nextElementSibling();
		}
		Element header = surrogate;
		if (header != null && header.tagName().equals("ins")) {
			header = header.firstElementChild();
		}

		if (surrogate == null || header == null) {
			if (context.options().strictHeaders()) {
				throw new SpecCompilationException("Clause " + clause.id() + " doesn't have a header");
			}
			report(DiagnosticCategory.STRUCTURAL, "missing-header", "could not locate header element", node);
			return null;
		}
		if (!header.tagName().equals("h1")) {
			report(DiagnosticCategory.STRUCTURAL, "missing-header",
					"could not locate header element; found <" + surrogate.tagName() + "> before any <h1>", surrogate);
			return null;
		}

		Optional<CompiledHeader> compiled = headerCompiler.compile(header, surrogate, clause.kind());
		compiled.ifPresent(c -> applyCompiledHeader(clause, c));
		return header;
	}

	private static boolean isSkippedBeforeHeader(Element element) {
		String tag = element.tagName();
		// old-id anchors are empty spans
		return tag.equals("del") || (tag.equals("span") && element.childrenSize() == 0);
	}

	private void applyCompiledHeader(Clause clause, CompiledHeader compiled) {
		clause.setSignature(compiled.signature());
		HeaderFields fields = compiled.fields();

		if (!fields.redefinition()) {
			if (clause.node().hasAttr("aoid")) {
				report(DiagnosticCategory.SEMANTIC, "header-format",
						"nodes with structured headers should not include an AOID", clause.node());
			} else if (compiled.name() != null && clause.kind().isAlgorithmLike()) {
				clause.node().attr("aoid", compiled.name());
				clause.setAoid(compiled.name());
			}
		}

		clause.setSkipChecks(fields.skipGlobalChecks(), fields.skipReturnChecks());

		for (String effect : fields.effects()) {
			clause.addEffect(effect);
			context.effects().add(effect, clause);
		}
	}

	private void buildNotes(Clause clause) {
		List<Note> notes = clause.notes();
		if (notes.size() == 1) {
			notes.get(0).build(null);
		} else {
			for (int i = 0; i < notes.size(); i++) {
				notes.get(i).build(i + 1);
			}
		}
		clause.editorNotes().forEach(note -> note.build(null));
	}

	private void buildExamples(Clause clause) {
		List<Example> examples = clause.examples();
		if (examples.size() == 1) {
			examples.get(0).build(null);
		} else {
			for (int i = 0; i < examples.size(); i++) {
				examples.get(i).build(i + 1);
			}
		}
	}

	private void insertSectionLabel(Clause clause, Element header) {
		String label = clause.sectionLabel();
		if (label.isEmpty()) {
			return;
		}
		Element secnum = new Element("span").addClass("secnum");
		if (clause.isAnnex() && label.startsWith("Annex ")) {
			secnum.appendText("Annex " + clause.number() + " ");
			secnum.appendElement("span").addClass("annex-kind")
					.text("(" + (clause.isNormative() ? "normative" : "informative") + ")");
		} else {
			secnum.text(label);
		}
		header.prependText(" ");
		header.prependChild(secnum);
	}

	private void labelSpecialKinds(Clause clause) {
		List<SpecialKind> kinds = SpecialKind.presentOn(clause.node());
		if (kinds.isEmpty()) {
			return;
		}
		String text = kinds.stream().map(SpecialKind::label).collect(Collectors.joining(", "));
		TextNode contents = new TextNode(text);
		Element tag = new Element("div").addClass("attributes-tag");
		tag.appendChild(contents);
		clause.node().prependChild(tag);
		// the traversal already passed this position, so queue it for cross-linking explicitly
		context.registerLinkableText(clause.namespace(), new LinkableText(contents, clause));
	}

	private void addBiblioEntries(Clause clause) {
		BiblioRegistry biblio = context.biblio();
		String namespace = clause.namespace();
		String aoid = clause.aoid();

		if (aoid != null) {
			if (biblio.keysForNamespace(namespace).contains(aoid)) {
				report(DiagnosticCategory.SEMANTIC, "duplicate-definition",
						"duplicate definition \"" + aoid + "\"", clause.node());
			} else {
				Signature signature = clause.signature();
				if (signature != null && signature.returnsMixedCompletionUnion()) {
					report(DiagnosticCategory.SEMANTIC, "completion-union",
							"algorithms should return either completions or things which are not completions, never both",
							clause.header() != null ? clause.header() : clause.node());
				}
				ClauseKind kind = clause.kind().isAlgorithmLike() ? clause.kind() : null;
				biblio.add(new OpEntry(aoid, clause.id(), kind, signature, clause.effects(),
						clause.skipGlobalChecks(), clause.skipReturnChecks()), namespace);
			}
		}

		boolean duplicateId = !clause.id().isEmpty() && biblio.namespace(namespace)
				.map(ns -> ns.clauseIds().contains(clause.id()))
				.orElse(false);
		if (duplicateId) {
			report(DiagnosticCategory.SEMANTIC, "duplicate-id", "duplicate clause id \"" + clause.id() + "\"",
					clause.node());
		}
		biblio.add(new ClauseEntry(clause.id(), aoid, clause.title(), clause.titleHtml(), clause.number()), namespace);
	}

	private void report(DiagnosticCategory category, String ruleId, String message, Element node) {
		context.diagnostics().report(Diagnostic.of(category, ruleId, message, node));
	}
}
