package org.javai.specmark;

import java.util.Objects;
import org.javai.specmark.clause.ClauseBuilder;
import org.javai.specmark.clause.ClauseElements;
import org.javai.specmark.diag.CollectingDiagnosticSink;
import org.javai.specmark.diag.DiagnosticSink;
import org.javai.specmark.diag.LoggingDiagnosticSink;
import org.javai.specmark.render.EmdLiteRenderer;
import org.javai.specmark.render.InlineRenderer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: parses a source document and builds its clause tree, bibliography
 * and effect worklist in a single document-order pass.
 * <p>
 * Each call to {@link #compile(String)} uses a fresh {@link CompileContext}, so one
 * compiler instance can be reused for independent documents.
 */
public class SpecCompiler {

	private static final Logger logger = LoggerFactory.getLogger(SpecCompiler.class);

	private final CompilerOptions options;
	private final InlineRenderer renderer;
	private final DiagnosticSink sink;

	public SpecCompiler() {
		this(CompilerOptions.defaults());
	}

	public SpecCompiler(CompilerOptions options) {
		this(options, new EmdLiteRenderer(), new LoggingDiagnosticSink());
	}

	public SpecCompiler(CompilerOptions options, InlineRenderer renderer, DiagnosticSink sink) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
		this.sink = Objects.requireNonNull(sink, "sink must not be null");
	}

	/**
	 * A compiler configured from {@code specmark.yml} on the classpath, or the defaults.
	 */
	public static SpecCompiler create() {
		return new SpecCompiler(new CompilerOptionsLoader().loadDefault(SpecCompiler.class.getClassLoader()));
	}

	public CompilerOptions options() {
		return options;
	}

	/**
	 * Compiles {@code source}. Problems are reported as diagnostics; only a clause
	 * without any header under strict headers aborts the run.
	 *
	 * @throws SpecCompilationException when strict headers are enabled and a clause has no header
	 */
	public CompilationResult compile(String source) {
		SpecDocument document = SpecDocument.parse(source);
		CollectingDiagnosticSink collected = new CollectingDiagnosticSink();
		CompileContext context = new CompileContext(options, document, collected.andThen(sink), renderer);
		ClauseBuilder builder = new ClauseBuilder(context);

		logger.info("Compiling document ({} chars) into namespace {}", source.length(), options.namespace());
		NodeTraversor.traverse(new ClauseVisitor(builder), document.document());

		CompilationResult result = new CompilationResult(context, collected.diagnostics());
		logger.info("Compiled {} top-level clauses with {} diagnostics", result.rootClauses().size(),
				result.diagnostics().size());
		return result;
	}

	/**
	 * Forwards clause, note and example elements to the builder.
	 */
	private static final class ClauseVisitor implements NodeVisitor {

		private final ClauseBuilder builder;

		ClauseVisitor(ClauseBuilder builder) {
			this.builder = builder;
		}

		@Override
		public void head(Node node, int depth) {
			if (!(node instanceof Element element)) {
				return;
			}
			if (ClauseElements.isClauseLike(element)) {
				builder.enter(element);
			} else if (ClauseElements.NOTE.equals(element.tagName())) {
				builder.addNote(element);
			} else if (ClauseElements.EXAMPLE.equals(element.tagName())) {
				builder.addExample(element);
			}
		}

		@Override
		public void tail(Node node, int depth) {
			if (node instanceof Element element && ClauseElements.isClauseLike(element)) {
				builder.exit(element);
			}
		}
	}
}
