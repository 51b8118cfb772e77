package org.javai.specmark.clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.specmark.effect.Effects;
import org.javai.specmark.type.Signature;
import org.jsoup.nodes.Element;

/**
 * A titled, numbered section of the document.
 * <p>
 * Created when the traversal enters the clause element and completed while it
 * exits; after that it is not modified. Subclauses are owned by their parent in
 * document order; the parent link is a back-reference only.
 */
public class Clause {

	private final Element node;
	private final String id;
	private final String namespace;
	private final Clause parent;
	private final String number;
	private final ClauseKind kind;
	private final boolean annex;
	private final boolean backMatter;
	private final boolean normative;
	private final boolean introduction;
	private final List<Clause> subclauses = new ArrayList<>();
	private final List<Note> notes = new ArrayList<>();
	private final List<Note> editorNotes = new ArrayList<>();
	private final List<Example> examples = new ArrayList<>();
	private final List<String> effects = new ArrayList<>();

	private String aoid;
	private Element header;
	private String title;
	private String titleHtml;
	private Signature signature;
	private boolean skipGlobalChecks;
	private boolean skipReturnChecks;

	Clause(Element node, String id, String namespace, Clause parent, String number, String aoid, ClauseKind kind) {
		this.node = node;
		this.id = id;
		this.namespace = namespace;
		this.parent = parent;
		this.number = number;
		this.aoid = aoid;
		this.kind = kind;
		this.introduction = ClauseElements.isIntroduction(node);
		this.annex = ClauseElements.isAnnex(node);
		this.backMatter = annex && node.hasAttr("back-matter");
		this.normative = !annex || node.hasAttr("normative");
	}

	public Element node() {
		return node;
	}

	public String id() {
		return id;
	}

	public String namespace() {
		return namespace;
	}

	/**
	 * The enclosing clause, or null for a top-level clause.
	 */
	public Clause parent() {
		return parent;
	}

	public List<Clause> subclauses() {
		return Collections.unmodifiableList(subclauses);
	}

	/**
	 * The section number, e.g. {@code 3.2.1} or {@code A.1}; empty for the introduction.
	 */
	public String number() {
		return number;
	}

	/**
	 * The aoid under which the clause is registered as an operation, or null.
	 */
	public String aoid() {
		return aoid;
	}

	public ClauseKind kind() {
		return kind;
	}

	public Element header() {
		return header;
	}

	public String title() {
		return title;
	}

	public String titleHtml() {
		return titleHtml;
	}

	public Signature signature() {
		return signature;
	}

	public List<String> effects() {
		return Collections.unmodifiableList(effects);
	}

	public List<Note> notes() {
		return Collections.unmodifiableList(notes);
	}

	public List<Note> editorNotes() {
		return Collections.unmodifiableList(editorNotes);
	}

	public List<Example> examples() {
		return Collections.unmodifiableList(examples);
	}

	public boolean isIntroduction() {
		return introduction;
	}

	public boolean isAnnex() {
		return annex;
	}

	public boolean isBackMatter() {
		return backMatter;
	}

	public boolean isNormative() {
		return normative;
	}

	public boolean skipGlobalChecks() {
		return skipGlobalChecks;
	}

	public boolean skipReturnChecks() {
		return skipReturnChecks;
	}

	/**
	 * Whether the clause may carry {@code effectName}. Static semantics never have
	 * the user-code effect.
	 */
	public boolean canHaveEffect(String effectName) {
		if (title != null && title.startsWith("Static Semantics:")) {
			return !Effects.USER_CODE.equals(effectName);
		}
		return true;
	}

	/**
	 * The label shown before the title: the number, {@code Annex X (normative)} for
	 * top-level annexes, or the empty string for unnumbered and back-matter clauses.
	 */
	public String sectionLabel() {
		if (number.isEmpty() || backMatter) {
			return "";
		}
		if (annex && parent == null) {
			return "Annex " + number + " (" + (normative ? "normative" : "informative") + ")";
		}
		return number;
	}

	@Override
	public String toString() {
		return "Clause[" + (number.isEmpty() ? "" : number + " ") + id + "]";
	}

	void addSubclause(Clause clause) {
		subclauses.add(clause);
	}

	void addNote(Note note) {
		if (note.isEditorNote()) {
			editorNotes.add(note);
		} else {
			notes.add(note);
		}
	}

	void addExample(Example example) {
		examples.add(example);
	}

	void addEffect(String effect) {
		effects.add(effect);
	}

	void setAoid(String aoid) {
		this.aoid = aoid;
	}

	void setHeader(Element header, String title, String titleHtml) {
		this.header = header;
		this.title = title;
		this.titleHtml = titleHtml;
	}

	void setSignature(Signature signature) {
		this.signature = signature;
	}

	void setSkipChecks(boolean skipGlobalChecks, boolean skipReturnChecks) {
		this.skipGlobalChecks = skipGlobalChecks;
		this.skipReturnChecks = skipReturnChecks;
	}
}
