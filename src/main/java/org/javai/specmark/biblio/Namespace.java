package org.javai.specmark.biblio;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One scope of the bibliography. Holds only the entries added to it directly;
 * the parent link is used for lookups only.
 */
public final class Namespace {

	private final String name;
	private final String parentName;
	private final List<BiblioEntry> entries = new ArrayList<>();
	private final Map<String, OpEntry> opsByAoid = new LinkedHashMap<>();
	private final Map<String, ClauseEntry> clausesById = new LinkedHashMap<>();

	Namespace(String name, String parentName) {
		this.name = name;
		this.parentName = parentName;
	}

	public String name() {
		return name;
	}

	/**
	 * The parent namespace name, or null for a root.
	 */
	public String parentName() {
		return parentName;
	}

	public List<BiblioEntry> entries() {
		return Collections.unmodifiableList(entries);
	}

	public Set<String> aoids() {
		return Collections.unmodifiableSet(opsByAoid.keySet());
	}

	public Set<String> clauseIds() {
		return Collections.unmodifiableSet(clausesById.keySet());
	}

	OpEntry op(String aoid) {
		return opsByAoid.get(aoid);
	}

	ClauseEntry clause(String id) {
		return clausesById.get(id);
	}

	void add(BiblioEntry entry) {
		entries.add(entry);
		if (entry instanceof OpEntry op) {
			opsByAoid.putIfAbsent(op.aoid(), op);
		} else if (entry instanceof ClauseEntry clause) {
			clausesById.putIfAbsent(clause.id(), clause);
		}
	}
}
