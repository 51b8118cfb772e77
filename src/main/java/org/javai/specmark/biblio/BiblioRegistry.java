package org.javai.specmark.biblio;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Namespace-scoped store of bibliography entries.
 * <p>
 * Entries are added to exactly one namespace. Lookups that miss in a namespace
 * continue in its parent, recursively. Two namespaces exist from the start:
 * {@value #EXTERNAL} and the document namespace, whose parent it is.
 * <p>
 * Operations (keyed by aoid) and clauses (keyed by id) live in separate key spaces.
 */
public final class BiblioRegistry {

	private static final Logger logger = LoggerFactory.getLogger(BiblioRegistry.class);

	public static final String EXTERNAL = "external";

	private final Map<String, Namespace> namespaces = new LinkedHashMap<>();
	private final String documentNamespace;

	public BiblioRegistry(String documentNamespace) {
		Objects.requireNonNull(documentNamespace, "documentNamespace must not be null");
		this.documentNamespace = documentNamespace;
		createNamespace(EXTERNAL, null);
		if (!documentNamespace.equals(EXTERNAL)) {
			createNamespace(documentNamespace, EXTERNAL);
		}
	}

	/**
	 * The namespace every clause belongs to unless it declares its own.
	 */
	public String documentNamespace() {
		return documentNamespace;
	}

	/**
	 * Registers a namespace. Re-registering a name with the same parent is a no-op.
	 *
	 * @param name the namespace name
	 * @param parentName the namespace lookups fall back to, or null for a root
	 * @throws IllegalArgumentException if the parent is unknown
	 * @throws IllegalStateException if the name is already registered with a different parent
	 */
	public Namespace createNamespace(String name, String parentName) {
		Objects.requireNonNull(name, "name must not be null");
		if (parentName != null && !namespaces.containsKey(parentName)) {
			throw new IllegalArgumentException("Unknown parent namespace: " + parentName);
		}
		Namespace existing = namespaces.get(name);
		if (existing != null) {
			if (!Objects.equals(existing.parentName(), parentName)) {
				throw new IllegalStateException("Namespace " + name + " already in use with parent "
						+ existing.parentName());
			}
			logger.debug("Namespace '{}' already registered; reusing it", name);
			return existing;
		}
		Namespace namespace = new Namespace(name, parentName);
		namespaces.put(name, namespace);
		return namespace;
	}

	public boolean hasNamespace(String name) {
		return namespaces.containsKey(name);
	}

	public Optional<Namespace> namespace(String name) {
		return Optional.ofNullable(namespaces.get(name));
	}

	/**
	 * All namespaces in creation order.
	 */
	public List<Namespace> namespaces() {
		return List.copyOf(namespaces.values());
	}

	/**
	 * Adds an entry to exactly {@code namespaceName}; nothing propagates to other namespaces.
	 */
	public void add(BiblioEntry entry, String namespaceName) {
		Objects.requireNonNull(entry, "entry must not be null");
		requireNamespace(namespaceName).add(entry);
	}

	/**
	 * The aoids registered directly in a namespace, ignoring its ancestors.
	 */
	public Set<String> keysForNamespace(String namespaceName) {
		return requireNamespace(namespaceName).aoids();
	}

	/**
	 * Entries added directly to a namespace, in insertion order.
	 */
	public List<BiblioEntry> entriesIn(String namespaceName) {
		return requireNamespace(namespaceName).entries();
	}

	public Optional<OpEntry> byAoid(String aoid, String namespaceName) {
		return lookup(namespaceName, aoid, Namespace::op);
	}

	public Optional<ClauseEntry> byClauseId(String id, String namespaceName) {
		return lookup(namespaceName, id, Namespace::clause);
	}

	/**
	 * Resolves a cross-reference key, preferring an operation over a clause at each level.
	 */
	public Optional<BiblioEntry> resolve(String key, String namespaceName) {
		return lookup(namespaceName, key, (namespace, k) -> {
			OpEntry op = namespace.op(k);
			return op != null ? op : namespace.clause(k);
		});
	}

	private <T> Optional<T> lookup(String namespaceName, String key, BiFunction<Namespace, String, T> finder) {
		Namespace current = requireNamespace(namespaceName);
		while (current != null) {
			T found = finder.apply(current, key);
			if (found != null) {
				return Optional.of(found);
			}
			current = current.parentName() == null ? null : namespaces.get(current.parentName());
		}
		return Optional.empty();
	}

	private Namespace requireNamespace(String name) {
		Namespace namespace = namespaces.get(name);
		if (namespace == null) {
			throw new IllegalArgumentException("Unknown namespace: " + name);
		}
		return namespace;
	}
}
