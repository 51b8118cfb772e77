package org.javai.specmark.biblio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.specmark.clause.ClauseKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BiblioRegistry")
class BiblioRegistryTest {

	private static final String DOC = "https://example.org/spec/";

	private BiblioRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new BiblioRegistry(DOC);
	}

	private static OpEntry op(String aoid, String refId) {
		return new OpEntry(aoid, refId, ClauseKind.ABSTRACT_OPERATION, null, List.of(), false, false);
	}

	private static ClauseEntry clause(String id) {
		return new ClauseEntry(id, null, "Title " + id, "Title " + id, "1");
	}

	@Nested
	@DisplayName("Namespaces")
	class Namespaces {

		@Test
		void bootstrapsExternalAndDocumentNamespaces() {
			assertThat(registry.namespaces()).extracting(Namespace::name).containsExactly(BiblioRegistry.EXTERNAL, DOC);
			assertThat(registry.namespace(DOC).orElseThrow().parentName()).isEqualTo(BiblioRegistry.EXTERNAL);
			assertThat(registry.namespace(BiblioRegistry.EXTERNAL).orElseThrow().parentName()).isNull();
		}

		@Test
		void creatingTheSameNamespaceTwiceIsIdempotent() {
			Namespace first = registry.createNamespace("proposal", DOC);
			Namespace second = registry.createNamespace("proposal", DOC);

			assertThat(second).isSameAs(first);
		}

		@Test
		void rejectsConflictingParent() {
			registry.createNamespace("proposal", DOC);

			assertThatThrownBy(() -> registry.createNamespace("proposal", BiblioRegistry.EXTERNAL))
					.isInstanceOf(IllegalStateException.class);
		}

		@Test
		void rejectsUnknownParent() {
			assertThatThrownBy(() -> registry.createNamespace("orphan", "missing"))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void rejectsUnknownNamespaceOnAdd() {
			assertThatThrownBy(() -> registry.add(op("Foo", "sec-foo"), "missing"))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Lookups")
	class Lookups {

		@Test
		@DisplayName("a child namespace falls back to its parent for absent keys")
		void parentFallback() {
			registry.createNamespace("proposal", DOC);
			OpEntry inherited = op("ToNumber", "sec-tonumber");
			registry.add(inherited, DOC);

			assertThat(registry.byAoid("ToNumber", "proposal")).contains(inherited);
			assertThat(registry.keysForNamespace("proposal")).isEmpty();
		}

		@Test
		@DisplayName("a local entry shadows the parent's")
		void localShadows() {
			registry.createNamespace("proposal", DOC);
			registry.add(op("ToNumber", "sec-tonumber"), DOC);
			OpEntry local = op("ToNumber", "sec-proposal-tonumber");
			registry.add(local, "proposal");

			assertThat(registry.byAoid("ToNumber", "proposal")).contains(local);
			assertThat(registry.byAoid("ToNumber", DOC).orElseThrow().refId()).isEqualTo("sec-tonumber");
		}

		@Test
		@DisplayName("lookups chain through several generations")
		void grandparentFallback() {
			registry.add(clause("sec-host"), BiblioRegistry.EXTERNAL);

			assertThat(registry.byClauseId("sec-host", DOC)).isPresent();
			assertThat(registry.byClauseId("sec-nowhere", DOC)).isEmpty();
		}

		@Test
		@DisplayName("entries never propagate to a child namespace")
		void noDownwardPropagation() {
			registry.createNamespace("proposal", DOC);
			registry.add(op("Local", "sec-local"), "proposal");

			assertThat(registry.byAoid("Local", DOC)).isEmpty();
		}

		@Test
		@DisplayName("resolve prefers operations over clauses with the same key")
		void resolvePrefersOps() {
			registry.add(clause("Same"), DOC);
			OpEntry op = op("Same", "sec-same");
			registry.add(op, DOC);

			assertThat(registry.resolve("Same", DOC)).contains(op);
		}

		@Test
		@DisplayName("ops and clauses use separate key spaces")
		void separateKeySpaces() {
			registry.add(clause("Foo"), DOC);

			assertThat(registry.keysForNamespace(DOC)).doesNotContain("Foo");
			assertThat(registry.namespace(DOC).orElseThrow().clauseIds()).containsExactly("Foo");
		}

		@Test
		void entriesKeepInsertionOrder() {
			registry.add(clause("b"), DOC);
			registry.add(op("A", "b"), DOC);
			registry.add(clause("a"), DOC);

			assertThat(registry.entriesIn(DOC)).extracting(BiblioEntry::key).containsExactly("b", "A", "a");
		}
	}
}
