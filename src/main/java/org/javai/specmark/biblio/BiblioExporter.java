package org.javai.specmark.biblio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Locale;
import java.util.Map;
import org.javai.specmark.SpecCompilationException;
import org.javai.specmark.type.CompletionType;
import org.javai.specmark.type.ListType;
import org.javai.specmark.type.NamedType;
import org.javai.specmark.type.Parameter;
import org.javai.specmark.type.RecordType;
import org.javai.specmark.type.Signature;
import org.javai.specmark.type.Type;
import org.javai.specmark.type.TypeVisitor;
import org.javai.specmark.type.UnionType;

/**
 * Serializes the bibliography to JSON so later runs and other documents can
 * link against it. Entries keep their insertion (document) order.
 */
public final class BiblioExporter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private BiblioExporter() {}

	/**
	 * Every namespace with its own entries.
	 */
	public static ObjectNode export(BiblioRegistry registry) {
		ObjectNode root = mapper.createObjectNode();
		root.put("documentNamespace", registry.documentNamespace());
		ArrayNode namespaces = root.putArray("namespaces");
		for (Namespace namespace : registry.namespaces()) {
			namespaces.add(exportNamespace(namespace));
		}
		return root;
	}

	public static ObjectNode exportNamespace(Namespace namespace) {
		ObjectNode node = mapper.createObjectNode();
		node.put("namespace", namespace.name());
		if (namespace.parentName() != null) {
			node.put("parent", namespace.parentName());
		}
		ArrayNode entries = node.putArray("entries");
		namespace.entries().forEach(entry -> entries.add(exportEntry(entry)));
		return node;
	}

	public static String toJson(BiblioRegistry registry) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(export(registry));
		} catch (JsonProcessingException e) {
			throw new SpecCompilationException("Failed to serialize bibliography", e);
		}
	}

	static ObjectNode exportEntry(BiblioEntry entry) {
		ObjectNode node = mapper.createObjectNode();
		if (entry instanceof ClauseEntry clause) {
			node.put("type", "clause");
			node.put("id", clause.id());
			if (clause.aoid() != null) {
				node.put("aoid", clause.aoid());
			}
			node.put("title", clause.title());
			node.put("titleHTML", clause.titleHtml());
			node.put("number", clause.number());
		} else if (entry instanceof OpEntry op) {
			node.put("type", "op");
			node.put("aoid", op.aoid());
			node.put("refId", op.refId());
			if (op.kind() != null) {
				node.put("kind", op.kind().attributeValue());
			}
			node.set("signature", op.signature() == null ? null : exportSignature(op.signature()));
			ArrayNode effects = node.putArray("effects");
			op.effects().forEach(effects::add);
			if (op.skipGlobalChecks()) {
				node.put("skipGlobalChecks", true);
			}
			if (op.skipReturnChecks()) {
				node.put("skipReturnChecks", true);
			}
		}
		return node;
	}

	private static ObjectNode exportSignature(Signature signature) {
		ObjectNode node = mapper.createObjectNode();
		ArrayNode parameters = node.putArray("parameters");
		signature.parameters().forEach(p -> parameters.add(exportParameter(p)));
		ArrayNode optional = node.putArray("optionalParameters");
		signature.optionalParameters().forEach(p -> optional.add(exportParameter(p)));
		node.set("return", exportType(signature.returnType()));
		return node;
	}

	private static ObjectNode exportParameter(Parameter parameter) {
		ObjectNode node = mapper.createObjectNode();
		node.put("name", parameter.name());
		node.set("type", exportType(parameter.type()));
		return node;
	}

	private static ObjectNode exportType(Type type) {
		return type == null ? null : type.accept(new JsonTypeVisitor());
	}

	/**
	 * Renders a type tree as tagged JSON objects.
	 */
	private static final class JsonTypeVisitor implements TypeVisitor<ObjectNode> {

		@Override
		public ObjectNode visitNamed(NamedType type) {
			ObjectNode node = tagged("opaque");
			node.put("type", type.name());
			return node;
		}

		@Override
		public ObjectNode visitList(ListType type) {
			ObjectNode node = tagged("list");
			node.set("elements", type.elementType() == null ? null : type.elementType().accept(this));
			return node;
		}

		@Override
		public ObjectNode visitRecord(RecordType type) {
			ObjectNode node = tagged("record");
			ObjectNode fields = node.putObject("fields");
			for (Map.Entry<String, Type> field : type.fields().entrySet()) {
				fields.set(field.getKey(), field.getValue() == null ? null : field.getValue().accept(this));
			}
			return node;
		}

		@Override
		public ObjectNode visitUnion(UnionType type) {
			ObjectNode node = tagged("union");
			ArrayNode types = node.putArray("types");
			type.types().forEach(member -> types.add(member.accept(this)));
			return node;
		}

		@Override
		public ObjectNode visitCompletion(CompletionType type) {
			ObjectNode node = tagged("completion");
			node.put("completionType", type.kind().name().toLowerCase(Locale.ROOT));
			node.set("typeOfValueIfNormal", type.valueType() == null ? null : type.valueType().accept(this));
			return node;
		}

		private ObjectNode tagged(String kind) {
			ObjectNode node = mapper.createObjectNode();
			node.put("kind", kind);
			return node;
		}
	}
}
