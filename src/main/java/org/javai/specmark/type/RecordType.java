package org.javai.specmark.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Record with named fields. Field types may be null when the header does not give one.
 */
public record RecordType(Map<String, Type> fields) implements Type {

	public RecordType {
		fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor) {
		return visitor.visitRecord(this);
	}
}
