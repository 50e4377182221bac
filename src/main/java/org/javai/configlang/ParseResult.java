package org.javai.configlang;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.configlang.document.DocumentFormat;
import org.javai.configlang.document.DocumentNode;
import org.javai.configlang.value.Value;

/**
 * Outcome of a completed parse.
 *
 * @param symbols the final bindings in declaration order
 * @param document the root of the document tree
 * @param results every expression result in input order
 */
public record ParseResult(Map<String, Value> symbols, DocumentNode document, List<ExpressionResult> results) {

	public ParseResult {
		symbols = symbols != null ? Collections.unmodifiableMap(new LinkedHashMap<>(symbols)) : Map.of();
		results = results != null ? List.copyOf(results) : List.of();
	}

	public Optional<Value> lookup(String name) {
		return Optional.ofNullable(symbols.get(name));
	}

	public String serialize(DocumentFormat format, boolean pretty) {
		return format.writer().write(document, pretty);
	}

	public String toXml() {
		return serialize(DocumentFormat.XML, false);
	}
}
