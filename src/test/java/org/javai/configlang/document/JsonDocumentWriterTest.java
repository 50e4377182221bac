package org.javai.configlang.document;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.configlang.value.Value;
import org.junit.jupiter.api.Test;

class JsonDocumentWriterTest {

	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	void writesElementTree() throws Exception {
		DocumentBuilder builder = new DocumentBuilder();
		builder.append("x", Value.of(10));
		builder.append("y", Value.list(Value.of(1), Value.list(Value.of(2))));

		JsonNode json = mapper.readTree(new JsonDocumentWriter().write(builder.root(), false));

		assertThat(json.get("element").asText()).isEqualTo("config");
		assertThat(json.has("attributes")).isFalse();
		JsonNode x = json.get("children").get(0);
		assertThat(x.get("element").asText()).isEqualTo("constant");
		assertThat(x.get("attributes").get("name").asText()).isEqualTo("x");
		assertThat(x.get("text").asText()).isEqualTo("10");
		assertThat(x.has("children")).isFalse();

		JsonNode y = json.get("children").get(1);
		assertThat(y.has("text")).isFalse();
		assertThat(y.get("children")).hasSize(2);
		assertThat(y.get("children").get(1).get("children").get(0).get("text").asText()).isEqualTo("2");
	}

	@Test
	void compactAndPrettyOutputsAreEquivalent() throws Exception {
		DocumentBuilder builder = new DocumentBuilder();
		builder.append("x", Value.of(10));
		JsonDocumentWriter writer = new JsonDocumentWriter();

		String compact = writer.write(builder.root(), false);
		String pretty = writer.write(builder.root(), true);

		assertThat(compact).doesNotContain("\n");
		assertThat(pretty).contains("\n");
		assertThat(mapper.readTree(pretty)).isEqualTo(mapper.readTree(compact));
	}

	@Test
	void formatLookupIsCaseInsensitive() {
		assertThat(DocumentFormat.fromString("json")).isEqualTo(DocumentFormat.JSON);
		assertThat(DocumentFormat.fromString(" XML ")).isEqualTo(DocumentFormat.XML);
		assertThat(DocumentFormat.JSON.writer()).isInstanceOf(JsonDocumentWriter.class);
	}
}
