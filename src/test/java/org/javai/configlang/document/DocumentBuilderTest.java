package org.javai.configlang.document;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.configlang.value.Value;
import org.junit.jupiter.api.Test;

class DocumentBuilderTest {

	@Test
	void emptyBuilderHasBareRoot() {
		DocumentBuilder builder = new DocumentBuilder();

		DocumentNode root = builder.root();

		assertThat(root.name()).isEqualTo("config");
		assertThat(root.children()).isEmpty();
		assertThat(builder.size()).isZero();
	}

	@Test
	void integerBecomesText() {
		DocumentBuilder builder = new DocumentBuilder();

		DocumentNode node = builder.append("x", Value.of(10));

		assertThat(node.name()).isEqualTo("constant");
		assertThat(node.attribute("name")).isEqualTo("x");
		assertThat(node.text()).isEqualTo("10");
		assertThat(node.children()).isEmpty();
	}

	@Test
	void listBecomesValueChildrenInOrder() {
		DocumentBuilder builder = new DocumentBuilder();

		DocumentNode node = builder.append("y", Value.list(Value.of(1), Value.of(2), Value.of(10)));

		assertThat(node.hasText()).isFalse();
		assertThat(node.children()).extracting(DocumentNode::name).containsOnly("value");
		assertThat(node.children()).extracting(DocumentNode::text).containsExactly("1", "2", "10");
	}

	@Test
	void emptyListHasNoValueChildren() {
		DocumentBuilder builder = new DocumentBuilder();

		DocumentNode node = builder.append("z", Value.list());

		assertThat(node.children()).isEmpty();
		assertThat(node.hasText()).isFalse();
	}

	@Test
	void nestedListsProduceNestedValueGroups() {
		DocumentBuilder builder = new DocumentBuilder();

		DocumentNode node = builder.append("m", Value.list(Value.list(Value.of(1), Value.of(2)), Value.of(3)));

		DocumentNode group = node.children().get(0);
		assertThat(group.name()).isEqualTo("value");
		assertThat(group.children()).extracting(DocumentNode::text).containsExactly("1", "2");
		assertThat(node.children().get(1).text()).isEqualTo("3");
	}

	@Test
	void rootKeepsAppendOrder() {
		DocumentBuilder builder = new DocumentBuilder();
		builder.append("b", Value.of(2));
		builder.append("a", Value.of(1));
		builder.append("b", Value.of(3));

		assertThat(builder.root().children())
				.extracting(child -> child.attribute("name"))
				.containsExactly("b", "a", "b");
	}

	@Test
	void customLayoutRenamesElements() {
		DocumentBuilder builder = new DocumentBuilder(new DocumentLayout("settings", "const", "item", "id"));

		builder.append("xs", Value.list(Value.of(1)));

		DocumentNode root = builder.root();
		assertThat(root.name()).isEqualTo("settings");
		DocumentNode constant = root.children().get(0);
		assertThat(constant.name()).isEqualTo("const");
		assertThat(constant.attribute("id")).isEqualTo("xs");
		assertThat(constant.children().get(0).name()).isEqualTo("item");
	}

	@Test
	void serializeDefaultsToCompactXml() {
		DocumentBuilder builder = new DocumentBuilder();
		builder.append("x", Value.of(10));

		assertThat(builder.serialize()).isEqualTo("<config><constant name=\"x\">10</constant></config>");
	}
}
