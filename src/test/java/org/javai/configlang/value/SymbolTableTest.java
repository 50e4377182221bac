package org.javai.configlang.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SymbolTableTest {

	@Test
	void newTableIsEmpty() {
		SymbolTable table = new SymbolTable();

		assertThat(table.isEmpty()).isTrue();
		assertThat(table.lookup("x")).isEmpty();
	}

	@Test
	void defineThenLookup() {
		SymbolTable table = new SymbolTable();

		assertThat(table.define("x", Value.of(10))).isEmpty();

		assertThat(table.lookup("x")).contains(Value.of(10));
		assertThat(table.contains("x")).isTrue();
		assertThat(table.size()).isEqualTo(1);
	}

	@Test
	void redeclarationReplacesAndReturnsPreviousValue() {
		SymbolTable table = new SymbolTable();
		table.define("x", Value.of(1));

		assertThat(table.define("x", Value.of(2))).contains(Value.of(1));
		assertThat(table.lookup("x")).contains(Value.of(2));
		assertThat(table.size()).isEqualTo(1);
	}

	@Test
	void redeclarationDoesNotChangeValuesResolvedEarlier() {
		SymbolTable table = new SymbolTable();
		table.define("x", Value.of(1));
		Value resolved = table.lookup("x").orElseThrow();
		table.define("y", Value.list(resolved));

		table.define("x", Value.of(99));

		assertThat(table.lookup("y")).contains(Value.list(Value.of(1)));
	}

	@Test
	void snapshotKeepsDeclarationOrderAndIsDetached() {
		SymbolTable table = new SymbolTable();
		table.define("b", Value.of(2));
		table.define("a", Value.of(1));

		Map<String, Value> snapshot = table.snapshot();
		table.define("c", Value.of(3));

		assertThat(snapshot.keySet()).containsExactly("b", "a");
		assertThat(table.names()).containsExactly("b", "a", "c");
	}

	@Test
	void rejectsInvalidIdentifiers() {
		SymbolTable table = new SymbolTable();

		assertThatThrownBy(() -> table.define("1abc", Value.of(1)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("1abc");
		assertThatThrownBy(() -> table.define("", Value.of(1)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void identifierRules() {
		assertThat(SymbolTable.isIdentifier("_x1")).isTrue();
		assertThat(SymbolTable.isIdentifier("Abc_9")).isTrue();
		assertThat(SymbolTable.isIdentifier("9x")).isFalse();
		assertThat(SymbolTable.isIdentifier("a-b")).isFalse();
		assertThat(SymbolTable.isIdentifier(null)).isFalse();
	}
}
