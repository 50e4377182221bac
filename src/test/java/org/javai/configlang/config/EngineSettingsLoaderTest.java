package org.javai.configlang.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.configlang.document.DocumentFormat;
import org.javai.configlang.document.DocumentLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineSettingsLoaderTest {

	private final EngineSettingsLoader loader = new EngineSettingsLoader();

	private Path fixture(String name) throws URISyntaxException {
		return Path.of(getClass().getClassLoader().getResource("fixtures/" + name).toURI());
	}

	@Test
	void classpathDefaultsMatchBuiltInDefaults() {
		assertThat(loader.loadDefaults()).isEqualTo(EngineSettings.defaults());
	}

	@Test
	void fileOverridesOnlyTheKeysItNames() throws Exception {
		EngineSettings settings = loader.load(fixture("settings-override.yml"));

		assertThat(settings.layout()).isEqualTo(new DocumentLayout("settings", "constant", "value", "name"));
		assertThat(settings.maxNestingDepth()).isEqualTo(3);
		assertThat(settings.signedLiterals()).isFalse();
		assertThat(settings.format()).isEqualTo(DocumentFormat.JSON);
		assertThat(settings.pretty()).isTrue();
	}

	@Test
	void emptyDocumentKeepsBase() {
		EngineSettings base = EngineSettings.defaults().withPretty(true);

		assertThat(loader.parseString(base, "")).isEqualTo(base);
	}

	@Test
	void unknownKeysAreIgnored() {
		EngineSettings settings = loader.parseString(EngineSettings.defaults(), "parser:\n  colour: blue\n");

		assertThat(settings).isEqualTo(EngineSettings.defaults());
	}

	@Test
	void wronglyTypedValueFails() {
		assertThatThrownBy(() -> loader.parseString(EngineSettings.defaults(), "parser:\n  max-nesting-depth: deep\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("max-nesting-depth");
		assertThatThrownBy(() -> loader.parseString(EngineSettings.defaults(), "output:\n  pretty: 3\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("pretty");
	}

	@Test
	void unknownFormatFails() {
		assertThatThrownBy(() -> loader.parseString(EngineSettings.defaults(), "output:\n  format: toml\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("toml");
	}

	@Test
	void invalidElementNameFails() {
		assertThatThrownBy(() -> loader.parseString(EngineSettings.defaults(), "document:\n  root-element: \"a b\"\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("not a valid XML name");
	}

	@Test
	void valueNodeLimitIsConfigurable() {
		EngineSettings settings = loader.parseString(EngineSettings.defaults(), "parser:\n  max-value-nodes: 5000000000\n");

		assertThat(settings.maxValueNodes()).isEqualTo(5_000_000_000L);
		assertThat(loader.loadDefaults().maxValueNodes()).isEqualTo(EngineSettings.DEFAULT_MAX_VALUE_NODES);
	}

	@Test
	void nonPositiveDepthFails() {
		assertThatThrownBy(() -> loader.parseString(EngineSettings.defaults(), "parser:\n  max-nesting-depth: 0\n"))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void missingFileFailsWithPath(@TempDir Path dir) {
		Path missing = dir.resolve("missing.yml");

		assertThatThrownBy(() -> loader.load(missing))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("missing.yml");
	}

	@Test
	void malformedYamlFails(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("bad.yml");
		Files.writeString(file, "document: [unclosed\n");

		assertThatThrownBy(() -> loader.load(file))
				.isInstanceOf(IllegalStateException.class);
	}
}
