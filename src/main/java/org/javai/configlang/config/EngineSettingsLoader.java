package org.javai.configlang.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.javai.configlang.document.DocumentFormat;
import org.javai.configlang.document.DocumentLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link EngineSettings} from YAML.
 * <p>
 * Defaults come from {@value #DEFAULTS_RESOURCE} on the classpath; a user file only
 * needs the keys it overrides. Unknown keys are ignored, values of the wrong type fail.
 *
 * <pre>
 * document:
 *   root-element: config
 * parser:
 *   max-nesting-depth: 64
 *   max-value-nodes: 100000
 *   signed-literals: true
 * output:
 *   format: xml
 *   pretty: false
 * </pre>
 */
public class EngineSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(EngineSettingsLoader.class);

	public static final String DEFAULTS_RESOURCE = "META-INF/config-lang-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the classpath defaults, falling back to {@link EngineSettings#defaults()}
	 * when the resource is absent.
	 */
	public EngineSettings loadDefaults() {
		ClassLoader loader = EngineSettingsLoader.class.getClassLoader();
		try (InputStream stream = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (stream == null) {
				logger.debug("No {} on the classpath; using built-in defaults", DEFAULTS_RESOURCE);
				return EngineSettings.defaults();
			}
			return apply(EngineSettings.defaults(), yaml.load(stream), DEFAULTS_RESOURCE);
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load settings from " + DEFAULTS_RESOURCE, e);
		}
	}

	/**
	 * Loads the classpath defaults and overlays the given file.
	 */
	public EngineSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return apply(loadDefaults(), yaml.load(reader), path.toString());
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load settings from path: " + path, e);
		}
	}

	/**
	 * Overlays the YAML document in {@code yamlContent} on {@code base}.
	 */
	public EngineSettings parseString(EngineSettings base, String yamlContent) {
		try {
			return apply(base, yaml.load(yamlContent), "string");
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to parse settings from string", e);
		}
	}

	private EngineSettings apply(EngineSettings base, Object data, String source) {
		if (data == null) {
			return base;
		}
		Map<String, Object> root = asMap(data, "settings", source);

		Map<String, Object> document = section(root, "document", source);
		DocumentLayout layout = new DocumentLayout(
				string(document, "root-element", base.layout().rootElement(), source),
				string(document, "constant-element", base.layout().constantElement(), source),
				string(document, "value-element", base.layout().valueElement(), source),
				string(document, "name-attribute", base.layout().nameAttribute(), source));

		Map<String, Object> parser = section(root, "parser", source);
		int maxNestingDepth = integer(parser, "max-nesting-depth", base.maxNestingDepth(), source);
		long maxValueNodes = longValue(parser, "max-value-nodes", base.maxValueNodes(), source);
		boolean signedLiterals = bool(parser, "signed-literals", base.signedLiterals(), source);

		Map<String, Object> output = section(root, "output", source);
		String formatName = string(output, "format", base.format().name(), source);
		boolean pretty = bool(output, "pretty", base.pretty(), source);

		EngineSettings settings = new EngineSettings(layout, maxNestingDepth, maxValueNodes, signedLiterals,
				DocumentFormat.fromString(formatName), pretty);
		logger.debug("Loaded settings from {}: {}", source, settings);
		return settings;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String key, String source) {
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("'" + key + "' in " + source + " must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static Map<String, Object> section(Map<String, Object> root, String key, String source) {
		Object value = root.get(key);
		return value == null ? Map.of() : asMap(value, key, source);
	}

	private static String string(Map<String, Object> section, String key, String fallback, String source) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof String text)) {
			throw new IllegalArgumentException("'" + key + "' in " + source + " must be a string, was " + value);
		}
		return text;
	}

	private static int integer(Map<String, Object> section, String key, int fallback, String source) {
		long value = longValue(section, key, fallback, source);
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
			throw new IllegalArgumentException("'" + key + "' in " + source + " is out of range: " + value);
		}
		return (int) value;
	}

	private static long longValue(Map<String, Object> section, String key, long fallback, String source) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Integer || value instanceof Long)) {
			throw new IllegalArgumentException("'" + key + "' in " + source + " must be an integer, was " + value);
		}
		return ((Number) value).longValue();
	}

	private static boolean bool(Map<String, Object> section, String key, boolean fallback, String source) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Boolean flag)) {
			throw new IllegalArgumentException("'" + key + "' in " + source + " must be true or false, was " + value);
		}
		return flag;
	}
}
