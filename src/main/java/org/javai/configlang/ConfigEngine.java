package org.javai.configlang;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.configlang.config.EngineSettings;
import org.javai.configlang.expr.ExpressionEvaluator;
import org.javai.configlang.expr.ExpressionListener;
import org.javai.configlang.value.ValueLiteralParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing configuration sources.
 * <p>
 * Every parse call runs in a fresh {@link ParseSession}, so one engine can be reused
 * for any number of sources. Processing is fail-fast: the first failing line aborts
 * the parse with a {@link ConfigSyntaxException} that carries its line number.
 *
 * <pre>
 * ConfigEngine engine = ConfigEngine.builder()
 *         .listener((expression, result) -&gt; System.out.println(result))
 *         .build();
 * ParseResult result = engine.parse(List.of("global x = 10;", "^ x 2 *"));
 * </pre>
 */
public final class ConfigEngine {

	private static final Logger logger = LoggerFactory.getLogger(ConfigEngine.class);

	private final EngineSettings settings;
	private final ExpressionListener listener;
	private final DirectiveDispatcher dispatcher;

	private ConfigEngine(Builder builder) {
		this.settings = builder.settings;
		this.listener = builder.listener;
		ValueLiteralParser literalParser =
				new ValueLiteralParser(settings.maxNestingDepth(), settings.maxValueNodes(), settings.signedLiterals());
		this.dispatcher = new DirectiveDispatcher(
				new DeclarationParser(literalParser),
				new ExpressionEvaluator(settings.signedLiterals()));
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates an engine with default settings and no listener.
	 */
	public static ConfigEngine create() {
		return builder().build();
	}

	public ParseSession newSession() {
		return new ParseSession(settings.layout(), listener);
	}

	/**
	 * Parses the given lines in order. Each line is stripped before it is classified.
	 */
	public ParseResult parse(List<String> lines) {
		ParseSession session = newSession();
		int lineNumber = 0;
		for (String raw : lines) {
			lineNumber++;
			String line = raw != null ? raw.strip() : "";
			try {
				DirectiveDispatcher.Directive directive = dispatcher.dispatch(line, session);
				logger.debug("Line {}: {}", lineNumber, directive);
			} catch (ConfigSyntaxException e) {
				throw e.atLine(lineNumber);
			}
		}
		logger.info("Parsed {} lines: {} constants, {} expressions",
				lineNumber, session.symbols().size(), session.results().size());
		return session.toResult();
	}

	public ParseResult parse(Reader reader) throws IOException {
		try (BufferedReader buffered = new BufferedReader(reader)) {
			return parse(buffered.lines().collect(Collectors.toList()));
		}
	}

	public ParseResult parse(Path path) throws IOException {
		logger.debug("Reading {}", path);
		return parse(Files.readAllLines(path));
	}

	public ParseResult parseString(String source) {
		try {
			return parse(new StringReader(source != null ? source : ""));
		} catch (IOException e) {
			throw new IllegalStateException("Reading from a string failed", e);
		}
	}

	public EngineSettings settings() {
		return settings;
	}

	public static final class Builder {

		private EngineSettings settings = EngineSettings.defaults();
		private ExpressionListener listener = ExpressionListener.none();

		private Builder() {
		}

		public Builder settings(EngineSettings settings) {
			if (settings == null) {
				throw new IllegalArgumentException("Settings cannot be null");
			}
			this.settings = settings;
			return this;
		}

		public Builder listener(ExpressionListener listener) {
			this.listener = listener != null ? listener : ExpressionListener.none();
			return this;
		}

		public ConfigEngine build() {
			return new ConfigEngine(this);
		}
	}
}
