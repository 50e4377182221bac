package org.javai.configlang.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.javai.configlang.ConfigEngine;
import org.javai.configlang.ConfigSyntaxException;
import org.javai.configlang.ParseResult;
import org.javai.configlang.config.EngineSettings;
import org.javai.configlang.config.EngineSettingsLoader;
import org.javai.configlang.document.DocumentFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(name = "config-lang",
		description = "Parses a constant declaration file, prints expression results and the resulting document",
		version = "0.1.0", mixinStandardHelpOptions = true)
public class ConfigLangCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(ConfigLangCommand.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;

	@CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Configuration file to parse")
	private Path input;

	@CommandLine.Option(names = {"-f", "--format"}, description = "Output format: xml or json (default from settings)")
	private String format;

	@CommandLine.Option(names = {"-p", "--pretty"}, description = "Indent the output document")
	private boolean pretty;

	@CommandLine.Option(names = {"-s", "--settings"}, paramLabel = "YAML", description = "Settings file overriding the defaults")
	private Path settingsFile;

	@CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the document to a file instead of stdout")
	private Path output;

	@CommandLine.Option(names = {"-q", "--quiet"}, description = "Do not print expression results")
	private boolean quiet;

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new ConfigLangCommand()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() {
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();
		try {
			EngineSettings settings = resolveSettings();
			ConfigEngine engine = ConfigEngine.builder()
					.settings(settings)
					.listener((expression, result) -> {
						if (!quiet) {
							out.println("Result of expression: " + result);
						}
					})
					.build();

			ParseResult result = engine.parse(input);
			String document = result.serialize(settings.format(), settings.pretty());
			if (output != null) {
				Files.writeString(output, document + System.lineSeparator(), StandardCharsets.UTF_8);
			} else {
				out.println(document);
			}
			out.flush();
			return EXIT_OK;
		} catch (ConfigSyntaxException e) {
			err.println("Syntax error: " + e.getMessage());
			return EXIT_FAILURE;
		} catch (IOException e) {
			logger.debug("I/O failure", e);
			err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		} catch (IllegalArgumentException | IllegalStateException e) {
			err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		} finally {
			err.flush();
		}
	}

	private EngineSettings resolveSettings() {
		EngineSettingsLoader loader = new EngineSettingsLoader();
		EngineSettings settings = settingsFile != null ? loader.load(settingsFile) : loader.loadDefaults();
		if (format != null) {
			settings = settings.withFormat(DocumentFormat.fromString(format));
		}
		if (pretty) {
			settings = settings.withPretty(true);
		}
		return settings;
	}
}
