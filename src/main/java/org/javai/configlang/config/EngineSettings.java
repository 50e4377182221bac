package org.javai.configlang.config;

import org.javai.configlang.document.DocumentFormat;
import org.javai.configlang.document.DocumentLayout;

/**
 * Tunables of a parse engine.
 *
 * @param layout element names of the output document
 * @param maxNestingDepth deepest array nesting accepted in a literal
 * @param maxValueNodes largest number of values one declaration may resolve to
 * @param signedLiterals whether integer literals may carry a leading {@code -}
 * @param format default output format
 * @param pretty whether output is indented by default
 */
public record EngineSettings(
		DocumentLayout layout,
		int maxNestingDepth,
		long maxValueNodes,
		boolean signedLiterals,
		DocumentFormat format,
		boolean pretty
) {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;
	public static final long DEFAULT_MAX_VALUE_NODES = 100_000;

	public EngineSettings {
		if (layout == null) {
			layout = DocumentLayout.DEFAULT;
		}
		if (format == null) {
			format = DocumentFormat.XML;
		}
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be at least 1, was " + maxNestingDepth);
		}
		if (maxValueNodes < 1) {
			throw new IllegalArgumentException("maxValueNodes must be at least 1, was " + maxValueNodes);
		}
	}

	public static EngineSettings defaults() {
		return new EngineSettings(DocumentLayout.DEFAULT, DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_VALUE_NODES, true, DocumentFormat.XML, false);
	}

	public EngineSettings withFormat(DocumentFormat format) {
		return new EngineSettings(layout, maxNestingDepth, maxValueNodes, signedLiterals, format, pretty);
	}

	public EngineSettings withPretty(boolean pretty) {
		return new EngineSettings(layout, maxNestingDepth, maxValueNodes, signedLiterals, format, pretty);
	}

	public EngineSettings withMaxNestingDepth(int maxNestingDepth) {
		return new EngineSettings(layout, maxNestingDepth, maxValueNodes, signedLiterals, format, pretty);
	}

	public EngineSettings withMaxValueNodes(long maxValueNodes) {
		return new EngineSettings(layout, maxNestingDepth, maxValueNodes, signedLiterals, format, pretty);
	}

	public EngineSettings withSignedLiterals(boolean signedLiterals) {
		return new EngineSettings(layout, maxNestingDepth, maxValueNodes, signedLiterals, format, pretty);
	}
}
