package org.javai.configlang;

import java.math.BigInteger;
import org.javai.configlang.ConfigSyntaxException.Reason;
import org.javai.configlang.expr.ExpressionEvaluator;

/**
 * Classifies a normalized line and routes it to the component that handles it.
 */
public class DirectiveDispatcher {

	public static final String COMMENT_PREFIX = "#";
	public static final String EXPRESSION_PREFIX = "^";

	/**
	 * Kinds of line the language knows.
	 */
	public enum Directive {
		IGNORED,
		DECLARATION,
		EXPRESSION
	}

	private final DeclarationParser declarationParser;
	private final ExpressionEvaluator evaluator;

	public DirectiveDispatcher(DeclarationParser declarationParser, ExpressionEvaluator evaluator) {
		this.declarationParser = declarationParser;
		this.evaluator = evaluator;
	}

	/**
	 * Returns the kind of the line without acting on it.
	 *
	 * @throws ConfigSyntaxException with {@link Reason#UNKNOWN_DIRECTIVE} for any other line
	 */
	public static Directive classify(String line) {
		if (line == null || line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
			return Directive.IGNORED;
		}
		if (line.startsWith(DeclarationParser.PREFIX)) {
			return Directive.DECLARATION;
		}
		if (line.startsWith(EXPRESSION_PREFIX)) {
			return Directive.EXPRESSION;
		}
		throw new ConfigSyntaxException(Reason.UNKNOWN_DIRECTIVE, line);
	}

	/**
	 * Classifies {@code line} and applies it to {@code session}.
	 *
	 * @return the kind of line that was processed
	 */
	public Directive dispatch(String line, ParseSession session) {
		Directive directive = classify(line);
		switch (directive) {
			case DECLARATION -> declarationParser.parse(line, session);
			case EXPRESSION -> {
				String expression = line.substring(EXPRESSION_PREFIX.length()).strip();
				BigInteger result = evaluator.evaluate(expression, session.symbols());
				session.report(expression, result);
			}
			case IGNORED -> {
				// blank or comment
			}
		}
		return directive;
	}
}
