package org.javai.configlang.value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.javai.configlang.ConfigSyntaxException;
import org.javai.configlang.ConfigSyntaxException.Reason;

/**
 * Converts literal text into a {@link Value}.
 * <p>
 * Checks run in a fixed order: the {@code array(...)} form first, then integer
 * digits, then a name already bound in the symbol table. Array elements are split
 * on commas outside nested parentheses and parsed recursively; the whole literal
 * either parses or fails, nothing is bound on the way.
 * <p>
 * Limits apply to the resolved value, so a symbol used as an array element counts
 * with its own depth and size.
 */
public class ValueLiteralParser {

	public static final String ARRAY_PREFIX = "array(";
	public static final String ARRAY_SUFFIX = ")";

	private static final Pattern UNSIGNED_INTEGER = Pattern.compile("[0-9]+");
	private static final Pattern SIGNED_INTEGER = Pattern.compile("-?[0-9]+");

	private final int maxNestingDepth;
	private final long maxValueNodes;
	private final boolean signedLiterals;

	/**
	 * @param maxNestingDepth deepest array nesting accepted; a plain {@code array(...)} has depth 1
	 * @param maxValueNodes largest number of values a single literal may resolve to
	 * @param signedLiterals whether integer literals may carry a leading {@code -}
	 */
	public ValueLiteralParser(int maxNestingDepth, long maxValueNodes, boolean signedLiterals) {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be at least 1, was " + maxNestingDepth);
		}
		if (maxValueNodes < 1) {
			throw new IllegalArgumentException("maxValueNodes must be at least 1, was " + maxValueNodes);
		}
		this.maxNestingDepth = maxNestingDepth;
		this.maxValueNodes = maxValueNodes;
		this.signedLiterals = signedLiterals;
	}

	/**
	 * Parses trimmed literal text, resolving bare names against {@code symbols}.
	 *
	 * @throws ConfigSyntaxException with {@link Reason#INVALID_VALUE} for text that is
	 *         none of the literal forms, {@link Reason#NESTING_TOO_DEEP} or
	 *         {@link Reason#VALUE_TOO_LARGE} when the resolved value exceeds a limit
	 */
	public Value parse(String text, SymbolTable symbols) {
		if (text == null) {
			throw new ConfigSyntaxException(Reason.INVALID_VALUE, "null");
		}
		return parse(text.strip(), symbols, 0);
	}

	private Value parse(String text, SymbolTable symbols, int depth) {
		if (isArrayLiteral(text)) {
			return parseArray(text, symbols, depth + 1);
		}
		if (isIntegerLiteral(text, signedLiterals)) {
			return new Value.IntegerValue(new BigInteger(text));
		}
		return symbols.lookup(text)
				.orElseThrow(() -> new ConfigSyntaxException(Reason.INVALID_VALUE, text));
	}

	private Value parseArray(String text, SymbolTable symbols, int depth) {
		if (depth > maxNestingDepth) {
			throw new ConfigSyntaxException(Reason.NESTING_TOO_DEEP, text);
		}
		String interior = text.substring(ARRAY_PREFIX.length(), text.length() - ARRAY_SUFFIX.length());
		List<Value> elements = new ArrayList<>();
		for (String element : splitTopLevel(interior, text)) {
			elements.add(parse(element.strip(), symbols, depth));
		}
		Value.ListValue list = new Value.ListValue(elements);
		if (list.depth() > maxNestingDepth) {
			throw new ConfigSyntaxException(Reason.NESTING_TOO_DEEP, text);
		}
		if (list.nodeCount() > maxValueNodes) {
			throw new ConfigSyntaxException(Reason.VALUE_TOO_LARGE, text);
		}
		return list;
	}

	/**
	 * Splits on commas that are not enclosed in parentheses. Blank input yields no elements.
	 */
	static List<String> splitTopLevel(String interior, String literal) {
		if (interior.isBlank()) {
			return List.of();
		}
		List<String> parts = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < interior.length(); i++) {
			char c = interior.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth < 0) {
					throw new ConfigSyntaxException(Reason.INVALID_VALUE, literal);
				}
			} else if (c == ',' && depth == 0) {
				parts.add(interior.substring(start, i));
				start = i + 1;
			}
		}
		if (depth != 0) {
			throw new ConfigSyntaxException(Reason.INVALID_VALUE, literal);
		}
		parts.add(interior.substring(start));
		return parts;
	}

	public static boolean isArrayLiteral(String text) {
		return text.length() >= ARRAY_PREFIX.length() + ARRAY_SUFFIX.length()
				&& text.startsWith(ARRAY_PREFIX)
				&& text.endsWith(ARRAY_SUFFIX);
	}

	public static boolean isIntegerLiteral(String text, boolean signed) {
		return (signed ? SIGNED_INTEGER : UNSIGNED_INTEGER).matcher(text).matches();
	}
}
