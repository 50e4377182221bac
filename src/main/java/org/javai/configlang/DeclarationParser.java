package org.javai.configlang;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.configlang.ConfigSyntaxException.Reason;
import org.javai.configlang.value.Value;
import org.javai.configlang.value.ValueLiteralParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses {@code global <name> = <literal>;} lines.
 * <p>
 * The literal is parsed completely before anything is bound, so a failing line leaves
 * the symbol table and the document untouched.
 */
public class DeclarationParser {

	private static final Logger logger = LoggerFactory.getLogger(DeclarationParser.class);

	public static final String PREFIX = "global ";

	private static final Pattern DECLARATION =
			Pattern.compile("global\\s+([_a-zA-Z][_a-zA-Z0-9]*)\\s*=\\s*(.+);");

	private final ValueLiteralParser literalParser;

	public DeclarationParser(ValueLiteralParser literalParser) {
		this.literalParser = literalParser;
	}

	/**
	 * @return the value bound to the declared name
	 * @throws ConfigSyntaxException with {@link Reason#MALFORMED_DECLARATION} if the line does
	 *         not follow the declaration grammar, or the literal parser's failure
	 */
	public Value parse(String line, ParseSession session) {
		Matcher matcher = DECLARATION.matcher(line);
		if (!matcher.matches() || matcher.group(2).isBlank()) {
			throw new ConfigSyntaxException(Reason.MALFORMED_DECLARATION, line);
		}
		String name = matcher.group(1);
		Value value = literalParser.parse(matcher.group(2).strip(), session.symbols());
		session.bind(name, value);
		logger.debug("Bound '{}' = {}", name, value);
		return value;
	}
}
