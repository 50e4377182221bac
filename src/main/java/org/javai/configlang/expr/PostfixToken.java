package org.javai.configlang.expr;

/**
 * A whitespace-delimited token of a postfix expression.
 *
 * @param type the lexical class of the token
 * @param text the token text
 */
public record PostfixToken(TokenType type, String text) {

	public enum TokenType {
		INTEGER,       // 42, -7 when signed literals are enabled
		OPERATOR,      // + - * / mod max
		IDENTIFIER,    // candidate symbol name
		UNKNOWN        // anything else
	}

	@Override
	public String toString() {
		return type + "(" + text + ")";
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}
}
