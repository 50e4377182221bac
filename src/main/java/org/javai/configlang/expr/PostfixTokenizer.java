package org.javai.configlang.expr;

import java.util.ArrayList;
import java.util.List;
import org.javai.configlang.value.SymbolTable;
import org.javai.configlang.value.ValueLiteralParser;

/**
 * Splits a postfix expression on whitespace and classifies each token lexically.
 * Whether an identifier is actually bound is decided by the evaluator.
 */
public class PostfixTokenizer {

	private final String input;
	private final boolean signedLiterals;
	private int pos = 0;

	public PostfixTokenizer(String input, boolean signedLiterals) {
		this.input = input != null ? input : "";
		this.signedLiterals = signedLiterals;
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return the tokens in order, empty for blank input
	 */
	public List<PostfixToken> tokenize() {
		List<PostfixToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		return tokens;
	}

	private PostfixToken nextToken() {
		int start = pos;
		while (!isAtEnd() && !Character.isWhitespace(peek())) {
			pos++;
		}
		String text = input.substring(start, pos);
		return new PostfixToken(classify(text), text);
	}

	private PostfixToken.TokenType classify(String text) {
		if (ValueLiteralParser.isIntegerLiteral(text, signedLiterals)) {
			return PostfixToken.TokenType.INTEGER;
		}
		if (Operator.fromSymbol(text).isPresent()) {
			return PostfixToken.TokenType.OPERATOR;
		}
		if (SymbolTable.isIdentifier(text)) {
			return PostfixToken.TokenType.IDENTIFIER;
		}
		return PostfixToken.TokenType.UNKNOWN;
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			pos++;
		}
	}

	private char peek() {
		return input.charAt(pos);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}
}
