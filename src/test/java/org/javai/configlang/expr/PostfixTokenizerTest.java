package org.javai.configlang.expr;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class PostfixTokenizerTest {

	@Test
	void blankInputHasNoTokens() {
		assertThat(new PostfixTokenizer("   ", true).tokenize()).isEmpty();
		assertThat(new PostfixTokenizer(null, true).tokenize()).isEmpty();
	}

	@Test
	void classifiesTokens() {
		List<PostfixToken> tokens = new PostfixTokenizer("3  x\t+ mod ?", true).tokenize();

		assertThat(tokens).extracting(PostfixToken::type).containsExactly(
				PostfixToken.TokenType.INTEGER,
				PostfixToken.TokenType.IDENTIFIER,
				PostfixToken.TokenType.OPERATOR,
				PostfixToken.TokenType.OPERATOR,
				PostfixToken.TokenType.UNKNOWN);
		assertThat(tokens).extracting(PostfixToken::text).containsExactly("3", "x", "+", "mod", "?");
	}

	@Test
	void minusAloneIsOperatorAndSignedNumberIsInteger() {
		List<PostfixToken> tokens = new PostfixTokenizer("-10 - -", true).tokenize();

		assertThat(tokens).extracting(PostfixToken::type).containsExactly(
				PostfixToken.TokenType.INTEGER,
				PostfixToken.TokenType.OPERATOR,
				PostfixToken.TokenType.OPERATOR);
	}

	@Test
	void signedNumberIsUnknownWhenSignedLiteralsDisabled() {
		List<PostfixToken> tokens = new PostfixTokenizer("-10", false).tokenize();

		assertThat(tokens.get(0).type()).isEqualTo(PostfixToken.TokenType.UNKNOWN);
	}
}
