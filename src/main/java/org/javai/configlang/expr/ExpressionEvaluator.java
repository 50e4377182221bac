package org.javai.configlang.expr;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.javai.configlang.ConfigSyntaxException;
import org.javai.configlang.ConfigSyntaxException.Reason;
import org.javai.configlang.value.SymbolTable;
import org.javai.configlang.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stack-based evaluator for postfix integer expressions.
 * <p>
 * Each token is, in this order of precedence, an integer literal, a bound symbol, or
 * an operator; anything else is rejected. Symbols may push lists onto the stack, but
 * an operator only accepts integers and the final result must be an integer too.
 * The symbol table is only read.
 */
public class ExpressionEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

	private final boolean signedLiterals;

	public ExpressionEvaluator(boolean signedLiterals) {
		this.signedLiterals = signedLiterals;
	}

	/**
	 * Evaluates {@code expression} against the current bindings.
	 *
	 * @return the single value left on the stack
	 * @throws ConfigSyntaxException on unknown tokens, missing operands, non-integer
	 *         operands, division by zero, or when not exactly one value remains
	 */
	public BigInteger evaluate(String expression, SymbolTable symbols) {
		String source = expression != null ? expression.strip() : "";
		List<PostfixToken> tokens = new PostfixTokenizer(source, signedLiterals).tokenize();
		Deque<Value> stack = new ArrayDeque<>();

		for (PostfixToken token : tokens) {
			switch (token.type()) {
				case INTEGER -> stack.push(new Value.IntegerValue(new BigInteger(token.text())));
				case IDENTIFIER -> stack.push(symbols.lookup(token.text())
						.orElseThrow(() -> new ConfigSyntaxException(Reason.UNKNOWN_TOKEN, token.text())));
				case OPERATOR -> {
					// a bound symbol named like an operator shadows it
					Optional<Value> bound = symbols.lookup(token.text());
					if (bound.isPresent()) {
						stack.push(bound.get());
					} else {
						Operator operator = Operator.fromSymbol(token.text())
								.orElseThrow(() -> new ConfigSyntaxException(Reason.UNKNOWN_TOKEN, token.text()));
						BigInteger b = popInteger(stack, source);
						BigInteger a = popInteger(stack, source);
						stack.push(new Value.IntegerValue(apply(operator, a, b, source)));
					}
				}
				case UNKNOWN -> throw new ConfigSyntaxException(Reason.UNKNOWN_TOKEN, token.text());
			}
		}

		if (stack.size() != 1) {
			throw new ConfigSyntaxException(Reason.INVALID_EXPRESSION, source);
		}
		BigInteger result = asInteger(stack.pop(), source);
		logger.debug("Evaluated '{}' to {}", source, result);
		return result;
	}

	private static BigInteger apply(Operator operator, BigInteger a, BigInteger b, String source) {
		try {
			return operator.apply(a, b);
		} catch (ArithmeticException e) {
			throw new ConfigSyntaxException(Reason.DIVISION_BY_ZERO, source, e);
		}
	}

	private static BigInteger popInteger(Deque<Value> stack, String source) {
		if (stack.isEmpty()) {
			throw new ConfigSyntaxException(Reason.STACK_UNDERFLOW, source);
		}
		return asInteger(stack.pop(), source);
	}

	private static BigInteger asInteger(Value value, String source) {
		if (value instanceof Value.IntegerValue integer) {
			return integer.value();
		}
		throw new ConfigSyntaxException(Reason.TYPE_MISMATCH, source);
	}
}
