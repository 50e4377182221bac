package org.javai.configlang.expr;

import java.math.BigInteger;

/**
 * Receives the result of every successfully evaluated expression line, once, in input order.
 */
@FunctionalInterface
public interface ExpressionListener {

	/**
	 * @param expression the expression text without the leading {@code ^}
	 * @param result the single value the expression reduced to
	 */
	void onResult(String expression, BigInteger result);

	static ExpressionListener none() {
		return (expression, result) -> {
		};
	}
}
