package org.javai.configlang;

import java.math.BigInteger;

/**
 * The value an expression line reduced to.
 *
 * @param expression the expression text without the leading {@code ^}
 * @param value the result
 */
public record ExpressionResult(String expression, BigInteger value) {
}
