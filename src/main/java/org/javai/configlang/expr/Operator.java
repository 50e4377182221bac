package org.javai.configlang.expr;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Binary operators of the postfix language. Operands are applied as {@code a OP b}
 * where {@code b} is the most recently pushed value.
 * <p>
 * Division rounds toward negative infinity and {@code mod} takes the sign of the divisor.
 */
public enum Operator {
	ADD("+", BigInteger::add),
	SUBTRACT("-", BigInteger::subtract),
	MULTIPLY("*", BigInteger::multiply),
	DIVIDE("/", Operator::floorDiv),
	MOD("mod", Operator::floorMod),
	MAX("max", BigInteger::max);

	private final String symbol;
	private final BinaryOperator<BigInteger> function;

	Operator(String symbol, BinaryOperator<BigInteger> function) {
		this.symbol = symbol;
		this.function = function;
	}

	/**
	 * @throws ArithmeticException when dividing by zero
	 */
	public BigInteger apply(BigInteger a, BigInteger b) {
		return function.apply(a, b);
	}

	public static Optional<Operator> fromSymbol(String symbol) {
		return Arrays.stream(values())
				.filter(op -> op.symbol.equals(symbol))
				.findFirst();
	}

	static BigInteger floorDiv(BigInteger a, BigInteger b) {
		BigInteger[] quotientAndRemainder = a.divideAndRemainder(b);
		BigInteger quotient = quotientAndRemainder[0];
		BigInteger remainder = quotientAndRemainder[1];
		if (remainder.signum() != 0 && remainder.signum() != b.signum()) {
			return quotient.subtract(BigInteger.ONE);
		}
		return quotient;
	}

	static BigInteger floorMod(BigInteger a, BigInteger b) {
		BigInteger remainder = a.remainder(b);
		if (remainder.signum() != 0 && remainder.signum() != b.signum()) {
			return remainder.add(b);
		}
		return remainder;
	}
}
