package org.javai.configlang;

/**
 * Exception thrown when a configuration source cannot be parsed or evaluated.
 * <p>
 * Every failure carries a {@link Reason} and the text that caused it. The engine
 * attaches the 1-based line number once the failure leaves the line being processed.
 */
public class ConfigSyntaxException extends RuntimeException {

	/**
	 * Discriminates the kinds of failure the engine reports.
	 */
	public enum Reason {
		UNKNOWN_DIRECTIVE("Unknown syntax"),
		MALFORMED_DECLARATION("Invalid global declaration"),
		INVALID_VALUE("Invalid value"),
		UNKNOWN_TOKEN("Unknown token in expression"),
		STACK_UNDERFLOW("Not enough operands in expression"),
		INVALID_EXPRESSION("Invalid expression"),
		TYPE_MISMATCH("Operand is not an integer"),
		DIVISION_BY_ZERO("Division by zero"),
		NESTING_TOO_DEEP("Array nesting too deep"),
		VALUE_TOO_LARGE("Array has too many values");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String description() {
			return description;
		}
	}

	private final Reason reason;
	private final String offendingText;
	private final int lineNumber;

	public ConfigSyntaxException(Reason reason, String offendingText) {
		this(reason, offendingText, 0, null);
	}

	public ConfigSyntaxException(Reason reason, String offendingText, Throwable cause) {
		this(reason, offendingText, 0, cause);
	}

	private ConfigSyntaxException(Reason reason, String offendingText, int lineNumber, Throwable cause) {
		super(format(reason, offendingText, lineNumber), cause);
		this.reason = reason;
		this.offendingText = offendingText;
		this.lineNumber = lineNumber;
	}

	private static String format(Reason reason, String offendingText, int lineNumber) {
		String message = reason.description() + ": " + offendingText;
		return lineNumber > 0 ? "line " + lineNumber + ": " + message : message;
	}

	/**
	 * Returns a copy of this exception located at the given line.
	 */
	public ConfigSyntaxException atLine(int lineNumber) {
		ConfigSyntaxException located = new ConfigSyntaxException(reason, offendingText, lineNumber, getCause());
		located.setStackTrace(getStackTrace());
		return located;
	}

	public Reason reason() {
		return reason;
	}

	public String offendingText() {
		return offendingText;
	}

	/**
	 * @return the 1-based line number, or 0 when the failure was raised outside a line context
	 */
	public int lineNumber() {
		return lineNumber;
	}
}
