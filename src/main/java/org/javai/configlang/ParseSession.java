package org.javai.configlang;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.configlang.document.DocumentBuilder;
import org.javai.configlang.document.DocumentLayout;
import org.javai.configlang.expr.ExpressionListener;
import org.javai.configlang.value.SymbolTable;
import org.javai.configlang.value.Value;

/**
 * State of one run over one input source: the symbol table, the document being
 * built and the expression results reported so far.
 * <p>
 * Sessions are independent of each other and are confined to a single thread.
 */
public final class ParseSession {

	private final SymbolTable symbols = new SymbolTable();
	private final DocumentBuilder document;
	private final ExpressionListener listener;
	private final List<ExpressionResult> results = new ArrayList<>();

	public ParseSession() {
		this(DocumentLayout.DEFAULT, ExpressionListener.none());
	}

	public ParseSession(DocumentLayout layout, ExpressionListener listener) {
		this.document = new DocumentBuilder(layout);
		this.listener = listener != null ? listener : ExpressionListener.none();
	}

	/**
	 * Records a successfully parsed declaration in both the symbol table and the document.
	 */
	void bind(String name, Value value) {
		symbols.define(name, value);
		document.append(name, value);
	}

	void report(String expression, BigInteger value) {
		results.add(new ExpressionResult(expression, value));
		listener.onResult(expression, value);
	}

	public SymbolTable symbols() {
		return symbols;
	}

	public DocumentBuilder document() {
		return document;
	}

	public List<ExpressionResult> results() {
		return Collections.unmodifiableList(results);
	}

	/**
	 * Freezes the current state into a result.
	 */
	public ParseResult toResult() {
		return new ParseResult(symbols.snapshot(), document.root(), results);
	}
}
