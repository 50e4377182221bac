package org.javai.configlang.document;

import java.util.ArrayList;
import java.util.List;
import org.javai.configlang.value.Value;

/**
 * Accumulates one element per declaration under a fixed root.
 * <p>
 * An integer becomes the element's text. A list becomes one value element per
 * item; an item that is itself a list becomes a value element holding its own
 * value elements, so nesting is preserved exactly.
 */
public class DocumentBuilder {

	private final DocumentLayout layout;
	private final List<DocumentNode> constants = new ArrayList<>();

	public DocumentBuilder() {
		this(DocumentLayout.DEFAULT);
	}

	public DocumentBuilder(DocumentLayout layout) {
		this.layout = layout != null ? layout : DocumentLayout.DEFAULT;
	}

	/**
	 * Appends the binding {@code name -> value} as a new child of the root.
	 *
	 * @return the appended element
	 */
	public DocumentNode append(String name, Value value) {
		DocumentNode constant = toNode(layout.constantElement(), value)
				.withAttribute(layout.nameAttribute(), name);
		constants.add(constant);
		return constant;
	}

	private DocumentNode toNode(String elementName, Value value) {
		if (value instanceof Value.IntegerValue integer) {
			return DocumentNode.text(elementName, integer.value().toString());
		}
		if (value instanceof Value.ListValue list) {
			List<DocumentNode> children = new ArrayList<>(list.size());
			for (Value element : list.elements()) {
				children.add(toNode(layout.valueElement(), element));
			}
			return DocumentNode.element(elementName, children);
		}
		throw new IllegalArgumentException("Unsupported value: " + value);
	}

	/**
	 * @return the root element with every appended constant, in append order
	 */
	public DocumentNode root() {
		return DocumentNode.element(layout.rootElement(), constants);
	}

	public int size() {
		return constants.size();
	}

	public String serialize() {
		return serialize(DocumentFormat.XML, false);
	}

	public String serialize(DocumentFormat format, boolean pretty) {
		return format.writer().write(root(), pretty);
	}
}
