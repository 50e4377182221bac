package org.javai.configlang.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An element of the output document.
 * <p>
 * A node carries either text or child elements; a node with neither is an empty element.
 *
 * @param name the element name
 * @param attributes attributes in insertion order
 * @param text textual content, or null
 * @param children child elements in order
 */
public record DocumentNode(String name, Map<String, String> attributes, String text, List<DocumentNode> children) {

	public DocumentNode {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Element name cannot be blank");
		}
		attributes = attributes != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
				: Map.of();
		children = children != null ? List.copyOf(children) : List.of();
		if (text != null && !children.isEmpty()) {
			throw new IllegalArgumentException("Element '" + name + "' cannot carry both text and children");
		}
	}

	/**
	 * Creates an element holding only text.
	 */
	public static DocumentNode text(String name, String text) {
		return new DocumentNode(name, Map.of(), text, List.of());
	}

	/**
	 * Creates an element holding only child elements.
	 */
	public static DocumentNode element(String name, List<DocumentNode> children) {
		return new DocumentNode(name, Map.of(), null, children);
	}

	public DocumentNode withAttribute(String key, String value) {
		Map<String, String> copy = new LinkedHashMap<>(attributes);
		copy.put(key, value);
		return new DocumentNode(name, copy, text, children);
	}

	public boolean hasText() {
		return text != null;
	}

	public String attribute(String key) {
		return attributes.get(key);
	}

	/**
	 * Accepts a visitor, entering this node, then its children, then leaving it.
	 */
	public void accept(DocumentNodeVisitor visitor) {
		DocumentNodeWalker.walk(this, visitor);
	}
}
