package org.javai.configlang.document;

/**
 * Renders a document tree as text.
 */
public interface DocumentWriter {

	/**
	 * @param root the root element
	 * @param pretty whether to indent nested elements on separate lines
	 * @return the serialized document; never mutates the tree
	 */
	String write(DocumentNode root, boolean pretty);
}
