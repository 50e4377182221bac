package org.javai.configlang.document;

/**
 * Visitor for traversing a document tree depth-first.
 * <p>
 * Writers implement this to stream a tree out without building an intermediate form.
 */
public interface DocumentNodeVisitor {

	/**
	 * Called before the node's children are visited.
	 *
	 * @param node the element being entered
	 * @param depth 0 for the root
	 */
	void enterElement(DocumentNode node, int depth);

	/**
	 * Called after all of the node's children were visited.
	 *
	 * @param node the element being left
	 * @param depth 0 for the root
	 */
	void exitElement(DocumentNode node, int depth);
}
