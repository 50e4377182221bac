package org.javai.configlang.document;

/**
 * Walks document trees with a {@link DocumentNodeVisitor}.
 */
public final class DocumentNodeWalker {

	private DocumentNodeWalker() {
		// Utility class - no instantiation
	}

	public static void walk(DocumentNode node, DocumentNodeVisitor visitor) {
		walk(node, visitor, 0);
	}

	private static void walk(DocumentNode node, DocumentNodeVisitor visitor, int depth) {
		if (node == null) {
			return;
		}
		visitor.enterElement(node, depth);
		for (DocumentNode child : node.children()) {
			walk(child, visitor, depth + 1);
		}
		visitor.exitElement(node, depth);
	}
}
