package org.javai.configlang.document;

import java.util.Locale;

/**
 * Output formats available for a document.
 */
public enum DocumentFormat {
	XML {
		@Override
		public DocumentWriter writer() {
			return new XmlDocumentWriter();
		}
	},
	JSON {
		@Override
		public DocumentWriter writer() {
			return new JsonDocumentWriter();
		}
	};

	public abstract DocumentWriter writer();

	/**
	 * Case-insensitive lookup, e.g. {@code "json"}.
	 */
	public static DocumentFormat fromString(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Document format cannot be blank");
		}
		try {
			return valueOf(name.strip().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown document format: " + name, e);
		}
	}
}
