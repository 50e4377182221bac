package org.javai.configlang.document;

import java.util.regex.Pattern;

/**
 * Element and attribute names used for the output document. Names are restricted to
 * ASCII XML names without a namespace prefix.
 *
 * @param rootElement name of the root element
 * @param constantElement name of the element created per declaration
 * @param valueElement name of the element created per array item
 * @param nameAttribute attribute carrying the declared name
 */
public record DocumentLayout(String rootElement, String constantElement, String valueElement, String nameAttribute) {

	private static final Pattern XML_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9._-]*");

	public static final DocumentLayout DEFAULT = new DocumentLayout("config", "constant", "value", "name");

	public DocumentLayout {
		requireName("rootElement", rootElement);
		requireName("constantElement", constantElement);
		requireName("valueElement", valueElement);
		requireName("nameAttribute", nameAttribute);
	}

	private static void requireName(String field, String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(field + " cannot be blank");
		}
		if (!XML_NAME.matcher(value).matches()) {
			throw new IllegalArgumentException(field + " is not a valid XML name: '" + value + "'");
		}
	}
}
