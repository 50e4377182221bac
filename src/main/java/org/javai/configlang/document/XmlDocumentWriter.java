package org.javai.configlang.document;

import java.io.StringWriter;
import java.util.Map;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Writes a document as XML without a declaration, e.g.
 * {@code <config><constant name="x">10</constant></config>}.
 */
public class XmlDocumentWriter implements DocumentWriter {

	private static final String INDENT = "  ";

	private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

	@Override
	public String write(DocumentNode root, boolean pretty) {
		StringWriter out = new StringWriter();
		try {
			XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
			root.accept(new StreamingVisitor(xml, pretty));
			xml.flush();
			xml.close();
		} catch (XMLStreamException e) {
			throw new IllegalStateException("Failed to write XML document", e);
		} catch (UncheckedXmlException e) {
			throw new IllegalStateException("Failed to write XML document", e.getCause());
		}
		return out.toString();
	}

	private static final class StreamingVisitor implements DocumentNodeVisitor {

		private final XMLStreamWriter xml;
		private final boolean pretty;

		StreamingVisitor(XMLStreamWriter xml, boolean pretty) {
			this.xml = xml;
			this.pretty = pretty;
		}

		@Override
		public void enterElement(DocumentNode node, int depth) {
			try {
				if (depth > 0) {
					newline(depth);
				}
				xml.writeStartElement(node.name());
				for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
					xml.writeAttribute(attribute.getKey(), attribute.getValue());
				}
				if (node.hasText()) {
					xml.writeCharacters(node.text());
				}
			} catch (XMLStreamException e) {
				throw new UncheckedXmlException(e);
			}
		}

		@Override
		public void exitElement(DocumentNode node, int depth) {
			try {
				if (!node.children().isEmpty()) {
					newline(depth);
				}
				xml.writeEndElement();
			} catch (XMLStreamException e) {
				throw new UncheckedXmlException(e);
			}
		}

		private void newline(int depth) throws XMLStreamException {
			if (pretty) {
				xml.writeCharacters("\n" + INDENT.repeat(depth));
			}
		}
	}

	private static final class UncheckedXmlException extends RuntimeException {
		UncheckedXmlException(XMLStreamException cause) {
			super(cause);
		}
	}
}
