package com.docview.format;

import com.docview.tree.xml.XmlStreams;
import org.codehaus.stax2.DTDInfo;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;

/**
 * Re-indents or minifies XML text while keeping every construct: the declaration,
 * the DOCTYPE, processing instructions, comments, CDATA sections and namespace
 * declarations.
 *
 * <p>Whitespace-only text is dropped. When formatting, each tag, comment and
 * processing instruction starts a new line unless it directly follows text or
 * CDATA, which keeps mixed content on one line. Formatting trims text runs;
 * minifying leaves them as they are. Elements without content are written as
 * {@code <name/>}.</p>
 */
public class XmlFormatter {

    static final String PARSE_ERROR_PREFIX = "XML parse error: ";

    private final XMLInputFactory2 factory = XmlStreams.newInputFactory();

    public FormatResult format(String input, IndentStyle style) {
        return rewrite(input, style);
    }

    public FormatResult minify(String input) {
        return rewrite(input, null);
    }

    private FormatResult rewrite(String input, IndentStyle style) {
        if (input == null || input.isBlank()) {
            return FormatResult.failure(FormatError.emptyInput());
        }
        XMLStreamReader2 reader = null;
        try {
            reader = (XMLStreamReader2) factory.createXMLStreamReader(
                new StringReader(XmlStreams.stripByteOrderMark(input)));
            Output writer = new Output(style, input.length());
            writer.declaration(reader);
            while (reader.hasNext()) {
                writer.event(reader, reader.next());
            }
            return FormatResult.success(writer.finish());
        } catch (XMLStreamException e) {
            FormatError error = new FormatError(
                PARSE_ERROR_PREFIX + XmlStreams.message(e),
                XmlStreams.line(e.getLocation()),
                XmlStreams.column(e.getLocation()));
            LOGGER.debug("Rejected XML input: {}", error.describe());
            return FormatResult.failure(error);
        } finally {
            if (reader != null) {
                try {
                    reader.closeCompletely();
                } catch (XMLStreamException e) {
                    LOGGER.debug("Failed to close XML reader", e);
                }
            }
        }
    }

    /**
     * Output state for one document. {@code lineBreak} says whether the next tag
     * goes on a new line; a start tag stays open until we know whether the element
     * has content.
     */
    private static final class Output {
        private final IndentStyle style;
        private final StringBuilder out;
        private final StringBuilder text = new StringBuilder();
        private boolean lineBreak;
        private boolean startTagOpen;
        private int depth;

        Output(IndentStyle style, int capacity) {
            this.style = style;
            this.out = new StringBuilder(capacity);
        }

        void declaration(XMLStreamReader2 reader) {
            String version = reader.getVersion();
            if (version == null) {
                return;
            }
            StringBuilder decl = new StringBuilder("<?xml version=\"").append(version).append('"');
            String encoding = reader.getCharacterEncodingScheme();
            if (encoding != null) {
                decl.append(" encoding=\"").append(encoding).append('"');
            }
            if (reader.standaloneSet()) {
                decl.append(" standalone=\"").append(reader.isStandalone() ? "yes" : "no").append('"');
            }
            markup(decl.append("?>").toString());
        }

        void event(XMLStreamReader2 reader, int event) throws XMLStreamException {
            if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.SPACE) {
                text.append(reader.getText());
                return;
            }
            flushText();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> startElement(reader);
                case XMLStreamConstants.END_ELEMENT -> endElement(reader);
                case XMLStreamConstants.CDATA -> inline("<![CDATA[" + reader.getText() + "]]>");
                case XMLStreamConstants.ENTITY_REFERENCE -> inline("&" + reader.getLocalName() + ";");
                case XMLStreamConstants.COMMENT -> markup("<!--" + reader.getText() + "-->");
                case XMLStreamConstants.PROCESSING_INSTRUCTION -> processingInstruction(reader);
                case XMLStreamConstants.DTD -> markup(doctype(reader.getDTDInfo()));
                default -> {
                    // END_DOCUMENT
                }
            }
        }

        private void startElement(XMLStreamReader2 reader) {
            StringBuilder tag = new StringBuilder("<").append(qualifiedName(reader.getPrefix(), reader.getLocalName()));
            for (int i = 0; i < reader.getNamespaceCount(); i++) {
                String prefix = reader.getNamespacePrefix(i);
                tag.append(prefix == null || prefix.isEmpty() ? " xmlns" : " xmlns:" + prefix)
                    .append("=\"")
                    .append(XmlStreams.escapeAttribute(nullToEmpty(reader.getNamespaceURI(i))))
                    .append('"');
            }
            for (int i = 0; i < reader.getAttributeCount(); i++) {
                tag.append(' ')
                    .append(qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)))
                    .append("=\"")
                    .append(XmlStreams.escapeAttribute(reader.getAttributeValue(i)))
                    .append('"');
            }
            markup(tag.toString());
            startTagOpen = true;
            depth++;
        }

        private void endElement(XMLStreamReader2 reader) {
            depth--;
            if (startTagOpen) {
                out.append("/>");
                startTagOpen = false;
                lineBreak = true;
                return;
            }
            markup("</" + qualifiedName(reader.getPrefix(), reader.getLocalName()) + ">");
        }

        private void processingInstruction(XMLStreamReader2 reader) {
            String data = reader.getPIData();
            if (data == null || data.isBlank()) {
                markup("<?" + reader.getPITarget() + "?>");
            } else {
                markup("<?" + reader.getPITarget() + " " + data.strip() + "?>");
            }
        }

        private static String doctype(DTDInfo info) {
            StringBuilder doctype = new StringBuilder("<!DOCTYPE ").append(info.getDTDRootName());
            String publicId = info.getDTDPublicId();
            String systemId = info.getDTDSystemId();
            if (publicId != null && !publicId.isEmpty()) {
                doctype.append(" PUBLIC \"").append(publicId).append("\" \"").append(nullToEmpty(systemId)).append('"');
            } else if (systemId != null && !systemId.isEmpty()) {
                doctype.append(" SYSTEM \"").append(systemId).append('"');
            }
            String internalSubset = info.getDTDInternalSubset();
            if (internalSubset != null && !internalSubset.isEmpty()) {
                doctype.append(" [").append(internalSubset).append(']');
            }
            return doctype.append('>').toString();
        }

        private void flushText() {
            if (text.length() == 0) {
                return;
            }
            if (!XmlStreams.isWhitespace(text)) {
                String run = style == null ? text.toString() : text.toString().strip();
                inline(XmlStreams.escapeText(run));
            }
            text.setLength(0);
        }

        /**
         * Text-like output: never preceded by a line break, and the next tag follows on the same line.
         */
        private void inline(String s) {
            closeStartTag();
            out.append(s);
            lineBreak = false;
        }

        private void markup(String s) {
            closeStartTag();
            if (style != null && lineBreak) {
                out.append('\n').append(style.indent(depth));
            }
            out.append(s);
            lineBreak = true;
        }

        private void closeStartTag() {
            if (startTagOpen) {
                out.append('>');
                startTagOpen = false;
            }
        }

        String finish() {
            flushText();
            closeStartTag();
            return out.toString();
        }

        private static String qualifiedName(String prefix, String localName) {
            return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
        }

        private static String nullToEmpty(String s) {
            return s == null ? "" : s;
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(XmlFormatter.class);
}
