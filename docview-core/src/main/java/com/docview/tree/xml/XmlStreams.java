package com.docview.tree.xml;

import com.ctc.wstx.stax.WstxInputFactory;
import org.codehaus.stax2.XMLInputFactory2;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;

/**
 * Woodstox setup and text helpers shared by the XML tree builder and formatter.
 */
public final class XmlStreams {

    private XmlStreams() {
    }

    /**
     * A namespace-aware, non-coalescing reader factory that reports CDATA sections as
     * their own events and parses eagerly so malformed content fails on {@code next()}
     * with a location. DTDs are reported but never processed, so no external subset
     * or entity is ever fetched.
     */
    public static XMLInputFactory2 newInputFactory() {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory2.P_REPORT_CDATA, true);
        factory.setProperty(XMLInputFactory2.P_LAZY_PARSING, false);
        return factory;
    }

    /**
     * The reader's message without the location suffix Woodstox appends.
     */
    public static String message(XMLStreamException e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        int cut = message.indexOf("\n at [");
        return cut >= 0 ? message.substring(0, cut) : message;
    }

    /**
     * Drops a leading byte order mark, which a character reader would otherwise see as prolog content.
     */
    public static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    public static int line(Location location) {
        return location == null ? 0 : Math.max(location.getLineNumber(), 0);
    }

    public static int column(Location location) {
        return location == null ? 0 : Math.max(location.getColumnNumber(), 0);
    }

    public static boolean isWhitespace(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    /**
     * Escapes {@code &}, {@code <} and {@code >} in character data.
     */
    public static String escapeText(String text) {
        return text.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;");
    }

    /**
     * Escapes character data and double quotes for use inside a quoted attribute value.
     */
    public static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }
}
