package com.docview.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class XmlFormatterTest {

    private final XmlFormatter formatter = new XmlFormatter();

    private String format(String xml) {
        FormatResult result = formatter.format(xml, IndentStyle.TWO_SPACES);
        assertTrue(result.success(), result.error());
        return result.result();
    }

    private String minify(String xml) {
        FormatResult result = formatter.minify(xml);
        assertTrue(result.success(), result.error());
        return result.result();
    }

    @Test
    @DisplayName("Nested elements go one per line with inline text")
    void testFormat_Basic() {
        assertEquals("<root>\n  <child>text</child>\n</root>", format("<root><child>text</child></root>"));
        assertEquals("<a>\n  <b>\n    <c>deep</c>\n  </b>\n</a>", format("<a><b><c>deep</c></b></a>"));
    }

    @Test
    @DisplayName("Declaration, comments and processing instructions get their own lines")
    void testFormat_Prolog() {
        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<root/>",
            format("<?xml version=\"1.0\" encoding=\"UTF-8\"?><root/>"));
        assertEquals("<root>\n  <!-- comment -->\n  <child/>\n</root>",
            format("<root><!-- comment --><child/></root>"));
        assertEquals("<?xml version=\"1.0\"?>\n<root>\n  <?target data?>\n</root>",
            format("<?xml version=\"1.0\"?><root><?target data?></root>"));
        assertEquals("<!DOCTYPE root>\n<root/>", format("<!DOCTYPE root><root/>"));
    }

    @Test
    @DisplayName("CDATA stays inline and untouched")
    void testFormat_Cdata() {
        assertEquals("<root><![CDATA[<not xml>]]></root>", format("<root><![CDATA[<not xml>]]></root>"));
    }

    @Test
    @DisplayName("Namespace declarations and attributes are kept in place")
    void testFormat_NamespacesAndAttributes() {
        assertEquals("<ns:root xmlns:ns=\"http://example.com\">\n  <ns:child/>\n</ns:root>",
            format("<ns:root xmlns:ns=\"http://example.com\"><ns:child/></ns:root>"));
        assertEquals("<root attr=\"value\">\n  <child id=\"1\"/>\n</root>",
            format("<root attr=\"value\"><child id=\"1\"/></root>"));
        assertEquals("<e a=\"&lt;&amp;&quot;\"/>", format("<e a='&lt;&amp;\"'/>"));
    }

    @Test
    @DisplayName("Elements without content collapse to empty tags")
    void testFormat_EmptyElements() {
        assertEquals("<root>\n  <empty/>\n  <another/>\n</root>", format("<root><empty/><another></another></root>"));
    }

    @Test
    @DisplayName("Text followed by an element stays on the same line")
    void testFormat_MixedContent() {
        assertEquals("<root>hello<child>world</child>\n</root>", format("<root>hello<child>world</child></root>"));
        assertEquals("<p>padded</p>", format("<p>\n   padded\n</p>"));
    }

    @Test
    @DisplayName("Indentation follows the selected style")
    void testFormat_IndentStyles() {
        assertEquals("<a>\n    <b/>\n</a>", formatter.format("<a><b/></a>", IndentStyle.parse("spaces:4")).result());
        assertEquals("<a>\n\t<b/>\n</a>", formatter.format("<a><b/></a>", IndentStyle.parse("tabs")).result());
    }

    @Test
    @DisplayName("Formatting formatted output changes nothing")
    void testFormat_Idempotent() {
        String once = format("<?xml version=\"1.0\"?><r x=\"1\"><!-- c --><a>t</a><b><c/></b></r>");

        assertEquals(once, format(once));
    }

    @Test
    @DisplayName("Minify drops indentation but keeps every construct")
    void testMinify() {
        assertEquals("<root><child>text</child></root>", minify("<root>\n  <child>text</child>\n</root>"));
        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?><root/>",
            minify("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<root/>\n"));
        assertEquals("<root><!-- comment --><child/></root>", minify("<root>\n  <!-- comment -->\n  <child/>\n</root>"));
        assertEquals("<!DOCTYPE root><root/>", minify("<!DOCTYPE root>\n<root/>"));
        assertEquals("<root><empty/><another/></root>", minify("<root><empty/><another></another></root>"));
    }

    @Test
    @DisplayName("Minify keeps meaningful spaces inside text")
    void testMinify_KeepsTextSpacing() {
        assertEquals("<p>a <b>bold</b> word</p>", minify("<p>a <b>bold</b> word</p>"));
    }

    @Test
    @DisplayName("Parse errors report line and column")
    void testFormat_Errors() {
        FormatResult result = formatter.format("<a>\n  <b></c>\n</a>", IndentStyle.TWO_SPACES);

        assertFalse(result.success());
        assertTrue(result.error().startsWith(XmlFormatter.PARSE_ERROR_PREFIX), result.error());
        assertTrue(result.error().contains("at line 2, column"), result.error());

        assertFalse(formatter.minify("<a").success());
        assertFalse(formatter.minify("<a b=c/>").success());
        assertFalse(formatter.minify("<a x=\"1\" x=\"2\"/>").success());
    }

    @Test
    @DisplayName("Empty input is an error")
    void testFormat_Empty() {
        assertEquals(FormatResult.failure("Empty input"), formatter.format(" ", IndentStyle.TWO_SPACES));
    }

    @Test
    @DisplayName("A byte order mark before the document is dropped")
    void testFormat_ByteOrderMark() {
        assertEquals("<a/>", minify("\uFEFF<a/>"));
    }

    @Test
    @DisplayName("Deeply nested documents are indented level by level")
    void testFormat_DeepNesting() {
        StringBuilder xml = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            xml.append("<n>");
        }
        for (int i = 0; i < 100; i++) {
            xml.append("</n>");
        }
        String[] lines = format(xml.toString()).split("\n");

        assertEquals(199, lines.length);
        assertEquals("  ".repeat(99) + "<n/>", lines[99]);
        assertEquals("</n>", lines[198]);
    }
}
