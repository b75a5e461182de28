package com.docview.tree.xml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class XmlTreeItemTest {

    private final XmlTreeBuilder builder = new XmlTreeBuilder();

    private XmlTreeItem documentElement(String xml) {
        return builder.build(xml).child(0);
    }

    @Test
    @DisplayName("Elements with element children serialize one child per line")
    void testToXmlString_MultiLine() {
        XmlTreeItem root = documentElement("<root a=\"1\"><b>text</b><c/></root>");

        assertEquals("<root a=\"1\">\n  <b>text</b>\n  <c/>\n</root>", root.serialize());
    }

    @Test
    @DisplayName("Attributes alone still give a self-closing tag")
    void testToXmlString_SelfClosing() {
        assertEquals("<e x=\"1\" y=\"2\"/>", documentElement("<e x='1' y=\"2\"></e>").serialize());
    }

    @Test
    @DisplayName("A single text or CDATA child stays inline")
    void testToXmlString_Inline() {
        assertEquals("<t>a &amp; &lt;b&gt;</t>", documentElement("<t>a &amp; &lt;b&gt;</t>").serialize());
        assertEquals("<t><![CDATA[<b>]]></t>", documentElement("<t><![CDATA[<b>]]></t>").serialize());
    }

    @Test
    @DisplayName("Attribute values escape quotes as well as markup characters")
    void testToXmlString_AttributeEscaping() {
        XmlTreeItem e = documentElement("<e v=\"x&lt;y&amp;&quot;z&gt;\"/>");

        assertEquals("x<y&\"z>", e.child(0).value());
        assertEquals("<e v=\"x&lt;y&amp;&quot;z&gt;\"/>", e.serialize());
        assertEquals("", e.child(0).serialize());
    }

    @Test
    @DisplayName("Comments are indented like elements")
    void testToXmlString_Comment() {
        assertEquals("<r>\n  <!-- hi -->\n</r>", documentElement("<r><!-- hi --></r>").serialize());
    }

    @Test
    @DisplayName("Nested serialization starts at the given indent level")
    void testToXmlString_IndentLevel() {
        XmlTreeItem b = documentElement("<a><b><c>1</c></b></a>").child(0);

        assertEquals("  <b>\n    <c>1</c>\n  </b>", b.toXmlString(1));
    }

    @Test
    @DisplayName("The hidden root joins its children with newlines")
    void testSerialize_Root() {
        XmlTreeItem root = builder.build("<!-- top --><a><b/></a>");

        assertEquals("<!-- top -->\n<a>\n  <b/>\n</a>", root.serialize());
    }

    @Test
    @DisplayName("Serialized namespaced documents parse back to the same tree")
    void testSerialize_NamespaceRoundTrip() {
        String xml = "<ns:root xmlns:ns=\"http://example.com\"><ns:child ns:id=\"1\">v</ns:child></ns:root>";
        String once = builder.build(xml).serialize();

        assertEquals("<ns:root xmlns:ns=\"http://example.com\">\n  <ns:child ns:id=\"1\">v</ns:child>\n</ns:root>", once);
        assertEquals(once, builder.build(once).serialize());
    }

    @Test
    @DisplayName("Type names and last-child flags")
    void testTypeNameAndLastChild() {
        XmlTreeItem r = documentElement("<r k=\"v\"><x/>t</r>");

        assertEquals("element", r.typeName());
        assertEquals("attribute", r.child(0).typeName());
        assertEquals("text", r.child(2).typeName());
        assertFalse(r.child(0).isLastChild());
        assertTrue(r.child(2).isLastChild());
        assertTrue(r.isExpandable());
        assertFalse(r.child(1).isExpandable());
        assertEquals("root", r.parent().typeName());
    }
}
