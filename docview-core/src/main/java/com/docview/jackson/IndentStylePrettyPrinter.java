package com.docview.jackson;

import com.docview.format.IndentStyle;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;

/**
 * Pretty printer producing {@code "key": value} members, one per line, indented
 * with an {@link IndentStyle}; empty containers print as {@code {}} and {@code []}.
 */
public class IndentStylePrettyPrinter extends DefaultPrettyPrinter {

    private final IndentStyle style;

    public IndentStylePrettyPrinter(IndentStyle style) {
        this.style = style;
        DefaultIndenter indenter = new DefaultIndenter(style.unit(), "\n");
        indentObjectsWith(indenter);
        indentArraysWith(indenter);
    }

    @Override
    public IndentStylePrettyPrinter createInstance() {
        return new IndentStylePrettyPrinter(style);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
