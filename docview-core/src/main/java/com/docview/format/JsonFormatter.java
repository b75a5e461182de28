package com.docview.format;

import com.docview.jackson.DocviewJackson;
import com.docview.jackson.IndentStylePrettyPrinter;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Reformats, minifies and validates JSON text.
 *
 * <p>Text is copied token by token, so member order, duplicate keys and number
 * literals come out exactly as they went in; only whitespace changes.</p>
 */
public class JsonFormatter {

    private final JsonFactory factory;

    public JsonFormatter() {
        this(DocviewJackson.createExactObjectMapper().getFactory());
    }

    public JsonFormatter(JsonFactory factory) {
        this.factory = factory;
    }

    public FormatResult format(String input, IndentStyle style) {
        return rewrite(input, new IndentStylePrettyPrinter(style));
    }

    public FormatResult minify(String input) {
        return rewrite(input, null);
    }

    private FormatResult rewrite(String input, IndentStylePrettyPrinter prettyPrinter) {
        if (input == null || input.isBlank()) {
            return FormatResult.failure(FormatError.emptyInput());
        }
        StringWriter out = new StringWriter(input.length());
        try (JsonParser parser = factory.createParser(input);
             JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrinter != null) {
                generator.setPrettyPrinter(prettyPrinter);
            }
            JsonToken token = parser.nextToken();
            if (token == null) {
                return FormatResult.failure(FormatError.emptyInput());
            }
            copyValue(parser, generator);
            FormatError trailing = checkEnd(parser);
            if (trailing != null) {
                return FormatResult.failure(trailing);
            }
        } catch (JsonProcessingException e) {
            FormatError error = errorOf(e);
            LOGGER.debug("Rejected JSON input: {}", error.describe());
            return FormatResult.failure(error);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return FormatResult.success(out.toString());
    }

    private static void copyValue(JsonParser parser, JsonGenerator generator) throws IOException {
        int depth = 0;
        do {
            JsonToken token = parser.currentToken();
            switch (token) {
                case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> generator.writeNumber(parser.getText());
                default -> generator.copyCurrentEvent(parser);
            }
            if (token.isStructStart()) {
                depth++;
            } else if (token.isStructEnd()) {
                depth--;
            }
        } while (depth > 0 && parser.nextToken() != null);
    }

    /**
     * Counts the values of a well-formed document, or reports the first syntax error.
     */
    public ValidationResult validate(String input) {
        if (input == null || input.isBlank()) {
            return ValidationResult.invalid(FormatError.emptyInput());
        }
        try (JsonParser parser = factory.createParser(input)) {
            if (parser.nextToken() == null) {
                return ValidationResult.invalid(FormatError.emptyInput());
            }
            StatsCounter counter = new StatsCounter();
            int depth = 0;
            do {
                JsonToken token = parser.currentToken();
                if (token.isStructEnd()) {
                    depth--;
                } else if (token == JsonToken.FIELD_NAME) {
                    counter.totalKeys++;
                } else {
                    counter.value(token, depth + 1);
                    if (token.isStructStart()) {
                        depth++;
                    }
                }
            } while (depth > 0 && parser.nextToken() != null);
            FormatError trailing = checkEnd(parser);
            if (trailing != null) {
                return ValidationResult.invalid(trailing);
            }
            return ValidationResult.valid(counter.toStats());
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid(errorOf(e));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static FormatError checkEnd(JsonParser parser) throws IOException {
        if (parser.nextToken() != null) {
            JsonLocation location = parser.currentTokenLocation();
            return new FormatError("Unexpected content after the end of the document",
                location.getLineNr(), location.getColumnNr());
        }
        return null;
    }

    private static FormatError errorOf(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        return new FormatError(
            e.getOriginalMessage(),
            location == null ? 0 : Math.max(location.getLineNr(), 0),
            location == null ? 0 : Math.max(location.getColumnNr(), 0));
    }

    private static final class StatsCounter {
        int objectCount;
        int arrayCount;
        int stringCount;
        int numberCount;
        int booleanCount;
        int nullCount;
        int totalKeys;
        int maxDepth;

        void value(JsonToken token, int depth) {
            maxDepth = Math.max(maxDepth, depth);
            switch (token) {
                case START_OBJECT -> objectCount++;
                case START_ARRAY -> arrayCount++;
                case VALUE_STRING -> stringCount++;
                case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> numberCount++;
                case VALUE_TRUE, VALUE_FALSE -> booleanCount++;
                case VALUE_NULL -> nullCount++;
                default -> throw new IllegalStateException("Unexpected token " + token);
            }
        }

        JsonStats toStats() {
            return new JsonStats(objectCount, arrayCount, stringCount, numberCount,
                booleanCount, nullCount, totalKeys, maxDepth);
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFormatter.class);
}
