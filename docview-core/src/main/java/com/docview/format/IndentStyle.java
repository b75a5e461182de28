package com.docview.format;

/**
 * Indentation used when pretty-printing, selected with {@code "spaces:N"} or {@code "tabs"}.
 */
public sealed interface IndentStyle permits IndentStyle.Spaces, IndentStyle.Tabs {

    IndentStyle TWO_SPACES = new Spaces(2);

    /**
     * Text written once per nesting level.
     */
    String unit();

    default String indent(int depth) {
        return depth <= 0 ? "" : unit().repeat(depth);
    }

    record Spaces(int count) implements IndentStyle {
        public Spaces {
            if (count < 0 || count > 255) {
                throw new IllegalArgumentException("Indent width out of range: " + count);
            }
        }

        @Override
        public String unit() {
            return " ".repeat(count);
        }

        @Override
        public String toString() {
            return "spaces:" + count;
        }
    }

    record Tabs() implements IndentStyle {
        @Override
        public String unit() {
            return "\t";
        }

        @Override
        public String toString() {
            return "tabs";
        }
    }

    /**
     * Parses an indent selector.
     *
     * @throws IllegalArgumentException if the selector is neither {@code tabs} nor {@code spaces:N}
     */
    static IndentStyle parse(String selector) {
        if ("tabs".equals(selector)) {
            return new Tabs();
        }
        if (selector != null && selector.startsWith("spaces:")) {
            try {
                return new Spaces(Integer.parseInt(selector.substring(7)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid indent format. Use 'spaces:N' or 'tabs'", e);
            }
        }
        throw new IllegalArgumentException("Invalid indent format. Use 'spaces:2', 'spaces:4', or 'tabs'");
    }
}
