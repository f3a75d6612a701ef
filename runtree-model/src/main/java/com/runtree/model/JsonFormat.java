package com.runtree.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.PrettyPrinter;
import com.fasterxml.jackson.core.util.Instantiatable;

import java.io.IOException;
import java.util.Objects;

/**
 * Output formatting for {@link ModelObject#toJson(JsonFormat)}: ASCII escaping, indentation and
 * item/key separators. The default is compact ({@code ","} and {@code ":"}), no indentation and
 * non-ASCII characters written as is.
 */
public final class JsonFormat {

    public static final JsonFormat DEFAULT = new JsonFormat(false, 0, ",", ":");

    private final boolean ensureAscii;
    private final int indent;
    private final String itemSeparator;
    private final String keySeparator;

    public JsonFormat(boolean ensureAscii, int indent, String itemSeparator, String keySeparator) {
        this.ensureAscii = ensureAscii;
        this.indent = Math.max(0, indent);
        this.itemSeparator = Objects.requireNonNull(itemSeparator, "itemSeparator");
        this.keySeparator = Objects.requireNonNull(keySeparator, "keySeparator");
    }

    public JsonFormat withEnsureAscii(boolean ensureAscii) {
        return new JsonFormat(ensureAscii, indent, itemSeparator, keySeparator);
    }

    public JsonFormat withIndent(int indent) {
        return new JsonFormat(ensureAscii, indent, itemSeparator, keySeparator);
    }

    public JsonFormat withSeparators(String itemSeparator, String keySeparator) {
        return new JsonFormat(ensureAscii, indent, itemSeparator, keySeparator);
    }

    /** Escape every non-ASCII character as {@code \\uXXXX}. */
    public boolean isEnsureAscii() {
        return ensureAscii;
    }

    /** Spaces per nesting level; 0 writes everything on one line. */
    public int getIndent() {
        return indent;
    }

    public String getItemSeparator() {
        return itemSeparator;
    }

    public String getKeySeparator() {
        return keySeparator;
    }

    PrettyPrinter prettyPrinter() {
        return new Printer(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonFormat that)) return false;
        return ensureAscii == that.ensureAscii && indent == that.indent
                && itemSeparator.equals(that.itemSeparator) && keySeparator.equals(that.keySeparator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ensureAscii, indent, itemSeparator, keySeparator);
    }

    @Override
    public String toString() {
        return "JsonFormat(ensureAscii=" + ensureAscii + ", indent=" + indent
                + ", separators=('" + itemSeparator + "', '" + keySeparator + "'))";
    }

    /** Stateful per-write printer; Jackson obtains a fresh one through {@link #createInstance()}. */
    private static final class Printer implements PrettyPrinter, Instantiatable<Printer> {
        private final JsonFormat format;
        private int level;

        private Printer(JsonFormat format) {
            this.format = format;
        }

        @Override
        public Printer createInstance() {
            return new Printer(format);
        }

        @Override
        public void writeRootValueSeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw('\n');
        }

        @Override
        public void writeStartObject(JsonGenerator gen) throws IOException {
            gen.writeRaw('{');
            level++;
        }

        @Override
        public void writeEndObject(JsonGenerator gen, int nrOfEntries) throws IOException {
            level--;
            if (nrOfEntries > 0) newline(gen);
            gen.writeRaw('}');
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(format.itemSeparator);
            newline(gen);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(format.keySeparator);
        }

        @Override
        public void writeStartArray(JsonGenerator gen) throws IOException {
            gen.writeRaw('[');
            level++;
        }

        @Override
        public void writeEndArray(JsonGenerator gen, int nrOfValues) throws IOException {
            level--;
            if (nrOfValues > 0) newline(gen);
            gen.writeRaw(']');
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator gen) throws IOException {
            gen.writeRaw(format.itemSeparator);
            newline(gen);
        }

        @Override
        public void beforeArrayValues(JsonGenerator gen) throws IOException {
            newline(gen);
        }

        @Override
        public void beforeObjectEntries(JsonGenerator gen) throws IOException {
            newline(gen);
        }

        private void newline(JsonGenerator gen) throws IOException {
            if (format.indent == 0) return;
            gen.writeRaw('\n');
            gen.writeRaw(" ".repeat(format.indent * level));
        }
    }
}
