package com.ilograph.edit.doc;

import org.yaml.snakeyaml.DumperOptions.ScalarStyle;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.List;
import java.util.Objects;

/**
 * Scalar leaf: raw text, resolved tag and the quoting style it was written in.
 */
public final class DocScalar extends DocNode {
    private String value;
    private ScalarStyle style;
    private SourceBlock sourceBlock;

    /**
     * Source lines of a literal or folded scalar as it was read.
     *
     * @param indicator    block header token, e.g. {@code >-} or {@code |2}
     * @param headerIndent leading spaces of the line holding the header
     * @param lines        content lines after the header, trailing blank lines included
     * @param value        the value those lines decoded to
     */
    public record SourceBlock(String indicator, int headerIndent, List<String> lines, String value) {
        public SourceBlock {
            lines = List.copyOf(lines);
        }
    }

    public DocScalar(Tag tag, String value, ScalarStyle style) {
        super(tag);
        this.value = Objects.requireNonNull(value, "value");
        this.style = style == null ? ScalarStyle.PLAIN : style;
    }

    public static DocScalar ofString(String value) {
        return new DocScalar(Tag.STR, value, ScalarStyle.PLAIN);
    }

    public static DocScalar ofBoolean(boolean value) {
        return new DocScalar(Tag.BOOL, Boolean.toString(value), ScalarStyle.PLAIN);
    }

    public static DocScalar ofNumber(Number value) {
        Tag tag = (value instanceof Double || value instanceof Float) ? Tag.FLOAT : Tag.INT;
        return new DocScalar(tag, value.toString(), ScalarStyle.PLAIN);
    }

    public String value() {
        return value;
    }

    /** Replaces the text keeping anchor, comments and quoting style. */
    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public ScalarStyle style() {
        return style;
    }

    public void setStyle(ScalarStyle style) {
        this.style = style;
    }

    /**
     * The block this scalar was read from, or null once its value or style
     * no longer matches it.
     */
    public SourceBlock sourceBlock() {
        if (sourceBlock == null || !sourceBlock.value().equals(value)) {
            return null;
        }
        ScalarStyle expected = sourceBlock.indicator().startsWith(">") ? ScalarStyle.FOLDED : ScalarStyle.LITERAL;
        return expected == style ? sourceBlock : null;
    }

    public void setSourceBlock(SourceBlock sourceBlock) {
        this.sourceBlock = sourceBlock;
    }

    public boolean isString() {
        return Tag.STR.equals(tag());
    }

    public boolean isNull() {
        return Tag.NULL.equals(tag());
    }

    public boolean isBoolean() {
        return Tag.BOOL.equals(tag());
    }

    @Override
    public DocScalar deepCopy() {
        DocScalar copy = new DocScalar(tag(), value, style);
        copy.sourceBlock = sourceBlock;
        copyMetadataTo(copy);
        return copy;
    }

    @Override
    public String toString() {
        return value;
    }
}
