package com.raditha.treediff.model;

import java.util.Objects;

/**
 * Annotation attached to every node by the parsing layer.
 * Immutable once attached.
 *
 * @param range    byte range in the source
 * @param span     line/column span in the source
 * @param category language-independent category
 */
public record Info(ByteRange range, Span span, Category category) {

    public Info {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(category, "category");
    }

    /**
     * Annotation carrying only a category, for trees built in memory.
     */
    public static Info of(Category category) {
        return new Info(ByteRange.empty(), Span.unknown(), category);
    }
}
