package com.raditha.treediff.gram;

import com.raditha.treediff.model.Term;

/**
 * Chooses the label a node contributes to grams.
 */
public enum LabelFunction {
    /** Category name only (default). */
    CATEGORY {
        @Override
        public String label(Term term) {
            return term.category().name();
        }
    },

    /** Category and variant, e.g. "IF/IF" or "BLOCK/INDEXED". Finer but less tolerant of reshaping. */
    KIND_AND_CATEGORY {
        @Override
        public String label(Term term) {
            return term.category().name() + "/" + term.kind().name();
        }
    };

    public abstract String label(Term term);

    public static LabelFunction fromString(String value) {
        return switch (value.trim().toLowerCase()) {
            case "category" -> CATEGORY;
            case "kind_and_category", "kind-and-category" -> KIND_AND_CATEGORY;
            default -> throw new IllegalArgumentException("Unknown label function: " + value);
        };
    }
}
