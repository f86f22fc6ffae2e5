package com.schemacrud.metadata;

/**
 * Opt-in exposure of one field in listings. Every consumer reads this single
 * value instead of re-deriving it from {@code listable}, {@code show_in},
 * {@code sortable} and {@code filterable}.
 */
public record FieldPolicy(boolean sortable, boolean filterable, boolean listable) {

    public static final FieldPolicy HIDDEN = new FieldPolicy(false, false, false);
}
