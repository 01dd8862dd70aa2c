package uk.gegc.readlater.features.libraryitem.domain.model.search;

/**
 * Timestamp columns a date range filter may target.
 */
public enum DateField {
    SAVED_AT("saved_at"),
    UPDATED_AT("updated_at"),
    CREATED_AT("created_at"),
    PUBLISHED_AT("published_at"),
    READ_AT("read_at"),
    ARCHIVED_AT("archived_at"),
    DELETED_AT("deleted_at");

    private final String column;

    DateField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
