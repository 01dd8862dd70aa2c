package uk.gegc.readlater.features.libraryitem.domain.model.search;

/**
 * Text columns that support case-insensitive exact matching.
 */
public enum TermField {
    SUBSCRIPTION("subscription"),
    LANGUAGE("language"),
    SITE_NAME("site_name"),
    AUTHOR("author"),
    ORIGINAL_URL("original_url"),
    ITEM_TYPE("item_type");

    private final String column;

    TermField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
