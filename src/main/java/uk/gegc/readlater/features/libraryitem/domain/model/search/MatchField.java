package uk.gegc.readlater.features.libraryitem.domain.model.search;

/**
 * Fields backed by a generated {@code <field>_tsv} text-search vector.
 */
public enum MatchField {
    TITLE("title"),
    AUTHOR("author"),
    SITE("site"),
    CONTENT("content"),
    DESCRIPTION("description"),
    NOTE("note");

    private final String field;

    MatchField(String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }

    public String vectorColumn() {
        return field + "_tsv";
    }
}
