package uk.gegc.readlater.features.libraryitem.domain.model.search;

/**
 * Existence checks on the derived array columns.
 */
public enum HasFilter {
    HIGHLIGHTS("highlight_annotations"),
    LABELS("label_names");

    private final String column;

    HasFilter(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
