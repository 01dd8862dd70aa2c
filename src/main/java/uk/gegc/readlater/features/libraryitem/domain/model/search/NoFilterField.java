package uk.gegc.readlater.features.libraryitem.domain.model.search;

/**
 * Array columns that can be required to be empty.
 */
public enum NoFilterField {
    LABELS("label_names"),
    HIGHLIGHTS("highlight_annotations"),
    HIGHLIGHT_LABELS("highlight_labels"),
    RECOMMENDERS("recommender_names");

    private final String column;

    NoFilterField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
