package uk.gegc.readlater.features.libraryitem.domain.model.search;

public enum SortBy {
    SAVED("saved_at"),
    UPDATED("updated_at"),
    PUBLISHED("published_at"),
    READ("read_at"),
    WORDS_COUNT("word_count");

    private final String column;

    SortBy(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
