package uk.gegc.readlater.features.libraryitem.domain.model;

public enum LibraryItemType {
    ARTICLE,
    BOOK,
    FILE,
    PROFILE,
    WEBSITE,
    TWEET,
    VIDEO,
    IMAGE,
    UNKNOWN
}
