package uk.gegc.readlater.features.libraryitem.domain.model;

public enum LibraryItemState {
    PROCESSING,
    SUCCEEDED,
    ARCHIVED,
    DELETED
}
