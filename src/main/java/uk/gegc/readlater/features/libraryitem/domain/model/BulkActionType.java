package uk.gegc.readlater.features.libraryitem.domain.model;

public enum BulkActionType {
    ARCHIVE,
    DELETE,
    ADD_LABELS,
    MARK_AS_READ
}
