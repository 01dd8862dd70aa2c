package uk.gegc.readlater.features.libraryitem.domain.model.search;

public enum ReadFilter {
    ALL,
    READ,
    UNREAD
}
