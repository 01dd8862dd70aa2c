package uk.gegc.readlater.features.libraryitem.domain.model.search;

public enum LabelFilterMode {
    INCLUDE,
    EXCLUDE
}
