package uk.gegc.readlater.features.libraryitem.domain.event;

/**
 * Kind of entity a change notification refers to.
 */
public enum EntityType {
    LIBRARY_ITEM,
    LABEL,
    HIGHLIGHT
}
