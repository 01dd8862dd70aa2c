package uk.gegc.readlater.features.libraryitem.domain.model.search;

/**
 * Logical folder a search is restricted to.
 */
public enum ScopeFilter {
    ALL,
    INBOX,
    ARCHIVE,
    TRASH,
    SUBSCRIPTION,
    LIBRARY
}
