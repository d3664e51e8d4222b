package dev.jobaggregator.model;

/**
 * Work arrangement of a listing.
 */
public enum RemoteType {
    ONSITE,
    REMOTE,
    HYBRID,
    UNKNOWN
}
