package dev.jobaggregator.model;

/**
 * Employment type of a listing.
 */
public enum JobType {
    FULL_TIME,
    PART_TIME,
    CONTRACT,
    INTERNSHIP,
    UNKNOWN
}
