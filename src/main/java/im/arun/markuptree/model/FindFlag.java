package im.arun.markuptree.model;

/**
 * Flags controlling which fields a search compares and how.
 */
public enum FindFlag {
    /** compare tags */
    TAG,
    /** compare leaf payloads (the compact rendering of the children for composites) */
    PAYLOAD,
    /** compare attributes */
    ATTRIBUTES,
    /** values must be equal */
    EXACT,
    /** the candidate value must contain the searched value */
    CONTAINS
}
