package com.example.hydrant.service;

/**
 * What happens to non-extension fields when a duplicate of an already-seen resource arrives.
 */
public enum ScalarMergePolicy {
    /** The first sighting's values stay; later values are dropped. */
    FIRST_WINS,
    /** Fields carried by the later sighting overwrite the canonical ones. */
    LAST_WINS
}
