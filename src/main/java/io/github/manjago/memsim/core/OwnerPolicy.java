package io.github.manjago.memsim.core;

/**
 * Whether one owner label may hold several blocks at the same time.
 */
public enum OwnerPolicy {

    /** A second allocation under an active label is rejected. */
    SINGLE,

    /** Labels may hold any number of blocks; release frees all of them. */
    MULTIPLE
}
