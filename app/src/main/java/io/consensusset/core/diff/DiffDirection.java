package io.consensusset.core.diff;

/**
 * Face-value intent of a diff, and the direction a diff is committed with.
 * A diff committed with its own direction creates what it names; committed with
 * the opposite direction it removes it.
 */
public enum DiffDirection {
    APPLY,
    REVERT;

    public DiffDirection opposite() {
        return this == APPLY ? REVERT : APPLY;
    }
}
