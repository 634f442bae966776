package com.gridcalc.references;

/**
 * Read-only view of the named ranges that the tokenizer consults
 * when it meets a bare identifier.
 */
public interface NamedRangeLookup {

    boolean exists(String name);

    /**
     * Returns the target of {@code name}, or null when it is not defined.
     */
    NamedRange resolve(String name);
}
