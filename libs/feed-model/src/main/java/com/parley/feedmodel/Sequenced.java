package com.parley.feedmodel;

/**
 * A feed item positioned by a store-assigned, strictly increasing identifier.
 *
 * <p>Within one group, a larger {@code id} is always the newer item, so ordering by id is
 * equivalent to ordering by creation time. Identifiers are never reused.
 */
public interface Sequenced {

    /** Store-assigned identifier, strictly positive. */
    long id();
}
