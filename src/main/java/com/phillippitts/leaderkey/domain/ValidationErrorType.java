package com.phillippitts.leaderkey.domain;

/**
 * Rule violated by a node of the configuration tree.
 */
public enum ValidationErrorType {
    /** Non-root node without a key. */
    EMPTY_KEY,
    /** Key longer than one character that is not a known special key. */
    NON_SINGLE_CHARACTER_KEY,
    /** Key already used by an earlier sibling. */
    DUPLICATE_KEY,
    /** Action without a value. */
    EMPTY_VALUE
}
