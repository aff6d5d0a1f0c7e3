package com.solparser.ast;

/**
 * Unit suffix of a number literal, as in {@code 1 ether} or {@code 2 days}.
 */
public enum SubDenomination {
    NONE,
    WEI,
    GWEI,
    SZABO,
    FINNEY,
    ETHER,
    SECOND,
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    YEAR
}
