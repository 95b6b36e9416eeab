package com.animequote.domain.analysis.model;

/**
 * JLPT proficiency levels, declared from easiest to hardest so that
 * {@link #compareTo} orders by difficulty.
 */
public enum JlptLevel {
    N5,
    N4,
    N3,
    N2,
    N1;

    public boolean isHarderThan(JlptLevel other) {
        return compareTo(other) > 0;
    }

    public static JlptLevel hardest(JlptLevel a, JlptLevel b) {
        return a.isHarderThan(b) ? a : b;
    }
}
