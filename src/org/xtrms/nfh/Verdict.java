/*
 * @LICENSE@
 */

package org.xtrms.nfh;

/**
 * Outcome of a bounded search. A search that runs past its deadline is
 * {@link #INCONCLUSIVE}, which is never the same as a proven rejection.
 */
public enum Verdict {
    ACCEPTED,
    REJECTED,
    INCONCLUSIVE;

    /*
     * three valued "or" / "and", used when combining quantifier branches
     */
    Verdict or(Verdict v) {
        if (this == ACCEPTED || v == ACCEPTED) return ACCEPTED;
        if (this == INCONCLUSIVE || v == INCONCLUSIVE) return INCONCLUSIVE;
        return REJECTED;
    }

    Verdict and(Verdict v) {
        if (this == REJECTED || v == REJECTED) return REJECTED;
        if (this == INCONCLUSIVE || v == INCONCLUSIVE) return INCONCLUSIVE;
        return ACCEPTED;
    }
}
