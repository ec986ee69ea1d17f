/*
 * @LICENSE@
 */

package org.xtrms.nfh;

/**
 * The quantifier bound to one track of an {@link NFH}. The quantifier at
 * position <code>i</code> of {@link NFH#alpha()} ranges the word on track
 * <code>i</code> over the elements of a {@link Hyperword}.
 */
public enum Quantifier {

    /**
     * Some word of the hyperword makes the remaining prefix true.
     */
    EXISTS('E'),

    /**
     * Every word of the hyperword makes the remaining prefix true.
     */
    FORALL('A');

    private final char code;

    Quantifier(char code) {
        this.code = code;
    }

    /**
     * @return the one letter code used in definition files.
     */
    public char code() {
        return code;
    }

    /**
     * @param token
     *            "E" or "A".
     * @return the quantifier, or <code>null</code> if the token is neither.
     */
    public static Quantifier fromCode(String token) {
        if (token == null || token.length() != 1) return null;
        for (Quantifier q : values()) {
            if (q.code == token.charAt(0)) return q;
        }
        return null;
    }
}
