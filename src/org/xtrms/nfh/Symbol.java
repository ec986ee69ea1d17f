/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import java.util.HashMap;
import java.util.Map;

/**
 * One component of a transition's symbol vector: either a letter of the
 * automaton's alphabet, or the reserved {@link #IDLE} marker meaning "do not
 * consume from this track on this step".
 * <p>
 * Instances are interned, so <code>==</code> and {@link #equals(Object)}
 * agree. Because <code>IDLE</code> is not a letter, no user alphabet can
 * collide with it.
 */
public final class Symbol {

    /**
     * The textual form of the idle marker in definition files.
     */
    public static final String IDLE_TOKEN = "#";

    /**
     * The idle (skip) marker.
     */
    public static final Symbol IDLE = new Symbol('\0', true);

    private static final Symbol[] ascii = new Symbol[128];
    private static final Map<Character, Symbol> wide =
            new HashMap<Character, Symbol>();
    static {
        for (char c = 0; c < ascii.length; ++c) ascii[c] = new Symbol(c, false);
    }

    private final char c;
    private final boolean idle;

    private Symbol(char c, boolean idle) {
        this.c = c;
        this.idle = idle;
    }

    /**
     * @param c
     *            the letter.
     * @return the (interned) letter symbol for <code>c</code>.
     */
    public static Symbol of(char c) {
        if (c < ascii.length) return ascii[c];
        synchronized (wide) {
            Symbol s = wide.get(c);
            if (s == null) wide.put(c, s = new Symbol(c, false));
            return s;
        }
    }

    /**
     * Maps a definition-file token to a Symbol: {@value #IDLE_TOKEN} is the
     * idle marker, any other single character is a letter.
     *
     * @throws IllegalArgumentException
     *             if the token is neither.
     */
    public static Symbol parse(String token) {
        if (IDLE_TOKEN.equals(token)) return IDLE;
        if (token == null || token.length() != 1) {
            throw new IllegalArgumentException(
                "symbol must be a single character or '" + IDLE_TOKEN
                + "': " + token);
        }
        return of(token.charAt(0));
    }

    public boolean isIdle() {
        return idle;
    }

    /**
     * @return the letter.
     * @throws IllegalStateException
     *             if this is the idle marker.
     */
    public char letter() {
        if (idle) throw new IllegalStateException("idle has no letter");
        return c;
    }

    /**
     * True iff this is a letter equal to <code>c</code>.
     */
    boolean matches(char c) {
        return !idle && this.c == c;
    }

    @Override
    public String toString() {
        return idle ? IDLE_TOKEN : String.valueOf(c);
    }
}
