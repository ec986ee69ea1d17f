/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable transition <code>(source, symbols, target)</code> of an
 * {@link NFH}. The symbol vector has one entry per track.
 */
public final class Transition {

    private final String source;
    private final Symbol[] symbols;
    private final String target;

    public Transition(String source, List<Symbol> symbols, String target) {
        this(source, symbols.toArray(new Symbol[symbols.size()]), target);
    }

    public Transition(String source, Symbol[] symbols, String target) {
        this.source = source;
        this.symbols = symbols.clone();
        this.target = target;
    }

    /**
     * Convenience factory: <code>of("q0", "a#b", "q1")</code>, one char per
     * track, '#' for idle.
     */
    public static Transition of(String source, String symbols, String target) {
        Symbol[] s = new Symbol[symbols.length()];
        for (int i = 0; i < s.length; ++i) {
            s[i] = Symbol.parse(String.valueOf(symbols.charAt(i)));
        }
        return new Transition(source, s, target);
    }

    public String source() {
        return source;
    }

    public String target() {
        return target;
    }

    public List<Symbol> symbols() {
        return Collections.unmodifiableList(Arrays.asList(symbols));
    }

    public int arity() {
        return symbols.length;
    }

    public Symbol symbol(int track) {
        return symbols[track];
    }

    /**
     * @return "(a, #)" - the symbol vector alone.
     */
    public String vectorString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(Misc.join(Arrays.asList(symbols))).append(')');
        return sb.toString();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((source == null) ? 0 : source.hashCode());
        result = prime * result + Arrays.hashCode(symbols);
        result = prime * result + ((target == null) ? 0 : target.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Transition))
            return false;
        final Transition other = (Transition) obj;
        if (source == null) {
            if (other.source != null)
                return false;
        } else if (!source.equals(other.source))
            return false;
        if (target == null) {
            if (other.target != null)
                return false;
        } else if (!target.equals(other.target))
            return false;
        return Arrays.equals(symbols, other.symbols);
    }

    @Override
    public String toString() {
        return "(" + source + ", " + vectorString() + ", " + target + ")";
    }
}
