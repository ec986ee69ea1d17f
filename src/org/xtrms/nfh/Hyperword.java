/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An immutable finite set of words, the universe over which the quantified
 * tracks of an {@link NFH} range. Duplicates are dropped; iteration follows
 * first insertion, but equality is plain set equality.
 */
public final class Hyperword implements Iterable<String> {

    private static final Hyperword EMPTY = new Hyperword(Collections.<String>emptySet());

    private final Set<String> words;

    private Hyperword(Collection<String> words) {
        if (Misc.containsNull(words)) {
            throw new IllegalArgumentException("null word");
        }
        this.words = Collections.unmodifiableSet(new LinkedHashSet<String>(words));
    }

    public static Hyperword of(String... words) {
        return from(Arrays.asList(words));
    }

    public static Hyperword from(Collection<String> words) {
        return words.isEmpty() ? EMPTY : new Hyperword(words);
    }

    public static Hyperword empty() {
        return EMPTY;
    }

    public Set<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public boolean contains(String word) {
        return words.contains(word);
    }

    public Iterator<String> iterator() {
        return words.iterator();
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
            || (obj instanceof Hyperword && words.equals(((Hyperword) obj).words));
    }

    @Override
    public String toString() {
        return "{ " + Misc.join(words) + " }";
    }
}
