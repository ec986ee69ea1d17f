/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import static org.xtrms.nfh.Misc.LS;
import static org.xtrms.nfh.Misc.containsNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NFH: a Nondeterministic Finite automaton over Hyperwords. An NFH reads
 * <code>k</code> synchronized tracks; each transition carries one
 * {@link Symbol} per track, and the {@link Symbol#IDLE idle} marker lets a
 * track stand still while others advance. The quantifier vector
 * {@link #alpha()} binds each track to a word of a {@link Hyperword}.
 * <p>
 * Instances are immutable and thread safe. Every structural invariant is
 * checked by the constructor, which throws {@link ConstructionException} on
 * the first violation; no partially valid NFH is ever observable. The
 * per-state transition index is built once, in time linear in the number of
 * transitions.
 */
public final class NFH {

    private static final Logger logger = Logger.getLogger("org.xtrms.nfh");
    private static final Level level = Level.FINER;

    /**
     * A runtime exception thrown when an NFH definition violates one of the
     * structural invariants.
     */
    public static final class ConstructionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ConstructionException(String msg) {
            super(msg);
        }
    }

    private final Set<String> states;
    private final Set<String> initialStates;
    private final Set<String> acceptingStates;
    private final int k;
    private final Set<Symbol> alphabet;
    private final Set<Transition> delta;
    private final List<Quantifier> alpha;
    private final Map<String, List<Transition>> transitionMap;

    /*
     * int numbering of the states, in iteration order of states, for the
     * table driven search in RunManager.
     */
    private final Map<String, Integer> s2i;
    private final String[] i2s;
    private final boolean[] accepting;
    private final Arc[][] arcs;

    /*
     * a transition as the search sees it: symbols unwrapped, target numbered
     */
    static final class Arc {

        final Symbol[] symbols;
        final int ns;
        final Transition transition;

        Arc(Transition transition, int ns) {
            this.symbols = transition.symbols().toArray(new Symbol[transition.arity()]);
            this.ns = ns;
            this.transition = transition;
        }
        @Override
        public String toString() {
            return transition.toString();
        }
    }

    /**
     * Constructs and validates an NFH.
     *
     * @throws ConstructionException
     *             if any invariant is violated.
     */
    public NFH(Collection<String> states, Collection<String> initialStates,
            Collection<String> acceptingStates, int k,
            Collection<Transition> delta, List<Quantifier> alpha,
            Collection<Symbol> alphabet) {

        check(states != null && initialStates != null && acceptingStates != null
                && delta != null && alpha != null && alphabet != null,
            "null component");
        this.states = frozenSet(states);
        this.initialStates = frozenSet(initialStates);
        this.acceptingStates = frozenSet(acceptingStates);
        this.k = k;
        this.alphabet = frozenSet(alphabet);
        this.delta = frozenSet(delta);
        this.alpha = Collections.unmodifiableList(new ArrayList<Quantifier>(alpha));

        check(!this.states.isEmpty(), "must have at least one state");
        check(!containsNull(this.states), "null state");
        check(!this.initialStates.isEmpty(), "must have at least one initial state");
        check(this.states.containsAll(this.initialStates),
            "initial states must be states: " + this.initialStates);
        check(!this.acceptingStates.isEmpty(), "must have at least one accepting state");
        check(this.states.containsAll(this.acceptingStates),
            "accepting states must be states: " + this.acceptingStates);
        check(k > 0, "k must be positive: " + k);
        check(!containsNull(this.alphabet), "null symbol in alphabet");
        check(!this.alphabet.contains(Symbol.IDLE),
            "alphabet must not contain the idle marker '" + Symbol.IDLE_TOKEN + "'");
        check(!containsNull(this.delta), "null transition");
        for (Transition t : this.delta) {
            check(this.states.contains(t.source()),
                "transition source is not a state: " + t);
            check(this.states.contains(t.target()),
                "transition target is not a state: " + t);
            check(t.arity() == k,
                "transition must have " + k + " symbols: " + t);
            for (Symbol s : t.symbols()) {
                check(s != null && (s.isIdle() || this.alphabet.contains(s)),
                    "symbol " + s + " is neither in the alphabet nor idle: " + t);
            }
        }
        check(!containsNull(this.alpha), "invalid quantifier in alpha: " + this.alpha);
        check(this.alpha.size() == k,
            "alpha must have k = " + k + " quantifiers: " + this.alpha);

        /*
         * one entry per state, possibly empty
         */
        Map<String, List<Transition>> tm = new LinkedHashMap<String, List<Transition>>();
        s2i = new HashMap<String, Integer>();
        i2s = new String[this.states.size()];
        accepting = new boolean[i2s.length];
        int i = 0;
        for (String s : this.states) {
            tm.put(s, new ArrayList<Transition>());
            s2i.put(s, i);
            accepting[i] = this.acceptingStates.contains(s);
            i2s[i++] = s;
        }
        for (Transition t : this.delta) tm.get(t.source()).add(t);
        for (Map.Entry<String, List<Transition>> e : tm.entrySet()) {
            e.setValue(Collections.unmodifiableList(e.getValue()));
        }
        this.transitionMap = Collections.unmodifiableMap(tm);

        arcs = new Arc[i2s.length][];
        for (int s = 0; s < arcs.length; ++s) {
            List<Transition> out = tm.get(i2s[s]);
            Arc[] row = arcs[s] = new Arc[out.size()];
            int j = 0;
            for (Transition t : out) row[j++] = new Arc(t, s2i.get(t.target()));
        }

        logger.log(level, "nfh: " + this);
    }

    private static void check(boolean condition, String msg) {
        if (!condition) throw new ConstructionException(msg);
    }

    private static <T> Set<T> frozenSet(Collection<T> c) {
        return Collections.unmodifiableSet(new LinkedHashSet<T>(c));
    }

    /**
     * Parses the textual definition format, see {@link NFHReader}.
     *
     * @throws NFHSyntaxException
     *             if the text is malformed.
     * @throws ConstructionException
     *             if the parsed definition violates an invariant.
     */
    public static NFH parse(String text) {
        return new NFHReader().parse(text);
    }

    public Set<String> states() {
        return states;
    }

    public Set<String> initialStates() {
        return initialStates;
    }

    public Set<String> acceptingStates() {
        return acceptingStates;
    }

    public int k() {
        return k;
    }

    public Set<Symbol> alphabet() {
        return alphabet;
    }

    public Set<Transition> delta() {
        return delta;
    }

    public List<Quantifier> alpha() {
        return alpha;
    }

    /**
     * The transition index: exactly one entry per state, mapping it to its
     * outgoing transitions (possibly none).
     */
    public Map<String, List<Transition>> transitionMap() {
        return transitionMap;
    }

    /**
     * @return the outgoing transitions of <code>state</code>.
     * @throws IllegalArgumentException
     *             if <code>state</code> is not a state of this NFH.
     */
    public List<Transition> transitionsFrom(String state) {
        List<Transition> ret = transitionMap.get(state);
        if (ret == null) throw new IllegalArgumentException("not a state: " + state);
        return ret;
    }

    public boolean isAccepting(String state) {
        return acceptingStates.contains(state);
    }

    int size() {
        return i2s.length;
    }

    int indexOf(String state) {
        Integer i = s2i.get(state);
        return i == null ? -1 : i;
    }

    String stateAt(int i) {
        return i2s[i];
    }

    boolean isAccepting(int i) {
        return accepting[i];
    }

    /**
     * The outgoing arcs of state <code>i</code>, built once with the NFH and
     * shared by every search over it. Callers must not modify the array.
     */
    Arc[] arcsFrom(int i) {
        return arcs[i];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("k=").append(k).append(LS)
          .append("alpha=").append(alpha).append(LS)
          .append("states=").append(states).append(LS)
          .append("initial=").append(initialStates).append(LS)
          .append("accepting=").append(acceptingStates).append(LS)
          .append("alphabet=").append(alphabet).append(LS)
          .append("delta=").append(delta);
        return sb.toString();
    }

    /**
     * Incremental, chainable construction of an {@link NFH}. Tokens use the
     * textual definition conventions: quantifiers "E"/"A", symbols are
     * single characters or "#" for idle.
     */
    public static final class Builder {

        private final Set<String> states = new LinkedHashSet<String>();
        private final Set<String> initial = new LinkedHashSet<String>();
        private final Set<String> accepting = new LinkedHashSet<String>();
        private final Set<Symbol> alphabet = new LinkedHashSet<Symbol>();
        private final Set<Transition> delta = new LinkedHashSet<Transition>();
        private final List<Quantifier> alpha = new ArrayList<Quantifier>();
        private int k = 0;

        public Builder k(int k) {
            this.k = k;
            return this;
        }

        public Builder states(String... states) {
            this.states.addAll(Arrays.asList(states));
            return this;
        }

        public Builder initial(String... states) {
            initial.addAll(Arrays.asList(states));
            return this;
        }

        public Builder accepting(String... states) {
            accepting.addAll(Arrays.asList(states));
            return this;
        }

        /**
         * @param letters
         *            each char of each argument is added as a symbol; '#'
         *            maps to the idle marker and fails the build.
         */
        public Builder alphabet(String... letters) {
            for (String s : letters) {
                for (int i = 0; i < s.length(); ++i) {
                    alphabet.add(Symbol.parse(String.valueOf(s.charAt(i))));
                }
            }
            return this;
        }

        public Builder alphabet(Symbol... symbols) {
            alphabet.addAll(Arrays.asList(symbols));
            return this;
        }

        public Builder alpha(Quantifier... quantifiers) {
            alpha.addAll(Arrays.asList(quantifiers));
            return this;
        }

        /**
         * @param codes
         *            "E" or "A" each.
         * @throws ConstructionException
         *             on any other code.
         */
        public Builder alpha(String... codes) {
            for (String code : codes) {
                Quantifier q = Quantifier.fromCode(code);
                if (q == null) {
                    throw new ConstructionException(
                        "quantifier must be 'E' or 'A': " + code);
                }
                alpha.add(q);
            }
            return this;
        }

        /**
         * @see Transition#of(String, String, String)
         */
        public Builder transition(String source, String symbols, String target) {
            delta.add(Transition.of(source, symbols, target));
            return this;
        }

        public Builder transition(Transition t) {
            delta.add(t);
            return this;
        }

        public NFH build() {
            return new NFH(states, initial, accepting, k, delta, alpha, alphabet);
        }
    }
}
