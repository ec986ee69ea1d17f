/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import static org.xtrms.nfh.Misc.LS;
import static org.xtrms.nfh.Misc.isSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.nfh.Misc.FlagMgr;
import org.xtrms.nfh.NFH.Arc;

/**
 * Decides, for one fixed assignment of words to the k tracks of an
 * {@link NFH}, whether the automaton has a finite run that ends in an
 * accepting state with every track read to its end.
 * <p>
 * The search is a depth first traversal over <code>(state, cursors)</code>
 * keys, driven by an explicit stack so that its depth is not bounded by the
 * Java call stack. Every resolved key is memoized, which bounds the work by
 * <code>|states| * prod(|w_i| + 1)</code> and makes cycles of idle
 * transitions harmless. A wall clock deadline, fixed when {@link #run()}
 * starts, is checked on every step; running past it yields
 * {@link Verdict#INCONCLUSIVE}, never {@link Verdict#REJECTED}.
 * <p>
 * Memo and path tables belong to a single invocation of {@link #run()}, so
 * distinct RunManagers may search concurrently. A single instance is
 * <em>not</em> thread safe.
 */
public final class RunManager {

    private static final Logger logger = Logger.getLogger("org.xtrms.nfh");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Disables the deadline check; for inputs known to terminate quickly.
     */
    public static final int NO_TIMEOUT = flagMgr.next("NO_TIMEOUT");

    /**
     * Disables memoization of resolved keys. Only the keys on the current
     * path are tracked, which keeps idle cycles from looping but may expand
     * a key many times. The verdict is the same either way.
     */
    public static final int NO_MEMO = flagMgr.next("NO_MEMO");

    /**
     * Synchronous reading: the idle marker only pads a track whose word has
     * been read to its end, so all tracks advance in lock step until they
     * run out. Without this flag a track may idle at any position.
     */
    public static final int SYNCHRONOUS = flagMgr.next("SYNCHRONOUS");

    static final int FLAG_COUNT = flagMgr.freezeAndCount();

    /**
     * Timeout used when none is given, in milliseconds. Overridden by the
     * system property {@value #TIMEOUT_PROPERTY}.
     */
    public static final long DEFAULT_TIMEOUT = 60000L;

    public static final String TIMEOUT_PROPERTY = "org.xtrms.nfh.timeout";

    static long defaultTimeout() {
        return Long.getLong(TIMEOUT_PROPERTY, DEFAULT_TIMEOUT);
    }

    /*
     * (state, cursors); immutable once built
     */
    private static final class Key {

        final int s;
        final int[] p;
        private final int hash;

        Key(int s, int[] p) {
            this.s = s;
            this.p = p;
            this.hash = 31 * s + Arrays.hashCode(p);
        }
        @Override
        public int hashCode() {
            return hash;
        }
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return s == other.s && Arrays.equals(p, other.p);
        }
        @Override
        public String toString() {
            return "{s=" + s + ",p=" + Arrays.toString(p) + '}';
        }
    }

    private final class Frame {

        final Key key;
        final Arc[] arcs;
        int next = 0;
        Arc taken = null;

        Frame(Key key) {
            this.key = key;
            this.arcs = nfh.arcsFrom(key.s);
        }
        /*
         * the next arc that applies at key, or null when exhausted
         */
        Arc nextValid() {
            while (next < arcs.length) {
                Arc arc = arcs[next++];
                if (applies(arc, key.p)) return arc;
            }
            return null;
        }
        @Override
        public String toString() {
            return key + "@" + next + "/" + arcs.length;
        }
    }

    private final NFH nfh;
    private final List<String> assignment;
    private final char[][] words;
    private final String initialState;
    private final long timeout;
    private final int flags;
    private final boolean synchronous;

    private Verdict verdict = null;
    private Run run = null;
    private int expanded = 0;

    public RunManager(NFH nfh, List<String> assignment) {
        this(nfh, assignment, null);
    }

    /**
     * @param initialState
     *            the state to start from, or <code>null</code> to try every
     *            initial state of the NFH.
     */
    public RunManager(NFH nfh, List<String> assignment, String initialState) {
        this(nfh, assignment, initialState, defaultTimeout(), 0);
    }

    /**
     * @param nfh
     *            the automaton.
     * @param assignment
     *            one word per track; must have exactly <code>k</code>
     *            entries.
     * @param initialState
     *            the state to start from, or <code>null</code> to try every
     *            initial state of the NFH.
     * @param timeout
     *            the search deadline, in milliseconds from the start of
     *            {@link #run()}. A negative value makes every search
     *            inconclusive.
     * @param flags
     *            a combination of {@link #NO_TIMEOUT}, {@link #NO_MEMO} and
     *            {@link #SYNCHRONOUS}.
     * @throws IllegalArgumentException
     *             on a wrong size assignment, an unknown initial state or
     *             unknown flags.
     */
    public RunManager(NFH nfh, List<String> assignment, String initialState,
            long timeout, int flags) {

        flagMgr.check(flags);
        if (assignment.size() != nfh.k()) {
            throw new IllegalArgumentException(
                "assignment must have k = " + nfh.k() + " words: " + assignment);
        }
        if (initialState != null && nfh.indexOf(initialState) < 0) {
            throw new IllegalArgumentException("not a state: " + initialState);
        }
        this.nfh = nfh;
        this.assignment = Collections.unmodifiableList(new ArrayList<String>(assignment));
        this.words = new char[assignment.size()][];
        for (int i = 0; i < words.length; ++i) {
            String w = assignment.get(i);
            if (w == null) throw new IllegalArgumentException("null word on track " + (i + 1));
            words[i] = w.toCharArray();
        }
        this.initialState = initialState;
        this.timeout = timeout;
        this.flags = flags;
        this.synchronous = isSet(flags, SYNCHRONOUS);
    }

    /*
     * a transition applies iff each non idle symbol equals the letter under
     * its track's cursor; a track at end of word admits only idle.
     */
    private boolean applies(Arc arc, int[] p) {
        final Symbol[] symbols = arc.symbols;
        for (int i = 0; i < symbols.length; ++i) {
            Symbol sym = symbols[i];
            if (sym.isIdle()) {
                if (synchronous && p[i] < words[i].length) return false;
                continue;
            }
            if (p[i] >= words[i].length || !sym.matches(words[i][p[i]])) return false;
        }
        return true;
    }

    private static Key follow(Key key, Arc arc) {
        int[] p = key.p.clone();
        for (int i = 0; i < p.length; ++i) {
            if (!arc.symbols[i].isIdle()) ++p[i];
        }
        return new Key(arc.ns, p);
    }

    private boolean accepts(Key key) {
        if (!nfh.isAccepting(key.s)) return false;
        for (int i = 0; i < words.length; ++i) {
            if (key.p[i] != words[i].length) return false;
        }
        return true;
    }

    /**
     * Runs the search. Each invocation starts from scratch: fresh tables, a
     * fresh deadline.
     *
     * @return {@link Verdict#ACCEPTED} if an accepting run exists,
     *         {@link Verdict#REJECTED} if the search space was exhausted
     *         without one, {@link Verdict#INCONCLUSIVE} if the deadline
     *         passed first.
     */
    public Verdict run() {

        final Search search = new Search();
        run = null;
        expanded = 0;
        verdict = Verdict.REJECTED;

        List<String> starts = initialState != null
            ? Collections.singletonList(initialState)
            : new ArrayList<String>(nfh.initialStates());

        for (String start : starts) {
            Key root = new Key(nfh.indexOf(start), new int[words.length]);
            Verdict v = search.from(root);
            if (v == Verdict.ACCEPTED) {
                run = new Run(nfh, assignment, start, search.reconstruct(root));
                verdict = v;
                break;
            } else if (v == Verdict.INCONCLUSIVE) {
                verdict = v;
                break;
            }
        }
        expanded = search.expanded;
        logger.fine("assignment " + assignment + ": " + verdict
            + " (" + expanded + " keys expanded)");
        return verdict;
    }

    /*
     * State of one top level search; never outlives run().
     */
    private final class Search {

        final boolean memoize = !isSet(flags, NO_MEMO);
        final boolean timed = !isSet(flags, NO_TIMEOUT);
        final boolean overdue = timeout < 0;
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout);

        final Map<Key, Boolean> memo = new HashMap<Key, Boolean>();
        final Map<Key, Arc> path = new HashMap<Key, Arc>();
        final Set<Key> onPath = new HashSet<Key>();
        /* Deque<Frame> */ final LinkedList<Frame> stack = new LinkedList<Frame>();
        int expanded = 0;

        private boolean expired() {
            return timed && (overdue || System.nanoTime() - deadline > 0);
        }

        Verdict from(Key root) {

            if (expired()) return Verdict.INCONCLUSIVE;
            Boolean known = memo.get(root);
            if (known != null) return known ? Verdict.ACCEPTED : Verdict.REJECTED;
            if (accepts(root)) {
                memo.put(root, Boolean.TRUE);
                return Verdict.ACCEPTED;
            }
            push(root);

            while (!stack.isEmpty()) {

                if (expired()) {
                    logger.log(level, "deadline passed, " + stack.size() + " frames open");
                    stack.clear();
                    onPath.clear();
                    return Verdict.INCONCLUSIVE;
                }

                Frame f = stack.getFirst();
                Arc arc = f.nextValid();
                if (arc == null) {
                    // dead end: every alternative failed
                    stack.removeFirst();
                    onPath.remove(f.key);
                    if (memoize) memo.put(f.key, Boolean.FALSE);
                    continue;
                }

                Key child = follow(f.key, arc);
                if (onPath.contains(child)) continue;    // idle cycle
                if (memoize && memo.containsKey(child)) {
                    assert !memo.get(child) : child;     // true ends the search
                    continue;
                }
                f.taken = arc;
                if (accepts(child)) {
                    memo.put(child, Boolean.TRUE);
                    for (Frame g : stack) {
                        path.put(g.key, g.taken);
                        memo.put(g.key, Boolean.TRUE);
                    }
                    stack.clear();
                    onPath.clear();
                    return Verdict.ACCEPTED;
                }
                push(child);
            }
            return Verdict.REJECTED;
        }

        private void push(Key key) {
            ++expanded;
            stack.addFirst(new Frame(key));
            onPath.add(key);
            if (logger.isLoggable(level)) logger.log(level, "expand " + key);
        }

        /*
         * forward pass over the winning arcs; kept out of the search loop so
         * the search never copies history.
         */
        List<Transition> reconstruct(Key root) {
            List<Transition> ret = new ArrayList<Transition>();
            Key key = root;
            Arc arc;
            while ((arc = path.get(key)) != null) {
                ret.add(arc.transition);
                key = follow(key, arc);
                assert ret.size() <= path.size() : "path table loops";
            }
            assert accepts(key) : key;
            return ret;
        }
    }

    /**
     * @return the verdict of the last {@link #run()}, or <code>null</code>
     *         if it has not run yet.
     */
    public Verdict verdict() {
        return verdict;
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    /**
     * @return the accepting run found by the last {@link #run()}.
     * @throws IllegalStateException
     *             if the last verdict was not {@link Verdict#ACCEPTED}.
     */
    public Run toRun() {
        if (run == null) {
            throw new IllegalStateException("no accepting run: " + verdict);
        }
        return run;
    }

    /**
     * @return the transitions of the accepting run, empty if there is none.
     */
    public List<Transition> history() {
        return run == null ? Collections.<Transition>emptyList() : run.transitions();
    }

    public NFH nfh() {
        return nfh;
    }

    public List<String> assignment() {
        return assignment;
    }

    /**
     * @return the explicit start state, or <code>null</code> if every
     *         initial state is tried.
     */
    public String initialState() {
        return initialState;
    }

    public long timeout() {
        return timeout;
    }

    public boolean isTimeoutEnabled() {
        return !isSet(flags, NO_TIMEOUT);
    }

    public int flags() {
        return flags;
    }

    /**
     * @return the number of keys expanded by the last {@link #run()}.
     */
    public int expanded() {
        return expanded;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("assignment=").append(assignment).append(LS)
          .append("start=").append(initialState == null ? nfh.initialStates() : initialState)
          .append(LS)
          .append("timeout=").append(timeout).append("ms")
          .append(", flags=").append(flagMgr.stringFrom(flags)).append(LS)
          .append("verdict=").append(verdict);
        return sb.toString();
    }
}
