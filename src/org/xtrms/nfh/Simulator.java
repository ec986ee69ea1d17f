/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides membership of a {@link Hyperword} in the hyperlanguage of an
 * {@link NFH}: the quantifier prefix {@link NFH#alpha()} is peeled one
 * quantifier at a time, binding its track to each word of the hyperword in
 * turn, and every complete assignment is handed to a {@link RunManager}.
 * <p>
 * Verdicts combine three valued: a timed out leaf is
 * {@link Verdict#INCONCLUSIVE}, and stays so under <code>EXISTS</code>
 * unless some other branch accepts, and under <code>FORALL</code> unless some
 * other branch rejects.
 */
public final class Simulator {

    private static final Logger logger = Logger.getLogger("org.xtrms.nfh");
    private static final Level level = Level.FINER;

    /**
     * The outcome of a membership check. Exactly one of three shapes:
     * {@link Accepted}, carrying the witnesses; {@link Rejected}; or
     * {@link Inconclusive}. Only an accepted result has witnesses.
     */
    public static abstract class Result {

        private Result() {
        }

        public abstract Verdict verdict();

        /**
         * @return the accepting runs justifying the verdict, in branch
         *         order; always empty unless {@link #isAccepted()}.
         */
        public List<Run> witnesses() {
            return Collections.emptyList();
        }

        public final boolean isAccepted() {
            return verdict() == Verdict.ACCEPTED;
        }

        @Override
        public String toString() {
            return verdict() + "" + witnesses();
        }
    }

    public static final class Accepted extends Result {

        private final List<Run> witnesses;

        Accepted(List<Run> witnesses) {
            this.witnesses = Collections.unmodifiableList(new ArrayList<Run>(witnesses));
        }

        @Override
        public Verdict verdict() {
            return Verdict.ACCEPTED;
        }

        @Override
        public List<Run> witnesses() {
            return witnesses;
        }
    }

    public static final class Rejected extends Result {

        private Rejected() {
        }

        @Override
        public Verdict verdict() {
            return Verdict.REJECTED;
        }
    }

    public static final class Inconclusive extends Result {

        private Inconclusive() {
        }

        @Override
        public Verdict verdict() {
            return Verdict.INCONCLUSIVE;
        }
    }

    static final Result REJECTED = new Rejected();
    static final Result INCONCLUSIVE = new Inconclusive();
    private static final Result VACUOUS = new Accepted(Collections.<Run>emptyList());

    private final NFH nfh;
    private final Hyperword hyperword;
    private final long timeout;
    private final int flags;
    private int leaves = 0;

    private Simulator(NFH nfh, Hyperword hyperword, long timeout, int flags) {
        this.nfh = nfh;
        this.hyperword = hyperword;
        this.timeout = timeout;
        this.flags = flags;
    }

    public static Result checkMembership(NFH nfh, Hyperword hyperword) {
        return checkMembership(nfh, hyperword, RunManager.defaultTimeout(), 0);
    }

    /**
     * @param timeout
     *            per assignment search deadline in milliseconds, see
     *            {@link RunManager}.
     * @param flags
     *            {@link RunManager} flags, applied to every search.
     */
    public static Result checkMembership(NFH nfh, Hyperword hyperword,
            long timeout, int flags) {

        Simulator sim = new Simulator(nfh, hyperword, timeout, flags);
        Result result;
        if (hyperword.size() == 1) {
            /*
             * every track must bind the one word, whatever the quantifiers
             */
            String w = hyperword.iterator().next();
            result = sim.leaf(Collections.nCopies(nfh.k(), w));
        } else {
            result = sim.check(0, new HashMap<Integer, String>());
        }
        logger.fine("hyperword " + hyperword + ": " + result.verdict()
            + " after " + sim.leaves + " assignment(s), "
            + result.witnesses().size() + " witness(es)");
        return result;
    }

    /*
     * One frame per remaining quantifier; depth is bounded by k. The
     * assignment is copied on extension, never mutated for a caller.
     */
    private Result check(int track, Map<Integer, String> assignment) {

        if (track == nfh.k()) {
            List<String> words = new ArrayList<String>(nfh.k());
            for (int i = 0; i < nfh.k(); ++i) words.add(assignment.get(i));
            return leaf(words);
        }

        Quantifier q = nfh.alpha().get(track);
        switch (q) {

        case EXISTS: {
            if (hyperword.isEmpty()) return REJECTED;
            Verdict v = Verdict.REJECTED;
            for (String w : hyperword) {
                Result r = check(track + 1, extend(assignment, track, w));
                if (r.isAccepted()) return r;
                v = v.or(r.verdict());
            }
            return v == Verdict.INCONCLUSIVE ? INCONCLUSIVE : REJECTED;
        }

        case FORALL: {
            if (hyperword.isEmpty()) return VACUOUS;
            Verdict v = Verdict.ACCEPTED;
            List<Run> witnesses = new ArrayList<Run>();
            for (String w : hyperword) {
                Result r = check(track + 1, extend(assignment, track, w));
                if (r.verdict() == Verdict.REJECTED) return REJECTED;
                v = v.and(r.verdict());
                witnesses.addAll(r.witnesses());
            }
            return v == Verdict.INCONCLUSIVE ? INCONCLUSIVE : new Accepted(witnesses);
        }

        default:
            throw new AssertionError(q);
        }
    }

    private static Map<Integer, String> extend(
            Map<Integer, String> assignment, int track, String w) {
        Map<Integer, String> ret = new HashMap<Integer, String>(assignment);
        ret.put(track, w);
        return ret;
    }

    private Result leaf(List<String> words) {
        ++leaves;
        RunManager rm = new RunManager(nfh, words, null, timeout, flags);
        switch (rm.run()) {
        case ACCEPTED:
            return new Accepted(Collections.singletonList(rm.toRun()));
        case INCONCLUSIVE:
            logger.log(level, "inconclusive: " + words);
            return INCONCLUSIVE;
        default:
            return REJECTED;
        }
    }
}
