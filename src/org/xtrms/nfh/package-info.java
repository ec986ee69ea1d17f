/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-nfh</b> - membership checking for finite hyperwords against
 * nondeterministic finite automata over hyperwords (NFH).</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * Hyperproperties such as noninterference or declassification are properties
 * of <em>sets</em> of execution traces, not of single traces. An NFH reads
 * <code>k</code> traces at once, one per track, and a quantifier prefix
 * (one {@link org.xtrms.nfh.Quantifier} per track) says how the tracks range
 * over a set of traces: "for all traces x there exists a trace y such that
 * the automaton accepts (x, y)", and so on. This package decides such
 * statements for a finite set of finite words, a {@link org.xtrms.nfh.Hyperword}.
 * <p>
 * <h4>Architecture.</h4>
 * <ul>
 * <li>{@link org.xtrms.nfh.NFH} is the immutable, fully validated automaton,
 * with a per-state transition index. Definitions are loaded by
 * {@link org.xtrms.nfh.NFHReader} from a small text format or from JSON.</li>
 * <li>{@link org.xtrms.nfh.RunManager} is the engine: for one fixed
 * assignment of words to tracks it searches for an accepting run. Tracks move
 * at independent rates - the {@linkplain org.xtrms.nfh.Symbol#IDLE idle}
 * marker leaves a track where it is - so the search explores
 * <code>(state, cursors)</code> keys depth first, memoized, with an explicit
 * stack and a wall clock deadline.</li>
 * <li>{@link org.xtrms.nfh.Simulator} walks the quantifier prefix,
 * short-circuiting on the first witness of an existential and on the first
 * counterexample of a universal, and collects the accepting
 * {@linkplain org.xtrms.nfh.Run runs} that justify a positive answer.</li>
 * </ul>
 * <p>
 * <h4>Bounded, not complete.</h4>
 * <p>
 * The search is bounded by a deadline. A search that runs out of time
 * reports {@link org.xtrms.nfh.Verdict#INCONCLUSIVE}, which propagates
 * through the quantifiers instead of posing as a counterexample.
 * <p>
 * <h4>Example:</h4>
 *
 * <pre>
 * NFH nfh = NFH.parse(
 *       "k: 2\n"
 *     + "alpha: A E\n"
 *     + "states: q0 q1\n"
 *     + "initial: q0\n"
 *     + "accepting: q1\n"
 *     + "alphabet: a b\n"
 *     + "delta:\n"
 *     + "q0 a a q1\n"
 *     + "q0 b a q1\n");
 * Simulator.Result r = Simulator.checkMembership(nfh, Hyperword.of("a", "b"));
 * for (Run run : r.witnesses()) System.out.println(run.render());
 * </pre>
 */
package org.xtrms.nfh;
