/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import static org.xtrms.nfh.Misc.LS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A witness: a finite run of an {@link NFH} over one fixed assignment of
 * words to tracks. A Run records only the transitions taken; cursor
 * positions are recovered by {@link #replay() replaying} them from cursor 0
 * on every track, which is all an external viewer needs to animate it.
 */
public final class Run {

    private final NFH nfh;
    private final List<String> assignment;
    private final String initialState;
    private final List<Transition> transitions;

    Run(NFH nfh, List<String> assignment, String initialState,
            List<Transition> transitions) {
        this.nfh = nfh;
        this.assignment = Collections.unmodifiableList(new ArrayList<String>(assignment));
        this.initialState = initialState;
        this.transitions = Collections.unmodifiableList(new ArrayList<Transition>(transitions));
    }

    public NFH nfh() {
        return nfh;
    }

    /**
     * @return the words bound to tracks 1..k, in track order.
     */
    public List<String> assignment() {
        return assignment;
    }

    public String initialState() {
        return initialState;
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public int length() {
        return transitions.size();
    }

    public String finalState() {
        return transitions.isEmpty()
            ? initialState
            : transitions.get(transitions.size() - 1).target();
    }

    /**
     * Re-walks the run from the initial state with every cursor at 0,
     * applying the same consumption rule as the search: a non idle symbol
     * must equal the next letter of its track, and advances that track.
     *
     * @return the cursor of each track after the last transition.
     * @throws IllegalStateException
     *             if consecutive transitions are not chained, or a
     *             transition does not apply at its position.
     */
    public int[] replay() {
        int[] cursors = new int[assignment.size()];
        String state = initialState;
        int step = 0;
        for (Transition t : transitions) {
            ++step;
            if (!t.source().equals(state)) {
                throw new IllegalStateException(
                    "step " + step + ": " + t + " does not leave " + state);
            }
            for (int i = 0; i < cursors.length; ++i) {
                Symbol s = t.symbol(i);
                if (s.isIdle()) continue;
                String w = assignment.get(i);
                if (cursors[i] >= w.length() || !s.matches(w.charAt(cursors[i]))) {
                    throw new IllegalStateException(
                        "step " + step + ": " + t + " cannot read track " + (i + 1)
                        + " at position " + cursors[i]);
                }
                ++cursors[i];
            }
            state = t.target();
        }
        return cursors;
    }

    /**
     * True iff the replay ends in an accepting state with every track
     * consumed.
     */
    public boolean isAccepting() {
        int[] cursors;
        try {
            cursors = replay();
        } catch (IllegalStateException e) {
            return false;
        }
        for (int i = 0; i < cursors.length; ++i) {
            if (cursors[i] != assignment.get(i).length()) return false;
        }
        return nfh.isAccepting(finalState());
    }

    /**
     * @return a multi line, step by step trace of the run.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run (assignment: ").append(assignment)
          .append(", start: ").append(initialState).append("):").append(LS);
        int step = 0;
        for (Transition t : transitions) {
            sb.append("Step ").append(++step).append(": State ").append(t.source())
              .append(" --").append(t.vectorString()).append("--> State ")
              .append(t.target()).append(LS);
        }
        sb.append("Final State: ").append(finalState()).append(LS);
        sb.append("Result: ").append(isAccepting() ? "ACCEPTED" : "REJECTED");
        return sb.toString();
    }

    @Override
    public String toString() {
        return assignment + ": " + transitions;
    }
}
