/* @LICENSE@  
 */

package org.xtrms.nfh;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.xtrms.nfh.NFH.ConstructionException;

public class NFHTestCase extends AbstractNfhTestCase {

    public NFHTestCase(String name) {
        super(name);
    }

    private static NFH.Builder base() {
        return new NFH.Builder()
            .k(2)
            .alpha("A", "E")
            .states("q0", "q1", "q2")
            .initial("q0")
            .accepting("q1")
            .alphabet("ab")
            .transition("q0", "ab", "q1")
            .transition("q0", "a#", "q1")
            .transition("q1", "##", "q1");
    }

    private static void assertConstructionFails(NFH.Builder b, String fragment) {
        try {
            b.build();
            fail("expected ConstructionException containing '" + fragment + "'");
        } catch (ConstructionException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    public void testValid() {
        NFH nfh = base().build();
        assertEquals(2, nfh.k());
        assertEquals(Arrays.asList(Quantifier.FORALL, Quantifier.EXISTS), nfh.alpha());
        assertEquals(3, nfh.states().size());
        assertEquals(Collections.singleton("q0"), nfh.initialStates());
        assertEquals(Collections.singleton("q1"), nfh.acceptingStates());
        assertTrue(nfh.alphabet().contains(Symbol.of('a')));
        assertTrue(nfh.alphabet().contains(Symbol.of('b')));
        assertFalse(nfh.alphabet().contains(Symbol.IDLE));
        assertEquals(3, nfh.delta().size());
        assertTrue(nfh.isAccepting("q1"));
        assertFalse(nfh.isAccepting("q0"));
        assertFalse(nfh.isAccepting("nowhere"));
    }

    public void testTransitionIndexCoversEveryState() {
        NFH nfh = base().build();
        Map<String, List<Transition>> tm = nfh.transitionMap();
        assertEquals(nfh.states(), tm.keySet());
        assertEquals(2, tm.get("q0").size());
        assertEquals(1, tm.get("q1").size());
        assertTrue(tm.get("q2").isEmpty());
        int total = 0;
        for (Map.Entry<String, List<Transition>> e : tm.entrySet()) {
            for (Transition t : e.getValue()) assertEquals(e.getKey(), t.source());
            total += e.getValue().size();
        }
        assertEquals(nfh.delta().size(), total);
        assertEquals(tm.get("q0"), nfh.transitionsFrom("q0"));
        try {
            nfh.transitionsFrom("q9");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testArcTableBuiltOnce() {
        NFH nfh = base().build();
        for (int i = 0; i < nfh.size(); ++i) {
            NFH.Arc[] row = nfh.arcsFrom(i);
            assertSame(row, nfh.arcsFrom(i));
            List<Transition> out = nfh.transitionsFrom(nfh.stateAt(i));
            assertEquals(out.size(), row.length);
            for (int j = 0; j < row.length; ++j) {
                assertSame(out.get(j), row[j].transition);
                assertEquals(nfh.indexOf(out.get(j).target()), row[j].ns);
            }
        }
        assertEquals(2, nfh.arcsFrom(nfh.indexOf("q0")).length);
        assertEquals(0, nfh.arcsFrom(nfh.indexOf("q2")).length);
    }

    public void testImmutable() {
        NFH nfh = base().build();
        try {
            nfh.states().add("q3");
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            nfh.transitionsFrom("q2").add(Transition.of("q2", "ab", "q2"));
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            nfh.alpha().set(0, Quantifier.EXISTS);
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    public void testCollectionsAreCopied() {
        List<String> states = new ArrayList<String>(Arrays.asList("q0", "q1"));
        NFH nfh = new NFH(states, words("q0"), words("q1"), 1,
            Collections.singleton(Transition.of("q0", "a", "q1")),
            Collections.singletonList(Quantifier.EXISTS),
            Collections.singleton(Symbol.of('a')));
        states.add("q2");
        assertEquals(2, nfh.states().size());
    }

    public void testEmptyStates() {
        assertConstructionFails(new NFH.Builder().k(1).alpha("E").alphabet("a"),
            "at least one state");
    }

    public void testEmptyInitial() {
        NFH.Builder b = new NFH.Builder().k(1).alpha("E").states("q0")
            .accepting("q0").alphabet("a");
        assertConstructionFails(b, "initial state");
    }

    public void testEmptyAccepting() {
        NFH.Builder b = new NFH.Builder().k(1).alpha("E").states("q0")
            .initial("q0").alphabet("a");
        assertConstructionFails(b, "accepting state");
    }

    public void testInitialNotSubset() {
        assertConstructionFails(base().initial("q7"), "initial states must be states");
    }

    public void testAcceptingNotSubset() {
        assertConstructionFails(base().accepting("q7"), "accepting states must be states");
    }

    public void testNonPositiveK() {
        assertConstructionFails(new NFH.Builder().k(0).states("q0").initial("q0")
            .accepting("q0"), "k must be positive");
        assertConstructionFails(new NFH.Builder().k(-2).states("q0").initial("q0")
            .accepting("q0"), "k must be positive");
    }

    public void testIdleInAlphabet() {
        assertConstructionFails(base().alphabet("#"), "idle marker");
        assertConstructionFails(base().alphabet(Symbol.IDLE), "idle marker");
    }

    public void testTransitionEndpoints() {
        assertConstructionFails(base().transition("q9", "ab", "q1"), "source");
        assertConstructionFails(base().transition("q0", "ab", "q9"), "target");
    }

    public void testTransitionArity() {
        assertConstructionFails(base().transition("q0", "a", "q1"), "2 symbols");
        assertConstructionFails(base().transition("q0", "ab#", "q1"), "2 symbols");
    }

    public void testSymbolOutsideAlphabet() {
        assertConstructionFails(base().transition("q0", "ac", "q1"), "neither in the alphabet");
    }

    public void testAlphaLength() {
        assertConstructionFails(base().alpha("E"), "alpha must have k = 2");
        NFH.Builder b = new NFH.Builder().k(1).states("q0").initial("q0")
            .accepting("q0").alphabet("a");
        assertConstructionFails(b, "alpha must have k = 1");
    }

    public void testBadQuantifierCode() {
        try {
            new NFH.Builder().alpha("E", "X");
            fail();
        } catch (ConstructionException e) {
            assertTrue(e.getMessage().contains("X"));
        }
        assertNull(Quantifier.fromCode("e"));
        assertEquals(Quantifier.EXISTS, Quantifier.fromCode("E"));
        assertEquals(Quantifier.FORALL, Quantifier.fromCode("A"));
    }

    public void testNullComponent() {
        try {
            new NFH(null, words("q0"), words("q0"), 1,
                Collections.<Transition>emptySet(),
                Collections.singletonList(Quantifier.EXISTS),
                Collections.<Symbol>emptySet());
            fail();
        } catch (ConstructionException e) {
            // expected
        }
    }

    public void testEmptyAlphabetIsLegal() {
        NFH nfh = new NFH.Builder().k(1).alpha("A").states("q0").initial("q0")
            .accepting("q0").transition("q0", "#", "q0").build();
        assertTrue(nfh.alphabet().isEmpty());
    }

    public void testSymbols() {
        assertSame(Symbol.IDLE, Symbol.parse("#"));
        assertSame(Symbol.of('a'), Symbol.parse("a"));
        assertSame(Symbol.of('\u00e9'), Symbol.of('\u00e9'));
        assertTrue(Symbol.IDLE.isIdle());
        assertEquals('a', Symbol.of('a').letter());
        assertEquals("#", Symbol.IDLE.toString());
        try {
            Symbol.IDLE.letter();
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            Symbol.parse("ab");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testTransition() {
        Transition t = Transition.of("q0", "a#", "q1");
        assertEquals(2, t.arity());
        assertSame(Symbol.IDLE, t.symbol(1));
        assertEquals("(a, #)", t.vectorString());
        assertEquals("(q0, (a, #), q1)", t.toString());
        assertEquals(t, new Transition("q0", sym("a#"), "q1"));
        assertEquals(t.hashCode(), new Transition("q0", sym("a#"), "q1").hashCode());
        assertFalse(t.equals(Transition.of("q0", "#a", "q1")));
    }

    public void testHyperword() {
        Hyperword hw = Hyperword.of("a", "b", "a");
        assertEquals(2, hw.size());
        assertTrue(hw.contains("b"));
        assertFalse(hw.contains(null));
        assertEquals(Hyperword.of("b", "a"), hw);
        assertEquals("{ a, b }", hw.toString());
        assertTrue(Hyperword.empty().isEmpty());
        assertTrue(Hyperword.of("").contains(""));
        Set<String> words = hw.words();
        try {
            words.add("c");
            fail();
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            Hyperword.of("a", null);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
