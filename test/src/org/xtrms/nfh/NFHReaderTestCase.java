/* @LICENSE@  
 */

package org.xtrms.nfh;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.util.Arrays;

import org.xtrms.nfh.NFH.ConstructionException;

public class NFHReaderTestCase extends AbstractNfhTestCase {

    private static final String ALTERNATION =
          "k: 2\n"
        + "alpha: A E\n"
        + "states: q0 q1\n"
        + "initial: q0\n"
        + "accepting: q1\n"
        + "alphabet: a b\n"
        + "delta:\n"
        + "q0 a a q1\n"
        + "q0 a b q1\n"
        + "q0 b a q1\n";

    private NFHReader reader;

    public NFHReaderTestCase(String name) {
        super(name);
    }

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        reader = new NFHReader();
    }

    private void assertSyntaxError(String text, int line) {
        try {
            reader.parse(text);
            fail("expected a syntax error in:\n" + text);
        } catch (NFHSyntaxException e) {
            logger.log(level, e.getMessage());
            assertEquals(e.getMessage(), line, e.getLine());
        }
    }

    public void testParse() {
        NFH nfh = NFH.parse(ALTERNATION);
        assertEquals(2, nfh.k());
        assertEquals(Arrays.asList(Quantifier.FORALL, Quantifier.EXISTS), nfh.alpha());
        assertEquals(3, nfh.delta().size());
        assertTrue(nfh.delta().contains(Transition.of("q0", "ba", "q1")));
        assertTrue(nfh.transitionsFrom("q1").isEmpty());
    }

    public void testCommentsCommasAndAliases() {
        NFH nfh = reader.parse(
              "# a comment\n"
            + "\n"
            + "K: 1\n"
            + "quantifiers: E\n"
            + "states: q0, q1\n"
            + "initial_states: q0\n"
            + "Accepting States: q1\n"
            + "alphabet: a,b\n"
            + "delta: q0 a q1\n"
            + "   # between transitions\n"
            + "q1 # q1\n");
        assertEquals(1, nfh.k());
        assertEquals(2, nfh.alphabet().size());
        assertEquals(2, nfh.delta().size());
        assertTrue(nfh.delta().contains(Transition.of("q0", "a", "q1")));
        assertTrue(nfh.delta().contains(Transition.of("q1", "#", "q1")));
    }

    public void testIdleTransition() {
        NFH nfh = reader.parse(ALTERNATION + "q1 # # q1\n");
        assertTrue(nfh.delta().contains(Transition.of("q1", "##", "q1")));
    }

    public void testUnknownKeyIgnored() {
        NFH nfh = reader.parse("name: alternation\n" + ALTERNATION);
        assertEquals(2, nfh.k());
    }

    public void testWrongFieldCount() {
        assertSyntaxError(ALTERNATION + "q0 a q1\n", 11);
        assertSyntaxError(ALTERNATION + "q0 a a b q1\n", 11);
    }

    public void testBadSymbol() {
        assertSyntaxError(ALTERNATION + "\nq0 ab a q1\n", 12);
    }

    public void testMissingField() {
        assertSyntaxError(ALTERNATION.replace("alphabet: a b\n", ""), -1);
        try {
            reader.parse(ALTERNATION.replace("initial: q0\n", ""));
            fail();
        } catch (NFHSyntaxException e) {
            assertTrue(e.getMessage().contains("initial"));
        }
    }

    public void testBadK() {
        assertSyntaxError(ALTERNATION.replace("k: 2", "k: two"), 1);
    }

    public void testDuplicateKey() {
        assertSyntaxError(ALTERNATION.replace("states: q0 q1\n",
            "states: q0 q1\nstates: q2\n"), 4);
    }

    public void testHeaderWithoutColon() {
        assertSyntaxError("k: 1\nalpha E\n", 2);
    }

    public void testStateNameStartingWithHash() {
        // its transitions would read as comments
        assertSyntaxError(ALTERNATION.replace("states: q0 q1", "states: #s q0 q1"), 3);
        assertSyntaxError(ALTERNATION.replace("accepting: q1", "accepting: #q1"), 5);
        try {
            reader.parse("k: 1\nalpha: E\nstates: #s f\ninitial: #s\naccepting: f\n"
                + "alphabet: a\ndelta:\n#s a f\n");
            fail();
        } catch (NFHSyntaxException e) {
            assertEquals(3, e.getLine());
            assertTrue(e.getMessage().contains("#s"));
        }
    }

    public void testMultiCharAlphabet() {
        assertSyntaxError(ALTERNATION.replace("alphabet: a b", "alphabet: ab"), 6);
    }

    public void testSemanticErrors() {
        try {
            reader.parse(ALTERNATION.replace("alpha: A E", "alpha: A E E"));
            fail();
        } catch (ConstructionException e) {
            // expected
        }
        try {
            reader.parse(ALTERNATION.replace("alpha: A E", "alpha: A X"));
            fail();
        } catch (ConstructionException e) {
            // expected
        }
        try {
            reader.parse(ALTERNATION.replace("alphabet: a b", "alphabet: a b #"));
            fail();
        } catch (ConstructionException e) {
            // expected
        }
        try {
            reader.parse(ALTERNATION.replace("k: 2", "k: 0"));
            fail();
        } catch (ConstructionException e) {
            // expected
        }
        try {
            reader.parse(ALTERNATION + "q0 c a q1\n");
            fail();
        } catch (ConstructionException e) {
            // expected
        }
    }

    public void testSyntaxExceptionMessage() {
        NFHSyntaxException e = new NFHSyntaxException("bad", "q0 a", 3);
        assertEquals("bad", e.getDescription());
        assertEquals("q0 a", e.getInput());
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().startsWith("bad near line 3"));
        assertTrue(e.getMessage().endsWith("q0 a"));
        assertTrue(e instanceof IllegalArgumentException);
    }

    public void testResourceFile() throws Exception {
        NFH nfh = reader.parse(resource("concat.nfh"));
        assertEquals(3, nfh.k());
        assertEquals(5, nfh.delta().size());
        assertEquals(words("q0", "q1"), Arrays.asList(nfh.states().toArray()));
    }

    public void testJson() throws Exception {
        NFH json = reader.readJson(resource("alternation.json"));
        NFH text = NFH.parse(ALTERNATION);
        assertEquals(text.k(), json.k());
        assertEquals(text.alpha(), json.alpha());
        assertEquals(text.states(), json.states());
        assertEquals(text.initialStates(), json.initialStates());
        assertEquals(text.acceptingStates(), json.acceptingStates());
        assertEquals(text.alphabet(), json.alphabet());
        assertEquals(text.delta(), json.delta());
    }

    public void testJsonErrors() {
        try {
            reader.readJson("{ \"k\": 2, ");
            fail();
        } catch (NFHSyntaxException e) {
            assertNotNull(e.getCause());
        }
        try {
            reader.readJson("[1, 2]");
            fail();
        } catch (NFHSyntaxException e) {
            // expected
        }
        try {
            reader.readJson("{ \"k\": \"2\", \"alpha\": [\"E\"] }");
            fail();
        } catch (NFHSyntaxException e) {
            assertTrue(e.getMessage().contains("k"));
        }
        try {
            reader.readJson("{ \"k\": 1, \"alpha\": [\"E\"], \"states\": [\"q0\"],"
                + " \"initial\": [\"q0\"], \"accepting\": [\"q0\"],"
                + " \"alphabet\": [\"a\"], \"delta\": [[\"q0\", \"a\", \"q0\"]] }");
            fail();
        } catch (NFHSyntaxException e) {
            // expected
        }
    }

    public void testHyperwordJson() throws Exception {
        assertEquals(Hyperword.of("a", "b"), reader.readHyperwordJson(resource("hyperword.json")));
        assertEquals(Hyperword.of("ab", ""), reader.readHyperwordJson("[\"ab\", \"\"]"));
        assertTrue(reader.readHyperwordJson("[]").isEmpty());
        try {
            reader.readHyperwordJson("[\"a\", 1]");
            fail();
        } catch (NFHSyntaxException e) {
            // expected
        }
        try {
            reader.readHyperwordJson("{ \"w\": [] }");
            fail();
        } catch (NFHSyntaxException e) {
            // expected
        }
    }

    public void testHyperwordLines() throws Exception {
        assertEquals(Hyperword.of("a", "ab", "ba"), reader.readHyperwordLines(resource("hyperword.txt")));
        assertTrue(reader.readHyperwordLines(new StringReader("")).isEmpty());
    }

    public void testFiles() throws Exception {
        File f = File.createTempFile("nfh", ".nfh");
        f.deleteOnExit();
        Writer w = new OutputStreamWriter(new FileOutputStream(f), "UTF-8");
        try {
            w.write(ALTERNATION);
        } finally {
            w.close();
        }
        assertEquals(3, reader.parse(f).delta().size());
    }
}
