/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads {@link NFH} and {@link Hyperword} definitions.
 * <p>
 * <strong>Text format.</strong> Header lines of the form <code>key: value</code>
 * for the keys <code>k</code>, <code>alpha</code> (alias
 * <code>quantifiers</code>), <code>states</code>, <code>initial</code> (alias
 * <code>initial states</code>), <code>accepting</code> (alias
 * <code>accepting states</code>) and <code>alphabet</code>; list values are
 * separated by whitespace and/or commas. A <code>delta:</code> line opens the
 * transition section: every following line holds exactly <code>k+2</code>
 * fields, <code>source symbol_1 ... symbol_k target</code>, with
 * <code>#</code> standing for the idle marker. Blank lines and lines starting
 * with <code>#</code> are skipped, hence state names must not start with
 * <code>#</code>.
 *
 * <pre>
 * k: 2
 * alpha: A E
 * states: q0 q1
 * initial: q0
 * accepting: q1
 * alphabet: a b
 * delta:
 * q0 a a q1
 * q0 b # q1
 * </pre>
 * <p>
 * <strong>JSON format.</strong> An object with <code>k</code>,
 * <code>alpha</code>, <code>states</code>, <code>initial</code> (or
 * <code>initial_states</code>), <code>accepting</code> (or
 * <code>accepting_states</code>), <code>alphabet</code> and
 * <code>delta</code>, the latter an array of
 * <code>[source, [symbols...], target]</code> triples. A hyperword is a JSON
 * array of words, or an object whose <code>words</code> member is one.
 * <p>
 * Malformed input raises {@link NFHSyntaxException}; a well formed
 * definition that violates an NFH invariant raises
 * {@link NFH.ConstructionException}.
 */
public final class NFHReader {

    private static final Logger logger = Logger.getLogger("org.xtrms.nfh");
    private static final Level level = Level.FINER;

    private static final Charset UTF8 = Charset.forName("UTF-8");

    private static final String[] REQUIRED = {
        "k", "alpha", "states", "initial", "accepting", "alphabet"
    };

    private static final Map<String, String> ALIASES = new HashMap<String, String>();
    static {
        ALIASES.put("initial states", "initial");
        ALIASES.put("initial_states", "initial");
        ALIASES.put("accepting states", "accepting");
        ALIASES.put("accepting_states", "accepting");
        ALIASES.put("quantifiers", "alpha");
    }

    private final ObjectMapper mapper;

    public NFHReader() {
        this(new ObjectMapper());
    }

    public NFHReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /*
     * Text format
     */

    public NFH parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new AssertionError(e);    // StringReader doesn't
        }
    }

    public NFH parse(File file) throws IOException {
        Reader r = new InputStreamReader(new FileInputStream(file), UTF8);
        try {
            return parse(r);
        } finally {
            r.close();
        }
    }

    public NFH parse(Reader reader) throws IOException {

        final BufferedReader br = new BufferedReader(reader);
        final Map<String, String> header = new HashMap<String, String>();
        final Map<String, Integer> headerLine = new HashMap<String, Integer>();
        final List<String> deltaLines = new ArrayList<String>();
        final List<Integer> deltaLineNos = new ArrayList<Integer>();
        boolean inDelta = false;
        int lineNo = 0;
        String line;

        while ((line = br.readLine()) != null) {
            ++lineNo;
            line = line.trim();
            if (line.length() == 0 || line.startsWith("#")) continue;

            int colon = line.indexOf(':');
            if (!inDelta && colon != -1) {
                String key = line.substring(0, colon).trim().toLowerCase();
                String value = line.substring(colon + 1).trim();
                if (ALIASES.containsKey(key)) key = ALIASES.get(key);
                if (key.equals("delta")) {
                    inDelta = true;
                    if (value.length() != 0) {
                        deltaLines.add(value);
                        deltaLineNos.add(lineNo);
                    }
                    continue;
                }
                if (header.containsKey(key)) {
                    throw new NFHSyntaxException("duplicate key '" + key + "'", line, lineNo);
                }
                header.put(key, value);
                headerLine.put(key, lineNo);
            } else if (inDelta) {
                deltaLines.add(line);
                deltaLineNos.add(lineNo);
            } else {
                throw new NFHSyntaxException("expected 'key: value'", line, lineNo);
            }
        }

        for (String req : REQUIRED) {
            if (!header.containsKey(req)) {
                throw new NFHSyntaxException("missing required field: " + req, null, -1);
            }
        }
        for (String key : header.keySet()) {
            if (!isRequired(key)) logger.fine("ignoring unknown key: " + key);
        }

        final int k;
        try {
            k = Integer.parseInt(header.get("k"));
        } catch (NumberFormatException e) {
            throw new NFHSyntaxException(
                "k must be an integer", header.get("k"), headerLine.get("k"));
        }

        NFH.Builder b = new NFH.Builder().k(k);
        b.alpha(fields(header.get("alpha")));
        b.states(states("states", header, headerLine));
        b.initial(states("initial", header, headerLine));
        b.accepting(states("accepting", header, headerLine));
        for (String token : fields(header.get("alphabet"))) {
            b.alphabet(letter(token, header.get("alphabet"), headerLine.get("alphabet")));
        }

        if (k <= 0) return b.build();   // throws

        for (int i = 0; i < deltaLines.size(); ++i) {
            String dline = deltaLines.get(i);
            int no = deltaLineNos.get(i);
            String[] parts = fields(dline);
            if (parts.length != k + 2) {
                throw new NFHSyntaxException(
                    "invalid transition, expected " + (k + 2) + " fields but found "
                    + parts.length, dline, no);
            }
            Symbol[] symbols = new Symbol[k];
            for (int j = 0; j < k; ++j) {
                symbols[j] = symbol(parts[j + 1], dline, no);
            }
            b.transition(new Transition(parts[0], symbols, parts[k + 1]));
        }
        logger.log(level, "parsed " + lineNo + " lines, "
            + deltaLines.size() + " transitions");
        return b.build();
    }

    private static boolean isRequired(String key) {
        for (String req : REQUIRED) if (req.equals(key)) return true;
        return false;
    }

    private static String[] fields(String value) {
        String v = value.replace(',', ' ').trim();
        return v.length() == 0 ? new String[0] : v.split("\\s+");
    }

    /*
     * a delta line starting with '#' reads as a comment, so no state name
     * may start with one.
     */
    private static String[] states(String key, Map<String, String> header,
            Map<String, Integer> headerLine) {
        String[] ret = fields(header.get(key));
        for (String state : ret) {
            if (state.startsWith("#")) {
                throw new NFHSyntaxException(
                    "state names must not start with '#': " + state,
                    header.get(key), headerLine.get(key));
            }
        }
        return ret;
    }

    /*
     * an alphabet entry is a single character; "#" comes back as the idle
     * marker, which the NFH constructor rejects.
     */
    private static Symbol letter(String token, String input, int lineNo) {
        if (token.length() != 1) {
            throw new NFHSyntaxException(
                "alphabet symbols must be single characters: " + token, input, lineNo);
        }
        return Symbol.parse(token);
    }

    private static Symbol symbol(String token, String input, int lineNo) {
        try {
            return Symbol.parse(token);
        } catch (IllegalArgumentException e) {
            throw new NFHSyntaxException(e.getMessage(), input, lineNo);
        }
    }

    /*
     * JSON format
     */

    public NFH readJson(String json) {
        try {
            return readJson(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new NFHSyntaxException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public NFH readJson(File file) throws IOException {
        return readJson(tree(file));
    }

    public NFH readJson(Reader reader) throws IOException {
        return readJson(tree(reader));
    }

    private NFH readJson(JsonNode root) {

        if (root == null || !root.isObject()) {
            throw new NFHSyntaxException("NFH definition must be a JSON object", null, -1);
        }
        JsonNode kNode = member(root, "k");
        if (!kNode.isIntegralNumber() || !kNode.canConvertToInt()) {
            throw new NFHSyntaxException("k must be an integer", kNode.toString(), -1);
        }
        int k = kNode.intValue();

        NFH.Builder b = new NFH.Builder().k(k);
        b.alpha(strings(member(root, "alpha"), "alpha"));
        b.states(strings(member(root, "states"), "states"));
        b.initial(strings(member(root, "initial", "initial_states"), "initial"));
        b.accepting(strings(member(root, "accepting", "accepting_states"), "accepting"));
        for (String token : strings(member(root, "alphabet"), "alphabet")) {
            b.alphabet(letter(token, root.get("alphabet").toString(), -1));
        }

        JsonNode delta = member(root, "delta");
        if (!delta.isArray()) {
            throw new NFHSyntaxException("delta must be an array", delta.toString(), -1);
        }
        for (JsonNode t : delta) {
            if (!t.isArray() || t.size() != 3 || !t.get(0).isTextual()
                    || !t.get(1).isArray() || !t.get(2).isTextual()) {
                throw new NFHSyntaxException(
                    "transition must be [source, [symbols...], target]", t.toString(), -1);
            }
            String[] tokens = strings(t.get(1), "transition symbols");
            Symbol[] symbols = new Symbol[tokens.length];
            for (int j = 0; j < tokens.length; ++j) {
                symbols[j] = symbol(tokens[j], t.toString(), -1);
            }
            b.transition(new Transition(t.get(0).textValue(), symbols, t.get(2).textValue()));
        }
        return b.build();
    }

    public Hyperword readHyperwordJson(String json) {
        try {
            return readHyperwordJson(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new NFHSyntaxException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Hyperword readHyperwordJson(File file) throws IOException {
        return readHyperwordJson(tree(file));
    }

    public Hyperword readHyperwordJson(Reader reader) throws IOException {
        return readHyperwordJson(tree(reader));
    }

    private Hyperword readHyperwordJson(JsonNode root) {
        JsonNode words = root;
        if (root != null && root.isObject() && root.has("words")) {
            words = root.get("words");
        }
        if (words == null || !words.isArray()) {
            throw new NFHSyntaxException(
                "hyperword must be a JSON array or an object with a 'words' array",
                root == null ? null : root.toString(), -1);
        }
        Set<String> ret = new LinkedHashSet<String>();
        for (String w : strings(words, "words")) ret.add(w);
        return Hyperword.from(ret);
    }

    /**
     * Reads one word per line up to the first blank line or the end of the
     * input. Surrounding whitespace is trimmed.
     */
    public Hyperword readHyperwordLines(Reader reader) throws IOException {
        BufferedReader br = new BufferedReader(reader);
        Set<String> words = new LinkedHashSet<String>();
        String line;
        while ((line = br.readLine()) != null && (line = line.trim()).length() != 0) {
            words.add(line);
        }
        return Hyperword.from(words);
    }

    private JsonNode tree(File file) throws IOException {
        try {
            return mapper.readTree(file);
        } catch (JsonProcessingException e) {
            throw new NFHSyntaxException(
                "malformed JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode tree(Reader reader) throws IOException {
        try {
            return mapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new NFHSyntaxException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode member(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode n = root.get(name);
            if (n != null && !n.isNull()) return n;
        }
        throw new NFHSyntaxException("missing required field: " + names[0], null, -1);
    }

    private static String[] strings(JsonNode array, String what) {
        if (!array.isArray()) {
            throw new NFHSyntaxException(what + " must be an array", array.toString(), -1);
        }
        String[] ret = new String[array.size()];
        int i = 0;
        for (JsonNode n : array) {
            if (!n.isTextual()) {
                throw new NFHSyntaxException(
                    what + " must contain strings only", array.toString(), -1);
            }
            ret[i++] = n.textValue();
        }
        return ret;
    }
}
