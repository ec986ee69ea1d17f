/*
 * @LICENSE@
 */

package org.xtrms.nfh;

import static org.xtrms.nfh.Misc.LS;

/**
 * Unchecked exception thrown to indicate a malformed NFH or hyperword
 * definition; the analog of {@link java.util.regex.PatternSyntaxException}
 * for definition files.
 */
public class NFHSyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String desc;
    private final String input;
    private final int line;

    /**
     * @param desc
     *            a description of the error.
     * @param input
     *            the offending input (a line, or the whole definition).
     * @param line
     *            the 1-based line number, or -1 if not known.
     */
    public NFHSyntaxException(String desc, String input, int line) {
        this.desc = desc;
        this.input = input;
        this.line = line;
    }

    public NFHSyntaxException(String desc, Throwable cause) {
        this(desc, null, -1);
        initCause(cause);
    }

    public String getDescription() {
        return desc;
    }

    public String getInput() {
        return input;
    }

    /**
     * @return the 1-based line number, or -1.
     */
    public int getLine() {
        return line;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(desc);
        if (line >= 0) {
            sb.append(" near line ").append(line);
        }
        if (input != null) {
            sb.append(LS).append(input);
        }
        return sb.toString();
    }
}
