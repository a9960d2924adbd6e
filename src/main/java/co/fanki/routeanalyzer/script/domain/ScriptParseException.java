package co.fanki.routeanalyzer.script.domain;

/**
 * Signals that a single script file could not be tokenized.
 *
 * <p>Raised per file. The analyzer drops that file's contribution,
 * marks its result as partial, and carries on with the remaining
 * files.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScriptParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String filename;

    private final int line;

    /**
     * Creates a new parse exception.
     *
     * @param theFilename the file that failed
     * @param theLine the 1-based line where tokenizing stopped
     * @param message what was wrong
     */
    public ScriptParseException(final String theFilename, final int theLine,
            final String message) {
        super(theFilename + ":" + theLine + ": " + message);
        this.filename = theFilename;
        this.line = theLine;
    }

    /**
     * Returns the file that failed.
     *
     * @return the filename
     */
    public String getFilename() {
        return filename;
    }

    /**
     * Returns the line where tokenizing stopped.
     *
     * @return the 1-based line number
     */
    public int getLine() {
        return line;
    }

}
