package co.fanki.routeanalyzer.script.domain;

import java.util.List;

/**
 * Port to the collaborator that turns script files into statement records.
 *
 * <p>Files are reported in a stable order and statements in declaration
 * order. Failures are split in two: a single file that cannot be
 * tokenized raises {@link ScriptParseException} from
 * {@link #statements(String)}, while an unreachable corpus raises
 * {@link StatementSourceUnavailableException} from any method.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface StatementSource {

    /**
     * Lists the script files of the corpus.
     *
     * @return the filenames, in analysis order
     * @throws StatementSourceUnavailableException if the corpus cannot be
     *         read
     */
    List<String> filenames();

    /**
     * Returns the top-level statements of one file.
     *
     * @param filename a name previously returned by {@link #filenames()}
     * @return the statements in declaration order
     * @throws ScriptParseException if the file cannot be tokenized
     * @throws StatementSourceUnavailableException if the corpus cannot be
     *         read
     */
    List<Statement> statements(String filename) throws ScriptParseException;

    /**
     * Returns a cheap summary of the corpus state.
     *
     * <p>Two calls return equal values if and only if nothing relevant to
     * the analysis changed in between.</p>
     *
     * @return the fingerprint, never null
     * @throws StatementSourceUnavailableException if the corpus cannot be
     *         read
     */
    String fingerprint();

}
