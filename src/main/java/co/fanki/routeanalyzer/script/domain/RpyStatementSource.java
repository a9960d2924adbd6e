package co.fanki.routeanalyzer.script.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File-system {@link StatementSource} for {@code .rpy} scripts.
 *
 * <p>Discovers script files recursively under a root directory and turns
 * each one into statement records with a line-oriented, indentation-aware
 * tokenizer. Only the structure the route analysis needs is recognized:
 * labels, menus and their choices, dialogue, jumps, calls and returns.
 * Every other line becomes an {@link StatementKind#OTHER} record, and
 * every other block header a {@link StatementKind#BLOCK} record.</p>
 *
 * <p>Bodies of {@code init}, {@code python}, {@code screen} and similar
 * declarations are skipped by indentation without being tokenized, since
 * they hold code rather than story flow.</p>
 *
 * <p>A file is rejected with {@link ScriptParseException} on tabs in
 * indentation, inconsistent dedents, unterminated string literals, and
 * label or menu headers without a body.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RpyStatementSource implements StatementSource {

    private static final Logger LOG = LoggerFactory.getLogger(
            RpyStatementSource.class);

    private static final String BOM = "\uFEFF";

    private static final String NAME = "[A-Za-z_.][\\w.]*";

    private static final Pattern LABEL_PATTERN = Pattern.compile(
            "^label\\s+(" + NAME + ")\\s*(?:\\(.*\\))?\\s*(?:hide\\s*)?$");

    private static final Pattern MENU_PATTERN = Pattern.compile(
            "^menu(?:\\s+(" + NAME + "))?\\s*(?:\\(.*\\))?$");

    private static final Pattern JUMP_PATTERN = Pattern.compile(
            "^jump\\s+(" + NAME + ")\\s*$");

    private static final Pattern CALL_PATTERN = Pattern.compile(
            "^call\\s+(" + NAME + ")(?:\\s*\\(.*\\))?(?:\\s+from\\s+\\w+)?"
                    + "\\s*$");

    private static final Pattern EXPRESSION_TRANSFER_PATTERN =
            Pattern.compile("^(jump|call)\\s+expression\\b.*$");

    private static final Pattern RETURN_PATTERN = Pattern.compile(
            "^return\\b.*$");

    /** Speaker name and image attributes in front of a dialogue string. */
    private static final Pattern SAY_PREFIX_PATTERN = Pattern.compile(
            "^[A-Za-z_][\\w.]*(?:\\s+[A-Za-z_@][\\w.-]*)*\\s+(?=[\"'])");

    /** Statements that take a string operand which is not dialogue. */
    private static final Pattern NON_DIALOGUE_PATTERN = Pattern.compile(
            "^(?:play|queue|stop|voice|sound|show|scene|hide|with|window"
                    + "|pause|nvl|camera|define|default|image)\\b.*$");

    /** Headers whose bodies hold code, never story flow. */
    private static final Pattern OPAQUE_HEADER_PATTERN = Pattern.compile(
            "^(?:init|python|screen|transform|style|image|define|default"
                    + "|translate|layeredimage|testcase)\\b.*$");

    private static final Pattern CHOICE_GUARD_PATTERN = Pattern.compile(
            "^if\\s+(.+)$");

    private final Path root;

    private final String extension;

    /**
     * Creates a new source.
     *
     * @param theRoot the directory holding the scripts
     * @param theExtension the script file extension, e.g. {@code .rpy}
     */
    public RpyStatementSource(final Path theRoot, final String theExtension) {
        this.root = Preconditions.requireNonNull(theRoot,
                "Script root is required");
        this.extension = Preconditions.requireNonBlank(theExtension,
                "Script extension is required");
    }

    /**
     * Lists every script file under the root, as '/'-separated paths
     * relative to it, sorted.
     *
     * @return the relative filenames
     */
    @Override
    public List<String> filenames() {
        return discoverFiles().stream()
                .map(this::relativeName)
                .toList();
    }

    /** {@inheritDoc} */
    @Override
    public List<Statement> statements(final String filename)
            throws ScriptParseException {
        Preconditions.requireNonBlank(filename, "Filename is required");

        final List<String> lines;
        try {
            lines = Files.readAllLines(root.resolve(filename),
                    StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new ScriptParseException(filename, 0,
                    "Unreadable script file: " + e.getMessage());
        }
        return parse(filename, lines);
    }

    /**
     * Hashes relative path, size and modification time of every file.
     *
     * @return the hex-encoded SHA-256 digest
     */
    @Override
    public String fingerprint() {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }

        for (final Path file : discoverFiles()) {
            try {
                final String marker = relativeName(file) + "|"
                        + Files.size(file) + "|"
                        + Files.getLastModifiedTime(file).toMillis() + "\n";
                digest.update(marker.getBytes(StandardCharsets.UTF_8));
            } catch (final IOException e) {
                throw new StatementSourceUnavailableException(
                        "Cannot stat script file " + file, e);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Tokenizes the content of one file.
     *
     * @param filename the name reported in statements and errors
     * @param lines the raw lines of the file
     * @return the top-level statements
     * @throws ScriptParseException if the content cannot be tokenized
     */
    public static List<Statement> parse(final String filename,
            final List<String> lines) throws ScriptParseException {
        return new Tokenizer(filename, logicalLines(filename, lines))
                .topLevel();
    }

    private List<Path> discoverFiles() {
        if (!Files.isDirectory(root)) {
            throw new StatementSourceUnavailableException(
                    "Script directory not found: " + root);
        }

        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString()
                            .endsWith(extension))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new StatementSourceUnavailableException(
                    "Cannot list script directory " + root, e);
        }
    }

    private String relativeName(final Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    // -- Tokenizer -----------------------------------------------------------

    /** A non-blank, non-comment source line with its indentation. */
    private record Line(int number, int indent, String content) {}

    private static List<Line> logicalLines(final String filename,
            final List<String> raw) throws ScriptParseException {

        final List<Line> result = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            final String text = i == 0 && raw.get(i).startsWith(BOM)
                    ? raw.get(i).substring(BOM.length())
                    : raw.get(i);
            final String content = text.strip();
            if (content.isEmpty() || content.startsWith("#")) {
                continue;
            }

            int indent = 0;
            while (indent < text.length()
                    && Character.isWhitespace(text.charAt(indent))) {
                if (text.charAt(indent) == '\t') {
                    throw new ScriptParseException(filename, i + 1,
                            "Tab character in indentation");
                }
                indent++;
            }
            result.add(new Line(i + 1, indent, content));
        }
        return result;
    }

    /** Recursive-descent walk over indentation levels of one file. */
    private static final class Tokenizer {

        private final String filename;
        private final List<Line> lines;
        private int pos;

        private Tokenizer(final String theFilename, final List<Line> theLines) {
            this.filename = theFilename;
            this.lines = theLines;
        }

        private List<Statement> topLevel() throws ScriptParseException {
            final List<Statement> statements = block(0, false);
            if (pos < lines.size()) {
                final Line stray = lines.get(pos);
                throw error(stray, "Unexpected indentation");
            }
            LOG.debug("Tokenized {}: {} top-level statements", filename,
                    statements.size());
            return statements;
        }

        private List<Statement> block(final int indent,
                final boolean menuBody) throws ScriptParseException {

            final List<Statement> statements = new ArrayList<>();
            while (pos < lines.size()) {
                final Line line = lines.get(pos);
                if (line.indent() < indent) {
                    break;
                }
                if (line.indent() > indent) {
                    throw error(line, "Unexpected indentation");
                }
                pos++;
                statements.add(statement(line, menuBody));
            }
            return statements;
        }

        private boolean hasBody(final Line header) {
            return pos < lines.size()
                    && lines.get(pos).indent() > header.indent();
        }

        private List<Statement> body(final Line header,
                final boolean menuBody) throws ScriptParseException {
            if (!hasBody(header)) {
                return List.of();
            }
            return block(lines.get(pos).indent(), menuBody);
        }

        private void skipBody(final Line header) {
            while (pos < lines.size()
                    && lines.get(pos).indent() > header.indent()) {
                pos++;
            }
        }

        private Statement statement(final Line line, final boolean menuBody)
                throws ScriptParseException {

            if (OPAQUE_HEADER_PATTERN.matcher(line.content()).matches()) {
                skipBody(line);
                return Statement.other(filename, line.number(),
                        line.content());
            }

            final String code = stripComment(line);

            if (code.endsWith(":")) {
                return header(line, code.substring(0, code.length() - 1)
                        .strip(), menuBody);
            }
            return simple(line, code);
        }

        private Statement header(final Line line, final String header,
                final boolean menuBody) throws ScriptParseException {

            if (header.isEmpty()) {
                throw error(line, "Empty block header");
            }

            final Matcher label = LABEL_PATTERN.matcher(header);
            if (label.matches()) {
                requireBody(line, "Label " + label.group(1));
                return Statement.label(filename, line.number(),
                        label.group(1), body(line, false));
            }

            final Matcher menu = MENU_PATTERN.matcher(header);
            if (menu.matches()) {
                requireBody(line, "Menu");
                return new Statement(StatementKind.MENU, filename,
                        line.number(), menu.group(1), null, null,
                        body(line, true));
            }

            if (menuBody && isQuote(header.charAt(0))) {
                final Literal literal = literal(line, header, 0);
                final String rest = header.substring(literal.end()).strip();
                String guard = null;
                if (!rest.isEmpty()) {
                    final Matcher guardMatcher =
                            CHOICE_GUARD_PATTERN.matcher(rest);
                    if (!guardMatcher.matches()) {
                        throw error(line, "Unexpected text after choice: "
                                + rest);
                    }
                    guard = guardMatcher.group(1).strip();
                }
                requireBody(line, "Choice");
                return Statement.choice(filename, line.number(),
                        literal.value(), guard, body(line, false));
            }

            return Statement.block(filename, line.number(), header,
                    body(line, false));
        }

        private Statement simple(final Line line, final String code)
                throws ScriptParseException {

            if (EXPRESSION_TRANSFER_PATTERN.matcher(code).matches()) {
                return code.startsWith("jump")
                        ? Statement.jump(filename, line.number(), null)
                        : Statement.call(filename, line.number(), null);
            }

            final Matcher jump = JUMP_PATTERN.matcher(code);
            if (jump.matches()) {
                return Statement.jump(filename, line.number(), jump.group(1));
            }

            final Matcher call = CALL_PATTERN.matcher(code);
            if (call.matches() && !"screen".equals(call.group(1))) {
                return Statement.call(filename, line.number(), call.group(1));
            }

            if (RETURN_PATTERN.matcher(code).matches()) {
                return Statement.ret(filename, line.number());
            }

            if (isQuote(code.charAt(0))) {
                return Statement.say(filename, line.number(),
                        literal(line, code, 0).value());
            }

            final Matcher speaker = SAY_PREFIX_PATTERN.matcher(code);
            if (!NON_DIALOGUE_PATTERN.matcher(code).matches()
                    && speaker.find()) {
                return Statement.say(filename, line.number(),
                        literal(line, code, speaker.end()).value());
            }

            return Statement.other(filename, line.number(), code);
        }

        private void requireBody(final Line line, final String what)
                throws ScriptParseException {
            if (!hasBody(line)) {
                throw error(line, what + " has no body");
            }
        }

        /**
         * Removes a trailing comment, validating string literals on the way.
         */
        private String stripComment(final Line line)
                throws ScriptParseException {
            final String content = line.content();
            int i = 0;
            while (i < content.length()) {
                final char c = content.charAt(i);
                if (isQuote(c)) {
                    i = literal(line, content, i).end();
                } else if (c == '#') {
                    return content.substring(0, i).strip();
                } else {
                    i++;
                }
            }
            return content;
        }

        private Literal literal(final Line line, final String text,
                final int start) throws ScriptParseException {

            final char quote = text.charAt(start);
            final boolean triple = text.startsWith(
                    String.valueOf(quote).repeat(3), start);
            final String delimiter = triple
                    ? String.valueOf(quote).repeat(3)
                    : String.valueOf(quote);

            final StringBuilder value = new StringBuilder();
            int i = start + delimiter.length();
            while (i < text.length()) {
                final char c = text.charAt(i);
                if (c == '\\' && i + 1 < text.length()) {
                    value.append(text.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (text.startsWith(delimiter, i)) {
                    return new Literal(value.toString(),
                            i + delimiter.length());
                }
                value.append(c);
                i++;
            }
            throw error(line, "Unterminated string literal");
        }

        private ScriptParseException error(final Line line,
                final String message) {
            return new ScriptParseException(filename, line.number(), message);
        }

        private static boolean isQuote(final char c) {
            return c == '"' || c == '\'' || c == '`';
        }
    }

    /** A decoded string literal and the index just past its closing quote. */
    private record Literal(String value, int end) {}

}
