package co.fanki.routeanalyzer.script.domain;

import co.fanki.routeanalyzer.shared.Preconditions;

import java.util.List;

/**
 * One statement of a script file, with its nested body.
 *
 * <p>The meaning of {@code name} depends on the kind: the declared name
 * for {@link StatementKind#LABEL} and {@link StatementKind#MENU}, the
 * target for {@link StatementKind#JUMP} and {@link StatementKind#CALL}
 * (null when the target is computed at runtime). {@code text} carries
 * dialogue or choice display text, {@code condition} the raw guard of a
 * choice.</p>
 *
 * @param kind the statement kind, never null
 * @param filename the file the statement was read from
 * @param line the 1-based line number
 * @param name the label, menu or target name, may be null
 * @param text the dialogue or display text, may be null
 * @param condition the raw guard expression, may be null
 * @param children the nested body, never null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Statement(
        StatementKind kind,
        String filename,
        int line,
        String name,
        String text,
        String condition,
        List<Statement> children) {

    /** Compact constructor, validates and freezes the body. */
    public Statement {
        Preconditions.requireNonNull(kind, "Statement kind is required");
        Preconditions.requireNonBlank(filename, "Filename is required");
        Preconditions.requireNonNegative(line, "Line must be non-negative");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Statement label(final String filename, final int line,
            final String name, final List<Statement> body) {
        Preconditions.requireNonBlank(name, "Label name is required");
        return new Statement(StatementKind.LABEL, filename, line, name,
                null, null, body);
    }

    public static Statement menu(final String filename, final int line,
            final List<Statement> choices) {
        return new Statement(StatementKind.MENU, filename, line, null,
                null, null, choices);
    }

    public static Statement choice(final String filename, final int line,
            final String text, final String condition,
            final List<Statement> body) {
        return new Statement(StatementKind.CHOICE, filename, line, null,
                text, condition, body);
    }

    public static Statement say(final String filename, final int line,
            final String text) {
        return new Statement(StatementKind.SAY, filename, line, null,
                text, null, List.of());
    }

    public static Statement jump(final String filename, final int line,
            final String target) {
        return new Statement(StatementKind.JUMP, filename, line, target,
                null, null, List.of());
    }

    public static Statement call(final String filename, final int line,
            final String target) {
        return new Statement(StatementKind.CALL, filename, line, target,
                null, null, List.of());
    }

    public static Statement ret(final String filename, final int line) {
        return new Statement(StatementKind.RETURN, filename, line, null,
                null, null, List.of());
    }

    public static Statement block(final String filename, final int line,
            final String header, final List<Statement> body) {
        return new Statement(StatementKind.BLOCK, filename, line, null,
                header, null, body);
    }

    public static Statement other(final String filename, final int line,
            final String raw) {
        return new Statement(StatementKind.OTHER, filename, line, null,
                raw, null, List.of());
    }

    /**
     * Checks if this statement is of the given kind.
     *
     * @param theKind the kind to compare against
     * @return true on a match
     */
    public boolean is(final StatementKind theKind) {
        return kind == theKind;
    }

    /** Returns {@code filename:line}, used in log lines and node ids. */
    public String location() {
        return filename + ":" + line;
    }

}
