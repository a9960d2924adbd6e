package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads choice guards into {@link Requirement}s.
 *
 * <p>This is a lexer, not an evaluator: nothing in the guard is executed.
 * The token stream is enough to tell which variables a guard reads,
 * whether it is a single comparison and which boolean keywords join its
 * top-level terms.</p>
 *
 * <p>Recognized tokens are identifiers (a dotted chain such as
 * {@code persistent.seen} is one identifier), numbers, quoted strings,
 * comparison operators ({@code == != >= <= > < in, not in, is, is not}),
 * the boolean keywords, the other expression keywords ({@code if},
 * {@code else}, {@code lambda}, {@code for}), parentheses and the usual
 * punctuation, attribute dots included. Any other
 * character, or an unterminated string, makes the guard malformed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConditionParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            ConditionParser.class);

    private static final Set<String> CONSTANTS = Set.of(
            "True", "False", "None");

    /** Python keywords that can appear in an expression but name nothing. */
    private static final Set<String> KEYWORDS = Set.of(
            "if", "else", "lambda", "for", "async", "await", "yield");

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "rb", "br", "fr", "rf");

    private static final String PUNCTUATION = "[]{},+-*/%:=~&|^.";

    /**
     * Collects the requirements of every guarded choice of a graph.
     *
     * @param graph the route graph
     * @return choice id to requirement, in node discovery order
     */
    public Map<String, Requirement> requirementsOf(final RouteGraph graph) {
        Preconditions.requireNonNull(graph, "Route graph is required");

        final Map<String, Requirement> requirements = new LinkedHashMap<>();
        for (final RouteNode node : graph.nodes()) {
            if (node.isLabel()) {
                continue;
            }
            for (final Choice choice : node.choices()) {
                if (choice.isGuarded()) {
                    final Requirement requirement = parse(node.id(),
                            choice.index(), choice.text(),
                            choice.condition());
                    requirements.put(requirement.choiceId(), requirement);
                }
            }
        }
        return requirements;
    }

    /**
     * Reads one guard.
     *
     * @param menuId the menu owning the choice
     * @param choiceIndex the choice position
     * @param choiceText the choice display text
     * @param condition the raw guard, never null
     * @return the requirement, never null
     */
    public Requirement parse(final String menuId, final int choiceIndex,
            final String choiceText, final String condition) {
        Preconditions.requireNonNull(condition, "Condition is required");

        final List<Token> tokens;
        try {
            tokens = unwrap(new Lexer(condition).tokens());
        } catch (final MalformedConditionException e) {
            LOG.debug("Malformed guard on {}: {} ({})",
                    Requirement.choiceId(menuId, choiceIndex), condition,
                    e.getMessage());
            return Requirement.malformed(menuId, choiceIndex, choiceText,
                    condition);
        }

        final List<String> connectors = new ArrayList<>();
        final List<Integer> comparisons = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            final Token token = tokens.get(i);
            if (token.type() == TokenType.OPEN) {
                depth++;
            } else if (token.type() == TokenType.CLOSE) {
                depth--;
            } else if (depth == 0 && token.type() == TokenType.CONNECTOR) {
                connectors.add(token.text());
            } else if (depth == 0 && token.type() == TokenType.COMPARISON) {
                comparisons.add(i);
            }
        }

        String operator = null;
        String comparedValue = null;
        if (connectors.isEmpty() && comparisons.size() == 1) {
            final int at = comparisons.get(0);
            operator = tokens.get(at).text();
            comparedValue = rightHandSide(condition, tokens, at);
        }

        return new Requirement(menuId, choiceIndex, choiceText, condition,
                variables(tokens), operator, comparedValue, connectors,
                false);
    }

    private static String rightHandSide(final String condition,
            final List<Token> tokens, final int operatorAt) {
        if (operatorAt + 1 >= tokens.size()) {
            return null;
        }
        final Token first = tokens.get(operatorAt + 1);
        final Token last = tokens.get(tokens.size() - 1);
        if (first == last && first.type() == TokenType.STRING) {
            return first.value();
        }
        return condition.substring(first.start(), last.end()).strip();
    }

    private static List<String> variables(final List<Token> tokens) {
        final Set<String> variables = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            final Token token = tokens.get(i);
            if (token.type() != TokenType.IDENTIFIER) {
                continue;
            }
            if (i > 0 && ".".equals(tokens.get(i - 1).text())) {
                // attribute of a call or subscript result
                continue;
            }
            final boolean called = i + 1 < tokens.size()
                    && tokens.get(i + 1).type() == TokenType.OPEN
                    && "(".equals(tokens.get(i + 1).text());
            if (!called) {
                variables.add(token.text());
            } else if (token.text().contains(".")) {
                // obj.method(...) reads obj
                variables.add(token.text().substring(0,
                        token.text().lastIndexOf('.')));
            }
        }
        return List.copyOf(variables);
    }

    /** Drops parentheses that enclose the whole expression. */
    private static List<Token> unwrap(final List<Token> tokens)
            throws MalformedConditionException {
        List<Token> current = tokens;
        while (current.size() >= 2
                && "(".equals(current.get(0).text())
                && current.get(0).type() == TokenType.OPEN
                && closingOf(current, 0) == current.size() - 1) {
            current = current.subList(1, current.size() - 1);
        }
        return current;
    }

    private static int closingOf(final List<Token> tokens, final int open)
            throws MalformedConditionException {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            final TokenType type = tokens.get(i).type();
            if (type == TokenType.OPEN) {
                depth++;
            } else if (type == TokenType.CLOSE) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new MalformedConditionException("Unbalanced parentheses");
    }

    // -- Lexer ---------------------------------------------------------------

    private enum TokenType {
        IDENTIFIER, NUMBER, STRING, CONSTANT, KEYWORD, COMPARISON,
        CONNECTOR, OPEN, CLOSE, PUNCTUATION
    }

    /**
     * A lexed token.
     *
     * @param value the unquoted content for strings, else the text
     */
    private record Token(TokenType type, String text, String value,
            int start, int end) {

        private Token(final TokenType type, final String text,
                final int start, final int end) {
            this(type, text, text, start, end);
        }
    }

    private static final class MalformedConditionException
            extends Exception {

        private static final long serialVersionUID = 1L;

        private MalformedConditionException(final String message) {
            super(message);
        }
    }

    private static final class Lexer {

        private final String input;

        private final List<Token> tokens = new ArrayList<>();

        private int position;

        private int depth;

        private Lexer(final String theInput) {
            input = theInput;
        }

        private List<Token> tokens() throws MalformedConditionException {
            while (position < input.length()) {
                final char c = input.charAt(position);
                if (Character.isWhitespace(c)) {
                    position++;
                } else if (Character.isLetter(c) || c == '_') {
                    word();
                } else if (Character.isDigit(c)) {
                    number();
                } else if (c == '"' || c == '\'') {
                    string(position);
                } else if (c == '(' || c == '[' || c == '{') {
                    depth++;
                    add(TokenType.OPEN, position, position + 1);
                } else if (c == ')' || c == ']' || c == '}') {
                    if (--depth < 0) {
                        throw new MalformedConditionException(
                                "Unbalanced " + c);
                    }
                    add(TokenType.CLOSE, position, position + 1);
                } else if (input.startsWith("==", position)
                        || input.startsWith("!=", position)
                        || input.startsWith(">=", position)
                        || input.startsWith("<=", position)) {
                    add(TokenType.COMPARISON, position, position + 2);
                } else if (c == '<' || c == '>') {
                    add(TokenType.COMPARISON, position, position + 1);
                } else if (c == '.' && position + 1 < input.length()
                        && Character.isDigit(input.charAt(position + 1))) {
                    number();
                } else if (PUNCTUATION.indexOf(c) >= 0) {
                    add(TokenType.PUNCTUATION, position, position + 1);
                } else {
                    throw new MalformedConditionException(
                            "Unexpected character '" + c + "' at "
                                    + position);
                }
            }
            if (depth != 0) {
                throw new MalformedConditionException(
                        "Unbalanced brackets");
            }
            return tokens;
        }

        private void word() throws MalformedConditionException {
            final int start = position;
            int end = identifierEnd(start);
            while (end + 1 < input.length() && input.charAt(end) == '.'
                    && isIdentifierStart(input.charAt(end + 1))) {
                end = identifierEnd(end + 1);
            }
            final String text = input.substring(start, end);

            if (end < input.length()
                    && (input.charAt(end) == '"' || input.charAt(end) == '\'')
                    && STRING_PREFIXES.contains(text.toLowerCase())) {
                string(start);
                return;
            }

            switch (text) {
                case "and", "or" -> add(TokenType.CONNECTOR, start, end);
                case "not" -> {
                    if (lastIs(TokenType.COMPARISON, "is")) {
                        merge("is not", end);
                    } else {
                        add(TokenType.CONNECTOR, start, end);
                    }
                }
                case "in" -> {
                    if (lastIs(TokenType.CONNECTOR, "not")) {
                        merge("not in", end);
                    } else {
                        add(TokenType.COMPARISON, start, end);
                    }
                }
                case "is" -> add(TokenType.COMPARISON, start, end);
                default -> add(KEYWORDS.contains(text) ? TokenType.KEYWORD
                        : CONSTANTS.contains(text) ? TokenType.CONSTANT
                        : TokenType.IDENTIFIER, start, end);
            }
        }

        private void number() {
            final int start = position;
            int end = start;
            while (end < input.length()
                    && (Character.isLetterOrDigit(input.charAt(end))
                    || input.charAt(end) == '.'
                    || input.charAt(end) == '_')) {
                end++;
            }
            add(TokenType.NUMBER, start, end);
        }

        private void string(final int start)
                throws MalformedConditionException {
            int i = start;
            while (input.charAt(i) != '"' && input.charAt(i) != '\'') {
                i++;
            }
            final char quote = input.charAt(i);
            final StringBuilder value = new StringBuilder();
            i++;
            while (i < input.length()) {
                final char c = input.charAt(i);
                if (c == '\\' && i + 1 < input.length()) {
                    value.append(input.charAt(i + 1));
                    i += 2;
                } else if (c == quote) {
                    tokens.add(new Token(TokenType.STRING,
                            input.substring(start, i + 1), value.toString(),
                            start, i + 1));
                    position = i + 1;
                    return;
                } else {
                    value.append(c);
                    i++;
                }
            }
            throw new MalformedConditionException(
                    "Unterminated string at " + start);
        }

        private int identifierEnd(final int from) {
            int end = from;
            while (end < input.length()
                    && (Character.isLetterOrDigit(input.charAt(end))
                    || input.charAt(end) == '_')) {
                end++;
            }
            return end;
        }

        private static boolean isIdentifierStart(final char c) {
            return Character.isLetter(c) || c == '_';
        }

        private boolean lastIs(final TokenType type, final String text) {
            if (tokens.isEmpty()) {
                return false;
            }
            final Token last = tokens.get(tokens.size() - 1);
            return last.type() == type && last.text().equals(text);
        }

        private void merge(final String text, final int end) {
            final Token previous = tokens.remove(tokens.size() - 1);
            tokens.add(new Token(TokenType.COMPARISON, text,
                    previous.start(), end));
            position = end;
        }

        private void add(final TokenType type, final int start,
                final int end) {
            tokens.add(new Token(type, input.substring(start, end),
                    start, end));
            position = end;
        }
    }

}
