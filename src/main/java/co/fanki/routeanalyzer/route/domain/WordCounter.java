package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.Statement;
import co.fanki.routeanalyzer.script.domain.StatementKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts the words a reader sees in each label.
 *
 * <p>Dialogue lines and choice display texts count, wherever they sit in
 * the label body. Nested labels count for themselves. Inline markup is
 * dropped before splitting on whitespace: {@code {...}} text tags and
 * {@code [...]} interpolations. The {@code {{} and {@code [[} escapes
 * stand for a literal bracket.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class WordCounter {

    /**
     * Counts the words of every label.
     *
     * @param labels the declarations, in declaration order
     * @return label name to word count, every label present
     */
    public WordCounts count(final List<LabelDeclaration> labels) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final LabelDeclaration label : labels) {
            counts.merge(label.name(), countBody(label.body()), Integer::sum);
        }
        return new WordCounts(counts);
    }

    private int countBody(final List<Statement> body) {
        int words = 0;
        for (final Statement statement : body) {
            if (statement.is(StatementKind.LABEL)) {
                continue;
            }
            if (statement.is(StatementKind.SAY)
                    || statement.is(StatementKind.CHOICE)) {
                words += countWords(statement.text());
            }
            words += countBody(statement.children());
        }
        return words;
    }

    /**
     * Counts the visible words of one text.
     *
     * @param text the text with markup, may be null
     * @return the word count
     */
    public static int countWords(final String text) {
        final String clean = stripMarkup(text).strip();
        if (clean.isEmpty()) {
            return 0;
        }
        return clean.split("\\s+").length;
    }

    /**
     * Removes text tags and interpolations.
     *
     * @param text the text, may be null
     * @return the visible text, never null
     */
    public static String stripMarkup(final String text) {
        if (text == null) {
            return "";
        }
        final StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if ((c == '{' || c == '[')
                    && i + 1 < text.length() && text.charAt(i + 1) == c) {
                out.append(c);
                i += 2;
                continue;
            }
            if (c == '{' || c == '[') {
                final int close = text.indexOf(c == '{' ? '}' : ']', i + 1);
                if (close >= 0) {
                    i = close + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

}
