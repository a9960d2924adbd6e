package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.InMemoryStatementSource;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link WordCounter}, {@link WordCounts} and
 * {@link ReadingSpeed}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class WordCounterTest {

    private final WordCounter counter = new WordCounter();

    @Test
    void whenCounting_givenThreeDialogueLines_shouldSumThem() {
        final WordCounts counts = count("label start:\n"
                + "    \"" + words(20) + "\"\n"
                + "    e \"" + words(15) + "\"\n"
                + "    \"" + words(5) + "\"\n");

        assertEquals(Map.of("start", 40), counts.asMap());
        assertEquals(40, counts.total());
        assertEquals(0.2, ReadingSpeed.standard().minutes(counts.total()));
    }

    @Test
    void whenCounting_givenMenusBlocksAndNestedLabels_shouldAttributeWords() {
        final WordCounts counts = count("""
                label start:
                    "One two three."
                    menu:
                        "Where now?"
                        "Go left":
                            "You walk left."
                    if brave:
                        "Onward!"
                    label .inner:
                        "Inner words here."
                label empty:
                    return
                """);

        final Map<String, Integer> expected = new LinkedHashMap<>();
        expected.put("start", 3 + 2 + 2 + 3 + 1);
        expected.put("start.inner", 3);
        expected.put("empty", 0);
        assertEquals(expected, counts.asMap());
        assertEquals(14, counts.total());
        assertEquals(2, counts.labelsWithContent());
    }

    @Test
    void whenCounting_givenVoicedScene_shouldCountOnlyDialogue() {
        final WordCounts counts = count("""
                label start:
                    play music "audio/theme.ogg" fadein 1.0
                    voice "v/line1.ogg"
                    show text "Chapter One"
                    e "Hello there."
                """);

        assertEquals(Map.of("start", 2), counts.asMap());
    }

    @Test
    void whenStrippingMarkup_givenTagsAndInterpolation_shouldDropThem() {
        assertEquals(3, WordCounter.countWords(
                "{b}Hello{/b} [player_name], welcome{w}!"));
        assertEquals("Hello !", WordCounter.stripMarkup("Hello [name]!"));
    }

    @Test
    void whenStrippingMarkup_givenEscapedBrackets_shouldKeepThemLiteral() {
        assertEquals("use {braces}} and [x]",
                WordCounter.stripMarkup("use {{braces}} and [[x]"));
        assertEquals(4, WordCounter.countWords("use {{braces}} and [[x]"));
    }

    @Test
    void whenCounting_givenBlankOrNullText_shouldReturnZero() {
        assertEquals(0, WordCounter.countWords(null));
        assertEquals(0, WordCounter.countWords("   {i}{/i}  "));
    }

    @Test
    void whenConvertingToMinutes_givenCustomSpeed_shouldRoundHalfUp() {
        assertEquals(0.3, new ReadingSpeed(100).minutes(25));
        assertEquals(1.0, ReadingSpeed.standard().minutes(199));
        assertEquals(0.0, ReadingSpeed.standard().minutes(0));
        assertThrows(IllegalArgumentException.class,
                () -> new ReadingSpeed(0));
    }

    private WordCounts count(final String script) {
        return counter.count(new RouteGraphBuilder().build(
                new InMemoryStatementSource().put("script.rpy", script))
                .labels());
    }

    private static String words(final int count) {
        final StringBuilder text = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                text.append(' ');
            }
            text.append("word").append(i);
        }
        return text.toString();
    }

}
