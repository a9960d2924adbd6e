package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts word counts into reading minutes.
 *
 * <p>Rounding happens only here, at report time, half-up to one decimal
 * place. Callers sum raw word counts before converting.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReadingSpeed {

    /** Average reading speed used when none is configured. */
    public static final int DEFAULT_WORDS_PER_MINUTE = 200;

    private final int wordsPerMinute;

    /**
     * Creates a reading speed.
     *
     * @param theWordsPerMinute words read per minute, must be positive
     */
    public ReadingSpeed(final int theWordsPerMinute) {
        Preconditions.require(theWordsPerMinute > 0,
                "Words per minute must be positive");
        wordsPerMinute = theWordsPerMinute;
    }

    /** Creates the default reading speed. */
    public static ReadingSpeed standard() {
        return new ReadingSpeed(DEFAULT_WORDS_PER_MINUTE);
    }

    /**
     * Estimates the reading time of a number of words.
     *
     * @param words the word count
     * @return the minutes, rounded to one decimal
     */
    public double minutes(final long words) {
        return round(words / (double) wordsPerMinute, 1);
    }

    public int wordsPerMinute() {
        return wordsPerMinute;
    }

    /**
     * Rounds half-up to a number of decimals.
     *
     * @param value the value to round
     * @param scale the decimals to keep
     * @return the rounded value
     */
    static double round(final double value, final int scale) {
        return BigDecimal.valueOf(value)
                .setScale(scale, RoundingMode.HALF_UP)
                .doubleValue();
    }

}
