package org.Aayush.assignment.scoring;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default driver/destination scorer.
 *
 * <ul>
 * <li>Even street-name length: base score is the number of vowels in the driver name times 1.5.</li>
 * <li>Odd street-name length: base score is the number of consonants in the driver name.</li>
 * <li>When the whitespace-free lengths of driver name and address share a factor other than 1,
 * the base score is raised by 50%.</li>
 * </ul>
 *
 * <p>The street name is the first comma-separated segment of the address without its
 * leading token (house number) and trailing token (street suffix), lower-cased with
 * whitespace removed.</p>
 */
public final class StreetNameSuitabilityScorer implements SuitabilityScorer {
    static final double VOWEL_WEIGHT = 1.5d;
    static final double CONSONANT_WEIGHT = 1.0d;
    static final double COMMON_FACTOR_BONUS = 1.5d;

    // Words that are neither the first nor the last token of the segment.
    private static final Pattern INNER_WORD = Pattern.compile("(?<=.)(\\b\\w+\\b)(?![^\\s]*$)", Pattern.MULTILINE);
    private static final Pattern VOWEL = Pattern.compile("[aeiou]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSONANT = Pattern.compile("[bcdfghjklmnpqrstvwxyz]", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public double score(String driver, String address) {
        Objects.requireNonNull(driver, "driver");
        Objects.requireNonNull(address, "address");

        double base = streetName(address).length() % 2 == 0
                ? vowelCount(driver) * VOWEL_WEIGHT
                : consonantCount(driver) * CONSONANT_WEIGHT;
        return sharesCommonFactor(driver, address) ? base * COMMON_FACTOR_BONUS : base;
    }

    /**
     * Extracts the bare street name from an address line.
     *
     * @param address full address, comma separated.
     * @return lower-cased street name without whitespace, or empty when none is found.
     */
    static String streetName(String address) {
        String segment = address.split(",", -1)[0];
        Matcher matcher = INNER_WORD.matcher(segment);
        StringBuilder name = new StringBuilder();
        while (matcher.find()) {
            name.append(matcher.group(1));
        }
        return name.toString().toLowerCase(Locale.ROOT);
    }

    static int vowelCount(String text) {
        return count(VOWEL, text);
    }

    static int consonantCount(String text) {
        return count(CONSONANT, text);
    }

    /**
     * Returns whether the whitespace-free lengths of both strings share a factor greater than 1.
     */
    static boolean sharesCommonFactor(String driver, String address) {
        int[] driverFactors = factorsExcludingOne(stripWhitespace(driver).length());
        for (int factor : factorsExcludingOne(stripWhitespace(address).length())) {
            if (Arrays.binarySearch(driverFactors, factor) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every divisor of {@code value} except 1, in ascending order.
     *
     * @param value non-negative integer; 0 and 1 yield no factors.
     */
    static int[] factorsExcludingOne(int value) {
        IntOpenHashSet factors = new IntOpenHashSet();
        int limit = (int) Math.floor(Math.sqrt(value));
        for (int i = 1; i <= limit; i++) {
            if (value % i == 0) {
                factors.add(i);
                factors.add(value / i);
            }
        }
        factors.remove(1);
        int[] sorted = factors.toIntArray();
        Arrays.sort(sorted);
        return sorted;
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String stripWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll("");
    }
}
