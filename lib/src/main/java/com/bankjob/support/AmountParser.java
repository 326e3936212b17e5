package com.bankjob.support;

import java.math.BigDecimal;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns scraped, locale-formatted money text into {@link BigDecimal} values. The caller names the
 * decimal separator the source uses ({@code '.'} or {@code ','}); the other character is treated as
 * a thousands separator and dropped.
 *
 * <p>{@link #parse(String, char)} is lenient and coerces unparsable text to zero, which is what the
 * ledger has always done for the derived numeric columns. {@link #parseStrict(String, char)} throws
 * instead and backs the strict validation rules.</p>
 */
public final class AmountParser {

    public static final char PERIOD = '.';
    public static final char COMMA = ',';

    private static final Logger LOGGER = Logger.getLogger(AmountParser.class.getName());
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AmountParser() {}

    /**
     * Parses {@code text} using {@code decimalSeparator}. Returns {@code null} for null input and
     * {@link BigDecimal#ZERO} for blank or unparsable input.
     */
    public static BigDecimal parse(String text, char decimalSeparator) {
        if (text == null) {
            return null;
        }
        String normalized = normalize(text, decimalSeparator);
        if (normalized.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.WARNING, "Unparsable amount \"{0}\" treated as zero", text);
            return BigDecimal.ZERO;
        }
    }

    /**
     * Parses {@code text} using {@code decimalSeparator}. Returns {@code null} for null input.
     * Throws {@link NumberFormatException} for blank or unparsable input.
     */
    public static BigDecimal parseStrict(String text, char decimalSeparator) {
        if (text == null) {
            return null;
        }
        String normalized = normalize(text, decimalSeparator);
        if (normalized.isEmpty()) {
            throw new NumberFormatException("Blank amount");
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException ex) {
            throw new NumberFormatException("Invalid amount: " + text);
        }
    }

    public static void checkSeparator(char decimalSeparator) {
        if (decimalSeparator != PERIOD && decimalSeparator != COMMA) {
            throw new IllegalArgumentException(
                    "Decimal separator must be '.' or ',' but was '" + decimalSeparator + "'");
        }
    }

    private static String normalize(String text, char decimalSeparator) {
        checkSeparator(decimalSeparator);
        String amount = WHITESPACE.matcher(text).replaceAll("");
        if (decimalSeparator == COMMA) {
            // 1.000.030,99
            return amount.replace(".", "").replace(',', '.');
        }
        return amount.replace(",", "");
    }
}
