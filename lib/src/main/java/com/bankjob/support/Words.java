package com.bankjob.support;

import java.util.Locale;

public final class Words {

    private Words() {}

    /** Lower-cases {@code text} and upper-cases the first letter of every word. */
    public static String capitalizeWords(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder(lower.length());
        boolean atWordStart = true;
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            boolean wordChar = Character.isLetterOrDigit(c) || c == '_';
            builder.append(atWordStart && wordChar ? Character.toUpperCase(c) : c);
            atWordStart = !wordChar;
        }
        return builder.toString();
    }
}
