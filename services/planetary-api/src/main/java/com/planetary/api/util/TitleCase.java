package com.planetary.api.util;

/**
 * Title-casing of names: the first letter of every run of letters is upper
 * case, the remaining letters of the run are lower case. Non-letters split
 * runs, so {@code "o'neil"} becomes {@code "O'Neil"} and {@code "mary-JANE"}
 * becomes {@code "Mary-Jane"}.
 */
public final class TitleCase {

    private TitleCase() {
    }

    public static String apply(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder result = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toTitleCase(c));
                previousIsLetter = true;
            } else {
                result.append(c);
                previousIsLetter = false;
            }
        }
        return result.toString();
    }
}
