package com.delta.screener.screening.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class TextUtils {
    private TextUtils() {
    }

    /**
     * Upper-cases the first letter of every letter run and lower-cases the rest:
     * "node.js" becomes "Node.Js", "ci/cd" becomes "Ci/Cd".
     */
    public static String titleCase(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                out.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                out.append(c);
                previousIsLetter = false;
            }
        }
        return out.toString();
    }

    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return List.of(text.split("\\r?\\n", -1));
    }

    public static List<String> lowercase(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(value == null ? "" : value.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
