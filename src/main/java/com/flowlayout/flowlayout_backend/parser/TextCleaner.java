package com.flowlayout.flowlayout_backend.parser;

import java.util.regex.Pattern;

/**
 * Text fix-ups applied before and during parsing. Diagram text often arrives
 * JSON-escaped from an upstream generator ({@code [\"5\"]}, literal {@code \n}).
 */
public final class TextCleaner {

    private static final Pattern BR_TAG = Pattern.compile("(?i)<br\\s*/?>");
    private static final Pattern NBSP = Pattern.compile("(?i)&nbsp;");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextCleaner() {
    }

    /**
     * Unescape quote, newline, tab and backslash sequences of the whole source text.
     * Sequences are read left to right, so an escaped backslash never pairs with the
     * character after it.
     */
    public static String unescape(String source) {
        if (source == null) return "";
        String s = source.replace("\r\n", "\n").replace('\r', '\n');
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            s = s.substring(1, s.length() - 1);
        }
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 == s.length()) {
                out.append(c);
                continue;
            }
            char next = s.charAt(i + 1);
            switch (next) {
                case '"' -> out.append('"');
                case 'n' -> out.append('\n');
                case 't' -> out.append(' ');
                case '\\' -> out.append('\\');
                default -> {
                    out.append(c);
                    continue;
                }
            }
            i++;
        }
        return out.toString();
    }

    /** Display label: markup, quotes and repeated whitespace removed. */
    public static String cleanLabel(String raw) {
        if (raw == null) return "";
        String s = BR_TAG.matcher(raw).replaceAll(" ");
        s = NBSP.matcher(s).replaceAll(" ");
        s = s.replace("\\n", " ")
                .replace('\n', ' ')
                .replace('<', ' ')
                .replace('>', ' ')
                .replace("\"", "");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /** Ids that are empty or made only of punctuation never become nodes. */
    public static boolean isValidId(String id) {
        if (id == null || id.isBlank()) return false;
        for (int i = 0; i < id.length(); i++) {
            if (Character.isLetterOrDigit(id.charAt(i))) return true;
        }
        return false;
    }
}
