package com.carelog.concern;

/**
 * Comparison rules for concern summary text.
 *
 * Two summaries are the same when they are equal after unifying line endings,
 * dropping trailing whitespace on every line and trimming the whole text.
 */
public final class SummaryContent {

    private SummaryContent() {
    }

    public static String normalize(String content) {
        if (content == null) {
            return "";
        }
        String unified = content.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder sb = new StringBuilder(unified.length());
        for (String line : unified.split("\n", -1)) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(line.stripTrailing());
        }
        return sb.toString().strip();
    }

    public static boolean differs(String current, String candidate) {
        return !normalize(current).equals(normalize(candidate));
    }

    /**
     * Appends {@code entry} as a new paragraph; returns {@code entry} alone when
     * there is no existing content.
     */
    public static String appendParagraph(String content, String entry) {
        if (content == null || content.isBlank()) {
            return entry;
        }
        return content.stripTrailing() + "\n\n" + entry;
    }
}
