package com.libragraph.evidence.util;

/**
 * Removes characters that XML 1.0 cannot represent, even escaped.
 */
public final class XmlText {

    private XmlText() {
    }

    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int width = Character.charCount(cp);
            if (isLegal(cp)) {
                if (sb != null) {
                    sb.appendCodePoint(cp);
                }
            } else if (sb == null) {
                sb = new StringBuilder(text.length());
                sb.append(text, 0, i);
            }
            i += width;
        }
        return sb == null ? text : sb.toString();
    }

    private static boolean isLegal(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }
}
