package nl.bytesoflife.deltabrep.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Accumulates the DATA section of a Part-21 file. Every call to {@link #add(String)}
 * takes the next instance id from a single counter starting at 1, so an entity can
 * only reference entities added before it.
 */
class StepEntityWriter {

    private int nextId = 1;
    private final List<String> lines = new ArrayList<>();

    /**
     * Appends {@code #n=entity;} and returns the reference {@code #n}.
     */
    String add(String entity) {
        String ref = "#" + nextId++;
        lines.add(ref + "=" + entity + ";");
        return ref;
    }

    List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    int getEntityCount() {
        return lines.size();
    }

    /**
     * Encodes text for use inside a Part-21 string literal. Apostrophes and
     * backslashes are doubled, characters outside printable ASCII become
     * {@code \X2\hhhh\X0\} runs, and code points beyond the Basic Multilingual
     * Plane become {@code \X4\hhhhhhhh\X0\} runs.
     */
    static String escape(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            if (cp >= 0x20 && cp < 0x7F) {
                if (cp == '\'') sb.append("''");
                else if (cp == '\\') sb.append("\\\\");
                else sb.append((char) cp);
                i++;
                continue;
            }
            boolean wide = Character.isSupplementaryCodePoint(cp);
            sb.append(wide ? "\\X4\\" : "\\X2\\");
            while (i < s.length()) {
                cp = s.codePointAt(i);
                if ((cp >= 0x20 && cp < 0x7F) || Character.isSupplementaryCodePoint(cp) != wide) {
                    break;
                }
                sb.append(String.format(Locale.US, wide ? "%08X" : "%04X", cp));
                i += Character.charCount(cp);
            }
            sb.append("\\X0\\");
        }
        return sb.toString();
    }

    static String real(double value) {
        return String.format(Locale.US, "%.6f", value);
    }

    static String real3(double value) {
        return String.format(Locale.US, "%.3f", value);
    }

    static String point(double x, double y, double z) {
        return "(" + real(x) + "," + real(y) + "," + real(z) + ")";
    }

    static String bool(boolean value) {
        return value ? ".T." : ".F.";
    }

    static String list(List<String> refs) {
        return "(" + String.join(",", refs) + ")";
    }
}
