package org.calista.accuracy.telemetry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogFmt — small helpers for log rendering.
 *
 * <ul>
 *   <li>{@link #line(String, Map[])}: single line {@code name k=v k=v}, for per-event records</li>
 *   <li>{@link #box(String, Consumer)}: framed multi-line block, for startup summaries</li>
 * </ul>
 */
public final class LogFmt {

    private LogFmt() {}

    @SafeVarargs
    public static String line(String name, Map<String, ?>... sections) {
        StringBuilder b = new StringBuilder(64);
        b.append(name == null ? "" : name);
        for (Map<String, ?> section : sections) {
            if (section == null) continue;
            for (Map.Entry<String, ?> e : section.entrySet()) {
                b.append(' ').append(e.getKey()).append('=').append(value(e.getValue()));
            }
        }
        return b.toString();
    }

    private static String value(Object v) {
        if (v == null) return "null";
        String s = String.valueOf(v);
        if (s.isEmpty()) return "\"\"";
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '=' || c == '"') {
                return '"' + s.replace("\"", "\\\"") + '"';
            }
        }
        return s;
    }

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    // ---------------------------------------------------------------------
    // Box
    // ---------------------------------------------------------------------

    public static final class BoxBuilder {
        private static final String SEP = "--";
        private final List<String> lines = new ArrayList<>(16);

        public BoxBuilder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public BoxBuilder sep() {
            lines.add(SEP);
            return this;
        }
    }

    private static String renderBox(String title, List<String> lines) {
        int width = title.length();
        for (String l : lines) {
            if (!BoxBuilder.SEP.equals(l)) width = Math.max(width, l.length());
        }
        int w = Math.max(24, width + 2);
        String rule = "─".repeat(w);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('┌').append(rule).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append('├').append(rule).append("┤\n");
        for (String l : lines) {
            if (BoxBuilder.SEP.equals(l)) {
                out.append('│').append(rule).append("│\n");
            } else {
                out.append("│ ").append(padRight(l, w - 1)).append("│\n");
            }
        }
        out.append('└').append(rule).append('┘');
        return out.toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
