package server.core;

import java.io.PrintWriter;
import java.util.*;

/**
 * Small JSON reader/writer for request and response bodies.
 * Writes Maps, Iterables, Strings, Numbers, Booleans and null; anything else is written as its string form.
 * Reads objects, arrays, strings, integers (as Integer or Long), decimals (as Double), booleans and null.
 */
public final class Json {

    private Json() {}

    /** Parses a JSON object. A blank body is an empty object; any other root is an error. */
    public static Map<String, Object> parseObject(String text) {
        if (text == null || text.isBlank()) return new LinkedHashMap<>();
        Reader r = new Reader(text);
        Object v = r.value();
        r.end();
        if (!(v instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Expected a JSON object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> m = (Map<String, Object>) v;
        return m;
    }

    public static void write(PrintWriter w, Object value) {
        w.write(stringify(value));
        w.flush();
    }

    public static String stringify(Object value) {
        return new Writer().value(value).toString();
    }

    // ---------- Writer ----------

    private static final class Writer {
        private final StringBuilder out = new StringBuilder();

        Writer value(Object v) {
            if (v == null || v instanceof Number || v instanceof Boolean) {
                out.append(v);
            } else if (v instanceof Map<?, ?> map) {
                out.append('{');
                int n = 0;
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    if (n++ > 0) out.append(',');
                    quote(String.valueOf(e.getKey())).out.append(':');
                    value(e.getValue());
                }
                out.append('}');
            } else if (v instanceof Iterable<?> items) {
                out.append('[');
                int n = 0;
                for (Object item : items) {
                    if (n++ > 0) out.append(',');
                    value(item);
                }
                out.append(']');
            } else {
                quote(v.toString());
            }
            return this;
        }

        /** Copies unescaped runs in bulk; only quotes, backslashes and control characters are escaped. */
        private Writer quote(String s) {
            out.append('"');
            int run = 0;
            for (int i = 0; i < s.length(); i++) {
                String esc = escape(s.charAt(i));
                if (esc == null) continue;
                out.append(s, run, i).append(esc);
                run = i + 1;
            }
            out.append(s, run, s.length()).append('"');
            return this;
        }

        private static String escape(char c) {
            if (c == '"' || c == '\\') return "\\" + c;
            if (c == '\n') return "\\n";
            if (c == '\r') return "\\r";
            if (c == '\t') return "\\t";
            if (c < 0x20) return String.format("\\u%04x", (int) c);
            return null;
        }

        @Override public String toString() { return out.toString(); }
    }

    // ---------- Reader ----------

    private static final class Reader {
        private final String s;
        private int i = 0;

        Reader(String s) { this.s = s; }

        Object value() {
            skipWs();
            if (i >= s.length()) throw error("Unexpected end of JSON");
            char c = s.charAt(i);
            return switch (c) {
                case '{' -> object();
                case '[' -> array();
                case '"' -> string();
                case 't' -> literal("true", Boolean.TRUE);
                case 'f' -> literal("false", Boolean.FALSE);
                case 'n' -> literal("null", null);
                default -> number();
            };
        }

        void end() {
            skipWs();
            if (i < s.length()) throw error("Unexpected trailing content");
        }

        private Map<String, Object> object() {
            i++;
            Map<String, Object> m = new LinkedHashMap<>();
            skipWs();
            if (accept('}')) return m;
            do {
                skipWs();
                if (i >= s.length() || s.charAt(i) != '"') throw error("Expected a field name");
                String key = string();
                skipWs();
                expect(':');
                m.put(key, value());
                skipWs();
            } while (accept(','));
            expect('}');
            return m;
        }

        private List<Object> array() {
            i++;
            List<Object> list = new ArrayList<>();
            skipWs();
            if (accept(']')) return list;
            do {
                list.add(value());
                skipWs();
            } while (accept(','));
            expect(']');
            return list;
        }

        private String string() {
            i++;
            StringBuilder sb = new StringBuilder();
            while (i < s.length()) {
                char c = s.charAt(i++);
                if (c == '"') return sb.toString();
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (i >= s.length()) break;
                char e = s.charAt(i++);
                switch (e) {
                    case '"', '\\', '/' -> sb.append(e);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (i + 4 > s.length()) throw error("Truncated \\u escape");
                        try {
                            sb.append((char) Integer.parseInt(s.substring(i, i + 4), 16));
                        } catch (NumberFormatException ex) {
                            throw error("Bad \\u escape");
                        }
                        i += 4;
                    }
                    default -> throw error("Bad escape \\" + e);
                }
            }
            throw error("Unterminated string");
        }

        private Object literal(String word, Object value) {
            if (!s.startsWith(word, i)) throw error("Unexpected token");
            i += word.length();
            return value;
        }

        private Number number() {
            int start = i;
            while (i < s.length() && "+-0123456789.eE".indexOf(s.charAt(i)) >= 0) i++;
            String token = s.substring(start, i);
            if (token.isEmpty()) throw error("Unexpected character '" + s.charAt(start) + "'");
            try {
                if (token.contains(".") || token.contains("e") || token.contains("E")) {
                    return Double.parseDouble(token);
                }
                long l = Long.parseLong(token);
                if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
                return l;
            } catch (NumberFormatException ex) {
                throw error("Bad number '" + token + "'");
            }
        }

        private void skipWs() {
            while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        }

        private boolean accept(char c) {
            if (i < s.length() && s.charAt(i) == c) {
                i++;
                return true;
            }
            return false;
        }

        private void expect(char c) {
            if (!accept(c)) throw error("Expected '" + c + "'");
        }

        private IllegalArgumentException error(String msg) {
            return new IllegalArgumentException("Malformed JSON at offset " + i + ": " + msg);
        }
    }
}
