package io.workflow.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Encodes message headers as a flat JSON object of string values, and back.
 *
 * <p>Only what the stores write is accepted on decode: one object whose values are strings
 * or {@code null}. Keys are written in sorted order so equal maps encode identically.
 */
public final class HeadersCodec {

    private HeadersCodec() {
    }

    /**
     * @return the JSON text, or {@code null} for a null or empty map
     */
    public static String encode(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        StringBuilder out = new StringBuilder(headers.size() * 24);
        out.append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : new TreeMap<>(headers).entrySet()) {
            if (!first) {
                out.append(',');
            }
            first = false;
            quote(entry.getKey(), out);
            out.append(':');
            if (entry.getValue() == null) {
                out.append("null");
            } else {
                quote(entry.getValue(), out);
            }
        }
        return out.append('}').toString();
    }

    /**
     * @return the decoded map, empty for {@code null} or blank input; null values are dropped
     * @throws IllegalArgumentException if {@code json} is not a flat object of strings
     */
    public static Map<String, String> decode(String json) {
        if (json == null || json.isBlank() || json.strip().equals("null")) {
            return Map.of();
        }
        return new Parser(json).object();
    }

    private static void quote(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static final class Parser {
        private final String text;
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        Map<String, String> object() {
            Map<String, String> result = new LinkedHashMap<>();
            skipWhitespace();
            expect('{');
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return end(result);
            }
            while (true) {
                skipWhitespace();
                String key = string();
                skipWhitespace();
                expect(':');
                skipWhitespace();
                String value;
                if (text.startsWith("null", pos)) {
                    pos += 4;
                    value = null;
                } else {
                    value = string();
                }
                if (value != null) {
                    result.put(key, value);
                }
                skipWhitespace();
                char c = next();
                if (c == '}') {
                    return end(result);
                }
                if (c != ',') {
                    throw error("expected ',' or '}'");
                }
            }
        }

        private Map<String, String> end(Map<String, String> result) {
            skipWhitespace();
            if (pos != text.length()) {
                throw error("trailing characters");
            }
            return result;
        }

        private String string() {
            expect('"');
            StringBuilder out = new StringBuilder();
            while (true) {
                char c = next();
                if (c == '"') {
                    return out.toString();
                }
                if (c != '\\') {
                    out.append(c);
                    continue;
                }
                char escaped = next();
                switch (escaped) {
                    case '"', '\\', '/' -> out.append(escaped);
                    case 'n' -> out.append('\n');
                    case 'r' -> out.append('\r');
                    case 't' -> out.append('\t');
                    case 'b' -> out.append('\b');
                    case 'f' -> out.append('\f');
                    case 'u' -> {
                        if (pos + 4 > text.length()) {
                            throw error("truncated unicode escape");
                        }
                        try {
                            out.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw error("invalid unicode escape");
                        }
                        pos += 4;
                    }
                    default -> throw error("invalid escape '\\" + escaped + "'");
                }
            }
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private char peek() {
            if (pos >= text.length()) {
                throw error("unexpected end of input");
            }
            return text.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }

        private void expect(char expected) {
            if (next() != expected) {
                pos--;
                throw error("expected '" + expected + "'");
            }
        }

        private IllegalArgumentException error(String problem) {
            return new IllegalArgumentException("Invalid headers JSON at offset " + pos + ": " + problem);
        }
    }
}
