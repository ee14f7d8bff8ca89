package com.linlay.agentruntime.json;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.regex.Pattern;

/**
 * Best-effort structural repair of truncated or slightly malformed JSON.
 * <p>
 * The repair only removes or closes structure: it closes a dangling value string, drops an
 * incomplete trailing token (partial literal, unfinished key, key without value, unfinished
 * escape), trims trailing commas and closes open objects and arrays. It never completes a
 * partial literal and never invents keys or values. Anything else that breaks the grammar before
 * the end of the input is rejected; text after a complete top-level value is ignored. Whitespace outside strings is dropped, so
 * the output of a successful repair is compact and repairing it again yields the same text.
 */
public final class JsonRepairer {

    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final String FENCE = "```";

    private JsonRepairer() {
    }

    public static String repair(String text) {
        if (text == null || text.isBlank()) {
            throw new JsonRecoveryException("nothing to repair: input is empty");
        }
        return new Scanner(stripCodeFence(text.strip())).run();
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith(FENCE)) {
            return text;
        }
        int firstLineEnd = text.indexOf('\n');
        String body = firstLineEnd < 0 ? "" : text.substring(firstLineEnd + 1);
        String trimmed = body.stripTrailing();
        if (trimmed.endsWith(FENCE)) {
            trimmed = trimmed.substring(0, trimmed.length() - FENCE.length());
        }
        return trimmed.strip();
    }

    private enum Container {
        OBJECT('}'),
        ARRAY(']');

        private final char closer;

        Container(char closer) {
            this.closer = closer;
        }
    }

    private enum Expect {
        VALUE,
        VALUE_OR_CLOSE,
        KEY_OR_CLOSE,
        COLON,
        COMMA_OR_CLOSE,
        DONE
    }

    private static final class Scanner {

        private final String text;
        private final StringBuilder out = new StringBuilder();
        private final Deque<Container> stack = new ArrayDeque<>();

        private Expect expect = Expect.VALUE;
        private boolean pendingComma;
        private int pos;

        private int safeLength = -1;
        private String safeClosers = "";

        private Scanner(String text) {
            this.text = text;
        }

        private String run() {
            while (pos < text.length() && expect != Expect.DONE) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                    continue;
                }
                if (!step(c)) {
                    break;
                }
            }
            if (safeLength < 0) {
                throw new JsonRecoveryException("no recoverable JSON prefix in input");
            }
            if (expect != Expect.DONE && pos < text.length()) {
                // stopped inside the input: a syntax error, not truncation
                throw new JsonRecoveryException("unexpected character '" + text.charAt(pos) + "' at offset " + pos);
            }
            return out.substring(0, safeLength) + safeClosers;
        }

        private boolean step(char c) {
            switch (expect) {
                case VALUE, VALUE_OR_CLOSE -> {
                    if (expect == Expect.VALUE_OR_CLOSE && c == ']') {
                        return close(Container.ARRAY);
                    }
                    return value(c);
                }
                case KEY_OR_CLOSE -> {
                    if (c == '}') {
                        return close(Container.OBJECT);
                    }
                    if (c != '"') {
                        return false;
                    }
                    flushComma();
                    if (!string(false)) {
                        return false;
                    }
                    expect = Expect.COLON;
                    return true;
                }
                case COLON -> {
                    if (c != ':') {
                        return false;
                    }
                    out.append(':');
                    pos++;
                    expect = Expect.VALUE;
                    return true;
                }
                case COMMA_OR_CLOSE -> {
                    if (c == ',') {
                        pendingComma = true;
                        pos++;
                        expect = stack.peek() == Container.ARRAY ? Expect.VALUE_OR_CLOSE : Expect.KEY_OR_CLOSE;
                        return true;
                    }
                    if (c == '}') {
                        return close(Container.OBJECT);
                    }
                    if (c == ']') {
                        return close(Container.ARRAY);
                    }
                    return false;
                }
                default -> {
                    return false;
                }
            }
        }

        private boolean value(char c) {
            if (c == '{' || c == '[') {
                flushComma();
                Container container = c == '{' ? Container.OBJECT : Container.ARRAY;
                out.append(c);
                pos++;
                stack.push(container);
                expect = container == Container.OBJECT ? Expect.KEY_OR_CLOSE : Expect.VALUE_OR_CLOSE;
                markSafe(false);
                return true;
            }
            if (c == '"') {
                flushComma();
                if (!string(true)) {
                    return false;
                }
                valueDone();
                return true;
            }
            if (c == '-' || Character.isDigit(c)) {
                return number();
            }
            if (Character.isLetter(c)) {
                return literal();
            }
            return false;
        }

        private boolean string(boolean valueString) {
            int mark = out.length();
            out.append('"');
            pos++;
            if (valueString) {
                markSafe(true);
            }
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '"') {
                    out.append('"');
                    pos++;
                    return true;
                }
                if (c == '\\') {
                    int escapeLength = escapeLength();
                    if (escapeLength < 0) {
                        // unfinished escape at end of input
                        pos = text.length();
                        return false;
                    }
                    out.append(text, pos, pos + escapeLength);
                    pos += escapeLength;
                } else if (c < 0x20) {
                    out.append(escapeControl(c));
                    pos++;
                } else {
                    out.append(c);
                    pos++;
                }
                if (valueString) {
                    markSafe(true);
                }
            }
            if (!valueString) {
                out.setLength(mark);
            }
            return false;
        }

        private int escapeLength() {
            if (pos + 1 >= text.length()) {
                return -1;
            }
            char next = text.charAt(pos + 1);
            if (next != 'u') {
                return 2;
            }
            if (pos + 6 > text.length()) {
                return -1;
            }
            return 6;
        }

        private boolean number() {
            int start = pos;
            while (pos < text.length() && isNumberChar(text.charAt(pos))) {
                pos++;
            }
            String token = text.substring(start, pos);
            if (pos >= text.length()) {
                while (!token.isEmpty() && !NUMBER.matcher(token).matches()) {
                    token = token.substring(0, token.length() - 1);
                }
                if (token.isEmpty()) {
                    return false;
                }
            } else if (!NUMBER.matcher(token).matches()) {
                return false;
            }
            flushComma();
            out.append(token);
            valueDone();
            return true;
        }

        private boolean literal() {
            int start = pos;
            while (pos < text.length() && Character.isLetter(text.charAt(pos))) {
                pos++;
            }
            String token = text.substring(start, pos);
            if (!"true".equals(token) && !"false".equals(token) && !"null".equals(token)) {
                if (pos < text.length() || !isLiteralPrefix(token)) {
                    pos = start;
                }
                return false;
            }
            flushComma();
            out.append(token);
            valueDone();
            return true;
        }

        private boolean close(Container container) {
            if (stack.peek() != container) {
                return false;
            }
            pendingComma = false;
            stack.pop();
            out.append(container.closer);
            pos++;
            valueDone();
            return true;
        }

        private void valueDone() {
            expect = stack.isEmpty() ? Expect.DONE : Expect.COMMA_OR_CLOSE;
            markSafe(false);
        }

        private void flushComma() {
            if (pendingComma) {
                out.append(',');
                pendingComma = false;
            }
        }

        private void markSafe(boolean insideString) {
            safeLength = out.length();
            StringBuilder closers = new StringBuilder();
            if (insideString) {
                closers.append('"');
            }
            Iterator<Container> iterator = stack.iterator();
            while (iterator.hasNext()) {
                closers.append(iterator.next().closer);
            }
            safeClosers = closers.toString();
        }

        private static boolean isLiteralPrefix(String token) {
            return "true".startsWith(token) || "false".startsWith(token) || "null".startsWith(token);
        }

        private static boolean isNumberChar(char c) {
            return Character.isDigit(c) || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E';
        }

        private static String escapeControl(char c) {
            return switch (c) {
                case '\n' -> "\\n";
                case '\r' -> "\\r";
                case '\t' -> "\\t";
                case '\b' -> "\\b";
                case '\f' -> "\\f";
                default -> String.format("\\u%04x", (int) c);
            };
        }
    }
}
