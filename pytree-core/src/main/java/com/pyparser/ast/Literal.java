package com.pyparser.ast;

import java.math.BigInteger;

/**
 * A number or string token.
 */
public final class Literal extends Leaf {

    public Literal(String value, Position start, String prefix) {
        super(value, start, prefix);
    }

    @Override
    public String type() {
        return isString() ? "string" : "number";
    }

    public boolean isString() {
        String value = value();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'' || c == '"') {
                return true;
            }
            if (!Character.isLetter(c)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Evaluates the literal: {@link String} for text, {@code byte[]} for bytes,
     * {@link Long} or {@link BigInteger} for integers, {@link Double} for floats.
     *
     * @throws UnsupportedOperationException for imaginary numbers
     * @throws IllegalStateException if the token is not a well-formed literal
     */
    public Object eval() {
        return isString() ? evalString() : evalNumber();
    }

    private Object evalString() {
        String value = value();
        int quoteStart = 0;
        while (value.charAt(quoteStart) != '\'' && value.charAt(quoteStart) != '"') {
            quoteStart++;
        }
        String stringPrefix = value.substring(0, quoteStart).toLowerCase();
        boolean raw = stringPrefix.contains("r");
        boolean bytes = stringPrefix.contains("b");
        char quote = value.charAt(quoteStart);
        int quoteLength = value.startsWith(String.valueOf(quote).repeat(3), quoteStart) ? 3 : 1;
        int bodyEnd = value.length() - quoteLength;
        if (bodyEnd < quoteStart + quoteLength) {
            throw new IllegalStateException("Unterminated string literal: " + value);
        }
        String body = value.substring(quoteStart + quoteLength, bodyEnd);
        String text = raw ? body : unescape(body, bytes);
        if (bytes) {
            byte[] result = new byte[text.length()];
            for (int i = 0; i < text.length(); i++) {
                result[i] = (byte) text.charAt(i);
            }
            return result;
        }
        return text;
    }

    private static String unescape(String body, boolean bytes) {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000b');
                case 'x' -> i = appendCodePoint(sb, body, i, 2, next);
                case 'u', 'U' -> {
                    if (bytes) {
                        sb.append('\\').append(next);
                    } else {
                        i = appendCodePoint(sb, body, i, next == 'u' ? 4 : 8, next);
                    }
                }
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        sb.append('\\').append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendCodePoint(StringBuilder sb, String body, int from, int digits, char escape) {
        int end = from + digits;
        if (end > body.length()) {
            throw new IllegalStateException("Truncated \\" + escape + " escape");
        }
        try {
            sb.appendCodePoint(Integer.parseInt(body.substring(from, end), 16));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid \\" + escape + " escape: " + body.substring(from, end), e);
        }
        return end;
    }

    private Object evalNumber() {
        String text = value().replace("_", "");
        String lower = text.toLowerCase();
        if (lower.endsWith("j")) {
            throw new UnsupportedOperationException("Complex literals are not supported: " + value());
        }
        try {
            if (lower.startsWith("0x")) {
                return narrow(new BigInteger(text.substring(2), 16));
            }
            if (lower.startsWith("0o")) {
                return narrow(new BigInteger(text.substring(2), 8));
            }
            if (lower.startsWith("0b")) {
                return narrow(new BigInteger(text.substring(2), 2));
            }
            if (lower.contains(".") || lower.contains("e")) {
                return Double.parseDouble(text);
            }
            return narrow(new BigInteger(text));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Not a number literal: " + value(), e);
        }
    }

    private static Object narrow(BigInteger value) {
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }
}
