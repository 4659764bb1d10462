package com.pyparser;

import com.pyparser.ast.Position;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Python source into tokens. Never fails: anything unrecognized becomes an
 * {@link TokenType#ERRORTOKEN}, and concatenating {@code prefix + value} of all tokens
 * gives back the input.
 *
 * <p>No INDENT/DEDENT tokens are produced; indentation stays in the prefix and the parser
 * reads it from token columns.
 */
public class Tokenizer {

    /**
     * Keywords that cannot appear inside brackets. A line starting with one of them ends
     * any open bracket.
     */
    static final Set<String> ALWAYS_BREAK_KEYWORDS = Set.of(
        "import", "class", "def", "try", "except", "finally", "while", "with", "return",
        "continue", "break", "del", "pass", "global", "assert", "nonlocal");

    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...", "->", ":=", "**", "//", "<<", ">>", "<=", ">=",
        "==", "!=", "<>", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]",
        "{", "}", ",", ":", ";", ".", "="
    };

    private static final Pattern NUMBER = Pattern.compile(
        "0[xX](?:_?[0-9a-fA-F])+"
            + "|0[bB](?:_?[01])+"
            + "|0[oO](?:_?[0-7])+"
            + "|(?:(?:[0-9](?:_?[0-9])*)?\\.[0-9](?:_?[0-9])*|[0-9](?:_?[0-9])*\\.?)"
            + "(?:[eE][+-]?[0-9](?:_?[0-9])*)?[jJ]?");

    private static final Set<String> STRING_PREFIXES = Set.of(
        "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder prefix = new StringBuilder();
    private int pos;
    private int line = 1;
    private int column;
    private int bracketDepth;
    private boolean lineHasToken;

    public Tokenizer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                prefix.append(c);
                pos++;
                column++;
            } else if (c == '#') {
                int end = pos;
                while (end < source.length() && source.charAt(end) != '\n' && source.charAt(end) != '\r') {
                    end++;
                }
                prefix.append(source, pos, end);
                column += end - pos;
                pos = end;
            } else if (c == '\\' && newlineLength(pos + 1) > 0) {
                int length = 1 + newlineLength(pos + 1);
                prefix.append(source, pos, pos + length);
                pos += length;
                line++;
                column = 0;
            } else if (c == '\n' || c == '\r') {
                lineBreak(newlineLength(pos));
            } else {
                readToken(c);
            }
        }
        emit(TokenType.ENDMARKER, "", new Position(line, column));
        return tokens;
    }

    private int newlineLength(int at) {
        if (at >= source.length()) {
            return 0;
        }
        char c = source.charAt(at);
        if (c == '\r') {
            return at + 1 < source.length() && source.charAt(at + 1) == '\n' ? 2 : 1;
        }
        return c == '\n' ? 1 : 0;
    }

    private void lineBreak(int length) {
        String newline = source.substring(pos, pos + length);
        if (lineHasToken && bracketDepth == 0) {
            emit(TokenType.NEWLINE, newline, new Position(line, column));
            lineHasToken = false;
        } else if (lineHasToken && startsWithBreakKeyword(pos + length)) {
            emit(TokenType.NEWLINE, newline, new Position(line, column));
            lineHasToken = false;
            bracketDepth = 0;
        } else {
            prefix.append(newline);
        }
        pos += length;
        line++;
        column = 0;
    }

    /**
     * Looks past blank lines, comments and indentation for a statement-only keyword.
     */
    private boolean startsWithBreakKeyword(int from) {
        int i = from;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == ' ' || c == '\t' || c == '\f' || c == '\n' || c == '\r') {
                i++;
            } else if (c == '#') {
                while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
                    i++;
                }
            } else {
                break;
            }
        }
        int end = i;
        while (end < source.length() && isIdentifierPart(source.codePointAt(end))) {
            end += Character.charCount(source.codePointAt(end));
        }
        return end > i && ALWAYS_BREAK_KEYWORDS.contains(source.substring(i, end));
    }

    private void readToken(char c) {
        Position start = new Position(line, column);
        int stringStart = stringStart();
        if (stringStart >= 0) {
            readString(start, stringStart);
            return;
        }
        if (Character.isDigit(c) || c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
            Matcher matcher = NUMBER.matcher(source).region(pos, source.length());
            if (matcher.lookingAt()) {
                advanceToken(TokenType.NUMBER, matcher.group(), start);
                return;
            }
        }
        int codePoint = source.codePointAt(pos);
        if (isIdentifierStart(codePoint)) {
            int end = pos;
            while (end < source.length() && isIdentifierPart(source.codePointAt(end))) {
                end += Character.charCount(source.codePointAt(end));
            }
            advanceToken(TokenType.NAME, source.substring(pos, end), start);
            return;
        }
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                updateBrackets(operator);
                advanceToken(TokenType.OP, operator, start);
                return;
            }
        }
        advanceToken(TokenType.ERRORTOKEN, new String(Character.toChars(codePoint)), start);
    }

    private void updateBrackets(String operator) {
        switch (operator) {
            case "(", "[", "{" -> bracketDepth++;
            case ")", "]", "}" -> bracketDepth = Math.max(0, bracketDepth - 1);
            default -> {
            }
        }
    }

    /**
     * Offset of the opening quote if a string literal (with optional prefix) starts here,
     * otherwise -1.
     */
    private int stringStart() {
        int i = pos;
        while (i < source.length() && i - pos < 2 && Character.isLetter(source.charAt(i))) {
            i++;
        }
        for (int quote = pos; quote <= i && quote < source.length(); quote++) {
            char c = source.charAt(quote);
            if (c == '\'' || c == '"') {
                String stringPrefix = source.substring(pos, quote).toLowerCase();
                return stringPrefix.isEmpty() || STRING_PREFIXES.contains(stringPrefix) ? quote : -1;
            }
            if (!Character.isLetter(c)) {
                return -1;
            }
        }
        return -1;
    }

    private void readString(Position start, int quoteStart) {
        char quote = source.charAt(quoteStart);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), quoteStart);
        int i = quoteStart + (triple ? 3 : 1);
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 1 + Math.max(1, newlineLength(i + 1));
                continue;
            }
            if (!triple && (c == '\n' || c == '\r')) {
                advanceToken(TokenType.ERRORTOKEN, source.substring(pos, i), start);
                return;
            }
            if (c == quote && (!triple || source.startsWith(String.valueOf(quote).repeat(3), i))) {
                int end = i + (triple ? 3 : 1);
                advanceToken(TokenType.STRING, source.substring(pos, end), start);
                return;
            }
            i++;
        }
        advanceToken(TokenType.ERRORTOKEN, source.substring(pos), start);
    }

    private void advanceToken(TokenType type, String value, Position start) {
        emit(type, value, start);
        lineHasToken = true;
        pos += value.length();
        int lastBreak = -1;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\n' || c == '\r' && (i + 1 == value.length() || value.charAt(i + 1) != '\n')) {
                line++;
                lastBreak = i;
            }
        }
        column = lastBreak < 0 ? column + value.length() : value.length() - lastBreak - 1;
    }

    private void emit(TokenType type, String value, Position start) {
        tokens.add(new Token(type, value, start, prefix.toString()));
        prefix.setLength(0);
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || Character.isUnicodeIdentifierPart(codePoint) && !Character.isIdentifierIgnorable(codePoint);
    }
}
