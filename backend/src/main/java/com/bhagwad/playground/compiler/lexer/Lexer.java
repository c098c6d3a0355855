package com.bhagwad.playground.compiler.lexer;

import com.bhagwad.playground.exception.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class Lexer {

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
            Map.entry("shloka", TokenKind.SHLOKA),
            Map.entry("dharma", TokenKind.DHARMA),
            Map.entry("adharma", TokenKind.ADHARMA),
            Map.entry("karma", TokenKind.KARMA),
            Map.entry("arjuna", TokenKind.ARJUNA),
            Map.entry("manifest", TokenKind.MANIFEST),
            Map.entry("moksha", TokenKind.MOKSHA),
            Map.entry("maya", TokenKind.MAYA),
            Map.entry("sankalpa", TokenKind.SANKALPA),
            Map.entry("yuga", TokenKind.YUGA),
            Map.entry("meditation", TokenKind.MEDITATION),
            Map.entry("disturbance", TokenKind.DISTURBANCE),
            Map.entry("cosmic", TokenKind.COSMIC),
            Map.entry("sattva", TokenKind.SATTVA),
            Map.entry("rajas", TokenKind.RAJAS),
            Map.entry("tamas", TokenKind.TAMAS),
            Map.entry("from", TokenKind.FROM),
            Map.entry("to", TokenKind.TO),
            Map.entry("in", TokenKind.IN),
            Map.entry("while", TokenKind.WHILE),
            Map.entry("true", TokenKind.BOOLEAN),
            Map.entry("false", TokenKind.BOOLEAN));

    private static final Map<String, TokenKind> TWO_CHAR_OPERATORS = Map.of(
            "==", TokenKind.EQUAL_EQUAL,
            "!=", TokenKind.BANG_EQUAL,
            "<=", TokenKind.LESS_EQUAL,
            ">=", TokenKind.GREATER_EQUAL,
            "->", TokenKind.ARROW,
            "&&", TokenKind.AND_AND,
            "||", TokenKind.OR_OR);

    private static final Map<Character, TokenKind> ONE_CHAR_OPERATORS = Map.ofEntries(
            Map.entry('+', TokenKind.PLUS),
            Map.entry('-', TokenKind.MINUS),
            Map.entry('*', TokenKind.STAR),
            Map.entry('/', TokenKind.SLASH),
            Map.entry('%', TokenKind.PERCENT),
            Map.entry('=', TokenKind.ASSIGN),
            Map.entry('<', TokenKind.LESS),
            Map.entry('>', TokenKind.GREATER),
            Map.entry('!', TokenKind.BANG),
            Map.entry('.', TokenKind.DOT),
            Map.entry('(', TokenKind.LEFT_PAREN),
            Map.entry(')', TokenKind.RIGHT_PAREN),
            Map.entry('{', TokenKind.LEFT_BRACE),
            Map.entry('}', TokenKind.RIGHT_BRACE),
            Map.entry('[', TokenKind.LEFT_BRACKET),
            Map.entry(']', TokenKind.RIGHT_BRACKET),
            Map.entry(',', TokenKind.COMMA),
            Map.entry(';', TokenKind.SEMICOLON));

    public List<Token> tokenize(String input) throws LexException {
        Source src = new Source(input);
        List<Token> tokens = new ArrayList<>();

        while (!src.atEnd()) {
            char c = src.peek();

            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                src.advance();
                continue;
            }

            // comments (must be checked before operators)
            if (c == '/' && src.peekAt(1) == '/') {
                while (!src.atEnd() && src.peek() != '\n') {
                    src.advance();
                }
                continue;
            }

            int line = src.line;
            int column = src.column;
            int start = src.pos;

            if (c == '"' || c == '\'') {
                String value = readString(src);
                tokens.add(new Token(TokenKind.STRING, value, line, column, src.pos - start));
                continue;
            }

            if (isDigit(c)) {
                while (!src.atEnd() && isDigit(src.peek())) {
                    src.advance();
                }
                tokens.add(new Token(TokenKind.INTEGER, input.substring(start, src.pos), line, column, src.pos - start));
                continue;
            }

            if (isIdentifierStart(c)) {
                while (!src.atEnd() && isIdentifierPart(src.peek())) {
                    src.advance();
                }
                String word = input.substring(start, src.pos);
                TokenKind kind = KEYWORDS.getOrDefault(word.toLowerCase(Locale.ROOT), TokenKind.IDENTIFIER);
                tokens.add(new Token(kind, word, line, column, src.pos - start));
                continue;
            }

            if (src.pos + 1 < input.length()) {
                String two = input.substring(src.pos, src.pos + 2);
                TokenKind kind = TWO_CHAR_OPERATORS.get(two);
                if (kind != null) {
                    src.advance();
                    src.advance();
                    tokens.add(new Token(kind, two, line, column, 2));
                    continue;
                }
            }

            TokenKind kind = ONE_CHAR_OPERATORS.get(c);
            if (kind == null) {
                throw new LexException("unexpected character '" + c + "'", line, column);
            }
            src.advance();
            tokens.add(new Token(kind, String.valueOf(c), line, column, 1));
        }

        tokens.add(new Token(TokenKind.EOF, "", src.line, src.column, 0));
        return tokens;
    }

    private static String readString(Source src) throws LexException {
        int line = src.line;
        int column = src.column;
        char quote = src.advance();
        StringBuilder value = new StringBuilder();

        while (true) {
            if (src.atEnd() || src.peek() == '\n' || src.peek() == '\r') {
                throw new LexException("unterminated string literal", line, column);
            }
            char c = src.advance();
            if (c == quote) {
                return value.toString();
            }
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (src.atEnd() || src.peek() == '\n' || src.peek() == '\r') {
                throw new LexException("unterminated string literal", line, column);
            }
            char escaped = src.advance();
            switch (escaped) {
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                // \" \' \\ and any other escaped character stand for themselves
                default -> value.append(escaped);
            }
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static final class Source {
        private final String text;
        private int pos;
        private int line = 1;
        private int column = 1;

        Source(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        char peekAt(int offset) {
            int at = pos + offset;
            return at < text.length() ? text.charAt(at) : '\0';
        }

        char advance() {
            char c = text.charAt(pos++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }
    }
}
