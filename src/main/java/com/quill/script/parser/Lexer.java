package com.quill.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.quill.debug.Debug;

public class Lexer {
    private static final String TAG = "Lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean newlinePending = false;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("var", TokenType.VAR);
        map.put("let", TokenType.LET);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("to", TokenType.TO);
        map.put("step", TokenType.STEP);
        map.put("function", TokenType.FUNCTION);
        map.put("return", TokenType.RETURN);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        start = current;
        startLine = line;
        startColumn = current - lineStart + 1;
        addToken(TokenType.EOF, null, "");
        Debug.get().t(TAG, "produced " + tokens.size() + " tokens over " + line + " line(s)");
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error(ErrorKind.INVALID_CHARACTER, "Unexpected character: '!'");
                break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                newLine();
                newlinePending = true;
                break;
            case '\\':
                continuation();
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) number();
                else if (isAlpha(c)) identifier();
                else throw error(ErrorKind.INVALID_CHARACTER, "Unexpected character: '" + c + "'");
        }
    }

    // A trailing '\' joins the next physical line: the line break is consumed
    // without marking a statement boundary.
    private void continuation() {
        int look = current;
        while (look < source.length() && (source.charAt(look) == ' ' || source.charAt(look) == '\t'
                || source.charAt(look) == '\r')) {
            look++;
        }
        if (look >= source.length()) {
            current = look;
            return;
        }
        if (source.charAt(look) != '\n') {
            throw error(ErrorKind.INVALID_CHARACTER, "Unexpected character: '\\'");
        }
        current = look + 1;
        newLine();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) addToken(type, Boolean.TRUE, text);
        else if (type == TokenType.FALSE) addToken(type, Boolean.FALSE, text);
        else addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            if (source.charAt(start) == '.' || !isDigit(peekNext())) {
                throw error(ErrorKind.MALFORMED_NUMBER, "Malformed number: " + numberText());
            }
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == '.' || isAlpha(peek())) {
            throw error(ErrorKind.MALFORMED_NUMBER, "Malformed number: " + numberText());
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, Double.parseDouble(text), text);
    }

    // The offending run of number-ish characters, for the error message only.
    private String numberText() {
        int end = current;
        while (end < source.length() && (isAlphaNumeric(source.charAt(end)) || source.charAt(end) == '.')) end++;
        return source.substring(start, end);
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') {
                throw error(ErrorKind.UNTERMINATED_STRING, "Unterminated string");
            }
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                char esc = advance();
                switch (esc) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    default: sb.append(esc); break;
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error(ErrorKind.UNTERMINATED_STRING, "Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString(), source.substring(start, current));
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null, source.substring(start, current)); }
    private void addToken(TokenType type, Object literal, String text) {
        tokens.add(new Token(type, text, literal, startLine, startColumn, newlinePending));
        newlinePending = false;
    }

    private LexException error(ErrorKind kind, String msg) {
        return new LexException(kind, startLine, startColumn, msg);
    }
}
