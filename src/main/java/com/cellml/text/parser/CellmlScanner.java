package com.cellml.text.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cellml.text.parser.CellmlToken.TokenType;

/**
 * Scanner for CellML Text source.
 *
 * Holds exactly one current token. {@link #nextToken()} advances by one token
 * and keeps the 1-based line count, including newlines inside {@code //} comments.
 * Unknown characters are skipped, logged and recorded as {@link LexicalDiagnostic}s.
 */
public class CellmlScanner {
    private static final Logger log = LoggerFactory.getLogger(CellmlScanner.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("def", TokenType.KW_DEF),
        Map.entry("model", TokenType.KW_MODEL),
        Map.entry("comp", TokenType.KW_COMP),
        Map.entry("enddef", TokenType.KW_ENDDEF),
        Map.entry("as", TokenType.KW_AS),
        Map.entry("var", TokenType.KW_VAR),
        Map.entry("unit", TokenType.KW_UNIT),
        Map.entry("sel", TokenType.KW_SEL),
        Map.entry("case", TokenType.KW_CASE),
        Map.entry("otherwise", TokenType.KW_OTHERWISE),
        Map.entry("endsel", TokenType.KW_ENDSEL),
        Map.entry("and", TokenType.OP_AND),
        Map.entry("or", TokenType.OP_OR)
    );

    private final String source;
    private final List<LexicalDiagnostic> diagnostics = new ArrayList<>();
    private int pos = 0;
    private int line = 1;
    private CellmlToken current;

    public CellmlScanner(String source) {
        this.source = source != null ? source : "";
        nextToken();
    }

    public CellmlToken getToken() {
        return current;
    }

    public TokenType getType() {
        return current.getType();
    }

    public String getValue() {
        return current.getValue();
    }

    public int getLine() {
        return line;
    }

    public List<LexicalDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Advance to the next token.
     */
    public CellmlToken nextToken() {
        while (true) {
            skipWhitespaceAndComments();

            if (pos >= source.length()) {
                current = new CellmlToken(TokenType.EOF, "", line);
                return current;
            }

            char c = source.charAt(pos);

            if (isIdentifierStart(c)) {
                current = readIdentifierOrKeyword();
                return current;
            }

            if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
                current = readNumber();
                return current;
            }

            CellmlToken symbol = readSymbol(c);
            if (symbol != null) {
                current = symbol;
                return current;
            }
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peekChar(1) == '/') {
                // Comment runs to end of line; the newline itself is counted above
                pos += 2;
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private CellmlToken readIdentifierOrKeyword() {
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        String word = source.substring(start, pos);
        return new CellmlToken(KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER), word, line);
    }

    private CellmlToken readNumber() {
        int start = pos;
        skipDigits();

        if (peekChar(0) == '.') {
            pos++;
            skipDigits();
        }

        char e = peekChar(0);
        if (e == 'e' || e == 'E') {
            char next = peekChar(1);
            boolean signed = next == '+' || next == '-';
            if (isDigit(signed ? peekChar(2) : next)) {
                pos += signed ? 2 : 1;
                skipDigits();
            }
        }

        return new CellmlToken(TokenType.NUMBER, source.substring(start, pos), line);
    }

    /**
     * Reads a symbol token, or returns null after recording an unknown character.
     */
    private CellmlToken readSymbol(char c) {
        pos++;

        switch (c) {
            case '=':
                return twoCharOr('=', TokenType.OP_EQ, "==", TokenType.OP_ASSIGN, "=");
            case '<':
                return twoCharOr('=', TokenType.OP_LE, "<=", TokenType.OP_LT, "<");
            case '>':
                return twoCharOr('=', TokenType.OP_GE, ">=", TokenType.OP_GT, ">");
            case '!':
                if (peekChar(0) == '=') {
                    pos++;
                    return new CellmlToken(TokenType.OP_NE, "!=", line);
                }
                break;
            case '+':
                return new CellmlToken(TokenType.OP_PLUS, "+", line);
            case '-':
                return new CellmlToken(TokenType.OP_MINUS, "-", line);
            case '*':
                return new CellmlToken(TokenType.OP_TIMES, "*", line);
            case '/':
                return new CellmlToken(TokenType.OP_DIVIDE, "/", line);
            case '(':
                return new CellmlToken(TokenType.LPAREN, "(", line);
            case ')':
                return new CellmlToken(TokenType.RPAREN, ")", line);
            case '{':
                return new CellmlToken(TokenType.LBRACE, "{", line);
            case '}':
                return new CellmlToken(TokenType.RBRACE, "}", line);
            case ':':
                return new CellmlToken(TokenType.COLON, ":", line);
            case ';':
                return new CellmlToken(TokenType.SEMICOLON, ";", line);
            case ',':
                return new CellmlToken(TokenType.COMMA, ",", line);
            default:
                break;
        }

        LexicalDiagnostic diagnostic = new LexicalDiagnostic(line, c);
        diagnostics.add(diagnostic);
        log.warn("{} at line {}", diagnostic.getMessage(), line);
        return null;
    }

    private CellmlToken twoCharOr(char second, TokenType pairType, String pairText,
                                  TokenType singleType, String singleText) {
        if (peekChar(0) == second) {
            pos++;
            return new CellmlToken(pairType, pairText, line);
        }
        return new CellmlToken(singleType, singleText, line);
    }

    private void skipDigits() {
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
        }
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
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
}
