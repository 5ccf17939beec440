package com.cellml.text.parser;

import java.util.EnumSet;
import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Represents a token produced by the CellML Text scanner.
 */
@Value
@AllArgsConstructor
public class CellmlToken {
    TokenType type;
    String value;
    int line;

    public enum TokenType {
        EOF,
        IDENTIFIER,
        NUMBER,

        KW_DEF,
        KW_MODEL,
        KW_COMP,
        KW_ENDDEF,
        KW_AS,
        KW_VAR,
        KW_UNIT,
        KW_SEL,
        KW_CASE,
        KW_OTHERWISE,
        KW_ENDSEL,
        OP_AND,
        OP_OR,

        OP_ASSIGN,
        OP_EQ,
        OP_NE,
        OP_LT,
        OP_LE,
        OP_GT,
        OP_GE,
        OP_PLUS,
        OP_MINUS,
        OP_TIMES,
        OP_DIVIDE,
        COMMA,
        COLON,
        SEMICOLON,
        LPAREN,
        RPAREN,
        LBRACE,
        RBRACE
    }

    private static final Set<TokenType> COMPARISONS = EnumSet.of(
            TokenType.OP_EQ, TokenType.OP_NE,
            TokenType.OP_LT, TokenType.OP_LE,
            TokenType.OP_GT, TokenType.OP_GE);

    private static final Set<TokenType> FACTOR_STARTS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.OP_MINUS,
            TokenType.LPAREN, TokenType.KW_SEL);

    public boolean isComparison() {
        return COMPARISONS.contains(type);
    }

    /**
     * True when this token can open a math factor, and therefore a math statement.
     */
    public boolean startsFactor() {
        return FACTOR_STARTS.contains(type);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }
}
