package com.cellml.text.parser;

import com.cellml.text.parser.CellmlToken.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CellmlScanner.
 */
class CellmlScannerTest {

    @Test
    void testKeywordsAndIdentifiers() {
        assertThat(types("def model hh as enddef;")).containsExactly(
                TokenType.KW_DEF, TokenType.KW_MODEL, TokenType.IDENTIFIER, TokenType.KW_AS,
                TokenType.KW_ENDDEF, TokenType.SEMICOLON, TokenType.EOF);
    }

    @Test
    void testAndOrAreOperators() {
        assertThat(types("a and b or c")).containsExactly(
                TokenType.IDENTIFIER, TokenType.OP_AND, TokenType.IDENTIFIER, TokenType.OP_OR,
                TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void testNumberForms() {
        List<CellmlToken> tokens = tokens("1.5e3 3.0E-2 .5 42");

        assertThat(tokens).extracting(CellmlToken::getValue)
                .containsExactly("1.5e3", "3.0E-2", ".5", "42", "");
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.NUMBER);
    }

    @Test
    void testExponentNeedsDigit() {
        List<CellmlToken> tokens = tokens("2e x");

        assertThat(tokens).extracting(CellmlToken::getValue).containsExactly("2", "e", "x", "");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void testTwoCharacterOperators() {
        assertThat(types("== = != <= < >= >")).containsExactly(
                TokenType.OP_EQ, TokenType.OP_ASSIGN, TokenType.OP_NE, TokenType.OP_LE,
                TokenType.OP_LT, TokenType.OP_GE, TokenType.OP_GT, TokenType.EOF);
    }

    @Test
    void testCommentsAndLineNumbers() {
        List<CellmlToken> tokens = tokens("a // comment with def model\n\nb\n// trailing");

        assertThat(tokens).extracting(CellmlToken::getValue).containsExactly("a", "b", "");
        assertThat(tokens).extracting(CellmlToken::getLine).containsExactly(1, 3, 4);
    }

    @Test
    void testUnknownCharactersAreSkippedAndRecorded() {
        CellmlScanner scanner = new CellmlScanner("a @\n# b");
        List<String> values = new ArrayList<>();
        while (scanner.getType() != TokenType.EOF) {
            values.add(scanner.getValue());
            scanner.nextToken();
        }

        assertThat(values).containsExactly("a", "b");
        assertThat(scanner.getDiagnostics()).hasSize(2);
        assertThat(scanner.getDiagnostics().get(0).getCharacter()).isEqualTo('@');
        assertThat(scanner.getDiagnostics().get(1).getLine()).isEqualTo(2);
        assertThat(scanner.getDiagnostics().get(1).getMessage()).isEqualTo("Unknown character '#' skipped");
    }

    @Test
    void testLoneBangIsUnknown() {
        CellmlScanner scanner = new CellmlScanner("a ! b");

        assertThat(scanner.nextToken().getValue()).isEqualTo("b");
        assertThat(scanner.getDiagnostics()).extracting(LexicalDiagnostic::getCharacter).containsExactly('!');
    }

    @Test
    void testEofIsSticky() {
        CellmlScanner scanner = new CellmlScanner("");

        assertThat(scanner.getType()).isEqualTo(TokenType.EOF);
        assertThat(scanner.nextToken().getType()).isEqualTo(TokenType.EOF);
        assertThat(scanner.nextToken().getType()).isEqualTo(TokenType.EOF);
    }

    private static List<TokenType> types(String source) {
        return tokens(source).stream().map(CellmlToken::getType).toList();
    }

    private static List<CellmlToken> tokens(String source) {
        CellmlScanner scanner = new CellmlScanner(source);
        List<CellmlToken> tokens = new ArrayList<>();
        tokens.add(scanner.getToken());
        while (scanner.getType() != TokenType.EOF) {
            tokens.add(scanner.nextToken());
        }
        return tokens;
    }
}
