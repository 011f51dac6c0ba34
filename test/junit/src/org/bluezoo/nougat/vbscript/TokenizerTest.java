/*
 * TokenizerTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of nougat, a classic ASP page engine.
 *
 * nougat is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * nougat is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with nougat.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.nougat.vbscript;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Tokenizer}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TokenizerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> types = new ArrayList<TokenType>();
        for (Token token : Tokenizer.tokenize(source)) {
            types.add(token.getType());
        }
        return types;
    }

    private static List<TokenType> expect(TokenType... types) {
        List<TokenType> list = new ArrayList<TokenType>();
        for (TokenType type : types) {
            list.add(type);
        }
        return list;
    }

    // ===== Structure =====

    @Test
    public void testEmptySourceYieldsSingleEof() {
        List<Token> tokens = Tokenizer.tokenize("");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).getType());
    }

    @Test
    public void testEndsWithSingleEof() {
        List<Token> tokens = Tokenizer.tokenize("x = 1\n");
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).getType());
        int eofs = 0;
        for (Token token : tokens) {
            if (token.is(TokenType.EOF)) {
                eofs++;
            }
        }
        assertEquals(1, eofs);
    }

    @Test
    public void testNewLineSequencesAndLineNumbers() {
        List<Token> tokens = Tokenizer.tokenize("a\r\nb\nc");
        assertEquals(expect(TokenType.IDENTIFIER, TokenType.NEW_LINE, TokenType.IDENTIFIER,
                            TokenType.NEW_LINE, TokenType.IDENTIFIER, TokenType.EOF),
                     types("a\r\nb\nc"));
        assertEquals(1, tokens.get(0).getLine());
        assertEquals(2, tokens.get(2).getLine());
        assertEquals(3, tokens.get(4).getLine());
    }

    @Test
    public void testBlankLinesFormOneNewLineToken() {
        List<Token> tokens = Tokenizer.tokenize("a\n\nb");
        assertEquals(expect(TokenType.IDENTIFIER, TokenType.NEW_LINE, TokenType.IDENTIFIER,
                            TokenType.EOF),
                     types("a\n\nb"));
        assertEquals(3, tokens.get(2).getLine());
    }

    @Test
    public void testColumns() {
        List<Token> tokens = Tokenizer.tokenize("Dim x");
        assertEquals(1, tokens.get(0).getColumn());
        assertEquals(5, tokens.get(1).getColumn());
    }

    @Test
    public void testFirstLineOffset() {
        List<Token> tokens = new Tokenizer("x\ny", 10).tokenize();
        assertEquals(10, tokens.get(0).getLine());
        assertEquals(11, tokens.get(2).getLine());
    }

    // ===== Keywords and identifiers =====

    @Test
    public void testKeywordsAreCaseInsensitive() {
        assertEquals(expect(TokenType.DIM, TokenType.IDENTIFIER, TokenType.EOF), types("dim X"));
        assertEquals(expect(TokenType.DIM, TokenType.IDENTIFIER, TokenType.EOF), types("DIM X"));
        assertEquals(expect(TokenType.END, TokenType.IF, TokenType.EOF), types("End If"));
        assertEquals(expect(TokenType.WEND, TokenType.EOF), types("WEnd"));
    }

    @Test
    public void testIdentifierKeepsSpelling() {
        Token token = Tokenizer.tokenize("myVar_2").get(0);
        assertEquals(TokenType.IDENTIFIER, token.getType());
        assertEquals("myVar_2", token.getValue());
        assertTrue(token.isWord("MYVAR_2"));
    }

    // ===== Literals =====

    @Test
    public void testStringWithDoubledQuote() {
        Token token = Tokenizer.tokenize("\"say \"\"hi\"\"\"").get(0);
        assertEquals(TokenType.STRING_LITERAL, token.getType());
        assertEquals("say \"hi\"", token.getValue());
        assertFalse(token.isUnterminated());
    }

    @Test
    public void testUnterminatedStringRunsToEnd() {
        List<Token> tokens = Tokenizer.tokenize("\"abc\ndef");
        assertEquals(2, tokens.size());
        Token token = tokens.get(0);
        assertEquals(TokenType.STRING_LITERAL, token.getType());
        assertEquals("abc\ndef", token.getValue());
        assertTrue(token.isUnterminated());
    }

    @Test
    public void testNumbers() {
        List<Token> tokens = Tokenizer.tokenize("42 3.14 1e3 &HFF &17 &O17");
        assertEquals(TokenType.INTEGER_LITERAL, tokens.get(0).getType());
        assertEquals("42", tokens.get(0).getValue());
        assertEquals(TokenType.FLOAT_LITERAL, tokens.get(1).getType());
        assertEquals("3.14", tokens.get(1).getValue());
        assertEquals(TokenType.FLOAT_LITERAL, tokens.get(2).getType());
        assertEquals(TokenType.HEX_LITERAL, tokens.get(3).getType());
        assertEquals("&HFF", tokens.get(3).getValue());
        assertEquals(TokenType.OCT_LITERAL, tokens.get(4).getType());
        assertEquals("&17", tokens.get(4).getValue());
        assertEquals(TokenType.OCT_LITERAL, tokens.get(5).getType());
        assertEquals("&O17", tokens.get(5).getValue());
    }

    @Test
    public void testExponentWithSign() {
        Token token = Tokenizer.tokenize("2.5E-3").get(0);
        assertEquals(TokenType.FLOAT_LITERAL, token.getType());
        assertEquals("2.5E-3", token.getValue());
    }

    @Test
    public void testDotWithoutDigitIsNotPartOfNumber() {
        assertEquals(expect(TokenType.INTEGER_LITERAL, TokenType.DOT, TokenType.IDENTIFIER,
                            TokenType.EOF),
                     types("1.x"));
    }

    @Test
    public void testDateLiteral() {
        Token token = Tokenizer.tokenize("#2024-01-31#").get(0);
        assertEquals(TokenType.DATE_LITERAL, token.getType());
        assertEquals("2024-01-31", token.getValue());
    }

    // ===== Operators =====

    @Test
    public void testConcatenationOperator() {
        assertEquals(expect(TokenType.IDENTIFIER, TokenType.CONCAT, TokenType.IDENTIFIER,
                            TokenType.EOF),
                     types("a & b"));
    }

    @Test
    public void testComparisonOperators() {
        assertEquals(expect(TokenType.GREATER_EQUAL, TokenType.LESS_EQUAL, TokenType.NOT_EQUAL,
                            TokenType.NOT_EQUAL, TokenType.EQUAL, TokenType.ASSIGN,
                            TokenType.LESS_THAN, TokenType.GREATER_THAN, TokenType.EOF),
                     types(">= <= <> != == = < >"));
    }

    @Test
    public void testArithmeticOperators() {
        assertEquals(expect(TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY,
                            TokenType.DIVIDE, TokenType.INT_DIVIDE, TokenType.POWER,
                            TokenType.MOD, TokenType.EOF),
                     types("+ - * / \\ ^ Mod"));
    }

    @Test
    public void testUnknownCharactersAreSkipped() {
        assertEquals(expect(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
                     types("a $ ! b"));
    }

    // ===== Comments and continuations =====

    @Test
    public void testApostropheComment() {
        List<Token> tokens = Tokenizer.tokenize("x = 1 ' note");
        assertEquals(expect(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER_LITERAL,
                            TokenType.COMMENT, TokenType.EOF),
                     types("x = 1 ' note"));
        assertEquals(" note", tokens.get(3).getValue());
    }

    @Test
    public void testRemComment() {
        List<Token> tokens = Tokenizer.tokenize("Rem hello world\nx");
        assertEquals(TokenType.COMMENT, tokens.get(0).getType());
        assertEquals("hello world", tokens.get(0).getValue());
        assertEquals(TokenType.NEW_LINE, tokens.get(1).getType());
    }

    @Test
    public void testLineContinuationIsConsumed() {
        List<Token> tokens = Tokenizer.tokenize("x = 1 + _\n  2");
        assertEquals(expect(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER_LITERAL,
                            TokenType.PLUS, TokenType.INTEGER_LITERAL, TokenType.EOF),
                     types("x = 1 + _\n  2"));
        assertEquals(2, tokens.get(4).getLine());
    }

    @Test
    public void testOffsetsCoverLexeme() {
        String source = "x = \"a\"\"b\"";
        Token token = Tokenizer.tokenize(source).get(2);
        assertEquals("\"a\"\"b\"", source.substring(token.getOffset(), token.getEnd()));
    }

}
