package me.golemcore.nsla.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.nsla.domain.model.Expression;
import me.golemcore.nsla.domain.model.ParseException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Recursive-descent parser for formula texts.
 *
 * <p>
 * Accepted forms:
 * <ul>
 * <li>literals {@code true}, {@code false}</li>
 * <li>atoms {@code Name(a, b)}, bare {@code Name}, prefix
 * {@code (Name a b)}</li>
 * <li>keyword connectives {@code not and or implies} (case-insensitive)</li>
 * <li>symbols {@code ! ~ ¬}, {@code & && ∧}, {@code | || ∨},
 * {@code -> => → ⇒}</li>
 * <li>function style {@code and(A, B)} and prefix style
 * {@code (and A B C)}</li>
 * </ul>
 * Precedence is {@code not > and > or > implies}; implication is
 * right-associative. Formulas nesting deeper than {@link #MAX_NESTING}
 * groups or producing trees deeper than {@link #MAX_DEPTH} are rejected with
 * a {@link ParseException}. Stateless and thread-safe.
 */
public class ExpressionParser {

    public static final int MAX_NESTING = 200;
    public static final int MAX_DEPTH = 1000;

    public Expression parse(String source) {
        if (source == null) {
            throw new ParseException("Formula text is missing", "", 0);
        }
        Cursor cursor = new Cursor(source, tokenize(source));
        if (cursor.peek().type() == TokenType.EOF) {
            throw cursor.error("Empty formula", cursor.peek());
        }
        Expression expression = parseImplies(cursor);
        Token trailing = cursor.peek();
        if (trailing.type() != TokenType.EOF) {
            throw cursor.error("Unexpected '" + trailing.text() + "'", trailing);
        }
        return expression;
    }

    // ==================== Grammar ====================

    private Expression parseImplies(Cursor cursor) {
        List<Expression> chain = new ArrayList<>();
        chain.add(parseOr(cursor));
        while (cursor.accept(TokenType.IMPLIES)) {
            chain.add(parseOr(cursor));
        }
        Expression result = chain.get(chain.size() - 1);
        for (int i = chain.size() - 2; i >= 0; i--) {
            result = cursor.node(new Expression.Implies(chain.get(i), result), chain.get(i), result);
        }
        return result;
    }

    private Expression parseOr(Cursor cursor) {
        Expression left = parseAnd(cursor);
        while (cursor.accept(TokenType.OR)) {
            Expression right = parseAnd(cursor);
            left = cursor.node(new Expression.Or(left, right), left, right);
        }
        return left;
    }

    private Expression parseAnd(Cursor cursor) {
        Expression left = parseUnary(cursor);
        while (cursor.accept(TokenType.AND)) {
            Expression right = parseUnary(cursor);
            left = cursor.node(new Expression.And(left, right), left, right);
        }
        return left;
    }

    private Expression parseUnary(Cursor cursor) {
        int negations = 0;
        while (cursor.accept(TokenType.NOT)) {
            negations++;
        }
        cursor.descend();
        Expression result;
        try {
            result = parsePrimary(cursor);
        } finally {
            cursor.nesting--;
        }
        for (int i = 0; i < negations; i++) {
            result = cursor.node(new Expression.Not(result), result);
        }
        return result;
    }

    private Expression parsePrimary(Cursor cursor) {
        Token token = cursor.next();
        switch (token.type()) {
        case TRUE:
            return new Expression.True();
        case FALSE:
            return new Expression.False();
        case IDENT:
            if (cursor.accept(TokenType.LPAREN)) {
                return new Expression.Atom(token.text(), parseArguments(cursor));
            }
            return new Expression.Atom(token.text(), List.of());
        case AND:
        case OR:
        case IMPLIES:
            if (cursor.accept(TokenType.LPAREN)) {
                return combine(token, parseCallOperands(cursor), cursor);
            }
            throw cursor.error("Operator '" + token.text() + "' is missing its left operand", token);
        case LPAREN:
            return parseParenthesized(cursor);
        case EOF:
            throw cursor.error("Unexpected end of formula", token);
        default:
            throw cursor.error("Unexpected '" + token.text() + "'", token);
        }
    }

    private Expression parseParenthesized(Cursor cursor) {
        Token head = cursor.peek();
        TokenType type = head.type();
        if (type == TokenType.AND || type == TokenType.OR || type == TokenType.IMPLIES) {
            int mark = cursor.position;
            try {
                return parsePrefixOperation(cursor);
            } catch (ParseException prefixFailure) {
                if (cursor.tooDeep) {
                    throw prefixFailure;
                }
                // "(and(A, B))": the operator is a function-style call inside a group
                cursor.position = mark;
            }
        }
        if (type == TokenType.IDENT && cursor.peekAhead(1).type() == TokenType.IDENT) {
            cursor.next();
            List<String> args = new ArrayList<>();
            while (cursor.peek().type() != TokenType.RPAREN) {
                args.add(cursor.expect(TokenType.IDENT, "argument name").text());
            }
            cursor.expect(TokenType.RPAREN, "')'");
            return new Expression.Atom(head.text(), args);
        }
        Expression inner = parseImplies(cursor);
        cursor.expect(TokenType.RPAREN, "')'");
        return inner;
    }

    private Expression parsePrefixOperation(Cursor cursor) {
        Token operator = cursor.next();
        List<Expression> operands = new ArrayList<>();
        while (cursor.peek().type() != TokenType.RPAREN) {
            if (cursor.peek().type() == TokenType.EOF) {
                throw cursor.error("Unclosed '('", cursor.peek());
            }
            operands.add(parseUnary(cursor));
        }
        cursor.expect(TokenType.RPAREN, "')'");
        return combine(operator, operands, cursor);
    }

    private List<String> parseArguments(Cursor cursor) {
        List<String> args = new ArrayList<>();
        if (cursor.accept(TokenType.RPAREN)) {
            return args;
        }
        do {
            args.add(cursor.expect(TokenType.IDENT, "argument name").text());
        } while (cursor.accept(TokenType.COMMA));
        cursor.expect(TokenType.RPAREN, "')' or ','");
        return args;
    }

    private List<Expression> parseCallOperands(Cursor cursor) {
        List<Expression> operands = new ArrayList<>();
        if (cursor.accept(TokenType.RPAREN)) {
            return operands;
        }
        do {
            operands.add(parseImplies(cursor));
        } while (cursor.accept(TokenType.COMMA));
        cursor.expect(TokenType.RPAREN, "')' or ','");
        return operands;
    }

    private Expression combine(Token operator, List<Expression> operands, Cursor cursor) {
        switch (operator.type()) {
        case AND:
            return foldLeft(operands, new Expression.True(), true, cursor);
        case OR:
            return foldLeft(operands, new Expression.False(), false, cursor);
        default:
            if (operands.size() < 2) {
                throw cursor.error("'" + operator.text() + "' needs at least two operands", operator);
            }
            Expression result = operands.get(operands.size() - 1);
            for (int i = operands.size() - 2; i >= 0; i--) {
                result = cursor.node(new Expression.Implies(operands.get(i), result), operands.get(i), result);
            }
            return result;
        }
    }

    private static Expression foldLeft(List<Expression> operands, Expression empty, boolean conjunction,
            Cursor cursor) {
        if (operands.isEmpty()) {
            return empty;
        }
        Expression result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            Expression next = operands.get(i);
            result = cursor.node(conjunction ? new Expression.And(result, next) : new Expression.Or(result, next),
                    result, next);
        }
        return result;
    }

    // ==================== Lexer ====================

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            switch (c) {
            case '(' -> tokens.add(new Token(TokenType.LPAREN, "(", start));
            case ')' -> tokens.add(new Token(TokenType.RPAREN, ")", start));
            case ',' -> tokens.add(new Token(TokenType.COMMA, ",", start));
            case '!', '~', '¬' -> tokens.add(new Token(TokenType.NOT, String.valueOf(c), start));
            case '∧' -> tokens.add(new Token(TokenType.AND, "∧", start));
            case '∨' -> tokens.add(new Token(TokenType.OR, "∨", start));
            case '→', '⇒' -> tokens.add(new Token(TokenType.IMPLIES, String.valueOf(c), start));
            case '&' -> {
                if (i + 1 < length && source.charAt(i + 1) == '&') {
                    i++;
                }
                tokens.add(new Token(TokenType.AND, source.substring(start, i + 1), start));
            }
            case '|' -> {
                if (i + 1 < length && source.charAt(i + 1) == '|') {
                    i++;
                }
                tokens.add(new Token(TokenType.OR, source.substring(start, i + 1), start));
            }
            case '-', '=' -> {
                if (i + 1 >= length || source.charAt(i + 1) != '>') {
                    throw new ParseException("Unexpected '" + c + "'", source, byteOffset(source, start));
                }
                i++;
                tokens.add(new Token(TokenType.IMPLIES, source.substring(start, i + 1), start));
            }
            default -> {
                if (!isIdentifierChar(c)) {
                    throw new ParseException("Unexpected '" + c + "'", source, byteOffset(source, start));
                }
                while (i + 1 < length && isIdentifierChar(source.charAt(i + 1))) {
                    i++;
                }
                String word = source.substring(start, i + 1);
                tokens.add(new Token(keywordType(word), word, start));
            }
            }
            i++;
        }
        tokens.add(new Token(TokenType.EOF, "<end>", length));
        return tokens;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }

    private static TokenType keywordType(String word) {
        return switch (word.toLowerCase(Locale.ROOT)) {
        case "not" -> TokenType.NOT;
        case "and" -> TokenType.AND;
        case "or" -> TokenType.OR;
        case "implies" -> TokenType.IMPLIES;
        case "true" -> TokenType.TRUE;
        case "false" -> TokenType.FALSE;
        default -> TokenType.IDENT;
        };
    }

    private static int byteOffset(String source, int charIndex) {
        return source.substring(0, Math.min(charIndex, source.length()))
                .getBytes(StandardCharsets.UTF_8).length;
    }

    private enum TokenType {
        LPAREN, RPAREN, COMMA, NOT, AND, OR, IMPLIES, TRUE, FALSE, IDENT, EOF
    }

    private record Token(TokenType type, String text, int charIndex) {
    }

    private static final class Cursor {

        private final String source;
        private final List<Token> tokens;
        private final Map<Expression, Integer> depths = new IdentityHashMap<>();
        private int position;
        private int nesting;
        private boolean tooDeep;

        private Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token peekAhead(int distance) {
            return tokens.get(Math.min(position + distance, tokens.size() - 1));
        }

        private Token next() {
            Token token = tokens.get(position);
            if (token.type() != TokenType.EOF) {
                position++;
            }
            return token;
        }

        private boolean accept(TokenType type) {
            if (peek().type() == type) {
                position++;
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String description) {
            Token token = peek();
            if (token.type() != type) {
                throw error("Expected " + description + " but found '" + token.text() + "'", token);
            }
            position++;
            return token;
        }

        private ParseException error(String message, Token token) {
            return new ParseException(message, source, byteOffset(source, token.charIndex()));
        }

        private void descend() {
            if (nesting >= MAX_NESTING) {
                tooDeep = true;
                throw error("Formula nests deeper than " + MAX_NESTING + " levels", peek());
            }
            nesting++;
        }

        /**
         * Records the tree depth of a freshly built connective. Leaves count as one.
         */
        private Expression node(Expression node, Expression... children) {
            int depth = 0;
            for (Expression child : children) {
                depth = Math.max(depth, depths.getOrDefault(child, 1));
            }
            depth++;
            if (depth > MAX_DEPTH) {
                tooDeep = true;
                Token last = tokens.get(Math.max(position - 1, 0));
                throw error("Formula is deeper than " + MAX_DEPTH + " levels", last);
            }
            depths.put(node, depth);
            return node;
        }
    }
}
