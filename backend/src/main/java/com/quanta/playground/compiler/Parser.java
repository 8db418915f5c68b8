package com.quanta.playground.compiler;

import com.quanta.playground.compiler.ast.Alternate;
import com.quanta.playground.compiler.ast.Block;
import com.quanta.playground.compiler.ast.Declaration;
import com.quanta.playground.compiler.ast.If;
import com.quanta.playground.compiler.ast.Print;
import com.quanta.playground.compiler.ast.Program;
import com.quanta.playground.compiler.ast.Repeat;
import com.quanta.playground.compiler.ast.Statement;
import com.quanta.playground.exception.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static com.quanta.playground.compiler.Keywords.*;

/**
 * Recursive-descent parser for Quanta. No backtracking; fails on the first
 * malformed construct. Each rule reads from and advances the given cursor.
 */
public final class Parser {

    public Program parse(List<Token> tokens) throws ParseException {
        return parseProgram(new TokenCursor(tokens));
    }

    /**
     * Statements up to end of input or a top-level {@code end}, which is consumed.
     * Nothing may follow that {@code end}.
     */
    Program parseProgram(TokenCursor cursor) throws ParseException {
        List<Statement> body = parseBlock(cursor);
        if (cursor.atEnd()) {
            return new Program(body);
        }
        cursor.expectKeyword(END);
        if (!cursor.atEnd()) {
            throw ParseException.expectedToken("end of input", cursor.peek().toString());
        }
        return new Program(body);
    }

    /**
     * Statements until {@code end}, {@code elif}, {@code else} or end of input.
     * The terminating token is left for the caller.
     */
    List<Statement> parseBlock(TokenCursor cursor) throws ParseException {
        List<Statement> body = new ArrayList<>();
        while (!cursor.atEnd()
                && !cursor.peekKeyword(END)
                && !cursor.peekKeyword(ELIF)
                && !cursor.peekKeyword(ELSE)) {
            body.add(parseStatement(cursor));
        }
        return body;
    }

    Statement parseStatement(TokenCursor cursor) throws ParseException {
        Token t = cursor.next("a statement");
        if (t.isKeyword(LET)) return parseDeclaration(cursor);
        if (t.isKeyword(WRITE)) return new Print(parseExpression(cursor, "an expression after 'write'"));
        if (t.isKeyword(IF)) return parseIf(cursor);
        if (t.isKeyword(REPEAT)) return parseRepeat(cursor);
        throw ParseException.expectedToken("a statement ('let', 'write', 'if' or 'repeat')", t.toString());
    }

    private Declaration parseDeclaration(TokenCursor cursor) throws ParseException {
        String name = cursor.expectKind(TokenKind.IDENTIFIER).text();
        Token following = cursor.peek();
        if (following == null || !following.is(TokenKind.OPERATOR, "=")) {
            return new Declaration(name, null);
        }
        cursor.next("'='");
        return new Declaration(name, parseExpression(cursor, "a value for '" + name + "'"));
    }

    /**
     * Whole {@code if ... [elif ...]* [else ...] end} chain; the single {@code end} is consumed here.
     */
    private If parseIf(TokenCursor cursor) throws ParseException {
        If chain = parseIfClause(cursor);
        cursor.expectKeyword(END);
        return chain;
    }

    private If parseIfClause(TokenCursor cursor) throws ParseException {
        String test = parseExpression(cursor, "a condition");
        List<Statement> consequent = parseBlock(cursor);
        Alternate alternate = null;
        if (cursor.peekKeyword(ELIF)) {
            cursor.next("'elif'");
            alternate = parseIfClause(cursor);
        } else if (cursor.peekKeyword(ELSE)) {
            cursor.next("'else'");
            alternate = new Block(parseBlock(cursor));
        }
        return new If(test, consequent, alternate);
    }

    private Repeat parseRepeat(TokenCursor cursor) throws ParseException {
        String count = parseExpression(cursor, "a repeat count");
        List<Statement> body = parseBlock(cursor);
        cursor.expectKeyword(END);
        return new Repeat(count, body);
    }

    /**
     * Greedy run of non-keyword tokens joined by single spaces. Operators,
     * names and literals pass through unchecked.
     */
    String parseExpression(TokenCursor cursor, String expected) throws ParseException {
        StringJoiner expression = new StringJoiner(" ");
        int parts = 0;
        while (!cursor.atEnd() && !cursor.peekKind(TokenKind.KEYWORD)) {
            expression.add(cursor.next(expected).render());
            parts++;
        }
        if (parts == 0) {
            if (cursor.atEnd()) {
                throw ParseException.unexpectedEndOfInput(expected);
            }
            throw ParseException.expectedToken(expected, cursor.peek().toString());
        }
        return expression.toString();
    }
}
