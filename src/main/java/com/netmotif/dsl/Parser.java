package com.netmotif.dsl;

import com.netmotif.api.NodeRef;
import com.netmotif.dsl.ast.*;
import com.netmotif.error.ParseException;
import com.netmotif.motif.DegreeComparator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * <pre>
 * program    := statement* EOF
 * statement  := 'let' IDENT '=' expression | expression
 * expression := motif | connect | overlay | relabel | pick | IDENT
 * motif      := MOTIF '(' [INT {',' INT}] ')'
 * connect    := 'Connect' '(' expression ',' expression ',' 'bridge' '=' '(' noderef ',' noderef ')' ')'
 * overlay    := 'Overlay' '(' expression ',' expression ')'
 * relabel    := 'Relabel' '(' expression ',' '{' [INT ':' INT {',' INT ':' INT}] '}' ')'
 * pick       := 'Pick' '(' expression ',' 'deg' ('=' | '<' | '>' | '<=' | '>=') INT ')'
 * noderef    := IDENT '.' INT
 * </pre>
 *
 * <p>
 * The parser checks syntax only. Motif arity, node ranges and name binding
 * are left to the checker so that the two kinds of failure stay distinct.
 */
public final class Parser {
    private final Iterator<Token> tokens;
    private Token current;

    public Parser(Iterable<Token> tokens) {
        this.tokens = tokens.iterator();
        this.current = this.tokens.next();
    }

    /** Lexes and parses {@code source}. */
    public static Program parse(String source) {
        return new Parser(new Lexer(source)).parseProgram();
    }

    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!current.is(TokenType.EOF))
            statements.add(statement());
        return new Program(statements);
    }

    private Statement statement() {
        if (current.is(TokenType.LET)) {
            Token let = advance();
            Token name = expect(TokenType.IDENT, "binding name after 'let'");
            expect(TokenType.EQUAL, "'=' in let binding");
            return new LetStatement(name.lexeme(), expression(), let.position());
        }
        SourcePosition start = current.position();
        if (!startsExpression(current.type()))
            throw error("statement ('let' or an expression)");
        return new ExpressionStatement(expression(), start);
    }

    private Expression expression() {
        TokenType type = current.type();
        if (type.isMotif())
            return motif();
        return switch (type) {
            case CONNECT -> connect();
            case OVERLAY -> overlay();
            case RELABEL -> relabel();
            case PICK -> pick();
            case IDENT -> {
                Token name = advance();
                yield new NameExpression(name.lexeme(), name.position());
            }
            default -> throw error("expression");
        };
    }

    private MotifExpression motif() {
        Token keyword = advance();
        expect(TokenType.LPAREN, "'(' after " + keyword.lexeme());
        List<Integer> args = new ArrayList<>();
        if (!current.is(TokenType.RPAREN)) {
            do {
                args.add(expect(TokenType.INT, "integer argument to " + keyword.lexeme()).intValue());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RPAREN, "')' to close " + keyword.lexeme());
        return new MotifExpression(keyword.type().motifKind(), args, keyword.position());
    }

    private ConnectExpression connect() {
        Token keyword = advance();
        expect(TokenType.LPAREN, "'(' after Connect");
        Expression left = expression();
        expect(TokenType.COMMA, "',' after first Connect operand");
        Expression right = expression();
        expect(TokenType.COMMA, "',' after second Connect operand");
        expectWord("bridge");
        expect(TokenType.EQUAL, "'=' after bridge");
        expect(TokenType.LPAREN, "'(' to open bridge pair");
        NodeRefLiteral leftRef = nodeRef();
        expect(TokenType.COMMA, "',' between bridge endpoints");
        NodeRefLiteral rightRef = nodeRef();
        expect(TokenType.RPAREN, "')' to close bridge pair");
        expect(TokenType.RPAREN, "')' to close Connect");
        return new ConnectExpression(left, right, leftRef, rightRef, keyword.position());
    }

    private OverlayExpression overlay() {
        Token keyword = advance();
        expect(TokenType.LPAREN, "'(' after Overlay");
        Expression left = expression();
        expect(TokenType.COMMA, "',' between Overlay operands");
        Expression right = expression();
        expect(TokenType.RPAREN, "')' to close Overlay");
        return new OverlayExpression(left, right, keyword.position());
    }

    private RelabelExpression relabel() {
        Token keyword = advance();
        expect(TokenType.LPAREN, "'(' after Relabel");
        Expression target = expression();
        expect(TokenType.COMMA, "',' between Relabel arguments");
        expect(TokenType.LBRACE, "'{' to open relabel mapping");
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        if (!current.is(TokenType.RBRACE)) {
            do {
                Token from = expect(TokenType.INT, "source node id in mapping");
                expect(TokenType.COLON, "':' in mapping entry");
                Token to = expect(TokenType.INT, "target node id in mapping");
                if (mapping.putIfAbsent(from.intValue(), to.intValue()) != null)
                    throw new ParseException("Duplicate key " + from.lexeme() + " in relabel mapping", from.position());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RBRACE, "'}' to close relabel mapping");
        expect(TokenType.RPAREN, "')' to close Relabel");
        return new RelabelExpression(target, mapping, keyword.position());
    }

    private PickExpression pick() {
        Token keyword = advance();
        expect(TokenType.LPAREN, "'(' after Pick");
        Expression target = expression();
        expect(TokenType.COMMA, "',' between Pick arguments");
        Token deg = expectWord("deg");
        if (!current.type().isComparator())
            throw error("degree comparator ('=', '<', '>', '<=', '>=')");
        DegreeComparator comparator = DegreeComparator.fromSymbol(advance().lexeme());
        Token value = expect(TokenType.INT, "integer degree value");
        expect(TokenType.RPAREN, "')' to close Pick");
        return new PickExpression(target,
                new DegreeCriteriaLiteral(comparator, value.intValue(), deg.position()),
                keyword.position());
    }

    private NodeRefLiteral nodeRef() {
        Token graph = expect(TokenType.IDENT, "graph name in node reference");
        expect(TokenType.DOT, "'.' in node reference");
        Token index = expect(TokenType.INT, "node id after '.'");
        return new NodeRefLiteral(new NodeRef(graph.lexeme(), index.intValue()), graph.position());
    }

    private static boolean startsExpression(TokenType type) {
        return type.isMotif() || type == TokenType.CONNECT || type == TokenType.OVERLAY
                || type == TokenType.RELABEL || type == TokenType.PICK || type == TokenType.IDENT;
    }

    // ── Token helpers ────────────────────────────────────────────

    private Token advance() {
        Token t = current;
        if (!current.is(TokenType.EOF))
            current = tokens.next();
        return t;
    }

    private boolean match(TokenType type) {
        if (current.is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        if (current.is(type))
            return advance();
        throw error(what);
    }

    private Token expectWord(String word) {
        if (current.is(TokenType.IDENT) && current.lexeme().equals(word))
            return advance();
        throw error("'" + word + "'");
    }

    private ParseException error(String expected) {
        return new ParseException("Expected " + expected + " but found " + current.describe(), current.position());
    }
}
