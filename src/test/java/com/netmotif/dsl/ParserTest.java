package com.netmotif.dsl;

import com.netmotif.dsl.ast.*;
import com.netmotif.error.ErrorKind;
import com.netmotif.error.LexException;
import com.netmotif.error.ParseException;
import com.netmotif.motif.DegreeComparator;
import com.netmotif.motif.MotifKind;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ParserTest {

    @Test
    public void testEmptyProgram() {
        assertTrue(Parser.parse("").statements().isEmpty());
    }

    @Test
    public void testLetMotif() {
        Program p = Parser.parse("let A = Ring(4)");
        assertEquals(1, p.statements().size());

        LetStatement let = (LetStatement) p.statements().get(0);
        assertEquals("A", let.name());
        assertEquals(new SourcePosition(1, 1), let.position());

        MotifExpression motif = (MotifExpression) let.expression();
        assertEquals(MotifKind.RING, motif.kind());
        assertEquals(List.of(4), motif.args());
        assertEquals(new SourcePosition(1, 9), motif.position());
    }

    @Test
    public void testArityIsNotCheckedByParser() {
        MotifExpression motif = (MotifExpression) ((LetStatement) Parser.parse("let A = Grid()").statements().get(0))
                .expression();
        assertTrue(motif.args().isEmpty());
        Parser.parse("let B = Ring(1, 2, 3)");
    }

    @Test
    public void testConnect() {
        Program p = Parser.parse("""
                let A = Ring(4)
                let B = Star(3)
                let C = Connect(A, B, bridge=(A.0, B.2))
                """);
        assertEquals(3, p.statements().size());

        ConnectExpression c = (ConnectExpression) ((LetStatement) p.statements().get(2)).expression();
        assertEquals("A", ((NameExpression) c.left()).name());
        assertEquals("B", ((NameExpression) c.right()).name());
        assertEquals("A", c.leftBridge().graphName());
        assertEquals(0, c.leftBridge().nodeId());
        assertEquals("B", c.rightBridge().graphName());
        assertEquals(2, c.rightBridge().nodeId());
        assertEquals(new SourcePosition(3, 31), c.leftBridge().position());
    }

    @Test
    public void testNestedOverlay() {
        Program p = Parser.parse("let T = Overlay(Path(2), Overlay(Mesh(3), Tree(2, 1)))");
        OverlayExpression outer = (OverlayExpression) ((LetStatement) p.statements().get(0)).expression();
        assertTrue(outer.left() instanceof MotifExpression);
        OverlayExpression inner = (OverlayExpression) outer.right();
        assertEquals(MotifKind.TREE, ((MotifExpression) inner.right()).kind());
    }

    @Test
    public void testRelabelKeepsEntryOrder() {
        Program p = Parser.parse("let R = Relabel(A, {2:0, 0:1, 1:2})");
        RelabelExpression r = (RelabelExpression) ((LetStatement) p.statements().get(0)).expression();
        assertEquals(List.of(2, 0, 1), List.copyOf(r.mapping().keySet()));
        assertEquals(Map.of(2, 0, 0, 1, 1, 2), r.mapping());
        assertTrue(Parser.parse("Relabel(A, {})").statements().get(0) instanceof ExpressionStatement);
    }

    @Test
    public void testRelabelDuplicateKey() {
        try {
            Parser.parse("Relabel(A, {0:1, 0:2})");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Duplicate key 0 in relabel mapping", e.detail());
            assertEquals(new SourcePosition(1, 18), e.position().orElseThrow());
        }
    }

    @Test
    public void testPick() {
        Program p = Parser.parse("let H = Pick(C, deg >= 3)");
        PickExpression pick = (PickExpression) ((LetStatement) p.statements().get(0)).expression();
        assertEquals("C", ((NameExpression) pick.target()).name());
        assertEquals(DegreeComparator.GE, pick.criteria().comparator());
        assertEquals(3, pick.criteria().value());

        for (String op : new String[] { "=", "<", ">", "<=", ">=" }) {
            PickExpression e = (PickExpression) ((ExpressionStatement) Parser.parse("Pick(C, deg " + op + " 1)")
                    .statements().get(0)).expression();
            assertEquals(op, e.criteria().comparator().symbol());
        }
    }

    @Test
    public void testBareExpressionStatement() {
        Program p = Parser.parse("let A = Ring(3)\nA");
        ExpressionStatement s = (ExpressionStatement) p.statements().get(1);
        assertEquals("A", ((NameExpression) s.expression()).name());
        assertEquals(new SourcePosition(2, 1), s.position());
    }

    @Test
    public void testUnclosedMotif() {
        try {
            Parser.parse("let A = Ring(4");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals(ErrorKind.PARSE, e.kind());
            assertEquals("Expected ')' to close Ring but found end of input", e.detail());
            assertEquals(new SourcePosition(1, 15), e.position().orElseThrow());
        }
    }

    @Test
    public void testMissingBindingName() {
        try {
            Parser.parse("let = Ring(3)");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Expected binding name after 'let' but found '='", e.detail());
            assertEquals(new SourcePosition(1, 5), e.position().orElseThrow());
        }
    }

    @Test
    public void testMissingBridgeKeyword() {
        try {
            Parser.parse("Connect(A, B, (A.0, B.0))");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Expected 'bridge' but found '('", e.detail());
        }
    }

    @Test
    public void testMissingCommaBetweenBridgeEndpoints() {
        try {
            Parser.parse("Connect(A, B, bridge=(A.0 B.0))");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertEquals("Expected ',' between bridge endpoints but found IDENT 'B'", e.detail());
        }
    }

    @Test
    public void testPickRequiresComparator() {
        try {
            Parser.parse("Pick(C, deg 3)");
            fail("Expected ParseException");
        } catch (ParseException e) {
            assertTrue(e.detail().startsWith("Expected degree comparator"));
            assertTrue(e.detail().endsWith("but found INT 3"));
        }
    }

    @Test(expected = ParseException.class)
    public void testStatementCannotStartWithPunctuation() {
        Parser.parse(") let A = Ring(3)");
    }

    @Test
    public void testTrailingTokensAfterStatement() {
        assertStrayToken("let A = Ring(3) 4", "INT 4");
        assertStrayToken("let A = Ring(3) )", "')'");
        assertStrayToken("let A = Ring(3) ,", "','");
    }

    @Test
    public void testBareExpressionsMayAppearBetweenBindings() {
        Program p = Parser.parse("let A = Ring(3) A let B = Ring(4)");
        assertEquals(3, p.statements().size());
        assertTrue(p.statements().get(1) instanceof ExpressionStatement);
        assertEquals("B", ((LetStatement) p.statements().get(2)).name());
    }

    private static void assertStrayToken(String source, String found) {
        try {
            Parser.parse(source);
            fail("Expected ParseException for: " + source);
        } catch (ParseException e) {
            assertEquals(ErrorKind.PARSE, e.kind());
            assertEquals("Expected statement ('let' or an expression) but found " + found, e.detail());
            assertEquals(new SourcePosition(1, 17), e.position().orElseThrow());
        }
    }

    @Test
    public void testLexErrorsSurfaceThroughParser() {
        try {
            Parser.parse("let A = Ring(3\n$");
            fail("Expected LexException");
        } catch (LexException e) {
            assertEquals(new SourcePosition(2, 1), e.position().orElseThrow());
        }
    }
}
