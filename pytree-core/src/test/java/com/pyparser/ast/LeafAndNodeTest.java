package com.pyparser.ast;

import com.pyparser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LeafAndNodeTest {

    @Test
    void testLeafCodeAndPositions() {
        Module module = Parser.parse("x = 1\n");
        List<Leaf> leaves = module.leaves();
        assertEquals(5, leaves.size());
        Leaf one = leaves.get(2);
        assertEquals(" 1", one.getCode());
        assertEquals("1", one.getCode(false));
        assertEquals(new Position(1, 4), one.start());
        assertEquals(new Position(1, 5), one.end());
        assertTrue(leaves.get(4) instanceof Whitespace);
        assertEquals("endmarker", leaves.get(4).type());
    }

    @Test
    void testSiblingsByIdentity() {
        Module module = Parser.parse("x = 1\n");
        List<Leaf> leaves = module.leaves();
        Leaf x = leaves.get(0);
        Leaf equals = leaves.get(1);
        assertSame(equals, x.nextSibling());
        assertSame(x, equals.prevSibling());
        assertNull(x.prevSibling());
        assertNull(module.nextSibling());
        assertNull(module.parent());
    }

    @Test
    @DisplayName("Parents come from the arena")
    void testParentsFromSyntaxTree() {
        Module module = Parser.parse("x = 1\n");
        Name x = (Name) module.leaves().get(0);
        assertTrue(x.parent() instanceof ExprStmt);
        assertSame(module, x.getParentScope());
        SyntaxTree tree = module.syntaxTree();
        assertSame(module, tree.root());
        assertEquals(module.childCount(), tree.childIndexes(0).length);
        assertEquals(-1, tree.parentIndex(0));
        for (Element element : tree.elements()) {
            if (element != module) {
                Node parent = (Node) element.parent();
                assertTrue(parent.children().stream().anyMatch(c -> c == element));
            }
        }
    }

    @Test
    void testNodeSpansItsLeaves() {
        Module module = Parser.parse("def f(a,\n      b):\n    return a\n");
        Function function = (Function) module.subscopes().get(0);
        assertEquals(new Position(1, 0), function.start());
        assertEquals(function.firstLeaf().start(), function.start());
        assertEquals(function.lastLeaf().end(), function.end());
        assertEquals(new Position(3, 13), function.end());
    }

    @Test
    void testMultilineLeafEnd() {
        Module module = Parser.parse("s = '''a\nbc'''\n");
        Literal literal = (Literal) module.leaves().get(2);
        assertEquals(new Position(1, 4), literal.start());
        assertEquals(new Position(2, 5), literal.end());
    }

    @Test
    void testMoveShiftsEveryLeaf() {
        String source = "def f():\n    x = 1\n";
        Module module = Parser.parse(source);
        module.move(2, 0);
        assertEquals(new Position(3, 0), module.start());
        Name x = module.usedNames().get("x").get(0);
        assertEquals(new Position(4, 4), x.start());
        assertEquals(source, module.getCode());
    }

    @Test
    void testNodesAreNeverEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new Node(Symbol.ATOM, List.of()));
    }

    @Test
    void testLiteralEval() {
        assertEquals("a\tb", literal("'a\\tb'").eval());
        assertEquals("a\\tb", literal("r'a\\tb'").eval());
        assertEquals("éA", literal("'\\xe9\\u0041'").eval());
        assertEquals("multi\nline", literal("'''multi\nline'''").eval());
        assertArrayEquals(new byte[]{'a', 'b'}, (byte[]) literal("b'ab'").eval());
        assertEquals(16L, literal("0x10").eval());
        assertEquals(1000L, literal("1_000").eval());
        assertEquals(8L, literal("0o10").eval());
        assertEquals(1.5, literal("1.5").eval());
        assertEquals(new BigInteger("123456789012345678901234567890"), literal("123456789012345678901234567890").eval());
        assertThrows(UnsupportedOperationException.class, () -> literal("10j").eval());
    }

    @Test
    void testLiteralKinds() {
        assertTrue(literal("'x'").isString());
        assertEquals("string", literal("f'x'").type());
        assertEquals("number", literal("42").type());
    }

    private static Literal literal(String code) {
        return new Literal(code, Position.START, "");
    }
}
