package com.pyparser.ast;

import com.pyparser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class FlowTest {

    private static List<String> values(List<Name> names) {
        return names.stream().map(Name::value).collect(Collectors.toList());
    }

    private static Flow head(Module module) {
        return (Flow) module.subscopes().get(0);
    }

    @Test
    void testIfChainLinks() {
        Module module = Parser.parse("if a:\n    x = 1\nelif b:\n    y = 2\nelse:\n    z = 3\n");
        Flow ifFlow = head(module);
        Flow elifFlow = ifFlow.next();
        Flow elseFlow = elifFlow.next();

        assertEquals("if", ifFlow.command());
        assertEquals("elif", elifFlow.command());
        assertEquals("else", elseFlow.command());
        assertNull(elseFlow.next());
        assertNull(ifFlow.previous());
        assertSame(elifFlow, elseFlow.previous());
        assertSame(ifFlow, elifFlow.previous());
        assertEquals(Symbol.IF_STMT, ifFlow.chain().symbol());
        assertEquals(3, ifFlow.chain().segments().size());
        assertSame(module, elseFlow.getParentScope());
        assertEquals(ScopeKind.FLOW, ifFlow.kind());
    }

    @Test
    @DisplayName("Flow names belong to the enclosing namespace")
    void testFlowNamesLeakIntoEnclosingScope() {
        Module module = Parser.parse("if a:\n    x = 1\nelif b:\n    y = 2\nelse:\n    z = 3\n");
        Flow ifFlow = head(module);
        assertEquals(List.of("z", "y", "x"), values(ifFlow.getDefinedNames(true)));
        assertEquals(List.of("z", "y", "x"), values(module.getDefinedNames()));
        assertEquals(values(module.getDefinedNames()), values(ifFlow.next().getDefinedNames()));
        assertEquals(List.of("z"), values(ifFlow.next().next().getDefinedNames(true)));
    }

    @Test
    void testFlowNamesInsideFunctionBelongToFunction() {
        Module module = Parser.parse("def f(p):\n    while p:\n        q = p\n");
        Function f = (Function) module.subscopes().get(0);
        Flow loop = (Flow) f.subscopes().get(0);
        assertEquals(List.of("q", "p"), values(loop.getDefinedNames()));
        assertTrue(module.getDefinedNames().stream().noneMatch(n -> n.value().equals("q")));
    }

    @Test
    void testWalrusInCondition() {
        Module module = Parser.parse("if (m := match()):\n    pass\nelif n := other():\n    pass\n");
        assertEquals(List.of("m", "n"), values(head(module).getDefinedNames(true)));
    }

    @Test
    void testSetNextAppendsDetachedSegment() {
        Module module = Parser.parse("if a:\n    pass\n");
        Flow ifFlow = head(module);
        Flow extra = new Flow(List.of(new Keyword("else", new Position(3, 0), ""), new Operator(":", new Position(3, 4), "")));
        assertSame(extra, ifFlow.setNext(extra));
        assertSame(extra, ifFlow.next());
        assertSame(ifFlow, extra.previous());
        assertSame(ifFlow.chain(), extra.parent());

        ifFlow.setNext(extra);
        assertEquals(2, ifFlow.chain().segments().size());
    }

    @Test
    void testSetNextWithoutChainFails() {
        Flow detached = new Flow(List.of(new Keyword("else", Position.START, ""), new Operator(":", new Position(1, 4), "")));
        Flow other = new Flow(List.of(new Keyword("else", new Position(2, 0), ""), new Operator(":", new Position(2, 4), "")));
        assertThrows(IllegalStateException.class, () -> detached.setNext(other));
        assertNull(detached.next());
    }

    @Test
    void testSetNextRejectsSegmentOfAnotherTree() {
        Module first = Parser.parse("if a:\n    pass\nelse:\n    pass\n");
        Module second = Parser.parse("if b:\n    pass\n");
        Flow attached = head(first);
        Flow elseFlow = attached.next();
        Flow other = head(second);

        assertThrows(IllegalArgumentException.class, () -> other.setNext(elseFlow));
        assertNull(other.next());
        assertSame(elseFlow, attached.next());
        assertSame(attached.chain(), elseFlow.parent());
        assertEquals(1, other.chain().segments().size());
    }

    @Test
    @DisplayName("Long elif chains are walked without recursion")
    void testLongElifChain() {
        StringBuilder sb = new StringBuilder("if c0:\n    import m0\n");
        for (int i = 1; i <= 20000; i++) {
            sb.append("elif c").append(i).append(":\n    import m").append(i).append('\n');
        }
        String source = sb.toString();
        Module module = Parser.parse(source);
        assertEquals(source, module.getCode());

        Flow ifFlow = head(module);
        assertEquals(20001, ifFlow.chain().segments().size());
        List<String> names = values(module.getDefinedNames());
        assertEquals(20001, names.size());
        assertEquals("m20000", names.get(0));
        assertEquals("m0", names.get(20000));
        assertEquals(20001, ifFlow.getImports().size());
        assertEquals(20001, module.getImports().size());
        assertEquals(20002, module.walk().size());

        Flow last = ifFlow.chain().segments().get(20000);
        assertEquals(List.of("m20000"), values(last.getDefinedNames(true)));
        assertSame(last, last.previous().next());
    }

    @Test
    void testForLoop() {
        Module module = Parser.parse("for i, (j, k) in pairs:\n    total = j\nelse:\n    done = 1\n");
        ForFlow loop = (ForFlow) head(module);
        assertEquals("for", loop.command());
        assertEquals(Symbol.FOR_STMT, loop.chain().symbol());
        assertEquals(List.of("i", "j", "k"), values(loop.setVars()));
        assertEquals("pairs", loop.iterable().getCode(false));
        assertEquals(List.of(loop.iterable()), loop.inputs());
        assertEquals("i, (j, k)", loop.setStmt().getCode(false));
        assertEquals(List.of("i", "j", "k", "done", "total"), values(loop.getDefinedNames(true)));
    }

    @Test
    void testForTargetIsFoundByPosition() {
        Module module = Parser.parse("for item in items:\n    pass\n");
        Element found = module.getStatementForPosition(new Position(1, 5));
        assertTrue(found instanceof Name);
        assertEquals("item", ((Name) found).value());
    }

    @Test
    void testWithItems() {
        Module module = Parser.parse("with open(p) as fh, lock:\n    pass\nwith ctx() as (a, b):\n    pass\n");
        Flow first = (Flow) module.subscopes().get(0);
        Flow second = (Flow) module.subscopes().get(1);
        assertEquals("with", first.command());
        assertEquals(List.of("fh"), values(first.setVars()));
        List<Element> inputs = first.inputs();
        assertEquals(2, inputs.size());
        assertEquals("open(p)", inputs.get(0).getCode(false));
        assertEquals("lock", inputs.get(1).getCode(false));
        assertEquals(List.of("a", "b"), values(second.setVars()));
    }

    @Test
    void testTryExcept() {
        Module module = Parser.parse("try:\n    pass\nexcept ValueError as e:\n    pass\nfinally:\n    pass\n");
        Flow tryFlow = head(module);
        Flow except = tryFlow.next();
        assertEquals(Symbol.TRY_STMT, tryFlow.chain().symbol());
        assertEquals("except", except.command());
        assertEquals(List.of("e"), values(except.setVars()));
        assertEquals(1, except.inputs().size());
        assertEquals("ValueError", except.inputs().get(0).getCode(false));
        assertEquals("finally", except.next().command());
    }

    @Test
    void testImportsInsideFlows() {
        Module module = Parser.parse("if x:\n    import a\nelse:\n    import b\n");
        assertTrue(module.imports().isEmpty());
        assertEquals(2, module.getImports().size());
        assertEquals(List.of("b", "a"), values(module.getDefinedNames()));
    }

    @Test
    void testAsyncFor() {
        Module module = Parser.parse("async def f():\n    async for x in y:\n        pass\n");
        Function f = (Function) module.subscopes().get(0);
        Flow loop = (Flow) f.subscopes().get(0);
        assertTrue(loop.isAsync());
        assertEquals("for", loop.command());
    }
}
