package com.pyparser.ast;

import com.pyparser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ParamTest {

    private static Function function(String source) {
        return (Function) Parser.parse(source).subscopes().get(0);
    }

    @Test
    void testStarsDefaultsAndAnnotations() {
        Function f = function("def f(a, b=1, *args, c: int = 2, **kw):\n    pass\n");
        List<Param> params = f.params();
        assertEquals(List.of(0, 0, 1, 0, 2), params.stream().map(Param::stars).collect(Collectors.toList()));
        assertNull(params.get(0).getDefault());
        assertEquals("1", params.get(1).getDefault().getCode(false));
        assertEquals("2", params.get(3).getDefault().getCode(false));
        assertEquals("int", params.get(3).annotation().getCode(false));
        assertNull(params.get(1).annotation());
        assertEquals("args", params.get(2).getName().value());
        assertEquals("kw", params.get(4).getName().value());
    }

    @Test
    void testPositionAndParent() {
        Function f = function("def f(a, b, c):\n    pass\n");
        List<Param> params = f.params();
        for (int i = 0; i < params.size(); i++) {
            assertEquals(i, params.get(i).positionNr());
            assertSame(f, params.get(i).parentFunction());
        }
    }

    @Test
    void testBareStarAndSlashAreNotParams() {
        Function g = function("def g(a, /, b, *, c):\n    pass\n");
        List<Param> params = g.params();
        assertEquals(List.of("a", "b", "c"),
            params.stream().map(p -> p.getName().value()).collect(Collectors.toList()));
        assertEquals(2, params.get(2).positionNr());
        assertEquals("(a, /, b, *, c)", g.parameters().getCode(false));
    }

    @Test
    void testDetachedParam() {
        Param param = new Param(List.of(new Name("x", Position.START, "")));
        assertNull(param.parentFunction());
        assertEquals(0, param.positionNr());
        assertEquals("x", param.getDefinedNames().get(0).value());
    }

    @Test
    void testLambda() {
        Module module = Parser.parse("f = lambda x, y=2: x + y\n");
        ExprStmt stmt = (ExprStmt) module.statements().get(0);
        Lambda lambda = (Lambda) stmt.getRhs();
        assertNull(lambda.name());
        assertEquals(2, lambda.params().size());
        assertEquals("x + y", lambda.expression().getCode(false));
        assertEquals(List.of("x", "y"),
            lambda.getDefinedNames().stream().map(Name::value).collect(Collectors.toList()));
        assertSame(module, lambda.getParentScope());
        assertSame(lambda, lambda.params().get(1).parentFunction());
        assertEquals(ScopeKind.FUNCTION, lambda.kind());
        assertTrue(module.getInnermostScope(new Position(1, 20)) instanceof Lambda);
    }
}
