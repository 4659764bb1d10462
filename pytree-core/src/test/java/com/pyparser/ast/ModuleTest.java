package com.pyparser.ast;

import com.pyparser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleTest {

    private static List<String> values(List<Name> names) {
        return names.stream().map(Name::value).collect(Collectors.toList());
    }

    @Test
    void testModuleName() {
        assertEquals("foo", Module.moduleName("/a/b/foo.py"));
        assertEquals("pkg", Module.moduleName("/a/pkg/__init__.py"));
        assertEquals("mod", Module.moduleName("x/mod.cpython-36m.so"));
        assertEquals("", Module.moduleName(null));

        Module module = Parser.parse("x = 1\n", "/src/tools/build.py");
        assertEquals("build", module.name().value());
        assertEquals(Position.START, module.name().start());
        assertSame(module.name(), module.name());
        assertEquals("", Parser.parse("x = 1\n").name().value());
    }

    @Test
    void testUsedNames() {
        Module module = Parser.parse("a = b + a\ndef f():\n    return a\n");
        Map<String, List<Name>> used = module.usedNames();
        assertEquals(List.of("a", "b", "f"), List.copyOf(used.keySet()));
        assertEquals(3, used.get("a").size());
        assertSame(used, module.usedNames());
        assertThrows(UnsupportedOperationException.class, () -> used.put("c", List.of()));
    }

    @Test
    void testGlobalNames() {
        Module module = Parser.parse("def f():\n    global g, h\n    g = 1\nglobal m\n");
        assertEquals(List.of("g", "h"), values(module.getGlobalNames()));
    }

    @Test
    void testInnermostScope() {
        Module module = Parser.parse("class A:\n    def f(self):\n        pass\n");
        ClassDef a = (ClassDef) module.subscopes().get(0);
        Function f = (Function) a.subscopes().get(0);
        assertSame(module, module.getInnermostScope(new Position(5, 0)));
        assertSame(a, module.getInnermostScope(new Position(1, 7)));
        assertSame(f, module.getInnermostScope(new Position(3, 9)));
        assertSame(f, module.getInnermostScope(new Position(2, 10)));
    }

    @Test
    @DisplayName("Names are visible from the innermost scope outwards")
    void testScopeNamesGenerator() {
        String source = String.join("\n",
            "x = 1",
            "def f(p):",
            "    y = 2",
            "    def g():",
            "        z = 3",
            "        return z + y",
            "late = 4",
            "");
        Module module = Parser.parse(source);
        List<ScopeNames> scopes = module.scopeNamesGenerator(new Position(6, 15));
        assertEquals(3, scopes.size());
        assertEquals("g", ((Function) scopes.get(0).scope()).name().value());
        assertEquals(List.of("z"), values(scopes.get(0).names()));
        assertEquals(List.of("y", "g", "p"), values(scopes.get(1).names()));
        assertSame(module, scopes.get(2).scope());
        assertEquals(List.of("x", "f"), values(scopes.get(2).names()));
    }

    @Test
    void testScopeNamesWithoutPosition() {
        Module module = Parser.parse("x = 1\ndef f():\n    y = 2\n");
        List<ScopeNames> scopes = module.scopeNamesGenerator(null);
        assertEquals(1, scopes.size());
        assertEquals(List.of("x", "f"), values(scopes.get(0).names()));
    }

    @Test
    void testFlowsAreSkipped() {
        Module module = Parser.parse("if c:\n    a = 1\n    b = a\n");
        List<ScopeNames> scopes = module.scopeNamesGenerator(new Position(3, 8));
        assertEquals(1, scopes.size());
        assertSame(module, scopes.get(0).scope());
        assertEquals(List.of("a", "b"), values(scopes.get(0).names()));
    }

    @Test
    void testListComprehension() {
        Module module = Parser.parse("r = [a + b for a in xs for b in a if b]\n");
        ExprStmt stmt = (ExprStmt) module.statements().get(0);
        ListComprehension comprehension = (ListComprehension) ((Node) stmt.getRhs()).child(1);
        assertEquals("a + b", comprehension.stmt().getCode(false));
        assertEquals(3, comprehension.clauses().size());
        assertEquals("b", comprehension.middle().getCode(false));
        assertEquals("a", comprehension.input().getCode(false));
        assertEquals("for", comprehension.command());
        assertEquals(List.of("a", "b"), values(comprehension.setVars()));
        assertNull(comprehension.next());
        assertEquals(List.of("r"), values(module.getDefinedNames()));

        assertSame(comprehension, module.getInnermostScope(new Position(1, 5)));
        List<ScopeNames> scopes = module.scopeNamesGenerator(new Position(1, 5));
        assertEquals(2, scopes.size());
        assertSame(comprehension, scopes.get(0).scope());
        assertEquals(List.of("a", "b"), values(scopes.get(0).names()));
        assertEquals(List.of("r"), values(scopes.get(1).names()));
    }

    @Test
    void testGeneratorArgument() {
        Module module = Parser.parse("total = sum(x * 2 for x in values)\n");
        Scope innermost = module.getInnermostScope(new Position(1, 12));
        assertTrue(innermost instanceof ListComprehension);
        assertEquals(List.of("x"), values(innermost.getDefinedNames()));
    }

    @Test
    void testFilterAfterPosition() {
        Module module = Parser.parse("a = 1\nb = 2\n");
        List<Name> names = module.getDefinedNames();
        assertEquals(List.of("a"), values(Scopes.filterAfterPosition(names, new Position(2, 0))));
        assertEquals(List.of("a", "b"), values(Scopes.filterAfterPosition(names, null)));
    }
}
