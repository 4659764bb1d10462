package com.pyparser.ast;

import com.pyparser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ExprStmtTest {

    private static ExprStmt firstStatement(String source) {
        Module module = Parser.parse(source);
        return (ExprStmt) module.statements().get(0);
    }

    private static List<String> defined(String source) {
        return firstStatement(source).getDefinedNames().stream().map(Name::value).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Nested tuple unpacking binds every name")
    void testNestedTupleTargets() {
        assertEquals(List.of("x", "y", "z"), defined("x, (y, z) = 2, ''"));
        assertEquals(List.of("a", "b"), defined("[a, b] = c"));
        assertEquals(List.of("a", "b"), defined("a, *b = c"));
    }

    @Test
    void testChainedAssignmentBindsEachTarget() {
        assertEquals(List.of("x", "y"), defined("x = y = 2"));
    }

    @Test
    @DisplayName("Attribute, subscript and augmented targets bind nothing")
    void testNonBindingTargets() {
        assertEquals(List.of(), defined("a.b = 1"));
        assertEquals(List.of(), defined("a[0] = 1"));
        assertEquals(List.of(), defined("x += 1"));
        assertEquals(List.of(), defined("f(x)"));
    }

    @Test
    void testAnnotatedAssignment() {
        assertEquals(List.of("x"), defined("x: int = 1"));
        assertEquals(List.of("x"), defined("x: int"));
        assertEquals(List.of(), defined("self.x: int = 1"));
        ExprStmt bare = firstStatement("x: int");
        assertTrue(bare.isAnnotated());
        assertNull(bare.getRhs());
        assertEquals("1", firstStatement("x: int = 1").getRhs().getCode(false));
    }

    @Test
    void testAssignmentDetails() {
        ExprStmt stmt = firstStatement("x = y = 2");
        List<AssignmentDetail> details = stmt.assignmentDetails();
        assertEquals(2, details.size());
        assertEquals("x", details.get(0).target().getCode(false));
        assertEquals("=", details.get(0).operator().value());
        assertEquals("y", details.get(1).target().getCode(false));
        assertEquals("+=", firstStatement("a += 1").assignmentDetails().get(0).operator().value());
    }

    @Test
    @DisplayName("Assignment indexes are listed outermost first")
    void testAssignmentIndexes() {
        Module module = Parser.parse("x, (y, z) = 2, ''\n");
        Name x = module.usedNames().get("x").get(0);
        Name y = module.usedNames().get("y").get(0);
        Name z = module.usedNames().get("z").get(0);
        assertEquals(List.of(0), x.assignmentIndexes());
        assertEquals(List.of(1, 0), y.assignmentIndexes());
        assertEquals(List.of(1, 1), z.assignmentIndexes());
        Name plain = Parser.parse("a = 1\n").usedNames().get("a").get(0);
        assertEquals(List.of(), plain.assignmentIndexes());
    }

    @Test
    void testAssignmentIndexesOfForTarget() {
        Module module = Parser.parse("for i, (j, k) in items:\n    pass\n");
        Name j = module.usedNames().get("j").get(0);
        assertEquals(List.of(1, 0), j.assignmentIndexes());
    }

    @Test
    void testBrokenParentLinkIsReported() {
        Module module = Parser.parse("x, y = 1, 2\n");
        ExprStmt stmt = (ExprStmt) module.statements().get(0);
        Name y = module.usedNames().get("y").get(0);
        SyntaxTree tree = module.syntaxTree();
        tree.adopt(y, tree.indexOf(stmt.getRhs()));
        assertThrows(StructuralInconsistencyException.class, y::assignmentIndexes);
    }

    @Test
    void testDefinitionLookup() {
        Module module = Parser.parse("a = b\ndef f(p): pass\n");
        Name a = module.usedNames().get("a").get(0);
        Name b = module.usedNames().get("b").get(0);
        Name f = module.usedNames().get("f").get(0);
        Name p = module.usedNames().get("p").get(0);
        assertTrue(a.getDefinition() instanceof ExprStmt);
        assertTrue(a.isDefinition());
        assertFalse(b.isDefinition());
        assertTrue(f.isDefinition());
        assertTrue(p.getDefinition() instanceof Param);
        assertTrue(p.isDefinition());
    }

    @Test
    void testExpressionList() {
        ExprStmt stmt = firstStatement("x = a.b, c, 1 + 2");
        List<StatementElement> chains = stmt.expressionList();
        assertEquals(2, chains.size());
        assertEquals(List.of("a", "b"), ((Call) chains.get(0)).names());
        assertEquals(List.of("c"), ((Call) chains.get(1)).names());
    }

    @Test
    @DisplayName("A string statement after an assignment documents it")
    void testAssignmentDocstring() {
        Module module = Parser.parse("x = 1\n\"\"\"About x.\"\"\"\ny = 2\nz = 3; 'About z.'\n");
        List<Node> statements = module.statements();
        assertEquals("About x.", ((ExprStmt) statements.get(0)).rawDoc());
        assertEquals("", ((ExprStmt) statements.get(1)).rawDoc());
        assertEquals("", ((ExprStmt) statements.get(2)).rawDoc());
        assertEquals("About z.", ((ExprStmt) statements.get(3)).rawDoc());
        assertEquals("", ((ExprStmt) statements.get(4)).rawDoc());
    }
}
