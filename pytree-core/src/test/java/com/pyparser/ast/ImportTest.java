package com.pyparser.ast;

import com.pyparser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ImportTest {

    private static Import parseImport(String source) {
        return (Import) Parser.parse(source).statements().get(0);
    }

    private static List<String> values(List<Name> names) {
        return names.stream().map(Name::value).collect(Collectors.toList());
    }

    @Test
    void testImportWithAlias() {
        Import imp = parseImport("import a.b as c, d\n");
        assertFalse(imp.isFrom());
        assertEquals(0, imp.level());
        List<ImportedName> items = imp.importedNames();
        assertEquals(2, items.size());
        assertEquals(List.of("a", "b"), values(items.get(0).path()));
        assertEquals("c", items.get(0).alias().value());
        assertNull(items.get(1).alias());
        assertEquals(List.of("c", "d"), values(imp.getDefinedNames()));
        assertEquals(List.of(List.of("a", "b"), List.of("d")),
            imp.paths().stream().map(ImportTest::values).collect(Collectors.toList()));
        assertFalse(imp.isNested());
        assertEquals(List.of("a", "b", "c", "d"), values(imp.getAllImportNames()));
    }

    @Test
    void testNestedImport() {
        Import imp = parseImport("import a.b\n");
        assertTrue(imp.isNested());
        assertEquals(List.of("a"), values(imp.getDefinedNames()));
    }

    @Test
    void testRelativeFromImport() {
        Import imp = parseImport("from ..pkg.mod import (x as y, z)\n");
        assertTrue(imp.isFrom());
        assertEquals(2, imp.level());
        assertEquals(List.of("pkg", "mod"), values(imp.getFromNames()));
        assertEquals(List.of("y", "z"), values(imp.getDefinedNames()));
        assertEquals(List.of(List.of("pkg", "mod", "x"), List.of("pkg", "mod", "z")),
            imp.paths().stream().map(ImportTest::values).collect(Collectors.toList()));
        assertFalse(imp.isStar());
        assertFalse(imp.isDefunct());
    }

    @Test
    void testPathForName() {
        Import imp = parseImport("from ..pkg.mod import (x as y, z)\n");
        Name mod = imp.getFromNames().get(1);
        Name alias = imp.importedNames().get(0).alias();
        assertEquals(List.of("pkg", "mod"), values(imp.pathForName(mod)));
        assertEquals(List.of("pkg", "mod", "x"), values(imp.pathForName(alias)));
        assertNull(imp.pathForName(new Name("x", Position.START, "")));
    }

    @Test
    void testLevelCountsEllipsis() {
        assertEquals(4, parseImport("from .... import x\n").level());
        Import dot = parseImport("from . import x\n");
        assertEquals(1, dot.level());
        assertTrue(dot.getFromNames().isEmpty());
        assertEquals(List.of("x"), values(dot.getDefinedNames()));
    }

    @Test
    void testStarImport() {
        Import imp = parseImport("from os.path import *\n");
        assertTrue(imp.isStar());
        assertTrue(imp.getDefinedNames().isEmpty());
        assertFalse(imp.isDefunct());
        assertEquals(List.of(List.of("os", "path")),
            imp.paths().stream().map(ImportTest::values).collect(Collectors.toList()));
    }

    @Test
    void testDefunctImports() {
        Import bare = parseImport("import\n");
        assertTrue(bare.isDefunct());
        assertTrue(bare.getDefinedNames().isEmpty());
        Import noModule = parseImport("from import x\n");
        assertTrue(noModule.isDefunct());
        assertTrue(noModule.getDefinedNames().isEmpty());
        Import noKeyword = parseImport("from os\n");
        assertTrue(noKeyword.isDefunct());
        assertTrue(noKeyword.importedNames().isEmpty());
    }

    @Test
    void testOnlyImportSymbolsAreAccepted() {
        assertThrows(IllegalArgumentException.class,
            () -> new Import(Symbol.ATOM, List.of(new Keyword("import", Position.START, ""))));
    }

    @Test
    void testExplicitAbsoluteImport() {
        assertTrue(Parser.parse("from __future__ import absolute_import\n").hasExplicitAbsoluteImport());
        assertFalse(Parser.parse("from __future__ import division\n").hasExplicitAbsoluteImport());
        assertFalse(Parser.parse("import os\n").hasExplicitAbsoluteImport());
    }
}
