package com.pyparser.jackson;

import com.pyparser.Parser;
import com.pyparser.ast.Element;
import com.pyparser.ast.ExprStmt;
import com.pyparser.ast.Module;
import com.pyparser.json.TreeJsonException;
import com.pyparser.json.TreeJsonProvider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTreeJsonProviderTest {

    @Test
    void testProviderDiscovery() {
        assertTrue(TreeJsonProvider.isProviderAvailable());
        assertTrue(TreeJsonProvider.getProvider() instanceof JacksonTreeJsonProvider);
        assertEquals("Jackson", TreeJsonProvider.getProvider("jackson").getName());
        assertThrows(IllegalStateException.class, () -> TreeJsonProvider.getProvider("gson"));
    }

    @Test
    void testSerializeAndDeserializeModule() {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();
        Module module = Parser.parse("total = a + b\n");
        String json = provider.getSerializer().serialize(module);
        String pretty = provider.getSerializer().serializePretty(module);
        assertTrue(pretty.contains("\n"));
        assertEquals(json.replaceAll("\\s", ""), pretty.replaceAll("\\s", ""));

        Module copy = provider.getDeserializer().deserializeModule(pretty);
        assertEquals(module.getCode(), copy.getCode());
        assertEquals("total", copy.getDefinedNames().get(0).value());
    }

    @Test
    void testSerializeSubtree() {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();
        Module module = Parser.parse("x = f(y)\n");
        ExprStmt stmt = (ExprStmt) module.statements().get(0);
        Element copy = provider.getDeserializer().deserialize(provider.getSerializer().serialize(stmt));
        assertTrue(copy instanceof ExprStmt);
        assertEquals("x = f(y)", copy.getCode(false));
        assertNull(copy.parent());
    }

    @Test
    void testDeserializeModuleRejectsOtherElements() {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();
        String json = provider.getSerializer().serialize(Parser.parse("x = 1\n").leaves().get(0));
        assertThrows(TreeJsonException.class, () -> provider.getDeserializer().deserializeModule(json));
    }

    @Test
    void testInvalidJson() {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();
        assertThrows(TreeJsonException.class, () -> provider.getDeserializer().deserialize("{not json"));
        assertThrows(TreeJsonException.class, () -> provider.getDeserializer().deserialize("{\"value\":\"x\"}"));
        assertThrows(TreeJsonException.class,
            () -> provider.getDeserializer().deserialize("{\"type\":\"no_such_symbol\",\"children\":[]}"));
        assertThrows(TreeJsonException.class,
            () -> provider.getDeserializer().deserialize("{\"type\":\"atom\",\"children\":[]}"));
        TreeJsonException e = assertThrows(TreeJsonException.class,
            () -> provider.getDeserializer().deserialize("{\"type\":\"name\",\"value\":\"x\"}"));
        assertNotNull(e.getCause());
    }
}
