package com.nodeflow.engine;

import com.nodeflow.api.DataType;
import com.nodeflow.api.FlowAlg;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TypeRegistryTest {

    private final TypeRegistry types = new TypeRegistry();

    @Test
    public void testUntypedInputAcceptsAnything() {
        assertTrue(types.canConnect(null, null));
        assertTrue(types.canConnect(TypeRegistry.STRING, null));
        assertTrue(types.accepts(null, 42));
    }

    @Test
    public void testUntypedOutputFitsObjectOnly() {
        assertTrue(types.canConnect(null, TypeRegistry.OBJECT));
        assertFalse(types.canConnect(null, TypeRegistry.NUMBER));
    }

    @Test
    public void testAssignability() {
        assertTrue(types.canConnect(TypeRegistry.INTEGER, TypeRegistry.NUMBER));
        assertTrue(types.canConnect(TypeRegistry.DOUBLE, TypeRegistry.OBJECT));
        assertFalse(types.canConnect(TypeRegistry.NUMBER, TypeRegistry.INTEGER));
        assertFalse(types.canConnect(TypeRegistry.STRING, TypeRegistry.BOOLEAN));
    }

    @Test
    public void testAcceptsValues() {
        assertTrue(types.accepts(TypeRegistry.LIST, List.of(1)));
        assertTrue(types.accepts(TypeRegistry.STRING, null));
        assertFalse(types.accepts(TypeRegistry.LONG, 1));
    }

    @Test
    public void testResolveByName() {
        assertSame(TypeRegistry.DOUBLE, types.resolve("double"));
        assertNull(types.resolve(TypeRegistry.ANY));
        assertNull(types.resolve(null));
        assertEquals(TypeRegistry.ANY, TypeRegistry.nameOf(null));
        assertThrows(IllegalArgumentException.class, () -> types.resolve("matrix"));
    }

    @Test
    public void testCustomTypes() {
        DataType path = DataType.named("path", java.nio.file.Path.class);
        types.register(path).register(path);
        assertSame(path, types.resolve("path"));
        assertThrows(IllegalArgumentException.class,
                () -> types.register(DataType.named("path", String.class)));
    }

    @Test
    public void testAlgorithmModeStrings() {
        assertEquals(FlowAlg.DATA_OPT, FlowAlg.fromString("data opt"));
        assertEquals(FlowAlg.DATA_OPT, FlowAlg.fromString("DATA_OPT"));
        assertEquals(FlowAlg.EXEC, FlowAlg.fromString(" exec "));
        assertEquals("manual", FlowAlg.MANUAL.label());
        assertThrows(IllegalArgumentException.class, () -> FlowAlg.fromString("fast"));
    }
}
