package io.surfworks.loopweaver.lowering.select;

import io.surfworks.loopweaver.ir.AttributeValue;
import io.surfworks.loopweaver.ir.InMemoryGraphContext;
import io.surfworks.loopweaver.ir.Node;
import io.surfworks.loopweaver.ir.Ops;
import io.surfworks.loopweaver.ir.TensorValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeFactoryTest {

    private final InMemoryGraphContext ctx = new InMemoryGraphContext();
    private final NodeFactory factory = new NodeFactory(ctx);

    @Test
    void namesNodesAfterTheirKind() {
        Node gather = factory.create(Ops.GATHER, List.of("x", "i"));

        assertEquals("Gather__1", gather.name());
        assertEquals(List.of("Gather__1:0"), gather.outputs());
        assertTrue(ctx.names().isTaken("Gather__1"));
        assertTrue(ctx.names().isTaken("Gather__1:0"));
    }

    @Test
    void customPrefixAndOutputCount() {
        Node loop = factory.create(Ops.LOOP, "loop", List.of("m", "c"), 2, Map.of());

        assertEquals(Ops.LOOP, loop.opType());
        assertEquals(List.of(loop.name() + ":0", loop.name() + ":1"), loop.outputs());
        assertTrue(loop.name().startsWith("loop__"));
        assertTrue(ctx.names().isTaken(loop.name() + ":1"));
    }

    @Test
    void constantOutputIsItsName() {
        Node constant = factory.constant("condition", TensorValue.scalarBool(true));

        assertEquals(List.of(constant.name()), constant.outputs());
        assertTrue(constant.inputs().isEmpty());
        assertEquals(AttributeValue.of(TensorValue.scalarBool(true)), constant.attribute(Ops.ATTR_VALUE).orElseThrow());
    }

    @Test
    void identityKeepsChosenOutput() {
        Node identity = factory.identity("Squeeze__4:0", "y");

        assertEquals(List.of("Squeeze__4:0"), identity.inputs());
        assertEquals(List.of("y"), identity.outputs());
        assertTrue(identity.name().startsWith("Identity__"));
    }

    @Test
    void outputPorts() {
        assertEquals("loop__3:1", NodeFactory.outputPort("loop__3", 1));
        assertEquals("Size__2:0", NodeFactory.outputPort("Size__2"));
    }
}
