package com.agentloop.core.capability;

import com.agentloop.core.error.CapabilityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Test
    @DisplayName("descriptors keep registration order")
    void descriptorsInOrder() {
        var registry = new CapabilityRegistry()
                .register("search", CapabilityKind.PROTOCOL_TOOL, "web search", args -> "")
                .register("summarize", CapabilityKind.SUBAGENT, "summarizer agent", args -> "")
                .register("add", CapabilityKind.FUNCTION, "adds numbers", args -> "");

        assertEquals(List.of("search", "summarize", "add"),
                registry.descriptors().stream().map(CapabilityDescriptor::name).toList());
        assertEquals(CapabilityKind.SUBAGENT, registry.lookup("summarize").orElseThrow().kind());
        assertTrue(registry.lookup("missing").isEmpty());
    }

    @Test
    @DisplayName("re-registering a name replaces the handler without duplicating it")
    void reRegister() {
        var registry = new CapabilityRegistry()
                .register("echo", CapabilityKind.FUNCTION, "v1", args -> "one")
                .register("echo", CapabilityKind.FUNCTION, "v2", args -> "two");

        assertEquals(1, registry.descriptors().size());
        assertEquals("two", registry.invoke("echo", Map.of(), TIMEOUT).output());
    }

    @Test
    @DisplayName("invoke passes arguments to the handler")
    void invoke() {
        var registry = new CapabilityRegistry()
                .register("add", CapabilityKind.FUNCTION, "adds",
                        args -> String.valueOf(Integer.parseInt(args.get("a")) + Integer.parseInt(args.get("b"))));

        CapabilityResult result = registry.invoke("add", Map.of("a", "2", "b", "3"), TIMEOUT);

        assertTrue(result.success());
        assertEquals("5", result.output());
    }

    @Test
    @DisplayName("unknown names and handler exceptions surface as capability errors")
    void errors() {
        var registry = new CapabilityRegistry()
                .register("io", CapabilityKind.PROTOCOL_TOOL, "does io", args -> {
                    throw new IOException("connection reset");
                });

        var unknown = assertThrows(CapabilityException.class, () -> registry.invoke("nope", Map.of(), TIMEOUT));
        assertEquals("nope", unknown.getCapabilityRef());

        var failed = assertThrows(CapabilityException.class, () -> registry.invoke("io", Map.of(), TIMEOUT));
        assertInstanceOf(IOException.class, failed.getCause());
        assertTrue(failed.getMessage().contains("connection reset"));
    }
}
