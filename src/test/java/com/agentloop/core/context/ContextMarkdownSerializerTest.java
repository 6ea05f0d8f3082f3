package com.agentloop.core.context;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextMarkdownSerializerTest {

    @Test
    @DisplayName("heading depth follows the level of detail of each round")
    void headingsEncodeLevel() {
        var store = new ContextStore(new ContextSettings(100, 0.7, 2, 10), new TruncatingSummarizer());
        store.appendRound("planning", "a".repeat(120));
        store.appendRound("observation", "b".repeat(120));
        store.appendRound("observation", "c".repeat(120));

        String md = ContextMarkdownSerializer.render("LOOP-1", store.snapshot());

        assertTrue(md.startsWith("# Context LOOP-1"));
        assertTrue(md.contains("#### Round 0 - planning (archived)"));
        assertTrue(md.contains("> raw content: archive#0"));
        assertTrue(md.contains("### Round 1 - observation (compressed)"));
        assertTrue(md.contains("## Round 2 - observation (raw)"));
        assertTrue(md.contains("c".repeat(120)));
    }

    @Test
    @DisplayName("an empty store renders just the title")
    void emptySnapshot() {
        assertEquals("# Context S\n\n", ContextMarkdownSerializer.render("S", ContextSnapshot.empty()));
    }
}
