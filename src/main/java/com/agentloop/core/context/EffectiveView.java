package com.agentloop.core.context;

import com.agentloop.core.model.LodLevel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The bounded projection of a context store that downstream reasoning sees.
 * <p>
 * Token counts are taken on the rendered text, label prefix and separators included, so
 * {@code TokenEstimator.estimate(render())} never exceeds {@link #totalTokens()}.
 *
 * @param entries contributing rounds in round order
 * @param totalTokens token estimate of {@link #render()}
 */
public record EffectiveView(List<Entry> entries, int totalTokens) {

    static final String SEPARATOR = "\n\n";

    public EffectiveView {
        entries = List.copyOf(entries);
    }

    /**
     * @param roundIndex index of the round the content comes from
     * @param label producing phase, or {@code digest} for a folded run
     * @param lodLevel level of the contributing round
     * @param content text contributed
     * @param tokens token estimate of the rendered entry, separator included
     */
    public record Entry(int roundIndex, String label, LodLevel lodLevel, String content, int tokens) {

        public String rendered() {
            return renderEntry(roundIndex, label, content);
        }
    }

    /** Builds a view whose total is measured on its own rendering. */
    static EffectiveView of(List<Entry> entries) {
        var view = new EffectiveView(entries, 0);
        return new EffectiveView(view.entries, TokenEstimator.estimate(view.render()));
    }

    static String renderEntry(int roundIndex, String label, String content) {
        return "[" + roundIndex + ":" + label + "] " + content;
    }

    /** Tokens an entry costs on top of its content: label prefix plus separator. */
    static int overheadTokens(int roundIndex, String label) {
        return TokenEstimator.estimate(renderEntry(roundIndex, label, "") + SEPARATOR);
    }

    /** Cost of one entry in a rendered view. */
    static int entryTokens(int roundIndex, String label, String content) {
        return TokenEstimator.estimate(renderEntry(roundIndex, label, content) + SEPARATOR);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Plain-text rendering used in prompts. */
    public String render() {
        return entries.stream()
                .map(Entry::rendered)
                .collect(Collectors.joining(SEPARATOR));
    }
}
