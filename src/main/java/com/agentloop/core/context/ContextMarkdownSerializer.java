package com.agentloop.core.context;

import com.agentloop.core.model.LodLevel;
import com.agentloop.core.model.Round;

/**
 * Renders a context snapshot as a human-readable markdown document.
 * <p>
 * Heading depth encodes the level of detail: {@code ##} raw, {@code ###} compressed,
 * {@code ####} archived. Archived rounds show their summary and point at the archive entry.
 */
public final class ContextMarkdownSerializer {

    private ContextMarkdownSerializer() {}

    public static String render(String sessionId, ContextSnapshot snapshot) {
        var sb = new StringBuilder();
        sb.append("# Context ").append(sessionId).append("\n\n");
        for (Round round : snapshot.rounds()) {
            sb.append(heading(round.lodLevel()))
                    .append(" Round ").append(round.index())
                    .append(" - ").append(round.label())
                    .append(" (").append(round.lodLevel().name().toLowerCase()).append(")\n\n");
            switch (round.lodLevel()) {
                case RAW -> sb.append(round.rawContent()).append("\n\n");
                case COMPRESSED -> sb.append(round.compressedSummary()).append("\n\n");
                case ARCHIVED -> {
                    sb.append(round.compressedSummary()).append("\n\n");
                    sb.append("> raw content: archive#").append(round.index()).append("\n\n");
                }
            }
            if (round.holdsDigest()) {
                sb.append("> digest: ").append(round.digest()).append("\n\n");
            }
            if (round.folded()) {
                sb.append("> folded into round ").append(round.foldedInto()).append("\n\n");
            }
        }
        return sb.toString();
    }

    static String heading(LodLevel level) {
        return switch (level) {
            case RAW -> "##";
            case COMPRESSED -> "###";
            case ARCHIVED -> "####";
        };
    }
}
