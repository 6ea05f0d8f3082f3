package com.agentloop.core.model;

/**
 * One iteration's slice of interaction history.
 * <p>
 * Archived rounds no longer carry their raw content; it lives in the store's
 * archive index under the same {@code index}. A round that heads a folded run
 * carries a {@code digest} standing in for every round folded into it, and those
 * rounds point back at it through {@code foldedInto}.
 *
 * @param index monotonically increasing position in the store
 * @param label name of the loop phase that produced the round
 * @param rawContent full-fidelity content, {@code null} once archived
 * @param compressedSummary bounded summary, present from compression on
 * @param lodLevel current level of detail
 * @param digest merged summary of a folded run, only on the run's first round
 * @param foldedInto index of the digest holder, {@code null} unless folded
 */
public record Round(
        int index,
        String label,
        String rawContent,
        String compressedSummary,
        LodLevel lodLevel,
        String digest,
        Integer foldedInto
) {

    public static Round raw(int index, String label, String rawContent) {
        return new Round(index, label, rawContent, null, LodLevel.RAW, null, null);
    }

    public Round compress(String summary) {
        requireAdvance(LodLevel.COMPRESSED);
        return new Round(index, label, rawContent, summary, LodLevel.COMPRESSED, digest, foldedInto);
    }

    public Round archive() {
        requireAdvance(LodLevel.ARCHIVED);
        return new Round(index, label, null, compressedSummary, LodLevel.ARCHIVED, digest, foldedInto);
    }

    public Round withDigest(String newDigest) {
        requireArchived("hold a digest");
        return new Round(index, label, rawContent, compressedSummary, lodLevel, newDigest, foldedInto);
    }

    public Round foldInto(int holderIndex) {
        requireArchived("be folded");
        return new Round(index, label, rawContent, compressedSummary, lodLevel, digest, holderIndex);
    }

    public boolean folded() {
        return foldedInto != null;
    }

    public boolean holdsDigest() {
        return digest != null;
    }

    private void requireAdvance(LodLevel next) {
        if (!lodLevel.canAdvanceTo(next)) {
            throw new IllegalStateException("Round " + index + " cannot move from " + lodLevel + " to " + next);
        }
    }

    private void requireArchived(String action) {
        if (lodLevel != LodLevel.ARCHIVED) {
            throw new IllegalStateException("Round " + index + " must be archived to " + action + ", is " + lodLevel);
        }
    }
}
