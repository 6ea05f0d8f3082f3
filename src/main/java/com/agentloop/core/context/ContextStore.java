package com.agentloop.core.context;

import com.agentloop.core.error.BudgetExceededException;
import com.agentloop.core.model.LodLevel;
import com.agentloop.core.model.Round;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only, multi-level-of-detail history of one session.
 * <p>
 * Size is tracked with {@link TokenEstimator} on the rendered view. After every append the store compresses
 * the oldest raw rounds once the effective view passes the configured threshold, archives
 * compressed rounds that have aged out, and, when the view still exceeds the hard ceiling,
 * folds the oldest archived rounds into a single digest. Raw content is never dropped:
 * archiving moves it into the {@link ArchiveIndex}.
 * <p>
 * An append either succeeds with the view within {@code maxTokens} or fails with
 * {@link BudgetExceededException} and leaves the store as it was.
 * <p>
 * Not thread-safe: a store belongs to exactly one loop controller.
 */
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    static final String DIGEST_LABEL = "digest";

    /** Receives a callback whenever a round moves to a new level of detail. */
    @FunctionalInterface
    public interface CompressionListener {
        void onLevelChanged(Round round);
    }

    private final ContextSettings settings;
    private final SummarizationPort summarizer;
    private List<Round> rounds = new ArrayList<>();
    private ArchiveIndex archive = new ArchiveIndex();
    private int nextIndex;
    private CompressionListener listener = round -> { };

    public ContextStore(ContextSettings settings, SummarizationPort summarizer) {
        this.settings = settings;
        this.summarizer = summarizer;
    }

    /**
     * Rebuilds a store exactly as it was snapshotted, without calling the summarizer.
     */
    public static ContextStore restore(ContextSettings settings, SummarizationPort summarizer,
                                       ContextSnapshot snapshot) {
        var store = new ContextStore(settings, summarizer);
        store.rounds = new ArrayList<>(snapshot.rounds());
        snapshot.archive().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> store.archive.store(e.getKey(), e.getValue()));
        store.nextIndex = snapshot.nextIndex();
        log.info("Restored context store: {} rounds, {} archived, view {} tokens",
                store.rounds.size(), store.archive.size(), store.effectiveView().totalTokens());
        return store;
    }

    public void setCompressionListener(CompressionListener listener) {
        this.listener = listener == null ? round -> { } : listener;
    }

    public ContextSettings settings() {
        return settings;
    }

    /**
     * Appends a new raw round and runs {@link #maybeCompress()}.
     * <p>
     * A round that alone exceeds {@code maxTokens} is compressed immediately.
     *
     * @param label name of the producing phase
     * @param rawContent full-fidelity content of the round
     * @return the round as stored after compression ran
     * @throws BudgetExceededException if the view cannot be brought within {@code maxTokens}
     */
    public Round appendRound(String label, String rawContent) {
        String content = rawContent == null ? "" : rawContent;
        List<Round> savedRounds = new ArrayList<>(rounds);
        ArchiveIndex savedArchive = archive.copy();
        int savedNext = nextIndex;

        int index = nextIndex++;
        Round round = Round.raw(index, label, content);
        int rawTokens = TokenEstimator.estimate(content);
        boolean oversized = EffectiveView.entryTokens(index, label, content) > settings.maxTokens();
        try {
            if (oversized) {
                log.info("Round {} ({}) is {} tokens, above max {}; compressing immediately",
                        index, label, rawTokens, settings.maxTokens());
                round = round.compress(summarizeWithinBudget(content, index, label));
            }
            rounds.add(round);
            maybeCompress();
        } catch (BudgetExceededException e) {
            rounds = savedRounds;
            archive = savedArchive;
            nextIndex = savedNext;
            throw e;
        }
        if (round.lodLevel() == LodLevel.COMPRESSED && oversized) {
            listener.onLevelChanged(round);
        }
        log.debug("Appended round {} ({}): {} raw tokens, view now {} tokens",
                index, label, rawTokens, effectiveView().totalTokens());
        return round(index).orElseThrow();
    }

    /**
     * Applies the compression and archival policy. Called after every append.
     *
     * @return number of level changes made
     * @throws BudgetExceededException if the view still exceeds {@code maxTokens} after folding everything
     */
    public int maybeCompress() {
        int changes = 0;
        double threshold = settings.thresholdTokens();

        while (viewTokens() > threshold) {
            Optional<Round> oldestRaw = rounds.stream().filter(r -> r.lodLevel() == LodLevel.RAW).findFirst();
            if (oldestRaw.isEmpty()) {
                break;
            }
            if (compressRound(oldestRaw.get().index())) {
                changes++;
            }
        }

        changes += archiveAged();

        if (viewTokens() > settings.maxTokens()) {
            changes += foldUntilWithinBudget();
        }
        return changes;
    }

    /**
     * Compresses one raw round. Rounds already compressed or archived are left alone.
     *
     * @return {@code true} if the round changed level
     */
    public boolean compressRound(int index) {
        Round round = round(index).orElseThrow(() -> new IllegalArgumentException("No round " + index));
        if (round.lodLevel() != LodLevel.RAW) {
            return false;
        }
        Round compressed = round.compress(summarizeWithinBudget(round.rawContent(), index, round.label()));
        replace(compressed);
        log.info("Compressed round {} ({}): {} -> {} tokens", index, round.label(),
                TokenEstimator.estimate(round.rawContent()), TokenEstimator.estimate(compressed.compressedSummary()));
        listener.onLevelChanged(compressed);
        return true;
    }

    private int archiveAged() {
        if (rounds.isEmpty()) {
            return 0;
        }
        int newest = rounds.get(rounds.size() - 1).index();
        int changes = 0;
        for (Round round : List.copyOf(rounds)) {
            if (round.lodLevel() == LodLevel.COMPRESSED && newest - round.index() >= settings.archiveAfterRounds()) {
                archiveRound(round);
                changes++;
            }
        }
        return changes;
    }

    private void archiveRound(Round round) {
        archive.store(round.index(), round.rawContent());
        Round archived = round.archive();
        replace(archived);
        log.info("Archived round {} ({})", round.index(), round.label());
        listener.onLevelChanged(archived);
    }

    /**
     * Folds rounds, oldest first, into a digest held by the first unfolded round until the
     * view fits. Rounds still raw are compressed and compressed rounds are archived on the way.
     */
    private int foldUntilWithinBudget() {
        int changes = 0;
        while (viewTokens() > settings.maxTokens()) {
            Round holder = null;
            Round next = null;
            for (Round r : rounds) {
                if (r.folded()) {
                    continue;
                }
                if (holder == null && r.holdsDigest()) {
                    holder = r;
                    continue;
                }
                next = r;
                break;
            }
            if (next == null) {
                throw new BudgetExceededException("Context cannot be folded any further",
                        viewTokens(), settings.maxTokens());
            }
            if (next.lodLevel() == LodLevel.RAW) {
                compressRound(next.index());
                changes++;
                next = round(next.index()).orElseThrow();
            }
            if (next.lodLevel() == LodLevel.COMPRESSED) {
                archiveRound(next);
                changes++;
                next = round(next.index()).orElseThrow();
            }
            if (holder == null) {
                replace(next.withDigest(next.compressedSummary()));
                continue;
            }
            String merged = mergeDigest(holder.digest(), next.compressedSummary(), holder.index());
            replace(holder.withDigest(merged));
            replace(next.foldInto(holder.index()));
            changes++;
            log.info("Folded round {} into digest at round {} ({} tokens)",
                    next.index(), holder.index(), TokenEstimator.estimate(merged));
        }
        return changes;
    }

    private String mergeDigest(String digest, String summary, int holderIndex) {
        String combined = digest + "\n" + summary;
        if (TokenEstimator.estimate(combined) <= entryBudget(holderIndex, DIGEST_LABEL)) {
            return combined;
        }
        return summarizeWithinBudget(combined, holderIndex, DIGEST_LABEL);
    }

    /**
     * Content budget of one rendered entry: the summary budget, capped so that the entry with
     * its label prefix still fits under {@code maxTokens} on its own.
     */
    private int entryBudget(int index, String label) {
        int room = settings.maxTokens() - EffectiveView.overheadTokens(index, label);
        return Math.min(settings.summaryBudgetTokens(), Math.max(1, room));
    }

    /**
     * Calls the summarizer and enforces its budget. A summary longer than the content it
     * replaces is discarded in favour of the content itself.
     */
    private String summarizeWithinBudget(String content, int index, String label) {
        int budget = entryBudget(index, label);
        String summary = summarizer.summarize(content, budget);
        if (summary == null) {
            summary = "";
        }
        int summaryTokens = TokenEstimator.estimate(summary);
        if (summaryTokens > budget) {
            throw new BudgetExceededException("Summary of round " + index + " exceeds its budget",
                    summaryTokens, budget);
        }
        if (summaryTokens >= TokenEstimator.estimate(content)) {
            return content;
        }
        return summary;
    }

    /**
     * The ordered content downstream reasoning sees. Raw rounds contribute their content,
     * compressed and archived rounds their summary, a digest holder its digest, and folded
     * rounds nothing.
     */
    public EffectiveView effectiveView() {
        var entries = new ArrayList<EffectiveView.Entry>();
        for (Round r : rounds) {
            if (r.folded()) {
                continue;
            }
            String content;
            String label = r.label();
            if (r.holdsDigest()) {
                content = r.digest();
                label = DIGEST_LABEL;
            } else if (r.lodLevel() == LodLevel.RAW) {
                content = r.rawContent();
            } else {
                content = r.compressedSummary();
            }
            int tokens = EffectiveView.entryTokens(r.index(), label, content);
            entries.add(new EffectiveView.Entry(r.index(), label, r.lodLevel(), content, tokens));
        }
        return EffectiveView.of(entries);
    }

    private int viewTokens() {
        return effectiveView().totalTokens();
    }

    /** Full-fidelity content of any round, wherever it currently lives. */
    public Optional<String> rawContent(int index) {
        Optional<Round> round = round(index);
        if (round.isEmpty()) {
            return Optional.empty();
        }
        if (round.get().rawContent() != null) {
            return Optional.of(round.get().rawContent());
        }
        return archive.lookup(index);
    }

    public Optional<Round> round(int index) {
        return rounds.stream().filter(r -> r.index() == index).findFirst();
    }

    public List<Round> rounds() {
        return List.copyOf(rounds);
    }

    public ArchiveIndex archive() {
        return archive;
    }

    public int size() {
        return rounds.size();
    }

    public ContextSnapshot snapshot() {
        return new ContextSnapshot(rounds, archive.asMap(), nextIndex);
    }

    private void replace(Round updated) {
        for (int i = 0; i < rounds.size(); i++) {
            if (rounds.get(i).index() == updated.index()) {
                rounds.set(i, updated);
                return;
            }
        }
        throw new IllegalArgumentException("No round " + updated.index());
    }
}
