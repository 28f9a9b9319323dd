package com.bank.reconciliation.service;

import com.bank.reconciliation.config.DuplicateDetectionConfig;
import com.bank.reconciliation.model.DuplicateMatch;
import com.bank.reconciliation.model.SimilarityScore;
import com.bank.reconciliation.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds likely duplicates of a record among a set of existing records.
 *
 * Detection is side-effect free: callers decide whether to mark a record through
 * {@link #markAsDuplicate}. A record links to at most one original, the highest scoring
 * match, with ties going to the lowest matched id.
 */
@Service
public class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private static final Comparator<DuplicateMatch> BY_SCORE_THEN_ID =
            Comparator.comparingDouble(DuplicateMatch::getScore).reversed()
                    .thenComparing(DuplicateMatch::getMatchedId,
                            Comparator.nullsLast(Comparator.naturalOrder()));

    private final SimilarityScorer similarityScorer;
    private final DuplicateDetectionConfig config;

    public DuplicateDetector(SimilarityScorer similarityScorer, DuplicateDetectionConfig config) {
        this.similarityScorer = similarityScorer;
        this.config = config;
    }

    public List<DuplicateMatch> findDuplicates(TransactionRecord candidate, List<TransactionRecord> existing) {
        return findDuplicates(candidate, existing, config.getThreshold());
    }

    /**
     * Compare the candidate against every existing record and return those scoring at or
     * above {@code threshold}, best first.
     */
    public List<DuplicateMatch> findDuplicates(TransactionRecord candidate,
                                               List<TransactionRecord> existing,
                                               double threshold) {
        Objects.requireNonNull(candidate, "candidate");
        if (existing == null || existing.isEmpty()) {
            return new ArrayList<>();
        }

        List<DuplicateMatch> matches = new ArrayList<>();
        for (TransactionRecord other : existing) {
            if (isSameRecord(candidate, other)) {
                continue;
            }
            SimilarityScore similarity = similarityScorer.score(candidate, other);
            if (similarity.getOverall() >= threshold) {
                matches.add(DuplicateMatch.builder()
                        .matchedId(other.getId())
                        .matchedRecord(other)
                        .score(similarity.getOverall())
                        .breakdown(similarity)
                        .build());
            }
        }

        matches.sort(BY_SCORE_THEN_ID);
        if (!matches.isEmpty()) {
            log.debug("Candidate {} ({}) has {} potential duplicate(s), best score {}",
                    candidate.getId(), candidate.getVendor(), matches.size(), matches.get(0).getScore());
        }
        return matches;
    }

    public Map<Long, List<DuplicateMatch>> batchCheck(List<TransactionRecord> records) {
        return batchCheck(records, config.getThreshold());
    }

    /**
     * Pairwise check of every identified record against all the others. Quadratic in the
     * number of records.
     */
    public Map<Long, List<DuplicateMatch>> batchCheck(List<TransactionRecord> records, double threshold) {
        Map<Long, List<DuplicateMatch>> results = new LinkedHashMap<>();
        if (records == null || records.isEmpty()) {
            return results;
        }

        for (TransactionRecord record : records) {
            if (record.getId() == null) {
                log.debug("Skipping record without id in batch duplicate check: {}", record.getVendor());
                continue;
            }
            results.put(record.getId(), findDuplicates(record, records, threshold));
        }
        return results;
    }

    public Optional<DuplicateMatch> bestMatch(List<DuplicateMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return Optional.empty();
        }
        return matches.stream().min(BY_SCORE_THEN_ID);
    }

    public TransactionRecord markAsDuplicate(TransactionRecord record, DuplicateMatch match) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(match, "match");
        if (match.getMatchedRecord() == record
                || (record.getId() != null && record.getId().equals(match.getMatchedId()))) {
            throw new IllegalArgumentException("A record cannot be marked as a duplicate of itself: " + record.getId());
        }
        record.setDuplicate(true);
        record.setDuplicateOf(match.getMatchedId());
        return record;
    }

    /**
     * Human-readable summary of the top three matches.
     */
    public String summarize(List<DuplicateMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return "No duplicates found";
        }

        StringBuilder summary = new StringBuilder()
                .append("Found ").append(matches.size()).append(" potential duplicate(s):");
        int rank = 1;
        for (DuplicateMatch match : matches.subList(0, Math.min(3, matches.size()))) {
            TransactionRecord entry = match.getMatchedRecord();
            summary.append(String.format("%n%d. Entry #%s - %s (%s %s) - Similarity: %.0f%%",
                    rank++, entry.getId(), entry.getVendor(),
                    entry.effectiveAmount().toPlainString(), entry.getCurrency(), match.getScore()));
        }
        return summary.toString();
    }

    private static boolean isSameRecord(TransactionRecord candidate, TransactionRecord other) {
        if (candidate == other) {
            return true;
        }
        return candidate.getId() != null && candidate.getId().equals(other.getId());
    }
}
