package com.network.matching.api;

import com.network.matching.ranking.RankingMode;

import java.time.Duration;
import java.time.Instant;

/**
 * Facts about how a match response was produced.
 *
 * @param totalCandidatesEvaluated  candidates considered, which is every loaded profile but the requester
 * @param processingTime            wall-clock time of the request
 * @param timestamp                 when the response was assembled
 * @param rankingMode               strategy that ordered the results
 * @param queryEmbeddingAvailable   false when the query embedding degraded to absent
 */
public record MatchMetadata(
        int totalCandidatesEvaluated,
        Duration processingTime,
        Instant timestamp,
        RankingMode rankingMode,
        boolean queryEmbeddingAvailable
) {
}
