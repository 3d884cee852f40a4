package com.network.matching.ranking;

import java.util.List;

/**
 * Orders candidates for a match request.
 */
public interface RankingStrategy {

    /**
     * Ranks the context's candidates, best first. The result may hold more than
     * {@link RankingContext#maxResults()} entries; callers truncate.
     *
     * @throws com.network.matching.ai.CollaboratorException if a collaborator needed for ranking fails
     */
    List<RankedCandidate> rank(RankingContext context);

    /**
     * Builds the human-readable explanation of a ranked candidate.
     *
     * @param mutualConnectionCount number of mutual connections attached to the result
     */
    String explain(RankedCandidate candidate, int mutualConnectionCount);

    RankingMode getMode();
}
