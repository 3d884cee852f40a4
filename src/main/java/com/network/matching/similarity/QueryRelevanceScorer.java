package com.network.matching.similarity;

import com.network.matching.core.model.Embedding;
import com.network.matching.core.model.ExperienceLevel;
import com.network.matching.core.model.ParsedQuery;
import com.network.matching.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores how well a candidate satisfies the structured criteria of a parsed query.
 *
 * <p>Each populated criterion contributes a score in [0, 1] and the result is their average.
 * An experience level of {@link ExperienceLevel#ANY} is not a criterion. Semantic similarity
 * between the query and profile embeddings counts as one more criterion when both are present.
 * A query with no criteria and no embeddings scores 0.0.</p>
 */
public class QueryRelevanceScorer {
    private static final Logger log = LoggerFactory.getLogger(QueryRelevanceScorer.class);

    private static final List<String> SENIOR_KEYWORDS = List.of("senior", "principal", "staff");
    private static final List<String> EXECUTIVE_KEYWORDS = List.of("vp", "director", "head", "ceo", "cto", "cpo");

    private final CosineSimilarity cosine;

    public QueryRelevanceScorer() {
        this(new CosineSimilarity());
    }

    public QueryRelevanceScorer(CosineSimilarity cosine) {
        this.cosine = cosine;
    }

    public double compute(Profile candidate, ParsedQuery query,
                          Embedding queryEmbedding, Embedding profileEmbedding) {
        if (query == null) {
            return 0.0;
        }

        double relevance = 0.0;
        int criteria = 0;
        String title = lower(candidate.getJobTitle().orElse(null));

        if (!query.jobTitles().isEmpty()) {
            criteria++;
            relevance += matchesTitle(title, query.jobTitles()) ? 1.0 : 0.0;
        }

        if (!query.companies().isEmpty()) {
            criteria++;
            Set<String> companies = CompanyOverlap.companiesOf(candidate);
            relevance += query.companies().stream()
                    .anyMatch(c -> companies.contains(lower(c))) ? 1.0 : 0.0;
        }

        if (!query.skills().isEmpty()) {
            criteria++;
            Set<String> skills = candidate.getSkills().stream()
                    .map(QueryRelevanceScorer::lower)
                    .collect(Collectors.toSet());
            long matched = query.skills().stream().filter(s -> skills.contains(lower(s))).count();
            relevance += (double) matched / query.skills().size();
        }

        if (!query.industries().isEmpty()) {
            criteria++;
            String industry = lower(candidate.getIndustry().orElse(null));
            relevance += industry != null && query.industries().stream()
                    .anyMatch(i -> industry.contains(lower(i))) ? 1.0 : 0.0;
        }

        if (!query.education().isEmpty()) {
            criteria++;
            String university = candidate.getEducation().map(e -> lower(e.university())).orElse(null);
            String degree = candidate.getEducation().map(e -> lower(e.degree())).orElse(null);
            relevance += query.education().stream()
                    .map(QueryRelevanceScorer::lower)
                    .anyMatch(req -> (university != null && university.contains(req))
                            || (degree != null && degree.contains(req))) ? 1.0 : 0.0;
        }

        if (query.experienceLevel() != ExperienceLevel.ANY) {
            criteria++;
            relevance += matchesLevel(title, query.experienceLevel()) ? 1.0 : 0.0;
        }

        if (queryEmbedding != null && profileEmbedding != null) {
            criteria++;
            relevance += cosine.compute(queryEmbedding, profileEmbedding);
        }

        if (criteria == 0) {
            return 0.0;
        }
        double score = relevance / criteria;
        log.debug("Query relevance for {}: {} over {} criteria", candidate.getId(), score, criteria);
        return score;
    }

    private static boolean matchesTitle(String title, List<String> queryTitles) {
        if (title == null) {
            return false;
        }
        for (String queryTitle : queryTitles) {
            String wanted = lower(queryTitle);
            if (title.contains(wanted) || wanted.contains(title)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesLevel(String title, ExperienceLevel level) {
        if (title == null) {
            return false;
        }
        return switch (level) {
            case SENIOR -> containsAny(title, SENIOR_KEYWORDS);
            case JUNIOR -> title.contains("junior")
                    || (!title.contains("senior") && !title.contains("principal"));
            case EXECUTIVE -> containsAny(title, EXECUTIVE_KEYWORDS);
            case ANY -> true;
        };
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
