package com.network.matching.similarity;

import com.network.matching.core.model.Education;
import com.network.matching.core.model.Profile;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Education similarity: university match plus degree match.
 *
 * <ul>
 *   <li>+0.7 when the universities are equal (case-insensitive)</li>
 *   <li>+0.3 when the degrees are equal (case-insensitive), otherwise
 *       +0.15 when both degrees sit at adjacent levels (two bachelor degrees, or any
 *       combination of master and doctorate)</li>
 * </ul>
 * Returns 0.0 if either profile has no education record.
 */
public class EducationSimilarity implements ProfileSimilarity {

    static final double UNIVERSITY_WEIGHT = 0.7;
    static final double DEGREE_WEIGHT = 0.3;
    static final double ADJACENT_DEGREE_WEIGHT = 0.15;

    @Override
    public double compute(Profile first, Profile second) {
        Optional<Education> firstEducation = first.getEducation();
        Optional<Education> secondEducation = second.getEducation();
        if (firstEducation.isEmpty() || secondEducation.isEmpty()) {
            return 0.0;
        }
        return compute(firstEducation.get(), secondEducation.get());
    }

    public double compute(Education first, Education second) {
        double similarity = 0.0;

        if (first.university() != null && second.university() != null
                && first.university().equalsIgnoreCase(second.university())) {
            similarity += UNIVERSITY_WEIGHT;
        }

        if (first.degree() != null && second.degree() != null) {
            if (first.degree().equalsIgnoreCase(second.degree())) {
                similarity += DEGREE_WEIGHT;
            } else if (DegreeLevel.of(first.degree()).isAdjacentTo(DegreeLevel.of(second.degree()))) {
                similarity += ADJACENT_DEGREE_WEIGHT;
            }
        }

        return similarity;
    }

    @Override
    public String getName() {
        return "education_similarity";
    }

    enum DegreeLevel {
        BACHELOR,
        MASTER,
        DOCTORATE,
        OTHER;

        private static final Set<String> BACHELOR_NAMES = Set.of("bs", "ba", "bsc", "bachelor", "bachelors", "beng");
        private static final Set<String> MASTER_NAMES = Set.of("ms", "ma", "msc", "mba", "master", "masters", "meng");
        private static final Set<String> DOCTORATE_NAMES = Set.of("phd", "dphil", "doctorate", "edd");

        static DegreeLevel of(String degree) {
            String key = degree.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
            if (BACHELOR_NAMES.contains(key)) {
                return BACHELOR;
            }
            if (MASTER_NAMES.contains(key)) {
                return MASTER;
            }
            if (DOCTORATE_NAMES.contains(key)) {
                return DOCTORATE;
            }
            return OTHER;
        }

        boolean isAdjacentTo(DegreeLevel other) {
            return switch (this) {
                case BACHELOR -> other == BACHELOR;
                case MASTER, DOCTORATE -> other == MASTER || other == DOCTORATE;
                case OTHER -> false;
            };
        }
    }
}
