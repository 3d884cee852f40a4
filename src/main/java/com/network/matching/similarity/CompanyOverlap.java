package com.network.matching.similarity;

import com.network.matching.core.model.Profile;
import com.network.matching.core.model.WorkHistoryEntry;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Jaccard overlap of current and past employers, compared case-insensitively.
 */
public class CompanyOverlap implements ProfileSimilarity {

    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    @Override
    public double compute(Profile first, Profile second) {
        return jaccard.compute(companiesOf(first), companiesOf(second));
    }

    @Override
    public String getName() {
        return "company_overlap";
    }

    /**
     * Lower-cased current company plus every company in the work history.
     */
    static Set<String> companiesOf(Profile profile) {
        Set<String> companies = new LinkedHashSet<>();
        profile.getCompany().ifPresent(c -> companies.add(c.toLowerCase(Locale.ROOT)));
        for (WorkHistoryEntry entry : profile.getWorkHistory()) {
            if (entry.hasCompany()) {
                companies.add(entry.company().toLowerCase(Locale.ROOT));
            }
        }
        return companies;
    }
}
