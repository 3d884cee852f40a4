package com.network.matching.ranking;

import com.network.matching.core.model.Education;
import com.network.matching.core.model.Profile;
import com.network.matching.core.model.WorkHistoryEntry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a profile as one descriptive text block for reranking and document embedding.
 *
 * <p>Format: {@code Name: … | Role: … | Company: … | Bio: … | Skills: a, b |
 * Education: <degree> in <field> from <university> | Previous companies: x, y | Industry: …}.
 * Absent parts are omitted.</p>
 */
public class ProfileDocumentFormatter {

    static final String SEPARATOR = " | ";

    public String format(Profile profile) {
        List<String> parts = new ArrayList<>();

        if (profile.getName() != null && !profile.getName().isBlank()) {
            parts.add("Name: " + profile.getName());
        }
        profile.getJobTitle().ifPresent(title -> parts.add("Role: " + title));
        profile.getCompany().ifPresent(company -> parts.add("Company: " + company));
        profile.getBio().ifPresent(bio -> parts.add("Bio: " + bio));

        if (!profile.getSkills().isEmpty()) {
            parts.add("Skills: " + String.join(", ", profile.getSkills()));
        }

        profile.getEducation()
                .flatMap(ProfileDocumentFormatter::describe)
                .ifPresent(education -> parts.add("Education: " + education));

        Set<String> previousCompanies = new LinkedHashSet<>();
        for (WorkHistoryEntry entry : profile.getWorkHistory()) {
            if (entry.hasCompany()) {
                previousCompanies.add(entry.company());
            }
        }
        if (!previousCompanies.isEmpty()) {
            parts.add("Previous companies: " + String.join(", ", previousCompanies));
        }

        profile.getIndustry().ifPresent(industry -> parts.add("Industry: " + industry));

        return String.join(SEPARATOR, parts);
    }

    private static Optional<String> describe(Education education) {
        StringBuilder text = new StringBuilder();
        education.degreeName().ifPresent(text::append);
        education.fieldName().ifPresent(field -> text.append(" in ").append(field));
        education.universityName().ifPresent(university -> text.append(" from ").append(university));
        String described = text.toString().trim();
        return described.isEmpty() ? Optional.empty() : Optional.of(described);
    }
}
