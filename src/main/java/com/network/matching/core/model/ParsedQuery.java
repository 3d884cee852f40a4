package com.network.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Structured criteria extracted from a natural-language networking query.
 * List fields are never null; an empty list means the criterion was not mentioned.
 */
public record ParsedQuery(
        List<String> jobTitles,
        List<String> companies,
        List<String> skills,
        List<String> industries,
        ExperienceLevel experienceLevel,
        List<String> education,
        String otherCriteria
) {
    public ParsedQuery {
        jobTitles = clean(jobTitles);
        companies = clean(companies);
        skills = clean(skills);
        industries = clean(industries);
        experienceLevel = experienceLevel != null ? experienceLevel : ExperienceLevel.ANY;
        education = clean(education);
    }

    /**
     * Query with no structured criteria; the raw text is kept as other criteria.
     */
    public static ParsedQuery unstructured(String text) {
        return new ParsedQuery(List.of(), List.of(), List.of(), List.of(), ExperienceLevel.ANY, List.of(), text);
    }

    /**
     * Returns true if at least one criterion that takes part in relevance scoring is populated.
     */
    public boolean hasCriteria() {
        return !jobTitles.isEmpty() || !companies.isEmpty() || !skills.isEmpty()
                || !industries.isEmpty() || !education.isEmpty()
                || experienceLevel != ExperienceLevel.ANY;
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> jobTitles;
        private List<String> companies;
        private List<String> skills;
        private List<String> industries;
        private ExperienceLevel experienceLevel = ExperienceLevel.ANY;
        private List<String> education;
        private String otherCriteria;

        public Builder jobTitles(String... jobTitles) {
            this.jobTitles = List.of(jobTitles);
            return this;
        }

        public Builder jobTitles(List<String> jobTitles) {
            this.jobTitles = jobTitles;
            return this;
        }

        public Builder companies(String... companies) {
            this.companies = List.of(companies);
            return this;
        }

        public Builder companies(List<String> companies) {
            this.companies = companies;
            return this;
        }

        public Builder skills(String... skills) {
            this.skills = List.of(skills);
            return this;
        }

        public Builder skills(List<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder industries(String... industries) {
            this.industries = List.of(industries);
            return this;
        }

        public Builder industries(List<String> industries) {
            this.industries = industries;
            return this;
        }

        public Builder experienceLevel(ExperienceLevel experienceLevel) {
            this.experienceLevel = experienceLevel;
            return this;
        }

        public Builder education(String... education) {
            this.education = List.of(education);
            return this;
        }

        public Builder education(List<String> education) {
            this.education = education;
            return this;
        }

        public Builder otherCriteria(String otherCriteria) {
            this.otherCriteria = otherCriteria;
            return this;
        }

        public ParsedQuery build() {
            return new ParsedQuery(jobTitles, companies, skills, industries, experienceLevel,
                    education, otherCriteria);
        }
    }
}
