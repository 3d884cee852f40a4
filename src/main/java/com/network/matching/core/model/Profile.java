package com.network.matching.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Professional profile held by the profile store.
 *
 * <p>Profiles are immutable. Relationships to other profiles are kept as ids only
 * (connection list and interaction map), never as object references, so the
 * population forms an arena keyed by id.</p>
 */
public final class Profile {

    private final String id;
    private final String name;
    private final String jobTitle;
    private final String company;
    private final String companySize;
    private final String industry;
    private final String bio;
    private final List<String> skills;
    private final Education education;
    private final List<WorkHistoryEntry> workHistory;
    private final List<String> connectionIds;
    private final Map<String, Interaction> interactions;

    private Profile(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        this.name = builder.name;
        this.jobTitle = builder.jobTitle;
        this.company = builder.company;
        this.companySize = builder.companySize;
        this.industry = builder.industry;
        this.bio = builder.bio;
        this.skills = List.copyOf(new LinkedHashSet<>(builder.skills));
        this.education = builder.education;
        this.workHistory = List.copyOf(builder.workHistory);
        this.connectionIds = List.copyOf(new LinkedHashSet<>(builder.connectionIds));
        this.interactions = Map.copyOf(builder.interactions);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Optional<String> getJobTitle() {
        return Optional.ofNullable(jobTitle);
    }

    public Optional<String> getCompany() {
        return Optional.ofNullable(company);
    }

    public Optional<String> getCompanySize() {
        return Optional.ofNullable(companySize);
    }

    public Optional<String> getIndustry() {
        return Optional.ofNullable(industry);
    }

    public Optional<String> getBio() {
        return Optional.ofNullable(bio);
    }

    public List<String> getSkills() {
        return skills;
    }

    public Optional<Education> getEducation() {
        return Optional.ofNullable(education);
    }

    public List<WorkHistoryEntry> getWorkHistory() {
        return workHistory;
    }

    public List<String> getConnectionIds() {
        return connectionIds;
    }

    public boolean isConnectedTo(String otherId) {
        return connectionIds.contains(otherId);
    }

    public Map<String, Interaction> getInteractions() {
        return interactions;
    }

    public Optional<Interaction> getInteractionWith(String otherId) {
        return Optional.ofNullable(interactions.get(otherId));
    }

    /**
     * Returns a summary view suitable for embedding in match results.
     */
    public ProfileSummary toSummary() {
        return new ProfileSummary(id, name, jobTitle, company);
    }

    /**
     * Returns a builder pre-populated with this profile's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .jobTitle(jobTitle)
                .company(company)
                .companySize(companySize)
                .industry(industry)
                .bio(bio)
                .skills(skills)
                .education(education)
                .workHistory(workHistory)
                .connectionIds(connectionIds)
                .interactions(interactions.values());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Profile profile = (Profile) o;
        return Objects.equals(id, profile.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Profile{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", jobTitle='" + jobTitle + '\'' +
                ", company='" + company + '\'' +
                ", connections=" + connectionIds.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String jobTitle;
        private String company;
        private String companySize;
        private String industry;
        private String bio;
        private final List<String> skills = new ArrayList<>();
        private Education education;
        private final List<WorkHistoryEntry> workHistory = new ArrayList<>();
        private final List<String> connectionIds = new ArrayList<>();
        private final Map<String, Interaction> interactions = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder jobTitle(String jobTitle) {
            this.jobTitle = blankToNull(jobTitle);
            return this;
        }

        public Builder company(String company) {
            this.company = blankToNull(company);
            return this;
        }

        public Builder companySize(String companySize) {
            this.companySize = blankToNull(companySize);
            return this;
        }

        public Builder industry(String industry) {
            this.industry = blankToNull(industry);
            return this;
        }

        public Builder bio(String bio) {
            this.bio = blankToNull(bio);
            return this;
        }

        public Builder skills(Collection<String> skills) {
            this.skills.clear();
            if (skills != null) {
                skills.stream().filter(Objects::nonNull).forEach(this.skills::add);
            }
            return this;
        }

        public Builder addSkill(String skill) {
            if (skill != null) {
                this.skills.add(skill);
            }
            return this;
        }

        public Builder education(Education education) {
            this.education = education;
            return this;
        }

        public Builder workHistory(Collection<WorkHistoryEntry> workHistory) {
            this.workHistory.clear();
            if (workHistory != null) {
                this.workHistory.addAll(workHistory);
            }
            return this;
        }

        public Builder addWorkHistory(WorkHistoryEntry entry) {
            this.workHistory.add(Objects.requireNonNull(entry, "entry is required"));
            return this;
        }

        public Builder connectionIds(Collection<String> connectionIds) {
            this.connectionIds.clear();
            if (connectionIds != null) {
                connectionIds.stream().filter(Objects::nonNull).forEach(this.connectionIds::add);
            }
            return this;
        }

        public Builder addConnection(String connectionId) {
            this.connectionIds.add(Objects.requireNonNull(connectionId, "connectionId is required"));
            return this;
        }

        public Builder interactions(Collection<Interaction> interactions) {
            this.interactions.clear();
            if (interactions != null) {
                interactions.forEach(this::addInteraction);
            }
            return this;
        }

        public Builder addInteraction(Interaction interaction) {
            Objects.requireNonNull(interaction, "interaction is required");
            this.interactions.put(interaction.targetId(), interaction);
            return this;
        }

        public Profile build() {
            return new Profile(this);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}
