package com.network.matching.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.network.matching.core.model.Education;
import com.network.matching.core.model.Interaction;
import com.network.matching.core.model.Profile;
import com.network.matching.core.model.WorkHistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Reads a profile population from the network JSON format.
 *
 * <p>Expected format:</p>
 * <pre>
 * {
 *   "profiles": [
 *     {
 *       "id": "p1", "name": "Ada Lovelace", "job_title": "Senior ML Engineer",
 *       "company": "Acme", "company_size": "large", "industry": "Technology",
 *       "bio": "...", "skills": ["Python", "PyTorch"],
 *       "education": {"university": "MIT", "degree": "MS", "field": "Computer Science"},
 *       "work_history": [{"company": "Initech", "title": "Engineer",
 *                         "start_date": "2019-01-01", "end_date": "2021-06-30", "is_current": false}],
 *       "linkedin_connections": ["p2"],
 *       "email_interactions": {"p2": {"email_frequency": 4, "last_contact": "2024-05-01",
 *                                     "relationship_strength": 0.6, "interaction_type": "professional"}}
 *     }
 *   ],
 *   "interactions": [{"source_id": "p1", "target_id": "p2", "frequency": 4, "strength": 0.6,
 *                     "last_contact": "2024-05-01"}]
 * }
 * </pre>
 *
 * <p>{@code profiles} may also be an object keyed by profile id. Top-level {@code interactions}
 * are optional and only fill in directions that {@code email_interactions} does not already
 * describe. The first {@code maxProfiles} profiles in document order are kept.</p>
 */
public class JsonProfileSource implements ProfileSource {
    private static final Logger log = LoggerFactory.getLogger(JsonProfileSource.class);

    private final String description;
    private final StreamOpener opener;
    private final ObjectMapper objectMapper;

    public JsonProfileSource(Path path) {
        this(path.toString(), () -> Files.newInputStream(path));
    }

    private JsonProfileSource(String description, StreamOpener opener) {
        this.description = description;
        this.opener = opener;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates a source reading a classpath resource.
     */
    public static JsonProfileSource fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource is required");
        return new JsonProfileSource("classpath:" + resource, () -> {
            InputStream in = JsonProfileSource.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("Resource not found: " + resource);
            }
            return in;
        });
    }

    @Override
    public ProfilePopulation read(int maxProfiles) {
        if (maxProfiles <= 0) {
            throw new IllegalArgumentException("maxProfiles must be > 0");
        }

        JsonNode root;
        try (InputStream in = opener.open()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            log.error("source.read.failed source={} error={}", description, e.getMessage());
            throw new ProfileSourceException("Cannot read profiles from " + description, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProfileSourceException("Profile document in " + description + " is not a JSON object");
        }

        List<ProfileJson> records = readProfiles(root.get("profiles"));
        int available = records.size();
        Set<String> documentIds = new HashSet<>();
        records.forEach(record -> documentIds.add(record.id()));
        if (records.size() > maxProfiles) {
            records = records.subList(0, maxProfiles);
        }
        Set<String> kept = new LinkedHashSet<>();
        records.forEach(record -> kept.add(record.id()));

        // Only references to profiles cut by truncation are dropped. Ids absent from the whole
        // document are kept so the store rejects them as dangling.
        Predicate<String> cut = id -> !kept.contains(id) && documentIds.contains(id);
        Map<String, List<Interaction>> extraInteractions =
                readInteractionRecords(root.get("interactions"), kept, cut);

        List<Profile> profiles = new ArrayList<>(records.size());
        int droppedReferences = 0;
        for (ProfileJson record : records) {
            Profile.Builder builder = toBuilder(record);
            Set<String> described = new LinkedHashSet<>();

            for (String connectionId : nullSafe(record.linkedinConnections())) {
                if (cut.test(connectionId)) {
                    droppedReferences++;
                } else {
                    builder.addConnection(connectionId);
                }
            }

            if (record.emailInteractions() != null) {
                for (Map.Entry<String, EmailInteractionJson> entry : record.emailInteractions().entrySet()) {
                    if (cut.test(entry.getKey())) {
                        droppedReferences++;
                        continue;
                    }
                    builder.addInteraction(toInteraction(record.id(), entry.getKey(), entry.getValue()));
                    described.add(entry.getKey());
                }
            }
            for (Interaction interaction : extraInteractions.getOrDefault(record.id(), List.of())) {
                if (!described.contains(interaction.targetId())) {
                    builder.addInteraction(interaction);
                }
            }
            profiles.add(build(builder, record.id()));
        }

        log.info("source.read source={} profiles={} available={} droppedReferences={}",
                description, profiles.size(), available, droppedReferences);
        return new ProfilePopulation(profiles, List.of());
    }

    @Override
    public String getDescription() {
        return description;
    }

    private List<ProfileJson> readProfiles(JsonNode profilesNode) {
        if (profilesNode == null || profilesNode.isNull()) {
            throw new ProfileSourceException("Profile document in " + description + " has no 'profiles'");
        }
        List<ProfileJson> records = new ArrayList<>();
        if (profilesNode.isArray()) {
            for (JsonNode node : profilesNode) {
                records.add(readProfile(node, null));
            }
        } else if (profilesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = profilesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                records.add(readProfile(field.getValue(), field.getKey()));
            }
        } else {
            throw new ProfileSourceException("'profiles' in " + description + " must be an array or an object");
        }
        return records;
    }

    private ProfileJson readProfile(JsonNode node, String keyId) {
        ProfileJson record;
        try {
            record = objectMapper.treeToValue(node, ProfileJson.class);
        } catch (JsonProcessingException e) {
            throw new ProfileSourceException("Malformed profile record in " + description, e);
        }
        if (record.id() == null || record.id().isBlank()) {
            if (keyId == null) {
                throw new ProfileSourceException("Profile record without id in " + description);
            }
            return record.withId(keyId);
        }
        return record;
    }

    private Map<String, List<Interaction>> readInteractionRecords(JsonNode node, Set<String> kept,
                                                                  Predicate<String> cut) {
        Map<String, List<Interaction>> bySource = new HashMap<>();
        if (node == null || node.isNull()) {
            return bySource;
        }
        if (!node.isArray()) {
            throw new ProfileSourceException("'interactions' in " + description + " must be an array");
        }
        for (JsonNode element : node) {
            InteractionRecordJson record;
            try {
                record = objectMapper.treeToValue(element, InteractionRecordJson.class);
            } catch (JsonProcessingException e) {
                throw new ProfileSourceException("Malformed interaction record in " + description, e);
            }
            if (record.sourceId() == null || record.targetId() == null) {
                throw new ProfileSourceException("Interaction record without source_id or target_id in " + description);
            }
            if (cut.test(record.sourceId()) || cut.test(record.targetId())) {
                continue;
            }
            if (!kept.contains(record.sourceId())) {
                throw new ProfileSourceException("Interaction record from unknown profile " + record.sourceId()
                        + " in " + description);
            }
            Interaction interaction = interaction(record.sourceId(), record.targetId(),
                    record.frequency(), record.lastContact(), record.strength(), record.interactionType());
            bySource.computeIfAbsent(record.sourceId(), k -> new ArrayList<>()).add(interaction);
        }
        return bySource;
    }

    private Profile.Builder toBuilder(ProfileJson record) {
        Profile.Builder builder = Profile.builder()
                .id(record.id())
                .name(record.name())
                .jobTitle(record.jobTitle())
                .company(record.company())
                .companySize(record.companySize())
                .industry(record.industry())
                .bio(record.bio())
                .skills(record.skills());
        if (record.education() != null) {
            EducationJson education = record.education();
            builder.education(new Education(education.university(), education.degree(), education.field()));
        }
        for (WorkHistoryJson work : nullSafe(record.workHistory())) {
            try {
                builder.addWorkHistory(new WorkHistoryEntry(work.company(), work.title(),
                        parseDate(work.startDate(), record.id()), parseDate(work.endDate(), record.id()),
                        Boolean.TRUE.equals(work.current())));
            } catch (IllegalArgumentException e) {
                throw new ProfileSourceException("Invalid work history of profile " + record.id(), e);
            }
        }
        return builder;
    }

    private Profile build(Profile.Builder builder, String id) {
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ProfileSourceException("Invalid profile " + id, e);
        }
    }

    private Interaction toInteraction(String sourceId, String targetId, EmailInteractionJson json) {
        if (json == null) {
            throw new ProfileSourceException("Empty interaction from " + sourceId + " to " + targetId);
        }
        return interaction(sourceId, targetId, json.emailFrequency(), json.lastContact(),
                json.relationshipStrength(), json.interactionType());
    }

    private Interaction interaction(String sourceId, String targetId, Integer frequency,
                                    String lastContact, Double strength, String type) {
        try {
            return new Interaction(targetId,
                    frequency != null ? frequency : 0,
                    parseDate(lastContact, sourceId),
                    strength != null ? strength : 0.0,
                    type);
        } catch (IllegalArgumentException e) {
            throw new ProfileSourceException("Invalid interaction from " + sourceId + " to " + targetId, e);
        }
    }

    private LocalDate parseDate(String value, String profileId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        // Accepts plain dates and the date part of ISO date-times.
        String date = value.length() > 10 ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new ProfileSourceException("Invalid date '" + value + "' in profile " + profileId, e);
        }
    }

    private static <T> List<T> nullSafe(List<T> values) {
        return values != null ? values : List.of();
    }

    @FunctionalInterface
    private interface StreamOpener {
        InputStream open() throws IOException;
    }

    // JSON DTOs for the network document
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ProfileJson(
            String id,
            String name,
            @JsonProperty("job_title") String jobTitle,
            String company,
            @JsonProperty("company_size") String companySize,
            String industry,
            String bio,
            List<String> skills,
            EducationJson education,
            @JsonProperty("work_history") List<WorkHistoryJson> workHistory,
            @JsonProperty("linkedin_connections") List<String> linkedinConnections,
            @JsonProperty("email_interactions") Map<String, EmailInteractionJson> emailInteractions
    ) {
        ProfileJson withId(String newId) {
            return new ProfileJson(newId, name, jobTitle, company, companySize, industry, bio, skills,
                    education, workHistory, linkedinConnections, emailInteractions);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EducationJson(String university, String degree, String field) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record WorkHistoryJson(
            String company,
            String title,
            @JsonProperty("start_date") String startDate,
            @JsonProperty("end_date") String endDate,
            @JsonProperty("is_current") Boolean current
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmailInteractionJson(
            @JsonProperty("email_frequency") Integer emailFrequency,
            @JsonProperty("last_contact") String lastContact,
            @JsonProperty("relationship_strength") Double relationshipStrength,
            @JsonProperty("interaction_type") String interactionType
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record InteractionRecordJson(
            @JsonProperty("source_id") String sourceId,
            @JsonProperty("target_id") String targetId,
            Integer frequency,
            Double strength,
            @JsonProperty("last_contact") String lastContact,
            @JsonProperty("interaction_type") String interactionType
    ) {}
}
