package org.perles.bql.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Registry of the fields a query may filter and sort on.
 *
 * The registry is closed: a name not listed here is rejected by the validator.
 */
public final class FieldRegistry {

    /**
     * A registered field.
     *
     * @param name          The name used in queries
     * @param type          The field category
     * @param allowedValues Whitelist of legal values for ENUM fields, empty otherwise
     */
    public record FieldSpec(String name, FieldType type, Set<String> allowedValues) {

        public FieldSpec {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(type, "Type cannot be null");
            allowedValues = Collections.unmodifiableSet(new LinkedHashSet<>(allowedValues));
        }

        public static FieldSpec of(String name, FieldType type) {
            return new FieldSpec(name, type, Set.of());
        }

        public static FieldSpec enumeration(String name, String... values) {
            return new FieldSpec(name, FieldType.ENUM, new LinkedHashSet<>(List.of(values)));
        }
    }

    public static final FieldRegistry DEFAULT = new Builder()
            .add(FieldSpec.of("id", FieldType.STRING))
            .add(FieldSpec.of("title", FieldType.STRING))
            .add(FieldSpec.of("description", FieldType.STRING))
            .add(FieldSpec.of("assignee", FieldType.STRING))
            .add(FieldSpec.of("label", FieldType.STRING))
            .add(FieldSpec.of("labels", FieldType.STRING))
            .add(FieldSpec.enumeration("type", "bug", "feature", "task", "epic", "chore"))
            .add(FieldSpec.enumeration("status", "open", "in_progress", "closed", "blocked"))
            .add(FieldSpec.of("priority", FieldType.PRIORITY))
            .add(FieldSpec.of("blocked", FieldType.BOOL))
            .add(FieldSpec.of("ready", FieldType.BOOL))
            .add(FieldSpec.of("pinned", FieldType.BOOL))
            .add(FieldSpec.of("is_template", FieldType.BOOL))
            .add(FieldSpec.of("created", FieldType.DATE))
            .add(FieldSpec.of("updated", FieldType.DATE))
            .add(FieldSpec.of("closed", FieldType.DATE))
            .build();

    private final Map<String, FieldSpec> fields;

    private FieldRegistry(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<FieldSpec> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Map<String, FieldSpec> fields() {
        return fields;
    }

    /**
     * @return The registered field names, sorted and comma-separated
     */
    public String describeFieldNames() {
        return String.join(", ", new TreeSet<>(fields.keySet()));
    }

    /**
     * Builder for custom registries.
     */
    public static class Builder {
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        public Builder add(FieldSpec spec) {
            fields.put(spec.name(), spec);
            return this;
        }

        public FieldRegistry build() {
            return new FieldRegistry(fields);
        }
    }
}
