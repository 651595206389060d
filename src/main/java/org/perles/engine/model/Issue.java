package org.perles.engine.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An issue as returned by a BQL query.
 *
 * Base columns come from the issues table; labels, comment count and relations are
 * attached afterwards by the batch loader.
 *
 * @param id           Issue identifier, e.g. "perles-123"
 * @param title        Title
 * @param description  Description, empty when unset
 * @param status       open, in_progress, closed or blocked
 * @param priority     0 (highest) to 4
 * @param type         bug, feature, task, epic or chore
 * @param assignee     Assignee, empty when unset
 * @param pinned       Pinned flag, null when the column is null
 * @param template     Template flag, null when the column is null
 * @param createdAt    Creation time
 * @param updatedAt    Last update time
 * @param closedAt     Close time, or null
 * @param labels       Labels, sorted
 * @param commentCount Number of comments
 * @param relations    Dependency links
 */
public record Issue(
        String id,
        String title,
        String description,
        String status,
        int priority,
        String type,
        String assignee,
        Boolean pinned,
        Boolean template,
        Instant createdAt,
        Instant updatedAt,
        Instant closedAt,
        List<String> labels,
        int commentCount,
        IssueRelations relations) {

    public Issue {
        Objects.requireNonNull(id, "Id cannot be null");
        labels = List.copyOf(labels);
        Objects.requireNonNull(relations, "Relations cannot be null");
    }

    /**
     * Returns a copy with the batch-loaded details attached.
     */
    public Issue withDetails(List<String> labels, int commentCount, IssueRelations relations) {
        return new Issue(id, title, description, status, priority, type, assignee, pinned, template,
                createdAt, updatedAt, closedAt, labels, commentCount, relations);
    }

    public boolean isPinned() {
        return Boolean.TRUE.equals(pinned);
    }

    public boolean isTemplate() {
        return Boolean.TRUE.equals(template);
    }
}
