package org.perles.engine.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Dependency links of an issue, grouped by type and direction.
 *
 * @param parentId       The parent (parent-child edge where this issue is the child), or null
 * @param blockedBy      Issues blocking this one
 * @param blocks         Issues this one blocks
 * @param children       Child issues
 * @param discoveredFrom Issues this one was discovered from
 * @param discovered     Issues discovered from this one
 */
public record IssueRelations(
        String parentId,
        List<String> blockedBy,
        List<String> blocks,
        List<String> children,
        List<String> discoveredFrom,
        List<String> discovered) {

    public static final IssueRelations NONE = new IssueRelations(
            null, List.of(), List.of(), List.of(), List.of(), List.of());

    public IssueRelations {
        blockedBy = List.copyOf(blockedBy);
        blocks = List.copyOf(blocks);
        children = List.copyOf(children);
        discoveredFrom = List.copyOf(discoveredFrom);
        discovered = List.copyOf(discovered);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while grouping dependency rows.
     */
    public static class Builder {
        private String parentId;
        private final List<String> blockedBy = new ArrayList<>();
        private final List<String> blocks = new ArrayList<>();
        private final List<String> children = new ArrayList<>();
        private final List<String> discoveredFrom = new ArrayList<>();
        private final List<String> discovered = new ArrayList<>();

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder addBlockedBy(String id) {
            blockedBy.add(id);
            return this;
        }

        public Builder addBlocks(String id) {
            blocks.add(id);
            return this;
        }

        public Builder addChild(String id) {
            children.add(id);
            return this;
        }

        public Builder addDiscoveredFrom(String id) {
            discoveredFrom.add(id);
            return this;
        }

        public Builder addDiscovered(String id) {
            discovered.add(id);
            return this;
        }

        public IssueRelations build() {
            return new IssueRelations(parentId, blockedBy, blocks, children, discoveredFrom, discovered);
        }
    }
}
