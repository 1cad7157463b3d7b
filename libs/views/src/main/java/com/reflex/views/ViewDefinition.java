package com.reflex.views;

import java.util.Set;

/**
 * Declares a materialized view.
 *
 * @param name unique view name
 * @param schemaVersion version of the view's state layout, bumped when the fold changes
 * @param topics event types the view folds; {@code "*"} selects every type
 * @param fold the fold applied to each event in order
 */
public record ViewDefinition(String name, int schemaVersion, Set<String> topics, FoldFunction fold) {

    public ViewDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (schemaVersion < 1) {
            throw new IllegalArgumentException("schemaVersion must be >= 1, was " + schemaVersion);
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("topics must not be null or empty");
        }
        if (fold == null) {
            throw new IllegalArgumentException("fold must not be null");
        }
        topics = Set.copyOf(topics);
    }

    /** Whether events of this type feed the view. */
    public boolean appliesTo(String eventType) {
        return topics.contains("*") || topics.contains(eventType);
    }
}
