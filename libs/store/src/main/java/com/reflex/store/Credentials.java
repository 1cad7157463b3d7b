package com.reflex.store;

import java.util.Map;

/**
 * What the adapter needs to authenticate: either a path to a credentials file, or credentials
 * supplied inline by the embedding application.
 *
 * <p>Parsing the credentials file is the adapter's business; this record only carries the
 * location.
 *
 * @param credentialsPath path to a service-account file, or {@code null} when inline
 * @param projectId store project identifier, optional
 * @param inline credential properties supplied programmatically, empty when a path is used
 */
public record Credentials(String credentialsPath, String projectId, Map<String, String> inline) {

    public Credentials {
        inline = inline == null ? Map.of() : Map.copyOf(inline);
        if (credentialsPath != null && credentialsPath.isBlank()) {
            credentialsPath = null;
        }
    }

    public static Credentials fromPath(String credentialsPath, String projectId) {
        return new Credentials(credentialsPath, projectId, Map.of());
    }

    public static Credentials inline(String projectId, Map<String, String> properties) {
        return new Credentials(null, projectId, properties);
    }

    /** Whether any credentials were supplied at all. */
    public boolean isProvided() {
        return credentialsPath != null || !inline.isEmpty();
    }

    @Override
    public String toString() {
        return "Credentials[credentialsPath=%s, projectId=%s, inline=%s]"
                .formatted(credentialsPath, projectId, inline.isEmpty() ? "none" : inline.keySet());
    }
}
