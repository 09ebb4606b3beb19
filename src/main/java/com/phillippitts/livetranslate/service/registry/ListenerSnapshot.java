package com.phillippitts.livetranslate.service.registry;

import java.util.List;

/**
 * Listeners of one session at the time of the query, index-aligned:
 * {@code languages.get(i)} is the language of {@code connections.get(i)}.
 */
public record ListenerSnapshot(List<ClientConnection> connections, List<String> languages) {

    public ListenerSnapshot {
        connections = List.copyOf(connections);
        languages = List.copyOf(languages);
        if (connections.size() != languages.size()) {
            throw new IllegalArgumentException("connections and languages must be index-aligned");
        }
    }

    public static ListenerSnapshot empty() {
        return new ListenerSnapshot(List.of(), List.of());
    }

    public boolean isEmpty() {
        return connections.isEmpty();
    }

    public int size() {
        return connections.size();
    }

    /** Distinct languages in first-seen order. */
    public List<String> distinctLanguages() {
        return languages.stream().distinct().toList();
    }
}
