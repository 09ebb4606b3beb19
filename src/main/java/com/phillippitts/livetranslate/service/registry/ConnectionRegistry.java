package com.phillippitts.livetranslate.service.registry;

import com.phillippitts.livetranslate.config.properties.DeliveryProperties;
import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.Role;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of open client connections and their per-socket state.
 *
 * <p>State is kept in one concurrent map per attribute, keyed by connection id; removing a
 * connection clears every map. Aggregate queries return copies, never live views.
 *
 * <p><b>Scaling limitation:</b> the registry lives in one JVM. Running several instances behind
 * a load balancer needs this state moved to a shared store with its own concurrency control.
 */
@Component
public class ConnectionRegistry {

    private static final Logger LOG = LogManager.getLogger(ConnectionRegistry.class);

    private final String defaultListenerLanguage;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Role> roles = new ConcurrentHashMap<>();
    private final Map<String, String> languages = new ConcurrentHashMap<>();
    private final Map<String, String> sessionIds = new ConcurrentHashMap<>();
    private final Map<String, ClientSettings> settings = new ConcurrentHashMap<>();
    private final Map<String, String> classroomCodes = new ConcurrentHashMap<>();
    private final Map<String, String> presenterIds = new ConcurrentHashMap<>();
    private final Set<String> countedListeners = ConcurrentHashMap.newKeySet();

    @Autowired
    public ConnectionRegistry(DeliveryProperties deliveryProperties) {
        this(deliveryProperties.getDefaultListenerLanguage());
    }

    public ConnectionRegistry(String defaultListenerLanguage) {
        this.defaultListenerLanguage = Objects.requireNonNull(defaultListenerLanguage, "defaultListenerLanguage");
    }

    /**
     * Tracks a newly opened connection.
     *
     * @param sessionId     initial session id (replaced when the connection registers)
     * @param classroomCode code from the connection URL, or null
     */
    public void add(ClientConnection connection, String sessionId, String classroomCode) {
        String id = connection.id();
        connections.put(id, connection);
        settings.put(id, ClientSettings.empty());
        if (sessionId != null) {
            sessionIds.put(id, sessionId);
        }
        if (classroomCode != null) {
            classroomCodes.put(id, classroomCode);
        }
    }

    /**
     * Forgets a connection, clearing every per-connection attribute.
     *
     * @return the state held just before removal, or empty if the connection was unknown
     */
    public Optional<ConnectionState> remove(ClientConnection connection) {
        String id = connection.id();
        Optional<ConnectionState> last = snapshot(connection);
        connections.remove(id);
        roles.remove(id);
        languages.remove(id);
        sessionIds.remove(id);
        settings.remove(id);
        classroomCodes.remove(id);
        presenterIds.remove(id);
        countedListeners.remove(id);
        return last;
    }

    public boolean contains(ClientConnection connection) {
        return connections.containsKey(connection.id());
    }

    public int size() {
        return connections.size();
    }

    public Optional<ConnectionState> snapshot(ClientConnection connection) {
        String id = connection.id();
        if (!connections.containsKey(id)) {
            return Optional.empty();
        }
        return Optional.of(new ConnectionState(id,
                roles.get(id),
                languages.get(id),
                sessionIds.get(id),
                settings.getOrDefault(id, ClientSettings.empty()),
                countedListeners.contains(id),
                classroomCodes.get(id),
                presenterIds.get(id)));
    }

    public Role getRole(ClientConnection connection) {
        return roles.get(connection.id());
    }

    public void setRole(ClientConnection connection, Role role) {
        putOrRemove(roles, connection.id(), role);
    }

    public String getLanguage(ClientConnection connection) {
        return languages.get(connection.id());
    }

    public void setLanguage(ClientConnection connection, String languageCode) {
        putOrRemove(languages, connection.id(), languageCode);
    }

    public String getSessionId(ClientConnection connection) {
        return sessionIds.get(connection.id());
    }

    public void setSessionId(ClientConnection connection, String sessionId) {
        putOrRemove(sessionIds, connection.id(), sessionId);
    }

    public String getClassroomCode(ClientConnection connection) {
        return classroomCodes.get(connection.id());
    }

    public void setClassroomCode(ClientConnection connection, String classroomCode) {
        putOrRemove(classroomCodes, connection.id(), classroomCode);
    }

    /** Stable presenter identity supplied at registration, used to reclaim sessions on reconnect. */
    public String getPresenterId(ClientConnection connection) {
        return presenterIds.get(connection.id());
    }

    public void setPresenterId(ClientConnection connection, String presenterId) {
        putOrRemove(presenterIds, connection.id(), presenterId);
    }

    public ClientSettings getSettings(ClientConnection connection) {
        return settings.getOrDefault(connection.id(), ClientSettings.empty());
    }

    public void setSettings(ClientConnection connection, ClientSettings value) {
        settings.put(connection.id(), value == null ? ClientSettings.empty() : value);
    }

    /**
     * Merges {@code update} into the connection's settings.
     *
     * @return the merged settings
     */
    public ClientSettings updateSettings(ClientConnection connection, ClientSettings update) {
        return settings.merge(connection.id(), update == null ? ClientSettings.empty() : update,
                ClientSettings::merge);
    }

    public boolean isListenerCounted(ClientConnection connection) {
        return countedListeners.contains(connection.id());
    }

    /**
     * Marks the connection as counted into its session's listenerCount.
     *
     * @return true if this call set the flag, false if it was already set
     */
    public boolean markListenerCounted(ClientConnection connection) {
        return countedListeners.add(connection.id());
    }

    /**
     * Listener connections of a session with their languages. A listener without a language
     * is reported with the configured default rather than omitted.
     */
    public ListenerSnapshot getListenersForSession(String sessionId) {
        if (sessionId == null) {
            return ListenerSnapshot.empty();
        }
        List<ClientConnection> found = new ArrayList<>();
        List<String> langs = new ArrayList<>();
        for (Map.Entry<String, ClientConnection> entry : connections.entrySet()) {
            String id = entry.getKey();
            if (roles.get(id) != Role.LISTENER || !sessionId.equals(sessionIds.get(id))) {
                continue;
            }
            String lang = languages.get(id);
            if (lang == null) {
                LOG.debug("Listener {} has no language; using default {}", id, defaultListenerLanguage);
                lang = defaultListenerLanguage;
            }
            found.add(entry.getValue());
            langs.add(lang);
        }
        return new ListenerSnapshot(found, langs);
    }

    public List<ClientConnection> getPresenters(String sessionId) {
        List<ClientConnection> found = new ArrayList<>();
        if (sessionId == null) {
            return found;
        }
        connections.forEach((id, conn) -> {
            if (roles.get(id) == Role.PRESENTER && sessionId.equals(sessionIds.get(id))) {
                found.add(conn);
            }
        });
        return found;
    }

    public int countListeners(String sessionId) {
        return getListenersForSession(sessionId).size();
    }

    /** Session ids held by at least one registered (role assigned) connection. */
    public Set<String> getActiveSessionIds() {
        Set<String> ids = new LinkedHashSet<>();
        sessionIds.forEach((id, sessionId) -> {
            if (roles.containsKey(id)) {
                ids.add(sessionId);
            }
        });
        return ids;
    }

    /**
     * True if any connection other than {@code excluding} shares the session id, optionally
     * restricted to one role.
     */
    public boolean hasOtherConnectionsWithSessionId(String sessionId, ClientConnection excluding, Role role) {
        if (sessionId == null) {
            return false;
        }
        String excludedId = excluding == null ? null : excluding.id();
        for (Map.Entry<String, String> entry : sessionIds.entrySet()) {
            String id = entry.getKey();
            if (id.equals(excludedId) || !sessionId.equals(entry.getValue())) {
                continue;
            }
            if (role == null || role == roles.get(id)) {
                return true;
            }
        }
        return false;
    }

    private static <V> void putOrRemove(Map<String, V> map, String key, V value) {
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }
}
