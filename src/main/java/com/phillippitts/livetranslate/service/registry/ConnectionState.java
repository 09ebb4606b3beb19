package com.phillippitts.livetranslate.service.registry;

import com.phillippitts.livetranslate.domain.ClientSettings;
import com.phillippitts.livetranslate.domain.Role;

/**
 * Point-in-time copy of everything the registry knows about a connection.
 *
 * @param role            null until the connection registers
 * @param classroomCode   code supplied on the connection URL or in {@code register}, if any
 * @param presenterId     presenter identity, only for presenters that supplied one
 */
public record ConnectionState(
        String connectionId,
        Role role,
        String languageCode,
        String sessionId,
        ClientSettings settings,
        boolean listenerCounted,
        String classroomCode,
        String presenterId
) {

    public boolean isPresenter() {
        return role == Role.PRESENTER;
    }

    public boolean isListener() {
        return role == Role.LISTENER;
    }
}
