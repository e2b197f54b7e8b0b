package com.example.battlearena.registry;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * STOMP connections that are currently open, keyed by STOMP session id.
 */
@Component
public class ConnectionRegistry {

    private final Map<String, Long> usersByConnection = new ConcurrentHashMap<>();

    public void register(String connectionId, Long userId) {
        if (connectionId != null && userId != null) {
            usersByConnection.put(connectionId, userId);
        }
    }

    public Long unregister(String connectionId) {
        return connectionId == null ? null : usersByConnection.remove(connectionId);
    }

    public boolean isAlive(String connectionId) {
        return connectionId != null && usersByConnection.containsKey(connectionId);
    }
}
