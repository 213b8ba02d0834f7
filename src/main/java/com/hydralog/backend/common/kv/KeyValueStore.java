package com.hydralog.backend.common.kv;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Process-local string store shared by the summary cache and the offline queue.
 * Callers decide how to react to {@link IOException}; neither caller lets it escape.
 */
public interface KeyValueStore {

    Optional<String> get(String key) throws IOException;

    void put(String key, String value) throws IOException;

    void delete(String key) throws IOException;

    List<String> keysWithPrefix(String prefix) throws IOException;
}
