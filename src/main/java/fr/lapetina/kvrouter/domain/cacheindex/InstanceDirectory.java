package fr.lapetina.kvrouter.domain.cacheindex;

import fr.lapetina.kvrouter.domain.model.CandidateServer;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local, advisory cache of instance id to server, filled from resolve calls.
 *
 * Entries are never expired; a later resolve for the same instance id simply overwrites
 * the mapping. Safe for concurrent readers and writers.
 */
public final class InstanceDirectory {

    private final Map<String, CandidateServer> servers = new ConcurrentHashMap<>();

    public Optional<CandidateServer> get(String instanceId) {
        return Optional.ofNullable(servers.get(instanceId));
    }

    public void put(String instanceId, CandidateServer server) {
        servers.put(instanceId, server);
    }

    public int size() {
        return servers.size();
    }

    public void clear() {
        servers.clear();
    }
}
