package fr.lapetina.kvrouter.infrastructure.registry;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.ServerHealth;
import fr.lapetina.kvrouter.infrastructure.config.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of the inference servers requests can be routed to.
 *
 * Thread-safe storage keyed by server name. Supports configuration reloads and
 * admin enable/disable through {@link #replaceAll(Collection)}.
 */
public final class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    private final Map<String, CandidateServer> servers = new ConcurrentHashMap<>();
    private final List<Consumer<ServerRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new server or replaces one with the same name.
     */
    public void registerServer(CandidateServer server) {
        CandidateServer previous = servers.put(server.getName(), server);
        if (previous == null) {
            log.info("Server registered: {}", server);
            notifyListeners(new ServerRegistryEvent(ServerRegistryEvent.Type.ADDED, server));
        } else {
            log.info("Server updated: {}", server);
            notifyListeners(new ServerRegistryEvent(ServerRegistryEvent.Type.UPDATED, server));
        }
    }

    public Optional<CandidateServer> removeServer(String name) {
        CandidateServer removed = servers.remove(name);
        if (removed != null) {
            log.info("Server removed: {}", removed);
            notifyListeners(new ServerRegistryEvent(ServerRegistryEvent.Type.REMOVED, removed));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<CandidateServer> getServer(String name) {
        return Optional.ofNullable(servers.get(name));
    }

    /**
     * All registered servers, sorted by name.
     */
    public List<CandidateServer> getAllServers() {
        List<CandidateServer> all = new ArrayList<>(servers.values());
        all.sort(Comparator.comparing(CandidateServer::getName));
        return all;
    }

    /**
     * Servers that may take a request for {@code model}: enabled, UP and serving the model.
     *
     * @param names when not empty, only servers with one of these names are returned
     */
    public List<CandidateServer> getCandidates(String model, Collection<String> names) {
        Set<String> restrictTo = names == null ? Set.of() : new HashSet<>(names);
        return getAllServers().stream()
                .filter(server -> server.isRoutable(model))
                .filter(server -> restrictTo.isEmpty() || restrictTo.contains(server.getName()))
                .toList();
    }

    /**
     * Models served by enabled, UP servers, each with the names of the servers serving it.
     * Servers with an empty model set accept any model and are not listed.
     */
    public SortedMap<String, List<String>> getServedModels() {
        SortedMap<String, List<String>> models = new TreeMap<>();
        for (CandidateServer server : getAllServers()) {
            if (!server.isEnabled() || server.getHealth() != ServerHealth.UP) {
                continue;
            }
            for (String model : server.getModels()) {
                models.computeIfAbsent(model, m -> new ArrayList<>()).add(server.getName());
            }
        }
        return models;
    }

    public int getActiveCount() {
        return (int) servers.values().stream()
                .filter(server -> server.isEnabled() && server.getHealth() == ServerHealth.UP)
                .count();
    }

    /**
     * Updates the health status of a server.
     */
    public void updateHealth(String name, ServerHealth health) {
        CandidateServer server = servers.get(name);
        if (server != null) {
            ServerHealth previous = server.getHealth();
            server.setHealth(health);
            if (previous != health) {
                log.info("Server health changed: server={}, {} -> {}", name, previous, health);
                notifyListeners(new ServerRegistryEvent(ServerRegistryEvent.Type.HEALTH_CHANGED, server));
            }
        }
    }

    /**
     * Flips the enabled flag by rebuilding the server with the same identity.
     *
     * @return the updated server, or empty if unknown
     */
    public Optional<CandidateServer> setEnabled(String name, boolean enabled) {
        CandidateServer current = servers.get(name);
        if (current == null) {
            return Optional.empty();
        }
        if (current.isEnabled() == enabled) {
            return Optional.of(current);
        }
        CandidateServer updated = CandidateServer.builder()
                .name(current.getName())
                .url(current.getUrl())
                .address(current.getAddress())
                .models(current.getModels())
                .enabled(enabled)
                .initialHealth(current.getHealth())
                .build();
        registerServer(updated);
        return Optional.of(updated);
    }

    /**
     * Replaces all servers with a new set. Used for configuration reload.
     */
    public void replaceAll(Collection<CandidateServer> newServers) {
        Set<String> newNames = new HashSet<>();

        for (CandidateServer server : newServers) {
            newNames.add(server.getName());
            registerServer(server);
        }

        for (String existing : new ArrayList<>(servers.keySet())) {
            if (!newNames.contains(existing)) {
                removeServer(existing);
            }
        }

        log.info("Server registry replaced: {} servers registered", servers.size());
    }

    /**
     * Builds servers from the {@code servers} configuration section.
     */
    public static List<CandidateServer> fromConfig(List<RouterConfig.BackendConfig> backends) {
        List<CandidateServer> result = new ArrayList<>();
        for (RouterConfig.BackendConfig backend : backends) {
            result.add(CandidateServer.builder()
                    .name(backend.getName())
                    .url(backend.getUrl())
                    .address(backend.getAddress())
                    .models(backend.getModels())
                    .enabled(backend.isEnabled())
                    .build());
        }
        return result;
    }

    public void addListener(Consumer<ServerRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ServerRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ServerRegistryEvent event) {
        for (Consumer<ServerRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Error notifying listener", e);
            }
        }
    }

    public int size() {
        return servers.size();
    }

    public void clear() {
        for (String name : new ArrayList<>(servers.keySet())) {
            removeServer(name);
        }
    }

    /**
     * Event for server registry changes.
     */
    public record ServerRegistryEvent(Type type, CandidateServer server) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED,
            HEALTH_CHANGED
        }
    }
}
