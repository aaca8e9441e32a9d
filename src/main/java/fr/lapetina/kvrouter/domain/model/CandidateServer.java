package fr.lapetina.kvrouter.domain.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An inference server that may receive a routed request.
 *
 * Identity is the stable {@link #getName() name}. The endpoint URL is what the prefix
 * picker records in its trie, and the address is what the cache-index controller knows
 * the server by.
 *
 * Thread-safe: only the health flag is mutable.
 */
public final class CandidateServer {
    private final String name;
    private final URI url;
    private final String address;
    private final Set<String> models;
    private final boolean enabled;

    private final AtomicReference<ServerHealth> health;

    private CandidateServer(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Server name is required");
        this.url = Objects.requireNonNull(builder.url, "Server URL is required");
        this.address = builder.address != null ? builder.address : url.getHost();
        this.models = Collections.unmodifiableSet(new LinkedHashSet<>(builder.models));
        this.enabled = builder.enabled;
        this.health = new AtomicReference<>(builder.initialHealth);
    }

    public String getName() {
        return name;
    }

    public URI getUrl() {
        return url;
    }

    /**
     * Identity used by the prefix trie.
     */
    public String getEndpoint() {
        return url.toString();
    }

    public String getAddress() {
        return address;
    }

    public Set<String> getModels() {
        return models;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public ServerHealth getHealth() {
        return health.get();
    }

    public void setHealth(ServerHealth newHealth) {
        health.set(newHealth);
    }

    /**
     * An empty model set means the server accepts any model.
     */
    public boolean serves(String model) {
        return models.isEmpty() || models.contains(model);
    }

    public boolean isRoutable(String model) {
        return enabled && health.get() == ServerHealth.UP && serves(model);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CandidateServer that = (CandidateServer) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "CandidateServer{" +
                "name='" + name + '\'' +
                ", url=" + url +
                ", address=" + address +
                ", health=" + health.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private URI url;
        private String address;
        private final Set<String> models = new LinkedHashSet<>();
        private boolean enabled = true;
        private ServerHealth initialHealth = ServerHealth.UP;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder url(String url) {
            this.url = URI.create(url);
            return this;
        }

        public Builder url(URI url) {
            this.url = url;
            return this;
        }

        /**
         * Defaults to the URL host when not set.
         */
        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder addModel(String model) {
            this.models.add(model);
            return this;
        }

        public Builder models(Set<String> models) {
            if (models != null) {
                this.models.addAll(models);
            }
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder initialHealth(ServerHealth health) {
            this.initialHealth = health;
            return this;
        }

        public CandidateServer build() {
            return new CandidateServer(this);
        }
    }
}
