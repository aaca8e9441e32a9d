package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.cacheindex.InstanceDirectory;
import fr.lapetina.kvrouter.domain.prefix.ChunkHasher;
import fr.lapetina.kvrouter.domain.prefix.HashTrie;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Creates pickers by configured name.
 *
 * Supports runtime picker switching without service restart.
 */
public final class PickerFactory {

    public static final String DEFAULT_PICKER = "prefixmatch";

    private static final Map<String, Function<PickerContext, Picker>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("kvaware", PickerFactory::kvAware);
        register("prefixmatch", ctx -> new PrefixMatchPicker(
                new HashTrie(new ChunkHasher(ctx.chunkSize()), ctx.maxTrieNodes()),
                ThreadLocalRandom::current,
                ctx.observer()));
        register("roundrobin", ctx -> new RoundRobinPicker(new RoundRobinCursor(), ctx.observer()));
        register("random", ctx -> new RandomPicker(ThreadLocalRandom::current, ctx.observer()));
    }

    private PickerFactory() {
        // Utility class
    }

    /**
     * Registers a custom picker.
     *
     * @param name    Picker name (used in configuration)
     * @param factory Builds a picker from the shared context
     */
    public static void register(String name, Function<PickerContext, Picker> factory) {
        REGISTRY.put(name.toLowerCase(), factory);
    }

    /**
     * Creates a picker by name.
     *
     * @return Picker instance, or empty if the name is unknown
     * @throws IllegalStateException if the picker needs a cache-index controller and none is configured
     */
    public static Optional<Picker> create(String name, PickerContext context) {
        Function<PickerContext, Picker> factory = REGISTRY.get(name.toLowerCase());
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(context));
    }

    /**
     * Creates a picker by name, falling back to {@link #DEFAULT_PICKER} for unknown names.
     */
    public static Picker createOrDefault(String name, PickerContext context) {
        return create(name, context)
                .orElseGet(() -> create(DEFAULT_PICKER, context).orElseThrow());
    }

    public static Set<String> getRegisteredNames() {
        return new TreeSet<>(REGISTRY.keySet());
    }

    private static Picker kvAware(PickerContext ctx) {
        return new KvAwarePicker(
                ctx.cacheIndexService().orElseThrow(() ->
                        new IllegalStateException("kvaware picker requires picker.kvAware.controllerAddress")),
                ctx.threshold(),
                new InstanceDirectory(),
                new RoundRobinCursor(),
                ctx.observer());
    }
}
