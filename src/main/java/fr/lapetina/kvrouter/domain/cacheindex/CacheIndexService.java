package fr.lapetina.kvrouter.domain.cacheindex;

import java.util.Optional;

/**
 * Out-of-process index of which inference instance holds the KV cache for a prompt.
 *
 * Implementations must not throw for remote failures: unreachable controller, timeouts,
 * non-success statuses and undecodable payloads all come back as {@link Optional#empty()}.
 */
public interface CacheIndexService {

    /**
     * Finds the instance holding the longest cached prefix of {@code prompt} for {@code model}.
     */
    Optional<LookupResult> lookup(String model, String prompt);

    /**
     * Resolves a server's network address to the instance id the index knows it by.
     */
    Optional<String> resolveInstance(String address);
}
