package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.cacheindex.CacheIndexService;

import java.util.Optional;

/**
 * Everything a picker constructor may need. Built once from configuration.
 *
 * @param cacheIndex   controller client, null when none is configured
 * @param threshold    word tolerance for KV-cache matches
 * @param chunkSize    prefix trie chunk size in bytes
 * @param maxTrieNodes prefix trie capacity, 0 for unbounded
 */
public record PickerContext(
        CacheIndexService cacheIndex,
        int threshold,
        int chunkSize,
        int maxTrieNodes,
        PickObserver observer
) {
    public PickerContext {
        if (observer == null) {
            observer = PickObserver.NOOP;
        }
    }

    public Optional<CacheIndexService> cacheIndexService() {
        return Optional.ofNullable(cacheIndex);
    }
}
