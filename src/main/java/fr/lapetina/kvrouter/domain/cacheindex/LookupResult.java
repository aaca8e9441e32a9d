package fr.lapetina.kvrouter.domain.cacheindex;

/**
 * Answer of a prefix lookup: the instance holding the cache and how many prompt tokens it matched.
 */
public record LookupResult(String instanceId, int tokens) {

    public boolean hasInstance() {
        return instanceId != null && !instanceId.isBlank();
    }
}
