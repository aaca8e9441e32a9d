package fr.lapetina.kvrouter.domain.picker;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import fr.lapetina.kvrouter.domain.cacheindex.CacheIndexService;
import fr.lapetina.kvrouter.domain.cacheindex.InstanceDirectory;
import fr.lapetina.kvrouter.domain.cacheindex.LookupResult;
import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.DecisionPath;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.prompt.PromptExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * KV-cache aware picker.
 *
 * Asks the cache-index controller which instance holds the longest cached prefix of the
 * prompt. When the match covers the prompt (within {@code threshold} words) and that
 * instance maps to a current candidate, the request goes there. Anything else, including
 * every remote failure, falls back to deterministic round-robin.
 *
 * The instance-to-server mapping is kept in an {@link InstanceDirectory} and refreshed by
 * resolving each candidate's address when the instance is unknown or maps to a server that
 * is no longer a candidate.
 */
public final class KvAwarePicker implements Picker {

    private static final Logger log = LoggerFactory.getLogger(KvAwarePicker.class);

    private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final CacheIndexService cacheIndex;
    private final int threshold;
    private final InstanceDirectory directory;
    private final RoundRobinCursor fallback;
    private final PickObserver observer;

    public KvAwarePicker(
            CacheIndexService cacheIndex,
            int threshold,
            InstanceDirectory directory,
            RoundRobinCursor fallback,
            PickObserver observer
    ) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Threshold must be >= 0: " + threshold);
        }
        this.cacheIndex = cacheIndex;
        this.threshold = threshold;
        this.directory = directory;
        this.fallback = fallback;
        this.observer = observer;
    }

    public KvAwarePicker(CacheIndexService cacheIndex, int threshold) {
        this(cacheIndex, threshold, new InstanceDirectory(), new RoundRobinCursor(), PickObserver.NOOP);
    }

    @Override
    public String getName() {
        return "kvaware";
    }

    @Override
    public Optional<CandidateServer> pick(RoutingRequest request, List<CandidateServer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            PickObserver.notifySafely(observer, getName(), DecisionPath.NO_CANDIDATES, request, null);
            return Optional.empty();
        }

        String prompt = PromptExtractor.extract(request);

        Optional<CandidateServer> cached = findCachedServer(request, prompt, candidates);
        if (cached.isPresent()) {
            log.debug("KV cache hit: requestId={}, server={}", request.requestId(), cached.get().getName());
            PickObserver.notifySafely(observer, getName(), DecisionPath.CACHE_HIT, request, cached.get());
            return cached;
        }

        CandidateServer selected = fallback.next(candidates);
        log.debug("KV cache miss, round-robin fallback: requestId={}, server={}, candidates={}",
                request.requestId(), selected.getName(), candidates.size());
        PickObserver.notifySafely(observer, getName(), DecisionPath.ROUND_ROBIN, request, selected);
        return Optional.of(selected);
    }

    private Optional<CandidateServer> findCachedServer(
            RoutingRequest request,
            String prompt,
            List<CandidateServer> candidates
    ) {
        Optional<LookupResult> lookup;
        try {
            lookup = cacheIndex.lookup(request.model(), prompt);
        } catch (RuntimeException e) {
            log.warn("Cache index lookup failed: requestId={}, model={}", request.requestId(), request.model(), e);
            return Optional.empty();
        }

        if (lookup.isEmpty() || !lookup.get().hasInstance()) {
            return Optional.empty();
        }

        LookupResult result = lookup.get();
        int wordCount = wordCount(prompt);
        if (result.tokens() < wordCount - threshold) {
            log.debug("Cached prefix too short: requestId={}, instance={}, tokens={}, words={}, threshold={}",
                    request.requestId(), result.instanceId(), result.tokens(), wordCount, threshold);
            return Optional.empty();
        }

        Optional<CandidateServer> known = directory.get(result.instanceId())
                .flatMap(server -> findCandidate(server, candidates));
        if (known.isPresent()) {
            return known;
        }

        refreshDirectory(candidates);
        Optional<CandidateServer> resolved = directory.get(result.instanceId())
                .flatMap(server -> findCandidate(server, candidates));
        if (resolved.isEmpty()) {
            log.debug("Instance not among candidates: requestId={}, instance={}",
                    request.requestId(), result.instanceId());
        }
        return resolved;
    }

    /**
     * Resolves every candidate's address. Failures leave that candidate unmapped.
     */
    private void refreshDirectory(List<CandidateServer> candidates) {
        for (CandidateServer candidate : candidates) {
            try {
                cacheIndex.resolveInstance(candidate.getAddress())
                        .filter(id -> !id.isBlank())
                        .ifPresent(id -> directory.put(id, candidate));
            } catch (RuntimeException e) {
                log.warn("Instance resolution failed: server={}, address={}",
                        candidate.getName(), candidate.getAddress(), e);
            }
        }
    }

    private static Optional<CandidateServer> findCandidate(CandidateServer server, List<CandidateServer> candidates) {
        for (CandidateServer candidate : candidates) {
            if (candidate.equals(server)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    static int wordCount(String prompt) {
        return WORDS.splitToList(prompt).size();
    }

    @Override
    public void reset() {
        directory.clear();
        fallback.reset();
    }
}
