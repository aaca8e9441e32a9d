package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.DecisionPath;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;
import fr.lapetina.kvrouter.domain.prefix.HashTrie;
import fr.lapetina.kvrouter.domain.prompt.PromptExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Prefix-affinity picker backed by a local {@link HashTrie}.
 *
 * Routes to a random server among those recorded for the longest previously seen prefix of
 * the prompt that is still available, or among all candidates when there is no history.
 * The chosen server is then recorded along the whole prompt path, so repeated and extended
 * prompts keep landing on the same server.
 *
 * Needs no external service. Thread-safe: the trie carries its own lock and the random
 * source defaults to {@link ThreadLocalRandom}.
 */
public final class PrefixMatchPicker implements Picker {

    private static final Logger log = LoggerFactory.getLogger(PrefixMatchPicker.class);

    private final HashTrie trie;
    private final Supplier<? extends Random> random;
    private final PickObserver observer;

    public PrefixMatchPicker(HashTrie trie, Supplier<? extends Random> random, PickObserver observer) {
        this.trie = trie;
        this.random = random;
        this.observer = observer;
    }

    public PrefixMatchPicker(HashTrie trie) {
        this(trie, ThreadLocalRandom::current, PickObserver.NOOP);
    }

    public PrefixMatchPicker() {
        this(new HashTrie());
    }

    @Override
    public String getName() {
        return "prefixmatch";
    }

    @Override
    public Optional<CandidateServer> pick(RoutingRequest request, List<CandidateServer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            PickObserver.notifySafely(observer, getName(), DecisionPath.NO_CANDIDATES, request, null);
            return Optional.empty();
        }

        String prompt = PromptExtractor.extract(request);

        Set<String> available = new LinkedHashSet<>();
        for (CandidateServer candidate : candidates) {
            available.add(candidate.getEndpoint());
        }

        Set<String> matched = trie.longestPrefixMatch(prompt, available);
        DecisionPath path = DecisionPath.PREFIX_MATCH;
        if (matched.isEmpty()) {
            matched = available;
            path = DecisionPath.RANDOM;
        }

        // Sorted so a seeded random source gives reproducible picks
        List<String> pool = new ArrayList<>(matched);
        Collections.sort(pool);
        String selected = pool.get(random.get().nextInt(pool.size()));

        trie.insert(prompt, selected);

        CandidateServer target = candidates.stream()
                .filter(candidate -> candidate.getEndpoint().equals(selected))
                .findFirst()
                .orElse(candidates.get(0));

        log.debug("Prefix pick: requestId={}, server={}, path={}, pool={}, trieNodes={}",
                request.requestId(), target.getName(), path, pool.size(), trie.nodeCount());
        PickObserver.notifySafely(observer, getName(), path, request, target);
        return Optional.of(target);
    }

    public HashTrie getTrie() {
        return trie;
    }

    @Override
    public void reset() {
        trie.clear();
    }
}
