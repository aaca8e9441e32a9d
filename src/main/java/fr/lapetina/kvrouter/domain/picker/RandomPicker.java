package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import fr.lapetina.kvrouter.domain.model.DecisionPath;
import fr.lapetina.kvrouter.domain.model.RoutingRequest;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Cache-oblivious baseline: uniform random choice.
 *
 * Thread-safe via ThreadLocalRandom unless another source is injected.
 */
public final class RandomPicker implements Picker {

    private final Supplier<? extends Random> random;
    private final PickObserver observer;

    public RandomPicker(Supplier<? extends Random> random, PickObserver observer) {
        this.random = random;
        this.observer = observer;
    }

    public RandomPicker() {
        this(ThreadLocalRandom::current, PickObserver.NOOP);
    }

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<CandidateServer> pick(RoutingRequest request, List<CandidateServer> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            PickObserver.notifySafely(observer, getName(), DecisionPath.NO_CANDIDATES, request, null);
            return Optional.empty();
        }
        CandidateServer selected = candidates.get(random.get().nextInt(candidates.size()));
        PickObserver.notifySafely(observer, getName(), DecisionPath.RANDOM, request, selected);
        return Optional.of(selected);
    }
}
