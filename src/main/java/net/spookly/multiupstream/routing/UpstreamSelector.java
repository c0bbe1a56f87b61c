package net.spookly.multiupstream.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import net.spookly.multiupstream.registry.ProxyRegistry;
import net.spookly.multiupstream.registry.ProxyRegistryStore;

/**
 * Chooses an upstream proxy per flow using rules, weights and session affinity.
 */
public final class UpstreamSelector {
    private final ProxyRegistryStore registryStore;
    private final SessionAffinityCache affinityCache;
    private final Supplier<Random> random;

    public UpstreamSelector(ProxyRegistryStore registryStore) {
        this(registryStore, new SessionAffinityCache(), ThreadLocalRandom::current);
    }

    public UpstreamSelector(ProxyRegistryStore registryStore,
                            SessionAffinityCache affinityCache,
                            Supplier<Random> random) {
        this.registryStore = Objects.requireNonNull(registryStore, "registryStore");
        this.affinityCache = Objects.requireNonNull(affinityCache, "affinityCache");
        this.random = Objects.requireNonNull(random, "random");
    }

    public SessionAffinityCache affinityCache() {
        return affinityCache;
    }

    /**
     * Select the upstream for a flow, reusing the session's previous choice while it still matches.
     */
    public SelectionResult select(FlowView flow) {
        Objects.requireNonNull(flow, "flow");
        ProxyRegistry registry = registryStore.current();
        if (!registry.loaded()) {
            return new SelectionResult(null, null, SelectionResult.NOT_LOADED);
        }
        ConnectionIdentity identity = ConnectionIdentity.of(flow);
        UpstreamProxy cached = affinityCache.get(identity);
        if (cached != null) {
            // Entries pinned to a proxy from a replaced snapshot are stale even if their rules match.
            if (registry.find(cached.name()) == cached && RuleMatcher.matchesAny(flow, cached.rules())) {
                return new SelectionResult(cached, identity, SelectionResult.AFFINITY);
            }
            affinityCache.evict(identity, cached);
        }

        List<UpstreamProxy> matching = new ArrayList<>();
        for (UpstreamProxy candidate : registry.candidates()) {
            if (RuleMatcher.matchesAny(flow, candidate.rules())) {
                matching.add(candidate);
            }
        }

        UpstreamProxy selection;
        String reason;
        if (matching.isEmpty()) {
            selection = registry.defaultProxy();
            if (selection == null) {
                return new SelectionResult(null, identity, SelectionResult.NO_MATCH);
            }
            reason = SelectionResult.DEFAULT;
        } else if (matching.size() == 1) {
            selection = matching.get(0);
            reason = SelectionResult.MATCHED;
        } else {
            selection = selectWeightedRandom(matching);
            reason = SelectionResult.WEIGHTED;
        }
        if (registryStore.current() == registry) {
            affinityCache.put(identity, selection);
        }
        return new SelectionResult(selection, identity, reason);
    }

    /**
     * Drop the affinity entry for a finished session.
     */
    public void release(FlowView flow) {
        if (flow == null) {
            return;
        }
        affinityCache.remove(ConnectionIdentity.of(flow));
    }

    // Weights are normalized over the matching subset only.
    private UpstreamProxy selectWeightedRandom(List<UpstreamProxy> candidates) {
        long totalWeight = 0;
        for (UpstreamProxy candidate : candidates) {
            totalWeight += candidate.weight();
        }
        long target = random.get().nextLong(totalWeight);
        long running = 0;
        for (UpstreamProxy candidate : candidates) {
            running += candidate.weight();
            if (target < running) {
                return candidate;
            }
        }
        return candidates.get(candidates.size() - 1);
    }
}
