package in.flipcycle.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ActiveCycleIndex - admission bookkeeping for ACTIVE cycles.
 *
 * STRUCTURE:
 * - Map<asset, cycleId> (at most one ACTIVE cycle per asset)
 * - Map<cycleId, asset> for reverse lookup (cleanup)
 *
 * THREAD-SAFETY:
 * admit() checks the global cap and the per-asset slot and claims both in
 * one step under the index monitor, so concurrent submissions can never
 * exceed the cap or double-book an asset.
 *
 * LIFECYCLE:
 * 1. admit() at SPEARHEAD_INVOKED
 * 2. release() at ECHO_IMPRINT (a cycle awaiting manual intervention keeps
 *    its slot)
 */
public final class ActiveCycleIndex {
    private static final Logger log = LoggerFactory.getLogger(ActiveCycleIndex.class);

    public enum Admission {
        ADMITTED,
        AT_CAPACITY,
        ASSET_ALREADY_ACTIVE
    }

    private final Map<String, String> assetToCycle = new HashMap<>();
    private final Map<String, String> cycleToAsset = new HashMap<>();

    /**
     * Atomically claim a slot for a cycle.
     */
    public synchronized Admission admit(String cycleId, String asset, int maxConcurrent) {
        if (assetToCycle.containsKey(asset)) {
            return Admission.ASSET_ALREADY_ACTIVE;
        }
        if (cycleToAsset.size() >= maxConcurrent) {
            return Admission.AT_CAPACITY;
        }
        assetToCycle.put(asset, cycleId);
        cycleToAsset.put(cycleId, asset);
        log.debug("Cycle admitted to index: {} → {}", cycleId, asset);
        return Admission.ADMITTED;
    }

    public synchronized void release(String cycleId) {
        String asset = cycleToAsset.remove(cycleId);
        if (asset != null) {
            assetToCycle.remove(asset, cycleId);
            log.debug("Cycle removed from index: {} (was {})", cycleId, asset);
        }
    }

    public synchronized Optional<String> activeCycleFor(String asset) {
        return Optional.ofNullable(assetToCycle.get(asset));
    }

    public synchronized boolean contains(String cycleId) {
        return cycleToAsset.containsKey(cycleId);
    }

    public synchronized int size() {
        return cycleToAsset.size();
    }

    /**
     * Share of the concurrency cap in use, 0..1.
     */
    public synchronized double exposure(int maxConcurrent) {
        return maxConcurrent > 0 ? (double) cycleToAsset.size() / maxConcurrent : 1.0;
    }
}
