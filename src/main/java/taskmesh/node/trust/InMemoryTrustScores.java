package taskmesh.node.trust;

import taskmesh.node.model.TrustRole;
import taskmesh.node.spi.ReputationSink;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Reputation sink that keeps one score per peer and role, clamped to the
 * trust bounds. Used when no ranking service is plugged in.
 */
public class InMemoryTrustScores implements ReputationSink {

    private record Key(String peerId, TrustRole role) {
    }

    private final ConcurrentHashMap<Key, Double> scores = new ConcurrentHashMap<>();
    private final double minTrust;
    private final double maxTrust;
    private final double initialTrust;

    public InMemoryTrustScores(double minTrust, double maxTrust) {
        this(minTrust, maxTrust, (minTrust + maxTrust) / 2);
    }

    public InMemoryTrustScores(double minTrust, double maxTrust, double initialTrust) {
        this.minTrust = minTrust;
        this.maxTrust = maxTrust;
        this.initialTrust = initialTrust;
    }

    @Override
    public void apply(String peerId, TrustRole role, double delta) {
        scores.compute(new Key(peerId, role), (k, current) -> {
            double base = current == null ? initialTrust : current;
            return Math.min(Math.max(base + delta, minTrust), maxTrust);
        });
    }

    public double score(String peerId, TrustRole role) {
        return scores.getOrDefault(new Key(peerId, role), initialTrust);
    }
}
