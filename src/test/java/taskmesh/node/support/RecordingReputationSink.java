package taskmesh.node.support;

import taskmesh.node.model.TrustRole;
import taskmesh.node.spi.ReputationSink;

import java.util.ArrayList;
import java.util.List;

public class RecordingReputationSink implements ReputationSink {

    public record Delta(String peerId, TrustRole role, double delta) {
    }

    public final List<Delta> deltas = new ArrayList<>();

    @Override
    public void apply(String peerId, TrustRole role, double delta) {
        deltas.add(new Delta(peerId, role, delta));
    }

    public double total(String peerId, TrustRole role) {
        return deltas.stream()
                .filter(d -> d.peerId().equals(peerId) && d.role() == role)
                .mapToDouble(Delta::delta)
                .sum();
    }
}
