package taskmesh.node.session;

import taskmesh.node.model.PeerAddress;
import taskmesh.node.model.PeerMessage;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Last few protocol messages exchanged with peers, newest last.
 */
public class MessageLog {

    private final Deque<PeerMessage> messages = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;

    public MessageLog(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized void sent(String type, PeerAddress peer, String description) {
        append(new PeerMessage(PeerMessage.Direction.SENT, type, clock.instant(), peer, description));
    }

    public synchronized void received(String type, PeerAddress peer, String description) {
        append(new PeerMessage(PeerMessage.Direction.RECEIVED, type, clock.instant(), peer, description));
    }

    private void append(PeerMessage message) {
        if (messages.size() >= capacity) {
            messages.removeFirst();
        }
        messages.addLast(message);
    }

    public synchronized List<PeerMessage> snapshot() {
        return List.copyOf(messages);
    }
}
