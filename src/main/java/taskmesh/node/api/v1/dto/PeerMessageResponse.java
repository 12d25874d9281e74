package taskmesh.node.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import taskmesh.node.model.PeerMessage;

import java.time.Instant;

/**
 * One entry of GET /api/v1/messages.
 */
public record PeerMessageResponse(
        @JsonProperty("direction") String direction,
        @JsonProperty("type") String type,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("peer") String peer,
        @JsonProperty("description") String description) {

    public static PeerMessageResponse from(PeerMessage message) {
        return new PeerMessageResponse(
                message.direction().name(),
                message.type(),
                message.timestamp(),
                message.peer().toString(),
                message.description());
    }
}
