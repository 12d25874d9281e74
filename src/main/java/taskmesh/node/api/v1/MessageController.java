package taskmesh.node.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskmesh.node.MarketplaceNode;
import taskmesh.node.api.Controller;
import taskmesh.node.api.v1.dto.PeerMessageResponse;
import taskmesh.node.util.JsonMapper;

import java.util.List;
import java.util.Map;

/**
 * Recent protocol messages.
 * GET /api/v1/messages
 */
public class MessageController implements Controller {

    private final MarketplaceNode node;

    public MessageController(MarketplaceNode node) {
        this.node = node;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/messages".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<PeerMessageResponse> messages = node.recentMessages().stream()
                .map(PeerMessageResponse::from)
                .toList();

        try {
            return ControllerResponse.json(JsonMapper.mapper().writeValueAsString(Map.of("messages", messages)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize messages response", e);
        }
    }
}
