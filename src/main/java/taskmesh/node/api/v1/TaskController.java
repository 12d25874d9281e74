package taskmesh.node.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskmesh.node.MarketplaceNode;
import taskmesh.node.api.Controller;
import taskmesh.node.api.v1.dto.KnownTaskResponse;
import taskmesh.node.util.JsonMapper;

import java.util.List;
import java.util.Map;

/**
 * Known tasks, remote and our own.
 * GET /api/v1/tasks
 *
 * Exceptions bubble to RouterHandler.
 */
public class TaskController implements Controller {

    private final MarketplaceNode node;

    public TaskController(MarketplaceNode node) {
        this.node = node;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/tasks".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        List<KnownTaskResponse> tasks = node.listKnownTasks().stream()
                .map(KnownTaskResponse::from)
                .toList();

        try {
            return ControllerResponse.json(JsonMapper.mapper().writeValueAsString(Map.of("tasks", tasks)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tasks response", e);
        }
    }
}
