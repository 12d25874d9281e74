package taskmesh.node.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import taskmesh.node.MarketplaceNode;
import taskmesh.node.api.Controller;
import taskmesh.node.api.internal.v1.dto.OperationResponse;
import taskmesh.node.model.TaskHeaderMessage;
import taskmesh.node.util.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Advertisement ingestion from a local gossip bridge (internal API).
 * POST /internal/v1/task-headers
 */
public class TaskHeaderIngestController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskHeaderIngestController.class);
    private static final TypeReference<Map<String, Object>> MESSAGE_TYPE = new TypeReference<>() {
    };

    private final MarketplaceNode node;

    public TaskHeaderIngestController(MarketplaceNode node) {
        this.node = node;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/internal/v1/task-headers".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        Map<String, Object> message;
        try {
            message = JsonMapper.mapper().readValue(body, MESSAGE_TYPE);
            if (message == null) {
                return ControllerResponse.badRequest("empty task header");
            }
            // unreadable fields surface as IllegalArgumentException, a 400 in the router
            JsonMapper.mapper().convertValue(message, TaskHeaderMessage.class).validate();
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        }

        boolean added;
        try {
            added = node.onTaskHeaderReceived(message).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ControllerResponse.error("interrupted");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Task header ingestion failed", e);
            return ControllerResponse.error("ingestion failed");
        }

        try {
            OperationResponse response = added ? OperationResponse.success() : OperationResponse.notAdded();
            return ControllerResponse.json(JsonMapper.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
