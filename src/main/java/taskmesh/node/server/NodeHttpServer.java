package taskmesh.node.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import taskmesh.node.MarketplaceNode;
import taskmesh.node.api.internal.v1.TaskHeaderIngestController;
import taskmesh.node.api.v1.HealthController;
import taskmesh.node.api.v1.MessageController;
import taskmesh.node.api.v1.TaskController;
import taskmesh.node.config.NodeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for the node's status read model.
 * Port 0 binds an ephemeral port; see {@link #port()}.
 */
public final class NodeHttpServer {

    private static final Logger log = LoggerFactory.getLogger(NodeHttpServer.class);

    private final NodeConfig config;
    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public NodeHttpServer(MarketplaceNode node, NodeConfig config) {
        this.config = config;
        this.router = new RouterHandler()
                .registerController(new HealthController(node))
                .registerController(new TaskController(node))
                .registerController(new MessageController(node))
                .registerController(new TaskHeaderIngestController(node));
    }

    private ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.httpHost(), config.httpPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Status server listening on {}:{}", config.httpHost(), port());
        } catch (RuntimeException e) {
            log.error("Status server failed to start on port {}", config.httpPort(), e);
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("Status server stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Actually bound port. */
    public synchronized int port() {
        if (serverChannel == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}
