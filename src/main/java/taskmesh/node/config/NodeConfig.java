package taskmesh.node.config;

import taskmesh.node.model.NodeCapabilities;
import taskmesh.node.model.PeerAddress;

import java.time.Duration;
import java.util.UUID;

/**
 * Configuration holder for a marketplace node.
 * All settings have sensible defaults.
 */
public final class NodeConfig {

    // Identity
    private String nodeId = "node-" + UUID.randomUUID().toString().substring(0, 8);

    // Where peers reach our task server
    private String taskServerHost = "127.0.0.1";
    private int taskServerPort = 40102;

    // Status server settings
    private int httpPort = 8090;
    private String httpHost = "0.0.0.0";

    // Coordination loop
    private Duration tickInterval = Duration.ofSeconds(1);

    // Task header settings
    private Duration removedTaskCooldown = Duration.ofSeconds(240);
    private boolean evictOnConnectionFailure = true;

    // Result delivery
    private Duration maxResultSendingDelay = Duration.ofSeconds(100);

    // Trust bounds
    private double minTrust = 0.0;
    private double maxTrust = 1.0;

    private int recentMessageCapacity = 5;

    // What we offer to task owners
    private double estimatedPerformance = 1000.0;
    private long maxResourceSize = 250L * 1024 * 1024;
    private long maxMemorySize = 1024L * 1024 * 1024;
    private int numCores = Runtime.getRuntime().availableProcessors();

    private NodeConfig() {
    }

    public static NodeConfig defaults() {
        return new NodeConfig();
    }

    public static NodeConfig fromEnv() {
        NodeConfig config = new NodeConfig();

        String nodeId = System.getenv("TASKMESH_NODE_ID");
        if (nodeId != null && !nodeId.isBlank()) {
            config.nodeId = nodeId;
        }

        String taskHost = System.getenv("TASKMESH_TASK_SERVER_HOST");
        if (taskHost != null && !taskHost.isBlank()) {
            config.taskServerHost = taskHost;
        }

        String taskPort = System.getenv("TASKMESH_TASK_SERVER_PORT");
        if (taskPort != null && !taskPort.isBlank()) {
            config.taskServerPort = Integer.parseInt(taskPort);
        }

        String port = System.getenv("TASKMESH_HTTP_PORT");
        if (port != null && !port.isBlank()) {
            config.httpPort = Integer.parseInt(port);
        }

        String cooldown = System.getenv("TASKMESH_REMOVED_TASK_COOLDOWN_SEC");
        if (cooldown != null && !cooldown.isBlank()) {
            config.removedTaskCooldown = Duration.ofSeconds(Long.parseLong(cooldown));
        }

        String sendingDelay = System.getenv("TASKMESH_MAX_RESULT_SENDING_DELAY_SEC");
        if (sendingDelay != null && !sendingDelay.isBlank()) {
            config.maxResultSendingDelay = Duration.ofSeconds(Long.parseLong(sendingDelay));
        }

        String evict = System.getenv("TASKMESH_EVICT_ON_CONNECTION_FAILURE");
        if (evict != null && !evict.isBlank()) {
            config.evictOnConnectionFailure = Boolean.parseBoolean(evict);
        }

        String cores = System.getenv("TASKMESH_NUM_CORES");
        if (cores != null && !cores.isBlank()) {
            config.numCores = Integer.parseInt(cores);
        }

        return config;
    }

    // Getters
    public String nodeId() {
        return nodeId;
    }

    public PeerAddress taskServerAddress() {
        return new PeerAddress(taskServerHost, taskServerPort);
    }

    public int httpPort() {
        return httpPort;
    }

    public String httpHost() {
        return httpHost;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Duration removedTaskCooldown() {
        return removedTaskCooldown;
    }

    public boolean evictOnConnectionFailure() {
        return evictOnConnectionFailure;
    }

    public Duration maxResultSendingDelay() {
        return maxResultSendingDelay;
    }

    public double minTrust() {
        return minTrust;
    }

    public double maxTrust() {
        return maxTrust;
    }

    public int recentMessageCapacity() {
        return recentMessageCapacity;
    }

    public NodeCapabilities capabilities() {
        return new NodeCapabilities(estimatedPerformance, maxResourceSize, maxMemorySize, numCores);
    }

    // Fluent setters for testing/customization
    public NodeConfig withNodeId(String nodeId) {
        this.nodeId = nodeId;
        return this;
    }

    public NodeConfig withTaskServerAddress(String host, int port) {
        this.taskServerHost = host;
        this.taskServerPort = port;
        return this;
    }

    public NodeConfig withHttpPort(int port) {
        this.httpPort = port;
        return this;
    }

    public NodeConfig withHttpHost(String host) {
        this.httpHost = host;
        return this;
    }

    public NodeConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public NodeConfig withRemovedTaskCooldown(Duration cooldown) {
        this.removedTaskCooldown = cooldown;
        return this;
    }

    public NodeConfig withEvictOnConnectionFailure(boolean evict) {
        this.evictOnConnectionFailure = evict;
        return this;
    }

    public NodeConfig withMaxResultSendingDelay(Duration delay) {
        this.maxResultSendingDelay = delay;
        return this;
    }

    public NodeConfig withTrustBounds(double min, double max) {
        if (min > max) {
            throw new IllegalArgumentException("minTrust must not exceed maxTrust");
        }
        this.minTrust = min;
        this.maxTrust = max;
        return this;
    }

    public NodeConfig withRecentMessageCapacity(int capacity) {
        this.recentMessageCapacity = capacity;
        return this;
    }

    public NodeConfig withCapabilities(NodeCapabilities capabilities) {
        this.estimatedPerformance = capabilities.estimatedPerformance();
        this.maxResourceSize = capabilities.maxResourceSize();
        this.maxMemorySize = capabilities.maxMemorySize();
        this.numCores = capabilities.numCores();
        return this;
    }

    @Override
    public String toString() {
        return "NodeConfig{" +
                "nodeId='" + nodeId + '\'' +
                ", taskServer=" + taskServerHost + ":" + taskServerPort +
                ", httpPort=" + httpPort +
                ", tickInterval=" + tickInterval +
                ", removedTaskCooldown=" + removedTaskCooldown +
                ", maxResultSendingDelay=" + maxResultSendingDelay +
                ", trust=[" + minTrust + ", " + maxTrust + "]" +
                ", evictOnConnectionFailure=" + evictOnConnectionFailure +
                '}';
    }
}
