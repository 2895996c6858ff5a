package blobnet.cmd;

import blobnet.messaging.NetworkAddress;
import blobnet.node.ArtifactNode;
import blobnet.node.NodeConfig;
import blobnet.node.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point that runs one node until the process is stopped.
 * <p>
 * Flags: {@code --config=<file.properties>}, {@code --listen=host:port},
 * {@code --peer=host:port} (repeatable or comma separated), {@code --storage=<dir>},
 * {@code --quota=<size>}, {@code --no-multicast}. Flags override the config file.
 */
public class NodeApplication {

    private static final Logger log = LoggerFactory.getLogger(NodeApplication.class);

    private final NodeConfig config;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private ArtifactNode node;

    public NodeApplication(NodeConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        NodeApplication application;
        try {
            application = new NodeApplication(configFromArgs(args));
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        try {
            application.start();
            application.awaitShutdown();
        } catch (RuntimeException e) {
            log.error("Node failed", e);
            application.stop();
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            application.stop();
        }
    }

    public static NodeConfig configFromArgs(String[] args) throws IOException {
        Properties properties = new Properties();
        for (String arg : args) {
            if (arg.startsWith("--config=")) {
                properties = NodeConfig.loadProperties(Path.of(arg.substring("--config=".length())));
            }
        }
        NodeConfig.Builder builder = NodeConfig.fromProperties(properties);
        boolean peersGiven = false;
        for (String arg : args) {
            if (arg.startsWith("--config=")) {
                continue;
            } else if (arg.startsWith("--listen=")) {
                builder.listenAddress(NetworkAddress.parse(arg.substring("--listen=".length())));
            } else if (arg.startsWith("--peer=")) {
                if (!peersGiven) {
                    builder.bootstrapPeers(NodeConfig.parseAddresses(arg.substring("--peer=".length())));
                    peersGiven = true;
                } else {
                    NodeConfig.parseAddresses(arg.substring("--peer=".length())).forEach(builder::addBootstrapPeer);
                }
            } else if (arg.startsWith("--storage=")) {
                builder.storageDir(Path.of(arg.substring("--storage=".length())));
            } else if (arg.startsWith("--quota=")) {
                builder.quota(arg.substring("--quota=".length()));
            } else if (arg.equals("--no-multicast")) {
                builder.multicastDiscovery(false);
            } else {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return builder.build();
    }

    public void start() {
        log.info("Starting node with {}", config);
        node = ArtifactNode.create(config);
        node.start();
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "shutdown"));
        NodeStatus status = node.status();
        log.info("Node {} ready: {}", node.peerId().shortId(), status);
    }

    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public synchronized void stop() {
        if (stopped.getCount() == 0) {
            return;
        }
        if (node != null) {
            node.close();
        }
        stopped.countDown();
    }

    public ArtifactNode node() {
        return node;
    }
}
