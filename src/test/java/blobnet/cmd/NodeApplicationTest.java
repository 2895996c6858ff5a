package blobnet.cmd;

import blobnet.messaging.NetworkAddress;
import blobnet.node.NodeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeApplicationTest {

    @Test
    void shouldBuildConfigFromFlags() throws IOException {
        // When
        NodeConfig config = NodeApplication.configFromArgs(new String[]{
                "--listen=127.0.0.1:7001",
                "--peer=127.0.0.1:7002,127.0.0.1:7003",
                "--peer=127.0.0.1:7004",
                "--storage=/tmp/blobnet-test",
                "--quota=2 GB",
                "--no-multicast"
        });

        // Then
        assertEquals(new NetworkAddress("127.0.0.1", 7001), config.listenAddress());
        assertEquals(List.of(
                new NetworkAddress("127.0.0.1", 7002),
                new NetworkAddress("127.0.0.1", 7003),
                new NetworkAddress("127.0.0.1", 7004)), config.bootstrapPeers());
        assertEquals(Path.of("/tmp/blobnet-test"), config.storageDir());
        assertEquals(2_000_000_000L, config.quotaBytes());
        assertFalse(config.multicastDiscovery());
    }

    @Test
    void noFlagsShouldGiveDefaults() throws IOException {
        NodeConfig config = NodeApplication.configFromArgs(new String[0]);

        assertEquals(7888, config.listenAddress().port());
        assertTrue(config.multicastDiscovery());
    }

    @Test
    void flagsShouldOverrideConfigFile(@TempDir Path dir) throws IOException {
        // Given
        Path file = dir.resolve("node.properties");
        Files.writeString(file, "blobnet.listen=127.0.0.1:7100\nblobnet.peers=10.0.0.5:7888\n");

        // When
        NodeConfig config = NodeApplication.configFromArgs(new String[]{
                "--peer=10.0.0.6:7888", "--config=" + file});

        // Then
        assertEquals(7100, config.listenAddress().port());
        assertEquals(List.of(new NetworkAddress("10.0.0.6", 7888)), config.bootstrapPeers());
    }

    @Test
    void unknownFlagShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> NodeApplication.configFromArgs(new String[]{"--verbose"}));
    }

    @Test
    void missingConfigFileShouldFail(@TempDir Path dir) {
        assertThrows(IOException.class,
                () -> NodeApplication.configFromArgs(new String[]{"--config=" + dir.resolve("absent.properties")}));
    }
}
