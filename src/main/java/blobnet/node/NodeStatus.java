package blobnet.node;

import java.util.Locale;

/**
 * Snapshot of a node's storage and membership.
 *
 * @param diskUsage used share of the quota in percent
 */
public record NodeStatus(long artifactCount, int peerCount, long diskAllocated, double diskUsage) {

    /**
     * Disk usage with four decimals, as shown to operators.
     */
    public String formattedDiskUsage() {
        return String.format(Locale.ROOT, "%.4f", diskUsage);
    }

    @Override
    public String toString() {
        return "NodeStatus{artifacts=" + artifactCount + ", peers=" + peerCount
                + ", diskAllocated=" + diskAllocated + ", diskUsage=" + formattedDiskUsage() + "%}";
    }
}
