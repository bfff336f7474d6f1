package io.storagecontroller.volume;

/**
 * Observed state of a volume.
 *
 * <ul>
 *   <li><strong>PENDING</strong> - created, first reconciliation not finished</li>
 *   <li><strong>HEALTHY</strong> - all desired replicas online</li>
 *   <li><strong>DEGRADED</strong> - fewer online replicas than desired or a rebuild in progress</li>
 *   <li><strong>OFFLINE</strong> - the nexus is unreachable</li>
 *   <li><strong>FAULTED</strong> - no usable replica left</li>
 *   <li><strong>DESTROYED</strong> - being or already torn down</li>
 * </ul>
 */
public enum VolumeState {
    PENDING,
    HEALTHY,
    DEGRADED,
    OFFLINE,
    FAULTED,
    DESTROYED
}
