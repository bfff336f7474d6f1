package io.storagecontroller.volume;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.storagecontroller.model.NexusProtocol;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Desired state of a volume.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VolumeSpec {

    /** Number of replicas. */
    @Builder.Default
    private int replicaCount = 1;

    /** The consumer should run on the first preferred node, next to the nexus. */
    private boolean local;

    /** Nodes to prefer for replicas; the first one is where the consumer is expected. */
    @Builder.Default
    private List<String> preferredNodes = new ArrayList<>();

    /** Replicas must be placed on a subset of these nodes (empty means anywhere). */
    @Builder.Default
    private List<String> requiredNodes = new ArrayList<>();

    /** Minimal size of the volume. */
    private long requiredBytes;

    /** Maximal size of the volume (0 means no limit). */
    private long limitBytes;

    /** Protocol the nexus is published with. */
    @Builder.Default
    private NexusProtocol protocol = NexusProtocol.NVMF;
}
