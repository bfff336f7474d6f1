package io.storagecontroller.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Replica URI opened by a nexus together with its state.
 * Rebuild progress does not take part in equality.
 */
@Getter
@ToString
@AllArgsConstructor
@EqualsAndHashCode(exclude = "rebuildProgress")
public class NexusChild implements Comparable<NexusChild> {
    private final String uri;
    private final ChildState state;
    private final int rebuildProgress;

    public static NexusChild of(NexusInfo.Child child) {
        return new NexusChild(child.getUri(),
                child.getState() != null ? child.getState() : ChildState.FAULTED,
                child.getRebuildProgress());
    }

    public boolean isRebuilding() {
        return state == ChildState.DEGRADED;
    }

    @Override
    public int compareTo(NexusChild other) {
        return uri.compareTo(other.uri);
    }
}
