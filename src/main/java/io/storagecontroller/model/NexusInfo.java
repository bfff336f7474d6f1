package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Nexus as listed by a storage node. {@code deviceUri} is empty unless published.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NexusInfo {
    private String uuid;
    private long size;
    private NexusState state;
    private List<Child> children;
    private String deviceUri;

    /**
     * Replica URI opened by the nexus.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Child {
        private String uri;
        private ChildState state;
        private int rebuildProgress;
    }
}
