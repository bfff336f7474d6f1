package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replica as listed by a storage node. {@code state} may be absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplicaInfo {
    private String uuid;
    private String pool;
    private long size;
    private boolean thin;
    private ShareProtocol share;
    private String uri;
    private ReplicaState state;
}
