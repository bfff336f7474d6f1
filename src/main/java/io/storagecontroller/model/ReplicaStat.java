package io.storagecontroller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * IO counters of one replica, stamped with the time they were collected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReplicaStat {
    private String timestamp;
    private String uuid;
    private String node;
    private String pool;
    private long numReadOps;
    private long numWriteOps;
    private long bytesRead;
    private long bytesWritten;
}
