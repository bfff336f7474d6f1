package io.storagecontroller.watcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Storage node announced by the orchestrator: its name and the endpoint of its
 * storage agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeSpec {
    private String name;
    private String endpoint;
}
