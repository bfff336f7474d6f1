package io.storagecontroller.watcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.storagecontroller.volume.VolumeSpec;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Desired volume as stored by the orchestrator: the volume uuid plus its
 * specification fields at the same level.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VolumeSpecRecord {
    private String uuid;
    @JsonUnwrapped
    private VolumeSpec spec;
}
