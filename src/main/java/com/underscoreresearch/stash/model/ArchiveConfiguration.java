package com.underscoreresearch.stash.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveConfiguration {
    @JsonProperty("temp_dir")
    private String tempDir;
    @JsonProperty("preserve_acls")
    private Boolean preserveAcls;
    private Boolean compression;
    @JsonProperty("min_size")
    private Long minSize;

    @JsonIgnore
    public boolean compressionEnabled() {
        return compression == null || compression;
    }

    @JsonIgnore
    public boolean aclPreservation() {
        return preserveAcls != null && preserveAcls;
    }

    @JsonIgnore
    public long minimumSize() {
        return minSize != null ? minSize : 0;
    }

    @JsonIgnore
    public Path scratchDirectory() {
        if (tempDir == null || tempDir.isEmpty()) {
            return Path.of(System.getProperty("java.io.tmpdir"));
        }
        return Path.of(tempDir);
    }
}
