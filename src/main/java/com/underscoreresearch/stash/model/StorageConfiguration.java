package com.underscoreresearch.stash.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.underscoreresearch.stash.utils.RetryUtils;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class StorageConfiguration {
    public static final String S3_TYPE = "S3";
    public static final String FILE_TYPE = "FILE";
    private static final int DEFAULT_TIMEOUT_SECONDS = 300;

    private String type;
    private String bucket;
    private String prefix;
    private String endpoint;
    private String region;
    @JsonProperty("access_key")
    private String accessKey;
    @JsonProperty("secret_key")
    private String secretKey;
    @JsonProperty("path_style")
    private Boolean pathStyle;
    @JsonProperty("max_retries")
    private Integer maxRetries;
    @JsonProperty("timeout_seconds")
    private Integer timeoutSeconds;
    @JsonProperty("local_root")
    private String localRoot;

    @JsonIgnore
    public String storageType() {
        return type != null ? type.toUpperCase() : S3_TYPE;
    }

    @JsonIgnore
    public String normalizedPrefix() {
        if (prefix == null) {
            return "";
        }
        String ret = prefix;
        while (ret.startsWith("/")) {
            ret = ret.substring(1);
        }
        while (ret.endsWith("/")) {
            ret = ret.substring(0, ret.length() - 1);
        }
        return ret;
    }

    @JsonIgnore
    public int retryCount() {
        return maxRetries != null ? maxRetries : RetryUtils.DEFAULT_RETRIES;
    }

    @JsonIgnore
    public int timeout() {
        return timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    }

    @JsonIgnore
    public boolean pathStyleAccess() {
        return pathStyle != null && pathStyle;
    }
}
