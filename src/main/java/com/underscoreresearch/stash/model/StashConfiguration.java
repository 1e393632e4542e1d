package com.underscoreresearch.stash.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

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
public class StashConfiguration {
    private StorageConfiguration storage;
    private Map<String, ServiceSpec> services;
    private Integer retention;
    @JsonProperty("auto_cleanup")
    private Boolean autoCleanup;
    private ArchiveConfiguration archive;
    private NotificationConfiguration notifications;

    @JsonIgnore
    public List<String> serviceNames() {
        List<String> ret = new ArrayList<>();
        if (services != null) {
            ret.addAll(services.keySet());
        }
        ret.sort(String::compareTo);
        return ret;
    }

    /**
     * Looks up a service by name, returning a copy that carries its name.
     */
    @JsonIgnore
    public Optional<ServiceSpec> findService(String name) {
        if (services == null || name == null) {
            return Optional.empty();
        }
        ServiceSpec spec = services.get(name);
        if (spec == null) {
            return Optional.empty();
        }
        return Optional.of(spec.toBuilder().name(name).build());
    }

    @JsonIgnore
    public boolean autoCleanupEnabled() {
        return autoCleanup != null && autoCleanup;
    }

    @JsonIgnore
    public ArchiveConfiguration archiveSettings() {
        return archive != null ? archive : new ArchiveConfiguration();
    }

    @JsonIgnore
    public NotificationConfiguration notificationSettings() {
        return notifications != null ? notifications : new NotificationConfiguration();
    }
}
