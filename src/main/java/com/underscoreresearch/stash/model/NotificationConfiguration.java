package com.underscoreresearch.stash.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.underscoreresearch.stash.notification.NotificationKind;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationConfiguration {
    @JsonProperty("on_success")
    private Boolean onSuccess;
    @JsonProperty("on_error")
    private Boolean onError;
    @JsonProperty("on_warning")
    private Boolean onWarning;

    @JsonIgnore
    public boolean enabled(NotificationKind kind) {
        return switch (kind) {
            case SUCCESS -> onSuccess == null || onSuccess;
            case ERROR -> onError == null || onError;
            case WARNING -> onWarning == null || onWarning;
        };
    }
}
