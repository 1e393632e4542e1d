package com.underscoreresearch.stash.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named service made up of one or more root directories, each known by a path name.
 */
@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceSpec {
    @JsonIgnore
    private String name;
    private Map<String, String> paths;
    @JsonProperty("include_folders")
    private Map<String, List<String>> includeFolders;

    @JsonIgnore
    public List<String> pathNames() {
        List<String> ret = new ArrayList<>();
        if (paths != null) {
            ret.addAll(paths.keySet());
        }
        ret.sort(String::compareTo);
        return ret;
    }

    @JsonIgnore
    public List<String> includeFoldersFor(String pathName) {
        if (includeFolders != null) {
            List<String> folders = includeFolders.get(pathName);
            if (folders != null) {
                return folders;
            }
        }
        return List.of();
    }
}
