package com.underscoreresearch.stash.configuration;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Strings;
import com.underscoreresearch.stash.model.ArchiveConfiguration;
import com.underscoreresearch.stash.model.ServiceSpec;
import com.underscoreresearch.stash.model.StashConfiguration;
import com.underscoreresearch.stash.model.StorageConfiguration;
import com.underscoreresearch.stash.utils.SerializationUtils;

@Slf4j
public class ConfigurationValidator {
    public static StashConfiguration loadConfiguration(File file) throws IOException {
        StashConfiguration configuration = SerializationUtils.readConfiguration(file);
        validateConfiguration(configuration);
        return configuration;
    }

    /**
     * @throws IllegalArgumentException describing the first problem found.
     */
    public static void validateConfiguration(StashConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Missing configuration");
        }
        validateStorage(configuration.getStorage());
        validateServices(configuration.getServices());
        validateRetention(configuration);
        validateArchive(configuration.getArchive());
    }

    private static void validateStorage(StorageConfiguration storage) {
        if (storage == null) {
            throw new IllegalArgumentException("Missing storage configuration");
        }
        switch (storage.storageType()) {
            case StorageConfiguration.S3_TYPE -> {
                if (Strings.isNullOrEmpty(storage.getBucket())) {
                    throw new IllegalArgumentException("S3 storage is missing a bucket");
                }
                if (!Strings.isNullOrEmpty(storage.getAccessKey()) && Strings.isNullOrEmpty(storage.getSecretKey())) {
                    throw new IllegalArgumentException("S3 storage has an access key but no secret key");
                }
                if (Strings.isNullOrEmpty(storage.getAccessKey())) {
                    log.info("No S3 access key configured, using default AWS credentials");
                }
            }
            case StorageConfiguration.FILE_TYPE -> {
                if (Strings.isNullOrEmpty(storage.getLocalRoot())) {
                    throw new IllegalArgumentException("File storage is missing a local root");
                }
            }
            default -> throw new IllegalArgumentException("Unknown storage type \"" + storage.getType() + "\"");
        }
        if (storage.getMaxRetries() != null && storage.getMaxRetries() < 0) {
            throw new IllegalArgumentException("Storage max retries can not be negative");
        }
        if (storage.getTimeoutSeconds() != null && storage.getTimeoutSeconds() < 0) {
            throw new IllegalArgumentException("Storage timeout can not be negative");
        }
    }

    private static void validateServices(Map<String, ServiceSpec> services) {
        if (services == null || services.isEmpty()) {
            throw new IllegalArgumentException("At least one service must be configured");
        }
        for (Map.Entry<String, ServiceSpec> entry : services.entrySet()) {
            String name = entry.getKey();
            if (StringUtils.isBlank(name) || name.contains("/")) {
                throw new IllegalArgumentException("Service has missing or invalid name \"" + name + "\"");
            }
            ServiceSpec service = entry.getValue();
            if (service == null || service.getPaths() == null || service.getPaths().isEmpty()) {
                throw new IllegalArgumentException("Service \"" + name + "\" must have at least one path");
            }
            for (Map.Entry<String, String> path : service.getPaths().entrySet()) {
                validatePath(name, path.getKey(), path.getValue());
            }
            if (service.getIncludeFolders() != null) {
                for (Map.Entry<String, List<String>> include : service.getIncludeFolders().entrySet()) {
                    if (!service.getPaths().containsKey(include.getKey())) {
                        throw new IllegalArgumentException("Service \"" + name + "\" has include folders for unknown path \""
                                + include.getKey() + "\"");
                    }
                }
            }
        }
    }

    private static void validatePath(String service, String pathName, String location) {
        if (StringUtils.isBlank(pathName) || pathName.startsWith("/")
                || pathName.endsWith("/") || pathName.contains("//")) {
            throw new IllegalArgumentException("Service \"" + service + "\" has invalid path name \"" + pathName + "\"");
        }
        if (StringUtils.isBlank(location)) {
            throw new IllegalArgumentException("Path \"" + pathName + "\" of service \"" + service
                    + "\" has no location");
        }
        if (!Path.of(location).isAbsolute()) {
            throw new IllegalArgumentException("Path \"" + pathName + "\" of service \"" + service
                    + "\" must be absolute, got \"" + location + "\"");
        }
    }

    private static void validateRetention(StashConfiguration configuration) {
        if (configuration.getRetention() != null && configuration.getRetention() <= 0) {
            throw new IllegalArgumentException("Retention must be greater than 0 days");
        }
        if (configuration.autoCleanupEnabled() && configuration.getRetention() == null) {
            throw new IllegalArgumentException("Auto cleanup requires a retention period");
        }
    }

    private static void validateArchive(ArchiveConfiguration archive) {
        if (archive != null && archive.getMinSize() != null && archive.getMinSize() < 0) {
            throw new IllegalArgumentException("Minimum archive size can not be negative");
        }
    }
}
