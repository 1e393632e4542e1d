package com.underscoreresearch.stash.io;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.utils.BackupTimestamp;

/**
 * Maps archives to object keys of the form {@code {prefix}/{service}/{path-name}/{timestamp}.tar.gz}.
 * <p>
 * Archives written without compression use the {@code .tar} suffix instead. Decoding accepts both
 * suffixes no matter how the codec is configured, and quietly rejects any key that does not end in
 * exactly one canonical timestamp so unrelated objects sharing the prefix are ignored.
 */
public class BackupKeyCodec {
    public static final String PATH_SEPARATOR = "/";
    public static final String COMPRESSED_SUFFIX = ".tar.gz";
    public static final String UNCOMPRESSED_SUFFIX = ".tar";

    @Getter
    private final String prefix;
    @Getter
    private final boolean compression;

    public BackupKeyCodec(String prefix, boolean compression) {
        this.prefix = normalizePrefix(prefix);
        this.compression = compression;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null) {
            return "";
        }
        String ret = prefix.trim();
        while (ret.startsWith(PATH_SEPARATOR)) {
            ret = ret.substring(1);
        }
        while (ret.endsWith(PATH_SEPARATOR)) {
            ret = ret.substring(0, ret.length() - 1);
        }
        return ret;
    }

    public String suffix() {
        return compression ? COMPRESSED_SUFFIX : UNCOMPRESSED_SUFFIX;
    }

    public String rootPrefix() {
        return prefix.isEmpty() ? "" : prefix + PATH_SEPARATOR;
    }

    public String servicePrefix(String service) {
        return rootPrefix() + service + PATH_SEPARATOR;
    }

    public String pathPrefix(String service, String pathName) {
        return servicePrefix(service) + pathName + PATH_SEPARATOR;
    }

    /**
     * Builds the key for an archive. Sub-second precision of the timestamp is dropped.
     */
    public String encode(String service, String pathName, LocalDateTime timestamp) {
        if (service == null || service.isBlank() || service.contains(PATH_SEPARATOR)) {
            throw new IllegalArgumentException("Invalid service name \"" + service + "\"");
        }
        if (pathName == null || pathName.isBlank() || pathName.startsWith(PATH_SEPARATOR)
                || pathName.endsWith(PATH_SEPARATOR) || pathName.contains(PATH_SEPARATOR + PATH_SEPARATOR)) {
            throw new IllegalArgumentException("Invalid path name \"" + pathName + "\"");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Missing timestamp");
        }
        return pathPrefix(service, pathName) + BackupTimestamp.format(timestamp) + suffix();
    }

    public Optional<BackupKey> decode(String key) {
        if (key == null || !key.startsWith(rootPrefix())) {
            return Optional.empty();
        }
        String rest = key.substring(rootPrefix().length());
        if (rest.endsWith(COMPRESSED_SUFFIX)) {
            rest = rest.substring(0, rest.length() - COMPRESSED_SUFFIX.length());
        } else if (rest.endsWith(UNCOMPRESSED_SUFFIX)) {
            rest = rest.substring(0, rest.length() - UNCOMPRESSED_SUFFIX.length());
        } else {
            return Optional.empty();
        }

        String[] segments = rest.split(PATH_SEPARATOR, -1);
        if (segments.length < 3) {
            return Optional.empty();
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                return Optional.empty();
            }
        }

        Optional<LocalDateTime> timestamp = BackupTimestamp.parse(segments[segments.length - 1]);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }
        String pathName = String.join(PATH_SEPARATOR, Arrays.asList(segments).subList(1, segments.length - 1));
        return Optional.of(new BackupKey(segments[0], pathName, timestamp.get()));
    }

    public Optional<BackupRecord> toRecord(String key, long size, String etag) {
        return decode(key).map(decoded -> BackupRecord.builder()
                .service(decoded.getService())
                .pathName(decoded.getPathName())
                .timestamp(decoded.getTimestamp())
                .key(key)
                .size(size)
                .etag(stripQuotes(etag))
                .build());
    }

    /**
     * Same as {@link #toRecord(String, long, String)} for keys this process wrote itself.
     */
    public BackupRecord requireRecord(String key, long size, String etag) {
        return toRecord(key, size, etag)
                .orElseThrow(() -> new IllegalArgumentException("Not a backup archive key \"" + key + "\""));
    }

    private static String stripQuotes(String etag) {
        if (etag != null && etag.length() >= 2 && etag.startsWith("\"") && etag.endsWith("\"")) {
            return etag.substring(1, etag.length() - 1);
        }
        return etag;
    }
}
