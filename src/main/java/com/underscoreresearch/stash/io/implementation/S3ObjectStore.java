package com.underscoreresearch.stash.io.implementation;

import static com.underscoreresearch.stash.utils.LogUtil.debug;
import static com.underscoreresearch.stash.utils.LogUtil.readableSize;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import com.underscoreresearch.stash.io.BackupKeyCodec;
import com.underscoreresearch.stash.io.ObjectStore;
import com.underscoreresearch.stash.model.BackupRecord;
import com.underscoreresearch.stash.model.StorageConfiguration;
import com.underscoreresearch.stash.utils.ProcessingStoppedException;
import com.underscoreresearch.stash.utils.RetryUtils;

@Slf4j
public class S3ObjectStore implements ObjectStore {
    public static final int DELETE_BATCH_SIZE = 1000;
    private static final String NO_SUCH_KEY = "NoSuchKey";
    private static final String ACCESS_DENIED = "AccessDenied";

    private final S3Client client;
    private final String bucket;
    private final BackupKeyCodec keyCodec;
    private final int retries;
    private final int retryBase;

    public S3ObjectStore(StorageConfiguration storage, BackupKeyCodec keyCodec) throws IOException {
        this(createClient(storage), storage.getBucket(), keyCodec, storage.retryCount(), RetryUtils.DEFAULT_BASE);
    }

    /**
     * @param retries   attempts after the first failed call, 0 to never retry.
     * @param retryBase milliseconds to wait before the first retry, doubled for every following one.
     */
    public S3ObjectStore(S3Client client, String bucket, BackupKeyCodec keyCodec, int retries, int retryBase)
            throws IOException {
        this.client = client;
        this.bucket = bucket;
        this.keyCodec = keyCodec;
        this.retries = retries;
        this.retryBase = retryBase;

        try {
            checkAccess();
        } catch (IOException exc) {
            client.close();
            throw exc;
        }
    }

    private static S3Client createClient(StorageConfiguration storage) {
        S3ClientBuilder builder = S3Client.builder()
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none())
                        .apiCallTimeout(Duration.ofSeconds(storage.timeout()))
                        .build())
                .credentialsProvider(credentials(storage))
                .region(region(storage));

        if (storage.getEndpoint() != null && !storage.getEndpoint().isEmpty()) {
            debug(() -> log.debug("Using custom S3 endpoint {}", storage.getEndpoint()));
            builder.endpointOverride(URI.create(storage.getEndpoint()));
        }
        if (storage.pathStyleAccess()) {
            builder.serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }

        return builder.build();
    }

    private static AwsCredentialsProvider credentials(StorageConfiguration storage) {
        if (storage.getAccessKey() != null && !storage.getAccessKey().isEmpty()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(storage.getAccessKey(),
                    storage.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    private static Region region(StorageConfiguration storage) {
        if (storage.getRegion() != null && !storage.getRegion().isEmpty()) {
            return Region.of(storage.getRegion());
        }
        try {
            return new DefaultAwsRegionProviderChain().getRegion();
        } catch (SdkException exc) {
            log.warn("No S3 region configured, using {}", Region.US_EAST_1);
            return Region.US_EAST_1;
        }
    }

    private static boolean shouldRetry(Exception exc) {
        if (exc instanceof S3Exception s3Exception && s3Exception.awsErrorDetails() != null) {
            String code = s3Exception.awsErrorDetails().errorCode();
            return !NO_SUCH_KEY.equals(code) && !ACCESS_DENIED.equals(code);
        }
        return true;
    }

    private static boolean isNoSuchKey(S3Exception exc) {
        return exc.awsErrorDetails() != null && NO_SUCH_KEY.equals(exc.awsErrorDetails().errorCode());
    }

    private void checkAccess() throws IOException {
        debug(() -> log.debug("Testing S3 connectivity to bucket {}", bucket));
        try {
            client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
        } catch (SdkException exc) {
            throw new IOException(String.format("Cannot access bucket \"%s\": %s%n%n"
                            + "Troubleshooting:%n"
                            + "1. Verify the bucket name is correct%n"
                            + "2. Check the configured access and secret key%n"
                            + "3. Ensure the credentials have S3 permissions%n"
                            + "4. For non-AWS S3, verify the endpoint is set correctly%n"
                            + "5. Check your S3 provider's documentation for region settings",
                    bucket, exc.getMessage()), exc);
        }
        debug(() -> log.debug("Connected to S3 bucket {}", bucket));
    }

    @Override
    public BackupRecord put(String key, Path source) throws IOException {
        long length = Files.size(source);
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentLength(length)
                .build();

        log.info("Uploading backup to s3://{}/{} ({})", bucket, key, readableSize(length));
        try {
            PutObjectResponse response = RetryUtils.retry(retries, retryBase, () ->
                    client.putObject(request, RequestBody.fromFile(source)), S3ObjectStore::shouldRetry);
            return keyCodec.requireRecord(key, length, response.eTag());
        } catch (IOException | ProcessingStoppedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while uploading object \"" + key + "\"", e);
        } catch (Exception e) {
            throw new IOException("Failed to upload object \"" + key + "\"", e);
        }
    }

    @Override
    public BackupRecord put(String key, InputStream stream, long length) throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentLength(length)
                .build();

        log.info("Uploading backup to s3://{}/{} ({})", bucket, key, readableSize(length));
        try {
            // A stream can only be consumed once so this is never retried.
            PutObjectResponse response = RetryUtils.retry(0, RetryUtils.DEFAULT_BASE, () ->
                    client.putObject(request, RequestBody.fromInputStream(stream, length)), null);
            return keyCodec.requireRecord(key, length, response.eTag());
        } catch (IOException | ProcessingStoppedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while uploading object \"" + key + "\"", e);
        } catch (Exception e) {
            throw new IOException("Failed to upload object \"" + key + "\"", e);
        }
    }

    @Override
    public InputStream get(String key) throws IOException {
        log.info("Downloading backup from s3://{}/{}", bucket, key);
        try {
            return RetryUtils.retry(retries, retryBase, () -> client.getObject(GetObjectRequest.builder()
                    .bucket(bucket).key(key).build()), S3ObjectStore::shouldRetry);
        } catch (IOException | ProcessingStoppedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while downloading object \"" + key + "\"", e);
        } catch (Exception e) {
            throw new IOException("Failed to download object \"" + key + "\"", e);
        }
    }

    @Override
    public List<BackupRecord> list(String prefix) throws IOException {
        ListObjectsV2Request initialRequest = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .build();

        debug(() -> log.debug("Listing S3 objects with prefix \"{}\"", prefix));
        List<BackupRecord> ret = new ArrayList<>();
        try {
            ListObjectsV2Response response = RetryUtils.retry(retries, retryBase, () ->
                    client.listObjectsV2(initialRequest), S3ObjectStore::shouldRetry);
            while (true) {
                for (S3Object obj : response.contents()) {
                    keyCodec.toRecord(obj.key(), obj.size() != null ? obj.size() : 0, obj.eTag())
                            .ifPresent(ret::add);
                }

                if (Boolean.TRUE.equals(response.isTruncated())) {
                    ListObjectsV2Request request = initialRequest.toBuilder()
                            .continuationToken(response.nextContinuationToken()).build();
                    response = RetryUtils.retry(retries, retryBase, () -> client.listObjectsV2(request),
                            S3ObjectStore::shouldRetry);
                } else {
                    break;
                }
            }
        } catch (IOException | ProcessingStoppedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while listing key prefix \"" + prefix + "\"", e);
        } catch (Exception e) {
            throw new IOException("Failed to list key prefix \"" + prefix + "\"", e);
        }
        return ret;
    }

    @Override
    public void delete(String key) throws IOException {
        log.info("Deleting backup s3://{}/{}", bucket, key);
        try {
            RetryUtils.<Void>retry(retries, retryBase, () -> {
                try {
                    client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
                    return null;
                } catch (S3Exception exc) {
                    if (isNoSuchKey(exc))
                        return null;
                    throw exc;
                }
            }, S3ObjectStore::shouldRetry);
        } catch (IOException | ProcessingStoppedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while deleting object \"" + key + "\"", e);
        } catch (Exception e) {
            throw new IOException("Failed to delete object \"" + key + "\"", e);
        }
    }

    @Override
    public void deleteMany(List<String> keys) throws IOException {
        if (keys == null || keys.isEmpty()) {
            return;
        }

        log.info("Deleting {} backups from s3://{}", keys.size(), bucket);
        for (int start = 0; start < keys.size(); start += DELETE_BATCH_SIZE) {
            List<String> batch = keys.subList(start, Math.min(start + DELETE_BATCH_SIZE, keys.size()));
            DeleteObjectsRequest request = DeleteObjectsRequest.builder()
                    .bucket(bucket)
                    .delete(Delete.builder()
                            .objects(batch.stream()
                                    .map(key -> ObjectIdentifier.builder().key(key).build())
                                    .collect(Collectors.toList()))
                            .quiet(true)
                            .build())
                    .build();

            DeleteObjectsResponse response;
            try {
                response = RetryUtils.retry(retries, retryBase, () -> client.deleteObjects(request),
                        S3ObjectStore::shouldRetry);
            } catch (IOException | ProcessingStoppedException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while deleting " + batch.size() + " objects", e);
            } catch (Exception e) {
                throw new IOException("Failed to delete " + batch.size() + " objects", e);
            }

            if (response.hasErrors() && !response.errors().isEmpty()) {
                List<String> failed = new ArrayList<>();
                for (S3Error error : response.errors()) {
                    failed.add(error.key() + " (" + error.code() + ")");
                }
                throw new IOException("Failed to delete objects: " + String.join(", ", failed));
            }
        }
    }

    @Override
    public BackupKeyCodec getKeyCodec() {
        return keyCodec;
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
