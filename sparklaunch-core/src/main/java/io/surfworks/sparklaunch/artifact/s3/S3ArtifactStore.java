package io.surfworks.sparklaunch.artifact.s3;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import io.surfworks.sparklaunch.artifact.ArtifactException;
import io.surfworks.sparklaunch.artifact.ArtifactStore;
import io.surfworks.sparklaunch.artifact.S3Location;
import io.surfworks.sparklaunch.config.LaunchConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Artifact store that uploads jars to an S3 folder.
 *
 * <p>Every {@link PutObjectRequest} passes through a decorator before it is
 * sent, so callers can set metadata such as server-side encryption.
 */
public final class S3ArtifactStore implements ArtifactStore {

    private static final Logger LOG = Logger.getLogger(S3ArtifactStore.class.getName());

    private final AmazonS3 s3;
    private final S3Location folder;
    private final UnaryOperator<PutObjectRequest> decorator;

    /**
     * @param s3        client to upload with; owned and shut down by this store
     * @param folder    folder artifacts are stored under
     * @param decorator applied to every put request before it is sent
     */
    public S3ArtifactStore(AmazonS3 s3, S3Location folder, UnaryOperator<PutObjectRequest> decorator) {
        this.s3 = Objects.requireNonNull(s3, "s3 cannot be null");
        this.folder = Objects.requireNonNull(folder, "folder cannot be null");
        this.decorator = Objects.requireNonNull(decorator, "decorator cannot be null");
    }

    /**
     * Creates a store for the configured jar folder and region.
     *
     * @throws IllegalArgumentException if no {@code s3JarFolder} is configured
     */
    public static S3ArtifactStore forConfig(LaunchConfig config) {
        if (config.s3JarFolder() == null || config.s3JarFolder().isBlank()) {
            throw new IllegalArgumentException("s3JarFolder is not configured");
        }
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard();
        if (config.awsRegion() != null && !config.awsRegion().isBlank()) {
            builder.withRegion(config.awsRegion());
        }
        UnaryOperator<PutObjectRequest> decorator = config.s3ServerSideEncryption()
                ? S3ArtifactStore::serverSideEncryption
                : UnaryOperator.identity();
        return new S3ArtifactStore(builder.build(), S3Location.parse(config.s3JarFolder()), decorator);
    }

    /**
     * Decorator requesting SSE-S3 (AES-256) encryption of the uploaded object.
     */
    public static PutObjectRequest serverSideEncryption(PutObjectRequest request) {
        ObjectMetadata metadata = request.getMetadata() != null ? request.getMetadata() : new ObjectMetadata();
        metadata.setSSEAlgorithm(ObjectMetadata.AES_256_SERVER_SIDE_ENCRYPTION);
        request.setMetadata(metadata);
        return request;
    }

    @Override
    public String name() {
        return "s3";
    }

    @Override
    public String store(Path localFile, String fileName) throws ArtifactException {
        if (!Files.isRegularFile(localFile)) {
            throw new ArtifactException("Artifact not found: " + localFile);
        }
        S3Location target = folder.resolve(fileName);
        LOG.info("Putting " + localFile + " to " + target);

        PutObjectRequest request = decorator.apply(
                new PutObjectRequest(target.bucket(), target.key(), localFile.toFile()));
        try {
            s3.putObject(request);
        } catch (AmazonClientException e) {
            throw new ArtifactException("Failed to upload " + localFile + " to " + target + ": " + e.getMessage(), e);
        }
        return target.toString();
    }

    @Override
    public String locate(String fileName) {
        return folder.resolve(fileName).toString();
    }

    @Override
    public String baseLocation() {
        return folder.toString();
    }

    @Override
    public void close() {
        s3.shutdown();
    }
}
