package io.surfworks.sparklaunch.artifact;

import java.nio.file.Path;

/**
 * Interface for publishing job artifacts where the cluster can read them.
 *
 * <p>The artifact is a jar built by the caller; the store only uploads it.
 */
public interface ArtifactStore extends AutoCloseable {

    /**
     * Returns the name of this artifact store.
     */
    String name();

    /**
     * Stores a local file under {@code fileName} below the store's base location.
     *
     * @param localFile the local file to store
     * @param fileName  name of the stored object, usually the jar's file name
     * @return location the cluster can load the artifact from, equal to {@code locate(fileName)}
     * @throws ArtifactException if storage fails
     */
    String store(Path localFile, String fileName) throws ArtifactException;

    /**
     * Returns the location {@link #store} places {@code fileName} at, without uploading anything.
     *
     * <p>Locations are plain strings such as {@code s3://bucket/jars/app 1.jar};
     * they are handed to spark-submit as they are, never percent-encoded.
     */
    String locate(String fileName);

    /**
     * Returns the base location for this store.
     */
    String baseLocation();

    @Override
    default void close() {
        // Default no-op implementation
    }
}
