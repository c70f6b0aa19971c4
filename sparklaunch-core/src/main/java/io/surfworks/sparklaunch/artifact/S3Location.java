package io.surfworks.sparklaunch.artifact;

import java.util.Objects;

/**
 * A bucket and key parsed from an {@code s3://bucket/key} URL.
 *
 * <p>Keys are kept raw: {@link #toString()} does not percent-encode, so a key
 * with spaces prints exactly as S3 stores it.
 *
 * @param bucket bucket name
 * @param key    object key without a leading slash (empty for the bucket root)
 */
public record S3Location(String bucket, String key) {

    private static final String PREFIX = "s3://";

    public S3Location {
        Objects.requireNonNull(bucket, "bucket cannot be null");
        Objects.requireNonNull(key, "key cannot be null");

        if (bucket.isBlank()) {
            throw new IllegalArgumentException("bucket cannot be blank");
        }
    }

    /**
     * Parses an {@code s3://bucket[/key]} URL.
     *
     * @throws IllegalArgumentException if the URL has another scheme or no bucket
     */
    public static S3Location parse(String url) {
        Objects.requireNonNull(url, "url cannot be null");
        if (!url.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not an s3:// URL: " + url);
        }
        String rest = url.substring(PREFIX.length());
        int slash = rest.indexOf('/');
        if (slash < 0) {
            return new S3Location(rest, "");
        }
        return new S3Location(rest.substring(0, slash), rest.substring(slash + 1));
    }

    /**
     * Returns the location of {@code name} inside this folder.
     */
    public S3Location resolve(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        String child = name.startsWith("/") ? name.substring(1) : name;
        if (key.isEmpty()) {
            return new S3Location(bucket, child);
        }
        String folder = key.endsWith("/") ? key : key + "/";
        return new S3Location(bucket, folder + child);
    }

    @Override
    public String toString() {
        return PREFIX + bucket + "/" + key;
    }
}
