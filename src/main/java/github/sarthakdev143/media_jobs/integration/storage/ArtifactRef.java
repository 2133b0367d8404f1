package github.sarthakdev143.media_jobs.integration.storage;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Location of an object in the artifact store. Rendered as {@code s3://bucket/key} or
 * {@code local://key}.
 */
public record ArtifactRef(String scheme, String bucket, String key) {

    public static final String S3 = "s3";
    public static final String LOCAL = "local";

    private static final Pattern S3_VIRTUAL_HOST = Pattern.compile("^([a-z0-9.\\-]+)\\.s3(?:[.\\-]([a-z0-9\\-]+))?\\.amazonaws\\.com$");

    public ArtifactRef {
        if (!S3.equals(scheme) && !LOCAL.equals(scheme)) {
            throw new IllegalArgumentException("Unsupported artifact scheme: " + scheme);
        }
        if (S3.equals(scheme) && (bucket == null || bucket.isBlank())) {
            throw new IllegalArgumentException("S3 artifact references need a bucket.");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Artifact key is required.");
        }
        bucket = LOCAL.equals(scheme) ? null : bucket;
    }

    public static ArtifactRef s3(String bucket, String key) {
        return new ArtifactRef(S3, bucket, key);
    }

    public static ArtifactRef local(String key) {
        return new ArtifactRef(LOCAL, null, key);
    }

    public static ArtifactRef parse(String ref) {
        return tryParse(ref).orElseThrow(() -> new IllegalArgumentException("Not an artifact reference: " + ref));
    }

    /**
     * Accepts {@code s3://bucket/key}, {@code local://key} and S3 virtual-host URLs such as
     * {@code https://bucket.s3.eu-west-1.amazonaws.com/key}. Any other string, including plain
     * HTTP URLs, yields an empty result.
     */
    public static Optional<ArtifactRef> tryParse(String ref) {
        if (ref == null || ref.isBlank()) {
            return Optional.empty();
        }
        String value = ref.trim();
        if (value.startsWith("s3://")) {
            String rest = value.substring("s3://".length());
            int slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                return Optional.empty();
            }
            return Optional.of(s3(rest.substring(0, slash), rest.substring(slash + 1)));
        }
        if (value.startsWith("local://")) {
            String key = value.substring("local://".length());
            return key.isBlank() ? Optional.empty() : Optional.of(local(key));
        }
        if (value.startsWith("https://")) {
            return parseVirtualHostUrl(value);
        }
        return Optional.empty();
    }

    public String uri() {
        return S3.equals(scheme) ? "s3://" + bucket + "/" + key : "local://" + key;
    }

    public String fileName() {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }

    @Override
    public String toString() {
        return uri();
    }

    private static Optional<ArtifactRef> parseVirtualHostUrl(String value) {
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (uri.getHost() == null) {
            return Optional.empty();
        }
        Matcher matcher = S3_VIRTUAL_HOST.matcher(uri.getHost().toLowerCase(Locale.ROOT));
        String path = uri.getPath();
        if (!matcher.matches() || path == null || path.length() <= 1 || uri.getQuery() != null) {
            return Optional.empty();
        }
        return Optional.of(s3(matcher.group(1), path.substring(1)));
    }
}
