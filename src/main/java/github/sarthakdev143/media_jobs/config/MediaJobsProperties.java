package github.sarthakdev143.media_jobs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "media-jobs")
public class MediaJobsProperties {

    /** "redis" or "memory"; selects the job record store and task queue implementations. */
    private String backend = "redis";

    private final Jobs jobs = new Jobs();
    private final Queue queue = new Queue();
    private final Worker worker = new Worker();
    private final Transform transform = new Transform();
    private final Generation generation = new Generation();
    private final ImageGeneration imageGeneration = new ImageGeneration();
    private final Storage storage = new Storage();

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Queue getQueue() {
        return queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public Transform getTransform() {
        return transform;
    }

    public Generation getGeneration() {
        return generation;
    }

    public ImageGeneration getImageGeneration() {
        return imageGeneration;
    }

    public Storage getStorage() {
        return storage;
    }

    public static class Jobs {

        private int maxAttempts = 3;

        /** How long a job may wait in QUEUED before the reaper marks it EXPIRED. */
        private Duration queuedTtl = Duration.ofMinutes(30);

        /** How long a RUNNING attempt may hold the job before it is presumed lost. */
        private Duration runningLease = Duration.ofMinutes(45);

        private Duration retention = Duration.ofHours(24);

        private String keyPrefix = "media-jobs";

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getQueuedTtl() {
            return queuedTtl;
        }

        public void setQueuedTtl(Duration queuedTtl) {
            this.queuedTtl = queuedTtl;
        }

        public Duration getRunningLease() {
            return runningLease;
        }

        public void setRunningLease(Duration runningLease) {
            this.runningLease = runningLease;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Queue {

        private Duration visibilityTimeout = Duration.ofMinutes(50);

        private Duration pollTimeout = Duration.ofSeconds(2);

        private int maxDeliveryAttempts = 5;

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public int getMaxDeliveryAttempts() {
            return maxDeliveryAttempts;
        }

        public void setMaxDeliveryAttempts(int maxDeliveryAttempts) {
            this.maxDeliveryAttempts = maxDeliveryAttempts;
        }
    }

    public static class Worker {

        private boolean enabled = true;

        private int slots = 2;

        private int reaperBatchSize = 100;

        private Duration infraBackoffInitial = Duration.ofMillis(500);

        private Duration infraBackoffMax = Duration.ofSeconds(30);

        private int infraRetryAttempts = 3;

        /** How often a running attempt pushes its lease forward; must stay well below the lease. */
        private Duration leaseRenewInterval = Duration.ofMinutes(5);

        private Path tempRoot = Path.of(System.getProperty("java.io.tmpdir"));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getSlots() {
            return slots;
        }

        public void setSlots(int slots) {
            this.slots = slots;
        }

        public int getReaperBatchSize() {
            return reaperBatchSize;
        }

        public void setReaperBatchSize(int reaperBatchSize) {
            this.reaperBatchSize = reaperBatchSize;
        }

        public Duration getInfraBackoffInitial() {
            return infraBackoffInitial;
        }

        public void setInfraBackoffInitial(Duration infraBackoffInitial) {
            this.infraBackoffInitial = infraBackoffInitial;
        }

        public Duration getInfraBackoffMax() {
            return infraBackoffMax;
        }

        public void setInfraBackoffMax(Duration infraBackoffMax) {
            this.infraBackoffMax = infraBackoffMax;
        }

        public int getInfraRetryAttempts() {
            return infraRetryAttempts;
        }

        public void setInfraRetryAttempts(int infraRetryAttempts) {
            this.infraRetryAttempts = infraRetryAttempts;
        }

        public Duration getLeaseRenewInterval() {
            return leaseRenewInterval;
        }

        public void setLeaseRenewInterval(Duration leaseRenewInterval) {
            this.leaseRenewInterval = leaseRenewInterval;
        }

        public Path getTempRoot() {
            return tempRoot;
        }

        public void setTempRoot(Path tempRoot) {
            this.tempRoot = tempRoot;
        }
    }

    public static class Transform {

        public static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
        private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";

        /** Falls back to the FFMPEG_PATH environment variable, then to "ffmpeg" on PATH. */
        private String ffmpegPath;

        private Duration timeout = Duration.ofMinutes(10);

        private long tempQuotaBytes = 2L * 1024 * 1024 * 1024;

        private Map<String, Path> fonts = new LinkedHashMap<>();

        public String getFfmpegPath() {
            return ffmpegPath;
        }

        public void setFfmpegPath(String ffmpegPath) {
            this.ffmpegPath = ffmpegPath;
        }

        public String resolveFfmpegBinary() {
            if (ffmpegPath != null && !ffmpegPath.isBlank()) {
                return ffmpegPath;
            }
            String fromEnvironment = System.getenv(FFMPEG_PATH_ENV);
            if (fromEnvironment != null && !fromEnvironment.isBlank()) {
                return fromEnvironment;
            }
            return DEFAULT_FFMPEG_BINARY;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public long getTempQuotaBytes() {
            return tempQuotaBytes;
        }

        public void setTempQuotaBytes(long tempQuotaBytes) {
            this.tempQuotaBytes = tempQuotaBytes;
        }

        public Map<String, Path> getFonts() {
            return fonts;
        }

        public void setFonts(Map<String, Path> fonts) {
            this.fonts = fonts;
        }
    }

    public static class Generation {

        private String baseUrl = "https://api.minimaxi.chat/v1";

        private String apiKey;

        private String model = "I2V-01-Director";

        private Duration connectTimeout = Duration.ofSeconds(10);

        private Duration readTimeout = Duration.ofSeconds(60);

        private Duration pollInterval = Duration.ofSeconds(20);

        private int maxPolls = 30;

        private int maxRetries = 4;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private double backoffMultiplier = 2.0;

        private Duration maxBackoff = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getMaxPolls() {
            return maxPolls;
        }

        public void setMaxPolls(int maxPolls) {
            this.maxPolls = maxPolls;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class ImageGeneration {

        private String baseUrl = "https://api.segmind.com/v1";

        private String apiKey;

        private String model = "juggernaut-pro-flux";

        private int width = 576;

        private int height = 1024;

        private int steps = 25;

        private long seed = 1184522L;

        private double cfgScale = 7.0;

        private String negativePrompt = "cartoon, blurry, low quality, extra limbs, deformed";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }

        public int getSteps() {
            return steps;
        }

        public void setSteps(int steps) {
            this.steps = steps;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }

        public double getCfgScale() {
            return cfgScale;
        }

        public void setCfgScale(double cfgScale) {
            this.cfgScale = cfgScale;
        }

        public String getNegativePrompt() {
            return negativePrompt;
        }

        public void setNegativePrompt(String negativePrompt) {
            this.negativePrompt = negativePrompt;
        }
    }

    public static class Storage {

        /** "s3" or "local". */
        private String type = "local";

        private String bucket;

        private String region;

        private String outputPrefix = "outputs/";

        private String uploadPrefix = "uploads/";

        private Duration presignTtl = Duration.ofHours(1);

        private Path localRoot = Path.of("artifacts");

        /** Objects under the output and upload prefixes older than this are deleted; zero disables. */
        private Duration artifactRetention = Duration.ofDays(7);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getOutputPrefix() {
            return outputPrefix;
        }

        public void setOutputPrefix(String outputPrefix) {
            this.outputPrefix = outputPrefix;
        }

        public String getUploadPrefix() {
            return uploadPrefix;
        }

        public void setUploadPrefix(String uploadPrefix) {
            this.uploadPrefix = uploadPrefix;
        }

        public Duration getPresignTtl() {
            return presignTtl;
        }

        public void setPresignTtl(Duration presignTtl) {
            this.presignTtl = presignTtl;
        }

        public Path getLocalRoot() {
            return localRoot;
        }

        public void setLocalRoot(Path localRoot) {
            this.localRoot = localRoot;
        }

        public Duration getArtifactRetention() {
            return artifactRetention;
        }

        public void setArtifactRetention(Duration artifactRetention) {
            this.artifactRetention = artifactRetention;
        }
    }
}
