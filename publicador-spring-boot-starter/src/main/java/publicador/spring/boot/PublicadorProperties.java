package publicador.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the publication dispatch engine.
 *
 * @see PublicadorAutoConfiguration
 */
@ConfigurationProperties(prefix = "publicador")
public class PublicadorProperties {

    /**
     * Prefix prepended to every table name of the JDBC store.
     */
    private String tablePrefix = "";

    private final Gateway gateway = new Gateway();
    private final Dispatch dispatch = new Dispatch();
    private final Media media = new Media();
    private final Scheduler scheduler = new Scheduler();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Gateway getGateway() {
        return gateway;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Media getMedia() {
        return media;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Gateway {
        /**
         * Base URL of the posting service. Required unless a PostingGateway bean is supplied.
         */
        private String serviceUrl;
        /**
         * Bearer token sent with every request.
         */
        private String apiToken;
        private int requestTimeoutSecs = 30;
        /**
         * Retries after the first call on retryable errors.
         */
        private int retryAttempts = 3;
        private long retryDelayMs = 1000;
        private long maxRetryDelayMs = 30000;
        private int idempotencyTtlMinutes = 10;

        public String getServiceUrl() {
            return serviceUrl;
        }

        public void setServiceUrl(String serviceUrl) {
            this.serviceUrl = serviceUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public int getRequestTimeoutSecs() {
            return requestTimeoutSecs;
        }

        public void setRequestTimeoutSecs(int requestTimeoutSecs) {
            this.requestTimeoutSecs = requestTimeoutSecs;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public long getMaxRetryDelayMs() {
            return maxRetryDelayMs;
        }

        public void setMaxRetryDelayMs(long maxRetryDelayMs) {
            this.maxRetryDelayMs = maxRetryDelayMs;
        }

        public int getIdempotencyTtlMinutes() {
            return idempotencyTtlMinutes;
        }

        public void setIdempotencyTtlMinutes(int idempotencyTtlMinutes) {
            this.idempotencyTtlMinutes = idempotencyTtlMinutes;
        }
    }

    public static class Dispatch {
        /**
         * Wall-clock bound for one post, retries included.
         */
        private int postProcessingTimeoutSeconds = 60;

        public int getPostProcessingTimeoutSeconds() {
            return postProcessingTimeoutSeconds;
        }

        public void setPostProcessingTimeoutSeconds(int postProcessingTimeoutSeconds) {
            this.postProcessingTimeoutSeconds = postProcessingTimeoutSeconds;
        }
    }

    public static class Media {
        /**
         * Base URL that relative media storage paths are resolved against.
         */
        private String baseUrl;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int intervalSeconds = 60;
        /**
         * Scheduled publications older than this are expired instead of sent.
         */
        private int windowMinutes = 10;
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "publicador";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
