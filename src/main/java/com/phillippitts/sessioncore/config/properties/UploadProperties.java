package com.phillippitts.sessioncore.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Upload limits and acknowledgment timing.
 *
 * <p>Size limits are enforced by the upload service before a request is registered; the
 * acknowledgment coordinator only sees the timeout.
 *
 * <p>Note: Bean created via {@link com.phillippitts.sessioncore.SessionCoreApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "upload")
@Validated
public class UploadProperties {

    /** How long to wait for the backend to acknowledge an upload. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    /** How long a connection test may take before it counts as failed. */
    @NotNull
    private Duration connectionTestTimeout = Duration.ofSeconds(5);

    /** Maximum file size accepted for upload. Default: 100 MiB. */
    @Positive(message = "Maximum file size must be positive")
    private long maxFileSizeBytes = 100L * 1024 * 1024;

    /** Backend directory the uploaded files are stored in; empty means not configured. */
    private String storageLocation = "";

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getConnectionTestTimeout() {
        return connectionTestTimeout;
    }

    public void setConnectionTestTimeout(Duration connectionTestTimeout) {
        this.connectionTestTimeout = connectionTestTimeout;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public String getStorageLocation() {
        return storageLocation;
    }

    public void setStorageLocation(String storageLocation) {
        this.storageLocation = storageLocation == null ? "" : storageLocation;
    }
}
