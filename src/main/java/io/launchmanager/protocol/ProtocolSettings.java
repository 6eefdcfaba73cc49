package io.launchmanager.protocol;

import io.launchmanager.config.LaunchManagerConfig;

import java.time.Duration;

/**
 * Timeouts and size ceiling shared by the detector and both codecs.
 *
 * @param detectTimeout how long detection waits for the first 8 bytes
 * @param readTimeout steady-state wait for each read or stalled write
 * @param maxMessageBytes exclusive upper bound for a frame length and for any encoded message
 */
public record ProtocolSettings(Duration detectTimeout, Duration readTimeout, long maxMessageBytes) {
    public static final int LENGTH_PREFIX_BYTES = 8;
    public static final int LEGACY_CHUNK_BYTES = 64 * 1024;

    public ProtocolSettings {
        maxMessageBytes = Math.min(maxMessageBytes, LaunchManagerConfig.MAX_MESSAGE_BYTES_LIMIT);
    }

    public static ProtocolSettings from(LaunchManagerConfig config) {
        return new ProtocolSettings(config.detectTimeout(), config.readTimeout(), config.maxMessageBytes());
    }

    public static ProtocolSettings defaults() {
        return new ProtocolSettings(
                Duration.ofMillis(LaunchManagerConfig.DEFAULT_DETECT_TIMEOUT_MS),
                Duration.ofMillis(LaunchManagerConfig.DEFAULT_READ_TIMEOUT_MS),
                LaunchManagerConfig.DEFAULT_MAX_MESSAGE_BYTES
        );
    }

    public boolean acceptsFrameLength(long length) {
        return length > 0L && length < maxMessageBytes;
    }
}
