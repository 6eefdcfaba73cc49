package io.launchmanager.protocol;

public enum WireFormat {
    /** 8-byte big-endian length prefix followed by the JSON payload. */
    FRAMED,
    /** Raw JSON with no prefix, kept for older clients. */
    LEGACY
}
