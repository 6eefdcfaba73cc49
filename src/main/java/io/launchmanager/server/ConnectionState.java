package io.launchmanager.server;

/**
 * Steps of one connection. {@link #ERROR} is reachable from every step and always leads to an
 * attempt at {@link #WRITE_RESPONSE} before {@link #CLOSE}.
 */
public enum ConnectionState {
    DETECT,
    READ_REQUEST,
    DISPATCH,
    WRITE_RESPONSE,
    ERROR,
    CLOSE
}
