/**
 * Commands shipped with the manager: shell processes ({@code bash}, {@code bash-status},
 * {@code bash-stop}, {@code bash-watch}), coding agent runs ({@code runner},
 * {@code runner-status}) and {@code pid}. Registered through {@link StandardCommandsPlugin}.
 */
package io.launchmanager.plugins;
