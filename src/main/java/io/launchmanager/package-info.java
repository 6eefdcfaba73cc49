/**
 * Launch manager source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.launchmanager.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.launchmanager.server.SupervisorServer} owns the socket, the process table and the command registry.</li>
 *   <li>{@code io.launchmanager.server.ConnectionHandler} runs one request/response exchange per connection.</li>
 *   <li>{@code io.launchmanager.protocol.ProtocolDetector} picks framed or legacy wire handling per connection.</li>
 *   <li>{@code io.launchmanager.plugins.StandardCommandsPlugin} contributes the bash and runner commands.</li>
 * </ul>
 */
package io.launchmanager;
