package io.launchmanager.server;

import io.launchmanager.command.CommandRegistry;
import io.launchmanager.command.PluginLoader;
import io.launchmanager.config.LaunchManagerConfig;
import io.launchmanager.process.ProcessRecord;
import io.launchmanager.process.ProcessTable;
import io.launchmanager.protocol.ProtocolSettings;
import io.launchmanager.protocol.Request;
import io.launchmanager.protocol.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The long-running manager: owns the listening socket, the process table, the command registry
 * and the pid file.
 *
 * <p>One accept loop runs on the thread that calls {@link #serve()}; each accepted connection gets
 * its own thread. The loop wakes up every {@code socket.timeout} to look at the running flag, so
 * {@link #requestShutdown()} takes effect within one poll interval. A failed accept is logged and
 * retried after a short pause. Once the loop ends, connections already in flight get up to
 * {@code socket.readTimeoutMs} plus the termination timeout to finish before {@link #serve()}
 * returns.
 */
public final class SupervisorServer implements Supervisor {
    private static final Logger logger = LogManager.getLogger(SupervisorServer.class);
    static final long ACCEPT_RETRY_DELAY_MS = 100L;

    private final LaunchManagerConfig config;
    private final ProtocolSettings protocolSettings;
    private final ProcessTable processTable;
    private final CommandRegistry commandRegistry;
    private final PluginLoader pluginLoader;
    private final PidFile pidFile;
    private final AtomicBoolean running;
    private final AtomicLong connectionCounter;
    private final CountDownLatch stopped;
    private final ThreadFactory workerFactory;
    private final Set<Thread> workers;
    private volatile ServerSocketChannel serverChannel;

    public SupervisorServer(LaunchManagerConfig config) {
        this(config, Thread::new);
    }

    SupervisorServer(LaunchManagerConfig config, ThreadFactory workerFactory) {
        this.config = config;
        this.workerFactory = workerFactory;
        this.workers = ConcurrentHashMap.newKeySet();
        this.protocolSettings = ProtocolSettings.from(config);
        this.processTable = new ProcessTable();
        this.commandRegistry = new CommandRegistry(config.conflictPolicy());
        this.pluginLoader = new PluginLoader(commandRegistry);
        this.pidFile = new PidFile(config.pidFile());
        this.running = new AtomicBoolean(false);
        this.connectionCounter = new AtomicLong(0L);
        this.stopped = new CountDownLatch(1);
        BuiltinCommands.registerAll(this, commandRegistry);
        List<String> plugins = pluginLoader.loadAll(config.commandsDir());
        logger.info("Registered {} commands ({} from plugins)", commandRegistry.size(), plugins.size());
    }

    @Override
    public LaunchManagerConfig config() {
        return config;
    }

    @Override
    public ProcessTable processes() {
        return processTable;
    }

    @Override
    public CommandRegistry commands() {
        return commandRegistry;
    }

    public PidFile pidFile() {
        return pidFile;
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public Response dispatch(Request request) {
        return commandRegistry.dispatch(this, request.command(), request.args());
    }

    /**
     * Removes a stale socket file, binds, listens and writes the pid file.
     */
    public void start() throws IOException {
        Path socketPath = config.socketPath();
        Path parent = socketPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.deleteIfExists(socketPath)) {
            logger.info("Removed stale socket {}", socketPath);
        }
        ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.bind(UnixDomainSocketAddress.of(socketPath));
            channel.configureBlocking(false);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
        serverChannel = channel;
        pidFile.write(ProcessHandle.current().pid());
        running.set(true);
        logger.info("Launch manager listening on {}", socketPath);
    }

    /**
     * Runs the accept loop until {@link #requestShutdown()}, then releases the socket and pid file.
     */
    public void serve() {
        ServerSocketChannel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("start() must be called before serve()");
        }
        long pollMs = Math.max(1L, config.acceptTimeout().toMillis());
        try (Selector selector = Selector.open()) {
            channel.register(selector, SelectionKey.OP_ACCEPT);
            while (running.get()) {
                try {
                    if (selector.select(pollMs) == 0) {
                        continue;
                    }
                    selector.selectedKeys().clear();
                    SocketChannel client;
                    while ((client = channel.accept()) != null) {
                        spawn(client);
                    }
                } catch (IOException | RuntimeException e) {
                    if (!running.get()) {
                        break;
                    }
                    logger.error("Accept failed, retrying in {} ms", ACCEPT_RETRY_DELAY_MS, e);
                    if (!pauseAfterAcceptFailure()) {
                        break;
                    }
                }
            }
        } catch (IOException e) {
            logger.error("Could not set up the accept loop", e);
        } finally {
            running.set(false);
            closeListener();
            awaitWorkers(config.readTimeout().plus(config.terminationTimeout()));
            releaseResources();
            stopped.countDown();
        }
    }

    int activeConnections() {
        return workers.size();
    }

    public void run() throws IOException {
        start();
        serve();
    }

    /**
     * SIGINT/SIGTERM reach the JVM as shutdown hooks: flip the running flag, give the accept loop
     * and the connections in flight time to wind down, and make sure the pid file is gone.
     */
    public void installSignalHandlers() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            running.set(false);
            awaitStopped(config.acceptTimeout()
                    .plus(config.readTimeout())
                    .plus(config.terminationTimeout())
                    .plusSeconds(1L));
            pidFile.delete();
        }, "launch-manager-shutdown-hook"));
    }

    @Override
    public void requestShutdown() {
        if (running.getAndSet(false)) {
            logger.info("Shutdown requested");
        }
    }

    public boolean awaitStopped(Duration timeout) {
        try {
            return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void stopProcess(String name) {
        ProcessRecord record = processTable.require(name);
        Process process = record.process();
        Duration timeout = config.terminationTimeout();
        try {
            List<ProcessHandle> descendants = descendantsOf(process);
            process.destroy();
            descendants.forEach(ProcessHandle::destroy);
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Process {} ignored termination for {} ms, killing it", name, timeout.toMillis());
                process.destroyForcibly();
                descendants.forEach(ProcessHandle::destroyForcibly);
                process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            logger.info("Stopped process {} (pid {})", name, record.pid());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            logger.warn("Interrupted while stopping {}, killed it", name);
        } catch (RuntimeException e) {
            logger.warn("Error while stopping {}: {}", name, e.getMessage());
        } finally {
            processTable.remove(name);
        }
    }

    @Override
    public int stopAll() {
        int count = 0;
        for (String name : processTable.names()) {
            try {
                stopProcess(name);
                count++;
            } catch (RuntimeException e) {
                logger.warn("Could not stop {}: {}", name, e.getMessage());
            }
        }
        return count;
    }

    private static List<ProcessHandle> descendantsOf(Process process) {
        try {
            return process.descendants().toList();
        } catch (UnsupportedOperationException e) {
            return List.of();
        }
    }

    private boolean pauseAfterAcceptFailure() {
        try {
            Thread.sleep(ACCEPT_RETRY_DELAY_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Accept loop interrupted, stopping");
            return false;
        }
    }

    /**
     * A connection whose worker cannot be started is closed unanswered; the loop keeps accepting.
     */
    private void spawn(SocketChannel client) {
        long id = connectionCounter.incrementAndGet();
        ConnectionHandler handler = new ConnectionHandler(id, client, protocolSettings, this::dispatch);
        Thread worker = null;
        try {
            worker = workerFactory.newThread(() -> {
                try {
                    handler.run();
                } finally {
                    workers.remove(Thread.currentThread());
                }
            });
            worker.setName("launch-manager-conn-" + id);
            workers.add(worker);
            worker.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            if (worker != null) {
                workers.remove(worker);
            }
            logger.error("Could not start a worker for connection {}, closing it", id, e);
            try {
                client.close();
            } catch (IOException closeError) {
                logger.debug("Failed to close connection {}: {}", id, closeError.getMessage());
            }
        }
    }

    private void awaitWorkers(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread worker : List.copyOf(workers)) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0L) {
                break;
            }
            try {
                worker.join(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!workers.isEmpty()) {
            logger.warn("{} connections still open after {} ms, not waiting any longer",
                    workers.size(), timeout.toMillis());
        }
    }

    private void closeListener() {
        ServerSocketChannel channel = serverChannel;
        serverChannel = null;
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                logger.warn("Failed to close listening socket: {}", e.getMessage());
            }
        }
    }

    private void releaseResources() {
        try {
            Files.deleteIfExists(config.socketPath());
        } catch (IOException e) {
            logger.warn("Failed to remove socket {}: {}", config.socketPath(), e.getMessage());
        }
        pidFile.delete();
        pluginLoader.close();
        logger.info("Launch manager stopped");
    }
}
