package io.launchmanager.plugins;

import io.launchmanager.process.ProcessTable;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory output of processes started with {@code --no-log}, keyed by process name. Shared by
 * the commands of one {@link StandardCommandsPlugin}.
 */
public final class OutputBuffers {
    private final Map<String, LineBuffer> buffers = new ConcurrentHashMap<>();
    private final int capacity;

    public OutputBuffers() {
        this(LineBuffer.DEFAULT_CAPACITY);
    }

    public OutputBuffers(int capacity) {
        this.capacity = capacity;
    }

    LineBuffer open(String processName) {
        return buffers.computeIfAbsent(processName, name -> new LineBuffer(capacity));
    }

    Optional<LineBuffer> find(String processName) {
        return Optional.ofNullable(buffers.get(processName));
    }

    void drop(String processName) {
        buffers.remove(processName);
    }

    /**
     * Drops the buffers of processes that have left the table, whichever path removed them.
     *
     * @return number of buffers dropped
     */
    int retainTracked(ProcessTable table) {
        int before = buffers.size();
        buffers.keySet().removeIf(name -> table.get(name).isEmpty());
        return before - buffers.size();
    }

    int size() {
        return buffers.size();
    }
}
