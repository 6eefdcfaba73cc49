package io.launchmanager.process;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * In-memory registry of managed child processes, shared by every connection worker.
 *
 * <p>Mutations are serialized by the write lock. Each record carries its own OS handle, so the
 * name-to-record and name-to-handle views can never drift apart.
 */
public final class ProcessTable {
    public static final String ENDED = "ended";
    public static final String EXIT_CODE = "exit_code";

    private final Map<String, ProcessRecord> records;
    private final ReadWriteLock lock;

    public ProcessTable() {
        this.records = new LinkedHashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    public ProcessRecord register(String name, Process process, ProcessKind kind, Map<String, ?> metadata) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("process name cannot be empty");
        }
        Objects.requireNonNull(process, "process");
        Objects.requireNonNull(kind, "kind");
        ProcessRecord record = new ProcessRecord(
                name,
                process,
                kind,
                Instant.now(),
                metadata == null ? Map.of() : new LinkedHashMap<>(metadata)
        );
        lock.writeLock().lock();
        try {
            if (records.containsKey(name)) {
                throw new DuplicateProcessNameException(name);
            }
            records.put(name, record);
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ProcessRecord> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ProcessRecord require(String name) {
        return get(name).orElseThrow(() -> new ProcessNotFoundException(name));
    }

    /**
     * Merges {@code patch} into the record's metadata. A {@code null} value removes the key.
     */
    public ProcessRecord updateMetadata(String name, Map<String, ?> patch) {
        lock.writeLock().lock();
        try {
            ProcessRecord current = records.get(name);
            if (current == null) {
                throw new ProcessNotFoundException(name);
            }
            ProcessRecord updated = current.merge(patch == null ? Map.of() : patch);
            records.put(name, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * The first observer of an exit stamps {@code ended} and {@code exit_code}; later calls leave
     * the record untouched. Empty when the name is no longer registered.
     */
    public Optional<ProcessRecord> recordExit(String name, int exitCode) {
        lock.writeLock().lock();
        try {
            ProcessRecord current = records.get(name);
            if (current == null || current.metadata().containsKey(ENDED)) {
                return Optional.ofNullable(current);
            }
            ProcessRecord updated = current.merge(Map.of(
                    ENDED, Instant.now().toString(),
                    EXIT_CODE, exitCode
            ));
            records.put(name, updated);
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ProcessRecord> remove(String name) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(records.remove(name));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Lazy view over the records accepted by {@code predicate}. Every call to
     * {@link Iterable#iterator()} starts from a fresh snapshot, so the view can be walked again.
     */
    public Iterable<ProcessRecord> listAll(Predicate<? super ProcessRecord> predicate) {
        Predicate<? super ProcessRecord> filter = predicate == null ? record -> true : predicate;
        return () -> new FilteringIterator(snapshot().iterator(), filter);
    }

    public List<String> names() {
        lock.readLock().lock();
        try {
            return List.copyOf(records.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ProcessRecord> clear() {
        lock.writeLock().lock();
        try {
            List<ProcessRecord> removed = new ArrayList<>(records.values());
            records.clear();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<ProcessRecord> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(records.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class FilteringIterator implements Iterator<ProcessRecord> {
        private final Iterator<ProcessRecord> source;
        private final Predicate<? super ProcessRecord> filter;
        private ProcessRecord next;

        FilteringIterator(Iterator<ProcessRecord> source, Predicate<? super ProcessRecord> filter) {
            this.source = source;
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            while (next == null && source.hasNext()) {
                ProcessRecord candidate = source.next();
                if (filter.test(candidate)) {
                    next = candidate;
                }
            }
            return next != null;
        }

        @Override
        public ProcessRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ProcessRecord out = next;
            next = null;
            return out;
        }
    }
}
