package com.ryuqq.provisioner.adapter.file.state;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.provisioner.adapter.file.json.JsonMappers;
import com.ryuqq.provisioner.core.error.StateLockException;
import com.ryuqq.provisioner.core.error.StateStoreException;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.core.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JSON file implementation of {@link StateStore}.
 *
 * <p><strong>Save sequence:</strong></p>
 * <pre>
 * 1. serialize state (serial + 1, digest recomputed) to a temp file in the same directory
 * 2. fsync the temp file (unless disabled)
 * 3. copy the current file to {@code <state>.backup}
 * 4. atomically rename the temp file over the state file
 * </pre>
 * <p>A crash at any step leaves either the previous or the new file in place, never a mix.</p>
 *
 * <p><strong>Locking:</strong> {@link #withLock(Supplier)} takes a non-blocking exclusive
 * {@link FileLock} on {@code <state>.lock}. A lock held by another process, or by another
 * channel in this JVM, fails immediately with {@link StateLockException}. The lock file records
 * the holder's pid and acquisition time for the error message.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private final FileStateStoreConfig config;
    private final ObjectMapper mapper;

    /**
     * Creates a store with default settings.
     *
     * @param statePath the state file
     */
    public FileStateStore(Path statePath) {
        this(new FileStateStoreConfig(statePath));
    }

    /**
     * Creates a store.
     *
     * @param config settings
     * @throws IllegalArgumentException if config is null
     */
    public FileStateStore(FileStateStoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.mapper = JsonMappers.mapper();
    }

    @Override
    public Optional<State> load() {
        Path path = config.statePath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        StateDocument document;
        try {
            document = mapper.readValue(path.toFile(), StateDocument.class);
        } catch (JacksonException e) {
            throw new StateStoreException("State file is corrupt: " + path, e);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state file: " + path, e);
        }

        State state = StateDocumentMapper.toState(document, path);
        String actual = state.digest();
        if (!actual.equals(document.digest())) {
            throw new StateStoreException(String.format(
                "State digest mismatch for %s (recorded: %s, computed: %s); the file was modified outside the engine",
                path, document.digest(), actual));
        }
        log.debug("Loaded state {} serial {} with {} resources from {}",
            state.lineage(), state.serial(), state.resources().size(), path);
        return Optional.of(state);
    }

    @Override
    public State save(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        State persisted = state.nextSerial();
        Path path = config.statePath().toAbsolutePath();
        Path directory = path.getParent();
        Path temp = null;
        try {
            byte[] bytes = mapper.writeValueAsBytes(StateDocumentMapper.toDocument(persisted));
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString() + ".", ".tmp");
            writeFully(temp, bytes);

            if (Files.exists(path)) {
                Files.copy(path, config.backupPath().toAbsolutePath(), StandardCopyOption.REPLACE_EXISTING);
            }
            moveIntoPlace(temp, path);
            temp = null;
        } catch (IOException e) {
            throw new StateStoreException("Failed to write state file: " + path, e);
        } finally {
            deleteQuietly(temp);
        }
        log.debug("Saved state {} serial {} to {}", persisted.lineage(), persisted.serial(), path);
        return persisted;
    }

    @Override
    public <T> T withLock(Supplier<T> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        Path lockPath = config.lockPath().toAbsolutePath();
        try {
            Files.createDirectories(lockPath.getParent());
        } catch (IOException e) {
            throw new StateStoreException("Failed to create state directory: " + lockPath.getParent(), e);
        }

        try (FileChannel channel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            FileLock lock = tryLock(channel, lockPath);
            try {
                recordHolder(channel);
                log.debug("Acquired state lock {}", lockPath);
                return action.get();
            } finally {
                channel.truncate(0);
                lock.release();
                log.debug("Released state lock {}", lockPath);
            }
        } catch (IOException e) {
            throw new StateStoreException("State lock I/O failure: " + lockPath, e);
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(config.statePath());
    }

    public FileStateStoreConfig config() {
        return config;
    }

    private FileLock tryLock(FileChannel channel, Path lockPath) throws IOException {
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            throw new StateLockException("State is locked by this process: " + lockPath, e);
        }
        if (lock == null) {
            throw new StateLockException("State is locked: " + lockPath + describeHolder(lockPath));
        }
        return lock;
    }

    private static void recordHolder(FileChannel channel) throws IOException {
        String holder = "pid=" + ProcessHandle.current().pid() + " acquiredAt=" + Instant.now() + System.lineSeparator();
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(holder.getBytes(StandardCharsets.UTF_8)), 0);
        channel.force(false);
    }

    private static String describeHolder(Path lockPath) {
        try {
            String holder = Files.readString(lockPath, StandardCharsets.UTF_8).trim();
            return holder.isEmpty() ? "" : " (held by " + holder + ")";
        } catch (IOException e) {
            log.debug("Could not read lock holder from {}", lockPath, e);
            return "";
        }
    }

    private void writeFully(Path target, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(target,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (config.fsync()) {
                channel.force(true);
            }
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}; falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary state file {}", temp, e);
        }
    }
}
