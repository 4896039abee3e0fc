package io.voxeldaemon.daemon.server;

import io.voxeldaemon.daemon.lifecycle.DaemonStartupException;
import io.voxeldaemon.daemon.lifecycle.InstanceConflictException;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the daemon's Unix domain socket.
 *
 * <p>
 * An existing socket file is checked first: if a peer accepts the connection a
 * live daemon owns the path and startup fails with
 * {@link InstanceConflictException}; otherwise the file is stale and is
 * replaced. {@link #close()} removes the socket file, but only one this
 * listener bound.
 */
public final class SocketListener implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SocketListener.class);

    private static final PosixFilePermission[] PERMISSION_BITS = {
        PosixFilePermission.OTHERS_EXECUTE,
        PosixFilePermission.OTHERS_WRITE,
        PosixFilePermission.OTHERS_READ,
        PosixFilePermission.GROUP_EXECUTE,
        PosixFilePermission.GROUP_WRITE,
        PosixFilePermission.GROUP_READ,
        PosixFilePermission.OWNER_EXECUTE,
        PosixFilePermission.OWNER_WRITE,
        PosixFilePermission.OWNER_READ
    };

    private final Path path;
    private final String permissions;
    private ServerSocketChannel server;
    private boolean bound;

    public SocketListener(Path path, String permissions) {
        this.path = path.toAbsolutePath();
        this.permissions = permissions;
    }

    public Path path() {
        return path;
    }

    /**
     * Binds the socket.
     *
     * @throws InstanceConflictException if a live daemon answers on the path
     * @throws DaemonStartupException    if the path cannot be bound
     */
    public synchronized ServerSocketChannel bind() {
        if (server != null) {
            throw new IllegalStateException("Listener already bound to " + path);
        }
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(path)) {
                replaceStale();
            }
            ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            try {
                channel.bind(UnixDomainSocketAddress.of(path));
            } catch (IOException | RuntimeException e) {
                channel.close();
                throw e;
            }
            server = channel;
            bound = true;
        } catch (IOException e) {
            throw new DaemonStartupException("Cannot bind socket " + path + ": " + e.getMessage(), e);
        }
        applyPermissions();
        LOG.info("Listening on {}", path);
        return server;
    }

    private void replaceStale() throws IOException {
        if (Files.isRegularFile(path) || Files.isDirectory(path)) {
            throw new DaemonStartupException("Socket path " + path + " exists and is not a socket");
        }
        if (isLive(path)) {
            throw new InstanceConflictException("Another daemon is already listening on " + path);
        }
        LOG.warn("Removing stale socket file {}", path);
        Files.deleteIfExists(path);
    }

    /** {@code true} if something accepts connections on {@code socket}. */
    public static boolean isLive(Path socket) {
        try (SocketChannel peer = SocketChannel.open(UnixDomainSocketAddress.of(socket))) {
            return peer.isConnected();
        } catch (IOException e) {
            return false;
        }
    }

    private void applyPermissions() {
        Set<PosixFilePermission> mode = parseMode(permissions);
        try {
            Files.setPosixFilePermissions(path, mode);
        } catch (UnsupportedOperationException e) {
            LOG.debug("File system does not support POSIX permissions; leaving {} as created", path);
        } catch (IOException e) {
            LOG.warn("Could not set permissions {} on {}: {}", permissions, path, e.getMessage());
        }
    }

    /** Converts an octal mode such as {@code "0660"} into POSIX permissions. */
    static Set<PosixFilePermission> parseMode(String octal) {
        int mode = Integer.parseInt(octal.trim(), 8);
        Set<PosixFilePermission> result = EnumSet.noneOf(PosixFilePermission.class);
        for (int bit = 0; bit < PERMISSION_BITS.length; bit++) {
            if ((mode & (1 << bit)) != 0) {
                result.add(PERMISSION_BITS[bit]);
            }
        }
        return result;
    }

    /** Closes the server channel and removes the socket file. Idempotent. */
    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        try {
            server.close();
        } catch (IOException e) {
            LOG.warn("Error closing listener on {}: {}", path, e.getMessage());
        }
        server = null;
        if (bound) {
            bound = false;
            try {
                Files.deleteIfExists(path);
                LOG.info("Removed socket file {}", path);
            } catch (IOException e) {
                LOG.warn("Could not remove socket file {}: {}", path, e.getMessage());
            }
        }
    }
}
