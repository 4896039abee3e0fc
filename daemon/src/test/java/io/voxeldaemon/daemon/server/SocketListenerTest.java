package io.voxeldaemon.daemon.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.voxeldaemon.daemon.lifecycle.DaemonStartupException;
import io.voxeldaemon.daemon.lifecycle.InstanceConflictException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link SocketListener}: stale sockets, conflicts, permissions, cleanup. */
class SocketListenerTest {

    @TempDir
    Path dir;

    @Test
    void bind_createsSocketWithPermissions_andCloseRemovesIt() {
        Path socket = dir.resolve("sub/d.sock");
        var listener = new SocketListener(socket, "0660");

        listener.bind();

        assertThat(socket).exists();
        assertThat(SocketListener.isLive(socket)).isTrue();
        if (dir.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            assertThat(PosixFilePermissions.toString(permissionsOf(socket))).isEqualTo("rw-rw----");
        }

        listener.close();
        listener.close();

        assertThat(socket).doesNotExist();
    }

    @Test
    void staleSocketFile_isReplaced() throws Exception {
        Path socket = dir.resolve("stale.sock");
        try (ServerSocketChannel orphan = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            orphan.bind(UnixDomainSocketAddress.of(socket));
        }
        // Closing a bound Unix server channel leaves the file behind with nobody listening.
        assertThat(socket).exists();
        assertThat(SocketListener.isLive(socket)).isFalse();

        var listener = new SocketListener(socket, "0666");
        try {
            listener.bind();
            assertThat(SocketListener.isLive(socket)).isTrue();
        } finally {
            listener.close();
        }
    }

    @Test
    void liveSocket_isAConflict_andStaysUntouched() {
        Path socket = dir.resolve("live.sock");
        var first = new SocketListener(socket, "0666");
        first.bind();
        try {
            var second = new SocketListener(socket, "0666");

            assertThatThrownBy(second::bind)
                    .isInstanceOf(InstanceConflictException.class)
                    .hasMessageContaining(socket.toString());

            second.close();
            assertThat(socket).exists();
            assertThat(SocketListener.isLive(socket)).isTrue();
        } finally {
            first.close();
        }
    }

    @Test
    void regularFileAtPath_isNotDeleted() throws Exception {
        Path file = Files.writeString(dir.resolve("data.sock"), "precious");
        var listener = new SocketListener(file, "0666");

        assertThatThrownBy(listener::bind)
                .isInstanceOf(DaemonStartupException.class)
                .hasMessageContaining("not a socket");
        assertThat(file).hasContent("precious");
    }

    @Test
    void parseMode_mapsOctalDigits() {
        assertThat(SocketListener.parseMode("0640")).containsExactlyInAnyOrder(
                PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.GROUP_READ);
        assertThat(SocketListener.parseMode("000")).isEmpty();
    }

    private static Set<PosixFilePermission> permissionsOf(Path path) {
        try {
            return Files.getPosixFilePermissions(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
