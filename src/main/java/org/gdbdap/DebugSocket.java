package org.gdbdap;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.Closeable;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/** The Unix domain socket the client connects to. */
class DebugSocket implements Closeable {
    static final String SOCKET_NAME = "dap_socket";

    private final Path path;
    /** Temporary directory we created for the socket, deleted on close. */
    private final Path ownedDirectory;
    private final ServerSocketChannel server;

    private DebugSocket(Path path, Path ownedDirectory, ServerSocketChannel server) {
        this.path = path;
        this.ownedDirectory = ownedDirectory;
        this.server = server;
    }

    /** Listen on {@code path}, or on a socket in a fresh temporary directory when it is null. */
    static DebugSocket open(Path path) throws IOException {
        Path owned = null;
        if (path == null) {
            owned = Files.createTempDirectory("gdb-dap");
            path = owned.resolve(SOCKET_NAME);
        }
        var server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        server.bind(UnixDomainSocketAddress.of(path));
        LOG.info("Listening on " + path);
        return new DebugSocket(path, owned, server);
    }

    Path path() {
        return path;
    }

    SocketChannel accept() throws IOException {
        var client = server.accept();
        LOG.info("Client connected");
        return client;
    }

    @Override
    public void close() {
        try {
            server.close();
            Files.deleteIfExists(path);
            if (ownedDirectory != null) MoreFiles.deleteRecursively(ownedDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to remove socket " + path, e);
        }
    }

    private static final Logger LOG = Logger.getLogger("main");
}
