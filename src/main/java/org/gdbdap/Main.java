package org.gdbdap;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.gdbdap.debug.DAP;

public class Main {
    private static final Logger LOG = Logger.getLogger("main");

    public static void setRootFormat() {
        var root = Logger.getLogger("");

        for (var h : root.getHandlers()) h.setFormatter(new LogFormat());
    }

    static void setVerbose() {
        var root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (var h : root.getHandlers()) h.setLevel(Level.FINE);
    }

    public static void main(String[] args) {
        setRootFormat();
        AdapterSettings settings;
        try {
            settings = AdapterSettings.parse(args);
        } catch (IllegalArgumentException e) {
            LOG.severe(e.getMessage());
            System.exit(2);
            return;
        }
        if (settings.verbose) setVerbose();

        try (var socket = DebugSocket.open(settings.socketPath)) {
            // The client reads this line to find the socket
            System.out.println("SOCKET_PATH=" + socket.path());
            System.out.flush();
            try (var channel = socket.accept()) {
                var connection = new DAP(channel, channel);
                var session = new Session(settings, connection.client());
                try {
                    session.start();
                } catch (IOException e) {
                    throw new BackendUnavailableException("Failed to start " + settings.gdbPath, e);
                }
                try {
                    connection.serve(new GdbDebugServer(session));
                } finally {
                    session.stop();
                }
            }
        } catch (Throwable t) {
            LOG.log(Level.SEVERE, t.getMessage(), t);
            System.exit(1);
        }
        System.exit(0);
    }
}
