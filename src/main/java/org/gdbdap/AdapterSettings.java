package org.gdbdap;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/** Command line options. */
public class AdapterSettings {
    public String gdbPath = "/usr/bin/gdb";
    /** Where to create the client socket. Null means a fresh temporary directory. */
    public Path socketPath;
    public Duration commandTimeout = CommandChannel.DEFAULT_TIMEOUT;
    public boolean verbose;

    /** @throws IllegalArgumentException on an unknown flag or a flag missing its value */
    public static AdapterSettings parse(String... args) {
        var settings = new AdapterSettings();
        for (var i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--gdb-path":
                    settings.gdbPath = value(args, ++i, "--gdb-path");
                    break;
                case "--socket":
                    settings.socketPath = Paths.get(value(args, ++i, "--socket"));
                    break;
                case "--timeout":
                    {
                        var text = value(args, ++i, "--timeout");
                        double seconds;
                        try {
                            seconds = Double.parseDouble(text);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--timeout expects seconds, got " + text, e);
                        }
                        if (seconds <= 0) throw new IllegalArgumentException("--timeout must be positive");
                        settings.commandTimeout = Duration.ofMillis((long) (seconds * 1000));
                        break;
                    }
                case "--verbose":
                    settings.verbose = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option " + args[i]);
            }
        }
        return settings;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException(flag + " needs a value");
        return args[i];
    }
}
