package respkv.config;

import respkv.exception.KvException;
import respkv.util.Logger;

public class ServerConfig {
    private String host = Constants.DEFAULT_HOST;
    private int port = Constants.DEFAULT_PORT;
    private Logger.Level logLevel = Logger.Level.INFO;
    private int maxBulkLength = Constants.DEFAULT_MAX_BULK_LENGTH;
    private int maxArguments = Constants.DEFAULT_MAX_ARGUMENTS;

    public ServerConfig(String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i += 2) {
            String name = args[i];
            if (i + 1 >= args.length) {
                throw new KvException("Missing value for '" + name + "' argument");
            }
            String value = args[i + 1];

            if (name.equalsIgnoreCase("--host")) {
                host = value;
            } else if (name.equalsIgnoreCase("--port")) {
                port = parseInt(name, value);
                if (port < 0 || port > 65535) {
                    throw new KvException("Port number must be between 0 and 65535");
                }
            } else if (name.equalsIgnoreCase("--log-level")) {
                try {
                    logLevel = Logger.Level.parse(value);
                } catch (IllegalArgumentException e) {
                    throw new KvException("Invalid log level: " + value);
                }
            } else if (name.equalsIgnoreCase("--max-bulk-length")) {
                maxBulkLength = positive(name, parseInt(name, value));
            } else if (name.equalsIgnoreCase("--max-arguments")) {
                maxArguments = positive(name, parseInt(name, value));
            } else {
                throw new KvException("Unknown argument: " + name);
            }
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new KvException("Invalid number for '" + name + "': " + value);
        }
    }

    private static int positive(String name, int value) {
        if (value <= 0) {
            throw new KvException("'" + name + "' must be positive");
        }
        return value;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Logger.Level getLogLevel() {
        return logLevel;
    }

    public int getMaxBulkLength() {
        return maxBulkLength;
    }

    public int getMaxArguments() {
        return maxArguments;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
               "host='" + host + '\'' +
               ", port=" + port +
               ", logLevel=" + logLevel +
               ", maxBulkLength=" + maxBulkLength +
               ", maxArguments=" + maxArguments +
               '}';
    }
}
