import respkv.RespKvServer;
import respkv.config.ServerConfig;
import respkv.exception.KvException;
import respkv.util.Logger;

import static respkv.util.Logger.error;

public class Main {
    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = new ServerConfig(args);
        } catch (KvException e) {
            error("Invalid arguments: %s", e.getMessage());
            System.exit(2);
            return;
        }
        Logger.setLevel(config.getLogLevel());

        try (RespKvServer server = new RespKvServer(config)) {
            Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));
            server.serve();
        } catch (Exception e) {
            error("Failed to start server on %s:%d: %s", config.getHost(), config.getPort(), e.getMessage());
            System.exit(1);
        }
    }
}
