package respkv;

import respkv.config.ServerConfig;
import respkv.resp.RespDecoder;
import respkv.store.KeyValueStore;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static respkv.util.Logger.debug;
import static respkv.util.Logger.error;
import static respkv.util.Logger.info;

/**
 * Accepts connections and serves each one on its own thread. The store is the only state
 * shared between connections.
 */
public class RespKvServer implements AutoCloseable {
    private final ServerConfig config;
    private final ExecutorService clientListeners;
    private final RespDecoder decoder;
    private final CommandDispatcher dispatcher;
    private final Set<ClientConnection> clients;
    private volatile ServerSocketChannel serverChannel;
    private volatile boolean closed;

    public RespKvServer(ServerConfig config) {
        this(config, new KeyValueStore());
    }

    public RespKvServer(ServerConfig config, KeyValueStore store) {
        this.config = config;
        AtomicInteger clientIndex = new AtomicInteger();
        this.clientListeners = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "client-" + clientIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.decoder = new RespDecoder(config.getMaxBulkLength(), config.getMaxArguments());
        this.dispatcher = new CommandDispatcher(store);
        this.clients = ConcurrentHashMap.newKeySet();
    }

    /**
     * Binds the listening socket. Called by {@link #serve()} when not done beforehand.
     */
    public synchronized InetSocketAddress bind() throws IOException {
        if (serverChannel == null) {
            ServerSocketChannel channel = ServerSocketChannel.open();
            channel.socket().setReuseAddress(true);
            channel.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            channel.configureBlocking(true);
            serverChannel = channel;
            info("Listening on %s", channel.getLocalAddress());
        }
        return (InetSocketAddress) serverChannel.getLocalAddress();
    }

    public int getPort() throws IOException {
        return bind().getPort();
    }

    /**
     * Accepts clients until {@link #close()} is called.
     */
    public void serve() throws IOException {
        bind();
        try {
            while (!closed && !Thread.currentThread().isInterrupted()) {
                SocketChannel channel = serverChannel.accept();
                ClientConnection client;
                try {
                    client = new ClientConnection(channel, decoder, dispatcher);
                } catch (IOException e) {
                    error("Failed to set up client connection: %s", e.getMessage());
                    channel.close();
                    continue;
                }
                debug("Accepted connection from %s", client.getRemoteAddress());
                clients.add(client);
                clientListeners.submit(() -> {
                    try {
                        client.serve();
                    } finally {
                        clients.remove(client);
                    }
                });
            }
        } catch (ClosedChannelException e) {
            if (!closed) {
                throw e;
            }
        } finally {
            debug("Accept loop has stopped.");
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (serverChannel != null) {
                serverChannel.close();
            }
        } catch (IOException e) {
            error("Failed to close server socket: %s", e.getMessage());
        }
        clients.forEach(ClientConnection::close);
        clientListeners.shutdownNow();
        info("Server has been closed.");
    }
}
