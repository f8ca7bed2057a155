package respkv;

import respkv.exception.ConnectionClosedException;
import respkv.exception.ProtocolException;
import respkv.resp.RespDecoder;
import respkv.resp.RespValue;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.util.List;
import java.util.Optional;

import static respkv.util.Logger.debug;
import static respkv.util.Logger.error;
import static respkv.util.Logger.warn;

/**
 * One client: read a command, dispatch it, write the reply, in order, until the peer goes away
 * or sends something unparseable. No store lock is held while reading or writing.
 */
public class ClientConnection implements AutoCloseable {
    private static final int BUFFER_SIZE = 8192;

    private final SocketChannel socketChannel;
    private final SocketAddress remoteAddress;
    private final InputStream in;
    private final OutputStream out;
    private final RespDecoder decoder;
    private final CommandDispatcher dispatcher;

    public ClientConnection(SocketChannel socketChannel, RespDecoder decoder, CommandDispatcher dispatcher) throws IOException {
        this.socketChannel = socketChannel;
        socketChannel.configureBlocking(true);
        this.remoteAddress = socketChannel.getRemoteAddress();
        this.in = new BufferedInputStream(Channels.newInputStream(socketChannel), BUFFER_SIZE);
        this.out = new BufferedOutputStream(Channels.newOutputStream(socketChannel), BUFFER_SIZE);
        this.decoder = decoder;
        this.dispatcher = dispatcher;
    }

    public void serve() {
        debug("Serving client %s", remoteAddress);
        try {
            while (true) {
                List<byte[]> command = decoder.decodeCommand(in);
                Optional<RespValue> reply = dispatcher.dispatch(command);
                if (reply.isPresent()) {
                    reply.get().writeTo(out);
                }
                // pipelined commands already buffered are answered before flushing
                if (in.available() == 0) {
                    out.flush();
                }
            }
        } catch (ConnectionClosedException e) {
            debug("Client %s disconnected: %s", remoteAddress, e.getMessage());
        } catch (ProtocolException e) {
            warn("Dropping client %s on protocol error: %s", remoteAddress, e.getMessage());
        } catch (IOException e) {
            if (socketChannel.isOpen()) {
                error("I/O error serving client %s: %s", remoteAddress, e.getMessage());
            } else {
                debug("Connection to %s closed while serving: %s", remoteAddress, e.getMessage());
            }
        } finally {
            close();
        }
    }

    public SocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    @Override
    public void close() {
        try {
            socketChannel.close();
        } catch (IOException e) {
            error("Got exception while closing %s: %s", remoteAddress, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "ClientConnection[" + remoteAddress + ']';
    }
}
