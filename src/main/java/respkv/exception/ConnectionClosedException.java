package respkv.exception;

/**
 * The peer closed the stream, either between frames or in the middle of one.
 */
public class ConnectionClosedException extends KvException {

    public ConnectionClosedException(String message) {
        super(message);
    }
}
