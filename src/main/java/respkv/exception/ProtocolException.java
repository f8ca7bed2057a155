package respkv.exception;

/**
 * Malformed RESP framing. The stream can no longer be trusted, so the connection is dropped
 * without a reply.
 */
public class ProtocolException extends KvException {

    public ProtocolException(String message) {
        super(message);
    }
}
