package respkv.exception;

public class KvException extends RuntimeException {

    public KvException(String message) {
        super(message);
    }
}
