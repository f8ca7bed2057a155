package respkv.exception;

public class InvalidArgumentException extends KvException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
