package respkv.exception;

import static respkv.config.Constants.ARITY_ERROR_FORMAT;
import static respkv.config.Constants.UNKNOWN_COMMAND_FORMAT;

public class UnknownCommandException extends KvException {

    public UnknownCommandException(String message) {
        super(message);
    }

    public static UnknownCommandException unknown(String name) {
        return new UnknownCommandException(UNKNOWN_COMMAND_FORMAT.formatted(name));
    }

    public static UnknownCommandException wrongArity(String name) {
        return new UnknownCommandException(ARITY_ERROR_FORMAT.formatted(name));
    }
}
