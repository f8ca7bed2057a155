package respkv.config;

public class Constants {

    private Constants() {

    }

    public static final String PONG = "PONG";
    public static final String OK = "OK";
    public static final String EXPIRATION_TOKEN_CONTENT = "PX";

    public static final String UNKNOWN_COMMAND_FORMAT = "unknown command '%s'";
    public static final String ARITY_ERROR_FORMAT = "wrong number of arguments for '%s' command";
    public static final String NOT_AN_INTEGER_MESSAGE = "value is not an integer or out of range";
    public static final String INVALID_EXPIRE_MESSAGE = "invalid expire time in 'set' command";
    public static final String WRONG_TYPE_MESSAGE = "Operation against a key holding the wrong kind of value";

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_ARGUMENTS = 1024 * 1024;
}
