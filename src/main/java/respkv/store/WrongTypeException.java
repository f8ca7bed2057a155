package respkv.store;

import respkv.exception.KvException;

import static respkv.config.Constants.WRONG_TYPE_MESSAGE;

public class WrongTypeException extends KvException {

    public WrongTypeException() {
        super(WRONG_TYPE_MESSAGE);
    }
}
