package respkv.resp;

import respkv.resp.exception.InternalSerializationException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

public abstract sealed class AbstractRespValue implements RespValue
        permits RespArray, RespBulkString, RespError, RespInteger, RespSimpleString {

    @Override
    public byte[] serialize() {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            writeTo(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new InternalSerializationException(e.getMessage(), e);
        }
    }
}
