package respkv.resp;

import respkv.resp.exception.InternalSerializationException;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

public final class RespSimpleString extends AbstractRespValue {
    private final String value;

    public RespSimpleString(String value) {
        if (value == null || value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            throw new InternalSerializationException("Simple string must be non-null and free of CR/LF");
        }
        this.value = value;
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        SerializerUtils.writeLine(out, '+', value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespSimpleString) obj;
        return Objects.equals(this.value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "RespSimpleString[value=" + value + ']';
    }
}
