package respkv.resp;

import java.io.IOException;
import java.io.OutputStream;

public final class RespInteger extends AbstractRespValue {
    private final long value;

    public RespInteger(long value) {
        this.value = value;
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        SerializerUtils.writeHeader(out, ':', value);
    }

    public long value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespInteger) obj;
        return this.value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "RespInteger[value=" + value + ']';
    }
}
