package respkv.resp;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class RespArray extends AbstractRespValue {
    private final List<RespValue> values;

    public RespArray(List<RespValue> values) {
        this.values = List.copyOf(values);
    }

    public static RespArray ofBulkStrings(List<byte[]> items) {
        List<RespValue> values = new ArrayList<>(items.size());
        for (byte[] item : items) {
            values.add(new RespBulkString(item));
        }
        return new RespArray(values);
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        SerializerUtils.writeHeader(out, '*', values.size());
        for (RespValue value : values) {
            value.writeTo(out);
        }
    }

    public List<RespValue> values() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespArray) obj;
        return Objects.equals(this.values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "RespArray[values=" + values + ']';
    }
}
