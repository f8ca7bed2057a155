package respkv.resp;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

public class SerializerUtils {
    static final byte[] CRLF = {'\r', '\n'};

    private SerializerUtils() {

    }

    public static byte[] decimal(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Writes {@code <prefix><decimal>\r\n}, the header shape shared by integers, bulk strings and arrays.
     */
    public static void writeHeader(OutputStream out, char prefix, long value) throws IOException {
        out.write(prefix);
        out.write(decimal(value));
        out.write(CRLF);
    }

    public static void writeLine(OutputStream out, char prefix, String text) throws IOException {
        out.write(prefix);
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.write(CRLF);
    }
}
