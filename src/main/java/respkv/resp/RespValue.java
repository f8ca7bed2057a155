package respkv.resp;

import java.io.IOException;
import java.io.OutputStream;

/**
 * A reply value that knows its own RESP2 wire form.
 */
public sealed interface RespValue permits AbstractRespValue {

    void writeTo(OutputStream out) throws IOException;

    byte[] serialize();
}
