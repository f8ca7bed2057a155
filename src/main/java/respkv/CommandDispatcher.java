package respkv;

import respkv.command.Command;
import respkv.command.Echo;
import respkv.command.Get;
import respkv.command.LLen;
import respkv.command.LPop;
import respkv.command.LPush;
import respkv.command.LRange;
import respkv.command.Ping;
import respkv.command.RPush;
import respkv.command.Set;
import respkv.exception.InvalidArgumentException;
import respkv.exception.UnknownCommandException;
import respkv.resp.RespError;
import respkv.resp.RespValue;
import respkv.store.KeyValueStore;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static respkv.util.Logger.debug;

/**
 * Turns a decoded command into a reply. Validation happens while the command object is built,
 * so a rejected command never reaches the store.
 */
public class CommandDispatcher {
    private final KeyValueStore store;

    public CommandDispatcher(KeyValueStore store) {
        this.store = store;
    }

    /**
     * @return the reply, or empty for an empty command which gets no reply
     */
    public Optional<RespValue> dispatch(List<byte[]> tokens) {
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        try {
            Command command = build(tokens);
            debug("Dispatching %s", command);
            return Optional.of(command.execute());
        } catch (UnknownCommandException | InvalidArgumentException e) {
            debug("Rejected command: %s", e.getMessage());
            return Optional.of(new RespError(e.getMessage()));
        }
    }

    Command build(List<byte[]> tokens) {
        String name = new String(tokens.get(0), StandardCharsets.UTF_8);
        return switch (name.toUpperCase(Locale.ROOT)) {
            case Ping.CODE -> new Ping(tokens);
            case Echo.CODE -> new Echo(tokens);
            case Set.CODE -> new Set(tokens, store);
            case Get.CODE -> new Get(tokens, store);
            case RPush.CODE -> new RPush(tokens, store);
            case LPush.CODE -> new LPush(tokens, store);
            case LRange.CODE -> new LRange(tokens, store);
            case LLen.CODE -> new LLen(tokens, store);
            case LPop.CODE -> new LPop(tokens, store);
            default -> throw UnknownCommandException.unknown(name);
        };
    }
}
