package respkv.command;

import respkv.resp.RespValue;

public sealed interface Command permits AbstractCommand {

    /**
     * Runs the command and returns its reply. Never throws for recoverable errors.
     */
    RespValue execute();
}
