package com.imapbox.exception;

import com.imapbox.session.ImapStatus;
import lombok.Getter;

/**
 * The session answered a request with a non-OK status.
 * Never retried; always surfaced to the caller.
 */
@Getter
public class ImapProtocolException extends ImapBoxException {

    private final ImapStatus status;
    private final String command;

    public ImapProtocolException(ImapStatus status, String command) {
        super(status + " in " + command);
        this.status = status;
        this.command = command;
    }

    protected ImapProtocolException(ImapStatus status, String command, String message) {
        super(message);
        this.status = status;
        this.command = command;
    }
}
