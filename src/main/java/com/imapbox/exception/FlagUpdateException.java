package com.imapbox.exception;

import com.imapbox.session.ImapStatus;
import lombok.Getter;

import java.util.List;

/**
 * A per-flag STORE failed part way through a multi-flag update.
 * Flags listed in {@link #getAppliedFlags()} stay applied on the server.
 */
@Getter
public class FlagUpdateException extends ImapProtocolException {

    private final long uid;
    private final String flag;
    private final List<String> appliedFlags;

    public FlagUpdateException(ImapStatus status, String command, long uid, String flag, List<String> appliedFlags) {
        super(status, command, status + " in " + command + " for flag " + flag + " of UID " + uid
                + " (already applied: " + appliedFlags + ")");
        this.uid = uid;
        this.flag = flag;
        this.appliedFlags = List.copyOf(appliedFlags);
    }
}
