package com.imapbox.session;

import java.util.List;

/**
 * Status plus untagged data records of one command
 */
public record ImapResponse(ImapStatus status, List<ResponseRecord> data) {

    public ImapResponse {
        data = data == null ? List.of() : List.copyOf(data);
    }

    public static ImapResponse ok(List<ResponseRecord> data) {
        return new ImapResponse(ImapStatus.OK, data);
    }

    public static ImapResponse ok(ResponseRecord... data) {
        return new ImapResponse(ImapStatus.OK, List.of(data));
    }

    public static ImapResponse no() {
        return new ImapResponse(ImapStatus.NO, List.of());
    }

    public boolean isOk() {
        return status == ImapStatus.OK;
    }
}
