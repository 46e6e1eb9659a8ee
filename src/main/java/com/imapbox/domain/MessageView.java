package com.imapbox.domain;

import com.imapbox.util.ImapDates;
import jakarta.mail.internet.MimeMessage;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * A message as retrieved from the server: parsed content plus the flags,
 * internal date and size observed at retrieval time.
 * Not kept in sync with the server afterwards.
 */
@Getter
@Builder
@ToString(exclude = {"raw", "message"})
public class MessageView {

    private final long uid;
    private final MimeMessage message;
    private final byte[] raw;
    private final Set<String> flags;
    private final OffsetDateTime internalDate;
    private final long size;
    private final boolean headerOnly;

    public boolean hasFlag(String flag) {
        return flags != null && flags.stream().anyMatch(f -> f.equalsIgnoreCase(flag));
    }

    /**
     * Flag list suitable for APPEND, e.g. (\Seen \Flagged)
     */
    public String flagString() {
        return ImapFlags.toFlagList(flags == null ? Set.of() : flags);
    }

    /**
     * Internal date in INTERNALDATE form, or null if unknown
     */
    public String internalDateString() {
        return internalDate == null ? null : ImapDates.format(internalDate);
    }
}
