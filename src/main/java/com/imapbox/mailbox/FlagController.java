package com.imapbox.mailbox;

import com.imapbox.domain.ImapFlags;
import com.imapbox.exception.FlagUpdateException;
import com.imapbox.exception.MalformedResponseException;
import com.imapbox.exception.NoSuchMessageException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.session.ResponseRecord;
import com.imapbox.util.ImapDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * UID addressed flag, size and internal date access.
 * Flags are never cached: every read and write goes to the server.
 */
@Slf4j
@RequiredArgsConstructor
public class FlagController {

    private static final Pattern FLAGS_ITEM = Pattern.compile("FLAGS \\(([^)]*)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SIZE_ITEM = Pattern.compile("RFC822\\.SIZE (\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_ITEM = Pattern.compile("INTERNALDATE \"([^\"]*)\"", Pattern.CASE_INSENSITIVE);

    private final ImapSessionPort session;

    public Set<String> getFlags(long uid) {
        ResponseRecord record = fetchItem(uid, "(FLAGS)", "getFlags");
        Matcher m = FLAGS_ITEM.matcher(record.text());
        if (!m.find()) {
            throw new MalformedResponseException(
                    "Unexpected results while fetching flags for message " + uid + ": " + record.text());
        }
        Set<String> flags = new LinkedHashSet<>();
        String list = m.group(1).trim();
        if (!list.isEmpty()) {
            Collections.addAll(flags, list.split("\\s+"));
        }
        return Collections.unmodifiableSet(flags);
    }

    /**
     * Replace the flag set with a single STORE FLAGS request
     */
    public void setFlags(long uid, Collection<String> flags) {
        String flagList = "(" + String.join(" ", flags) + ")";
        ImapResponse response = session.uid("STORE", String.valueOf(uid), "FLAGS", flagList);
        FetchResponses.requireOk(response, "UID STORE " + uid + " FLAGS " + flagList);
        log.debug("UID {} flags set to {}", uid, flagList);
    }

    public void setFlags(long uid, String flag) {
        setFlags(uid, List.of(flag));
    }

    /**
     * Add flags one STORE +FLAGS request at a time.
     *
     * @throws FlagUpdateException naming the failed flag; earlier flags stay applied
     */
    public void addFlags(long uid, String... flags) {
        storeEach(uid, "+FLAGS", flags);
    }

    /**
     * Remove flags one STORE -FLAGS request at a time.
     *
     * @throws FlagUpdateException naming the failed flag; earlier flags stay removed
     */
    public void removeFlags(long uid, String... flags) {
        storeEach(uid, "-FLAGS", flags);
    }

    public void markDeleted(long uid) {
        addFlags(uid, ImapFlags.DELETED);
    }

    /**
     * Number of bytes of the message (RFC822.SIZE)
     */
    public long getSize(long uid) {
        ResponseRecord record = fetchItem(uid, "(RFC822.SIZE)", "getSize");
        Matcher m = SIZE_ITEM.matcher(record.text());
        if (!m.find()) {
            throw new MalformedResponseException(
                    "Unexpected results while fetching size for message " + uid + ": " + record.text());
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Unparsable size for message " + uid + ": " + m.group(1), e);
        }
    }

    /**
     * Server assigned received timestamp (INTERNALDATE)
     */
    public OffsetDateTime getInternalDate(long uid) {
        ResponseRecord record = fetchItem(uid, "(INTERNALDATE)", "getInternalDate");
        Matcher m = DATE_ITEM.matcher(record.text());
        if (!m.find()) {
            throw new MalformedResponseException(
                    "Unexpected results while fetching internal date for message " + uid + ": " + record.text());
        }
        try {
            return ImapDates.parse(m.group(1));
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Unparsable internal date for message " + uid + ": " + m.group(1), e);
        }
    }

    private ResponseRecord fetchItem(long uid, String items, String operation) {
        ImapResponse response = FetchResponses.requireOk(
                session.uid("FETCH", String.valueOf(uid), items), FetchResponses.command(items, uid));
        ResponseRecord record = FetchResponses.find(response, uid);
        if (record == null) {
            throw new NoSuchMessageException(uid, operation);
        }
        return record;
    }

    private void storeEach(long uid, String action, String... flags) {
        List<String> applied = new ArrayList<>();
        for (String flag : flags) {
            String flagList = "(" + flag + ")";
            ImapResponse response = session.uid("STORE", String.valueOf(uid), action, flagList);
            if (!response.isOk()) {
                throw new FlagUpdateException(response.status(),
                        "UID STORE " + uid + " " + action + " " + flagList, uid, flag, applied);
            }
            applied.add(flag);
        }
        log.debug("UID {} {} {}", uid, action, applied);
    }
}
