package com.imapbox.mailbox;

import com.imapbox.exception.ImapProtocolException;
import com.imapbox.exception.MalformedResponseException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ImapSessionPort;
import com.imapbox.session.ResponseRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * UID SEARCH pass-through.
 * <p>
 * Criteria are not validated locally; the server's parser is authoritative.
 * Nothing is cached: every call is a round trip. Examples:
 * <pre>
 *   search("FLAGGED SINCE 1-Feb-1994 NOT FROM \"Smith\"")
 *   search("TEXT \"string not in mailbox\"")
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class UidSearch {

    public static final String ALL = "ALL";

    private final ImapSessionPort session;

    /**
     * UIDs matching the criteria, in server order
     *
     * @throws ImapProtocolException      on a non-OK response
     * @throws MalformedResponseException if the response is not a list of integers
     */
    public List<Long> search(String criteria) {
        return search(criteria, null);
    }

    /**
     * @param charset charset of the strings in the criteria, or null for none
     */
    public List<Long> search(String criteria, String charset) {
        String effective = criteria == null || criteria.isBlank() ? ALL : criteria.trim();
        String query = "(" + effective + ")";
        ImapResponse response = session.uidSearch(query, charset);
        if (!response.isOk()) {
            throw new ImapProtocolException(response.status(),
                    "UID SEARCH " + (charset == null ? "" : "CHARSET " + charset + " ") + query);
        }

        List<Long> uids = new ArrayList<>();
        for (ResponseRecord record : response.data()) {
            if (record == null || record.text() == null || record.text().isBlank()) {
                continue;
            }
            for (String token : record.text().trim().split("\\s+")) {
                uids.add(parseUid(token));
            }
        }
        log.debug("UID SEARCH {} -> {} UIDs", query, uids.size());
        return uids;
    }

    /**
     * Equivalent to search("UNSEEN UNDELETED")
     */
    public List<Long> unseenUndeleted() {
        return search("UNSEEN UNDELETED");
    }

    /**
     * Equivalent to search("UNDELETED")
     */
    public List<Long> allUndeleted() {
        return search("UNDELETED");
    }

    private static long parseUid(String token) {
        try {
            long uid = Long.parseLong(token);
            if (uid <= 0) {
                throw new MalformedResponseException("received non-positive UID in search response: " + token);
            }
            return uid;
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("received unparsable search response: " + token, e);
        }
    }
}
