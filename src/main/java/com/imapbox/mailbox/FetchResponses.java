package com.imapbox.mailbox;

import com.imapbox.exception.ImapProtocolException;
import com.imapbox.session.ImapResponse;
import com.imapbox.session.ResponseRecord;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers shared by the UID FETCH based components
 */
final class FetchResponses {

    private static final Pattern UID_ITEM = Pattern.compile("\\bUID (\\d+)", Pattern.CASE_INSENSITIVE);

    private FetchResponses() {}

    static ImapResponse requireOk(ImapResponse response, String command) {
        if (!response.isOk()) {
            throw new ImapProtocolException(response.status(), command);
        }
        return response;
    }

    /**
     * Record answering the given UID. A UID FETCH reply always carries the UID item,
     * so records without one, or naming another UID, are unsolicited updates
     * for other messages and are skipped.
     *
     * @return the record, or null if the server returned nothing for the UID
     */
    static ResponseRecord find(ImapResponse response, long uid) {
        for (ResponseRecord record : response.data()) {
            if (record == null || record.text() == null) {
                continue;
            }
            Matcher m = UID_ITEM.matcher(record.text());
            if (m.find() && m.group(1).equals(Long.toString(uid))) {
                return record;
            }
        }
        return null;
    }

    static String command(String items, long uid) {
        return "UID FETCH " + uid + " " + items;
    }
}
