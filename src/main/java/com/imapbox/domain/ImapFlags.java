package com.imapbox.domain;

import jakarta.mail.Flags;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * IMAP system flag names and flag list rendering
 */
public final class ImapFlags {

    public static final String SEEN = "\\Seen";
    public static final String ANSWERED = "\\Answered";
    public static final String FLAGGED = "\\Flagged";
    public static final String DELETED = "\\Deleted";
    public static final String DRAFT = "\\Draft";
    public static final String RECENT = "\\Recent";

    private ImapFlags() {}

    /**
     * Render a parenthesised flag list: (\Seen \Flagged).
     * \Recent is dropped, the server owns it.
     */
    public static String toFlagList(Collection<String> flags) {
        return flags.stream()
                .filter(flag -> !RECENT.equalsIgnoreCase(flag))
                .collect(Collectors.joining(" ", "(", ")"));
    }

    /**
     * Convert Jakarta Mail flags (system + user) to IMAP flag names
     */
    public static Set<String> fromJakarta(Flags flags) {
        Set<String> result = new LinkedHashSet<>();
        for (Flags.Flag flag : flags.getSystemFlags()) {
            if (flag == Flags.Flag.SEEN) result.add(SEEN);
            else if (flag == Flags.Flag.ANSWERED) result.add(ANSWERED);
            else if (flag == Flags.Flag.FLAGGED) result.add(FLAGGED);
            else if (flag == Flags.Flag.DELETED) result.add(DELETED);
            else if (flag == Flags.Flag.DRAFT) result.add(DRAFT);
            else if (flag == Flags.Flag.RECENT) result.add(RECENT);
        }
        for (String userFlag : flags.getUserFlags()) {
            result.add(userFlag);
        }
        return result;
    }
}
