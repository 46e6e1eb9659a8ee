package com.imapbox.util;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * INTERNALDATE per RFC 3501: dd-Mon-yyyy HH:mm:ss +zzzz
 */
public final class ImapDates {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm:ss Z", Locale.US);

    // day may be space padded (" 7-Jul-1996") or a single digit
    private static final DateTimeFormatter PARSE_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-yyyy HH:mm:ss Z")
            .toFormatter(Locale.US);

    private ImapDates() {}

    public static String format(OffsetDateTime dateTime) {
        return dateTime.format(FORMAT);
    }

    /**
     * @throws DateTimeParseException if the text is not a date-time in INTERNALDATE form
     */
    public static OffsetDateTime parse(String text) {
        return OffsetDateTime.parse(text.trim(), PARSE_FORMAT);
    }
}
