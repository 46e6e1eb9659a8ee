package com.imapbox.service;

import com.imapbox.domain.MessageView;
import com.imapbox.exception.ImapBoxException;
import com.imapbox.mailbox.ImapMailbox;
import com.imapbox.util.EmlParser;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One-line summaries and plain-text rendering of messages
 */
@Slf4j
@Service
public class MailboxSummaryService {

    public static final List<String> DEFAULT_HEADER_FIELDS = List.of("Date", "From", "To", "Subject");

    private static final int LINE_FROM_WIDTH = 25;
    private static final int SUBJECT_WIDTH = 35;
    private static final int DATE_WIDTH = 16;
    private static final DateTimeFormatter LINE_DATE_FMT = DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm", Locale.US);

    /**
     * Summary lines (index, sender, date, subject), at most 79 characters each.
     * Only headers are downloaded. UIDs that cannot be read are skipped.
     *
     * @param showUid index lines by UID instead of a running counter
     */
    public List<String> summary(ImapMailbox<MessageView> mailbox, List<Long> uids, boolean showUid) {
        List<String> lines = new ArrayList<>();
        int counter = 0;
        for (long uid : uids) {
            MessageView header;
            try {
                header = mailbox.getHeader(uid);
            } catch (ImapBoxException e) {
                log.warn("Summary skips UID {}: {}", uid, e.getMessage());
                continue;
            }
            counter++;
            String index = String.format("%2s", showUid ? String.valueOf(uid) : String.valueOf(counter));
            lines.add(formatLine(index, header.getMessage()));
        }
        return lines;
    }

    /**
     * Selected header fields followed by the first body part.
     * Reading the body part marks the message seen.
     */
    public String displayText(ImapMailbox<MessageView> mailbox, long uid, List<String> headerFields) {
        MessageView header = mailbox.getHeader(uid);
        byte[] body = mailbox.getBodySection(uid, "1");

        StringBuilder text = new StringBuilder();
        List<String> fields = headerFields == null ? DEFAULT_HEADER_FIELDS : headerFields;
        try {
            for (String field : fields) {
                String value = EmlParser.extractHeader(header.getMessage(), field);
                if (value != null) {
                    text.append(field).append(": ").append(value).append('\n');
                }
            }
        } catch (MessagingException e) {
            throw new ImapBoxException("Unreadable header of message " + uid, e);
        }
        text.append('\n');
        text.append(new String(body, StandardCharsets.UTF_8));
        return text.toString();
    }

    String formatLine(String index, MimeMessage message) {
        String from;
        String date;
        String subject;
        try {
            from = EmlParser.extractSenderName(message);
            date = EmlParser.extractHeader(message, "Date");
            subject = EmlParser.extractHeader(message, "Subject");
        } catch (MessagingException e) {
            throw new ImapBoxException("Unreadable header", e);
        }
        int fromWidth = Math.max(0, LINE_FROM_WIDTH - index.length());
        return index + " "
                + fit(from, fromWidth) + " "
                + formatDate(date) + " "
                + fit(subject == null ? "" : subject, SUBJECT_WIDTH);
    }

    static String formatDate(String dateHeader) {
        if (dateHeader == null) {
            return fit("", DATE_WIDTH);
        }
        String cleaned = dateHeader.replaceAll("\\s*\\([^)]*\\)\\s*$", "").trim();
        try {
            return ZonedDateTime.parse(cleaned, DateTimeFormatter.RFC_1123_DATE_TIME).format(LINE_DATE_FMT);
        } catch (DateTimeParseException e) {
            return fit(dateHeader, DATE_WIDTH);
        }
    }

    private static String fit(String value, int width) {
        String truncated = value.length() > width ? value.substring(0, width) : value;
        return String.format("%-" + Math.max(width, 1) + "s", truncated).substring(0, width);
    }
}
