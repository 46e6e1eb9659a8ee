package com.imapbox.util;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * RFC 822 parsing/serialization based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serialize a MimeMessage to bytes
     */
    public static byte[] toBytes(MimeMessage message) throws MessagingException {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            message.writeTo(outputStream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return outputStream.toByteArray();
    }

    /**
     * Display name of the first From address, or the bare address if it has none
     */
    public static String extractSenderName(MimeMessage message) throws MessagingException {
        String from = message.getHeader("From", ",");
        if (from == null || from.isBlank()) {
            return "unknown@unknown";
        }
        try {
            InternetAddress[] addresses = InternetAddress.parseHeader(from, false);
            if (addresses.length == 0) {
                return from.trim();
            }
            InternetAddress address = addresses[0];
            String personal = address.getPersonal();
            return personal != null && !personal.isBlank() ? personal : address.getAddress();
        } catch (MessagingException e) {
            log.debug("Unparsable From header: {}", from);
            return from.trim();
        }
    }

    /**
     * Decoded value of a header, or null if absent
     */
    public static String extractHeader(MimeMessage message, String name) throws MessagingException {
        String value = message.getHeader(name, ", ");
        if (value == null) {
            return null;
        }
        try {
            return MimeUtility.decodeText(MimeUtility.unfold(value));
        } catch (IOException e) {
            log.debug("Undecodable {} header kept raw: {}", name, e.getMessage());
            return value;
        }
    }
}
