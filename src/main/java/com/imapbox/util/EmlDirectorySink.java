package com.imapbox.util;

import com.imapbox.domain.MessageView;
import com.imapbox.exception.ImapBoxException;
import com.imapbox.mailbox.MessageSink;
import jakarta.mail.MessagingException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Local EML file store usable as a copy/move/backup target.
 * Path structure: basePath/YYYY/MM/DD/unixTime_random.eml
 */
@Slf4j
public class EmlDirectorySink implements MessageSink<String> {

    static final String LOCK_FILE = ".imapbox.lock";

    private static final DateTimeFormatter YEAR_FMT = DateTimeFormatter.ofPattern("yyyy");
    private static final DateTimeFormatter MONTH_FMT = DateTimeFormatter.ofPattern("MM");
    private static final DateTimeFormatter DAY_FMT = DateTimeFormatter.ofPattern("dd");

    @Getter
    private final String basePath;

    public EmlDirectorySink(String basePath) {
        this.basePath = basePath;
    }

    /**
     * Write the message as an EML file
     *
     * @return path of the file relative to basePath
     */
    @Override
    public String add(MessageView message) {
        try {
            return saveEml(basePath, EmlParser.toBytes(message.getMessage()));
        } catch (MessagingException e) {
            throw new ImapBoxException("Message " + message.getUid() + " could not be serialized", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Files are written synchronously
     */
    @Override
    public void flush() {
    }

    /**
     * Create the lock file; fails if another writer holds it
     */
    @Override
    public void lock() {
        Path lockFile = Paths.get(basePath, LOCK_FILE);
        try {
            Files.createDirectories(lockFile.getParent());
            Files.createFile(lockFile);
            log.debug("Locked {}", basePath);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("EML directory is locked: " + lockFile, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void unlock() {
        try {
            Files.deleteIfExists(Paths.get(basePath, LOCK_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Generate an EML storage directory (YYYY/MM/DD)
     */
    public static Path generateEmlPath(String basePath) {
        LocalDate now = LocalDate.now();
        return Paths.get(basePath,
                now.format(YEAR_FMT),
                now.format(MONTH_FMT),
                now.format(DAY_FMT));
    }

    /**
     * Generate a unique EML filename: unixTime_random.eml
     */
    public static String generateEmlFilename() {
        long unixTime = Instant.now().getEpochSecond();
        int random = ThreadLocalRandom.current().nextInt(100000, 999999);
        return unixTime + "_" + random + ".eml";
    }

    /**
     * Save EML file
     * @return relative path of the saved file
     */
    public static String saveEml(String basePath, byte[] emlData) throws IOException {
        Path dir = generateEmlPath(basePath);
        Files.createDirectories(dir);

        Path filePath = dir.resolve(generateEmlFilename());
        while (Files.exists(filePath)) {
            filePath = dir.resolve(generateEmlFilename());
        }
        Files.write(filePath, emlData);
        log.debug("EML saved: {}", filePath);

        return Paths.get(basePath).relativize(filePath).toString().replace('\\', '/');
    }

    @Override
    public String toString() {
        return "EmlDirectorySink[" + basePath + "]";
    }
}
