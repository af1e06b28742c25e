package com.flagship.marketplace.evidence;

import com.flagship.marketplace.error.MarketplaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Stores evidence files in a local directory, one file per object named by a random UUID.
 */
@Component
@Slf4j
public class FileSystemEvidenceStorage implements EvidenceStorage {

    private static final Pattern REF_PATTERN = Pattern.compile("^[0-9a-f]{8}(-[0-9a-f]{4}){3}-[0-9a-f]{12}$");

    private final Path directory;

    public FileSystemEvidenceStorage(@Value("${marketplace.evidence.storage-dir}") Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public String put(byte[] content) {
        String ref = UUID.randomUUID().toString();
        try {
            Files.createDirectories(directory);
            Files.write(directory.resolve(ref), content, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw MarketplaceException.unavailable("Evidence storage is unavailable", e);
        }
        log.debug("Stored evidence object {} ({} bytes)", ref, content.length);
        return ref;
    }

    @Override
    public void delete(String ref) {
        if (ref == null || !REF_PATTERN.matcher(ref).matches()) {
            log.debug("Ignoring delete of foreign evidence reference {}", ref);
            return;
        }
        try {
            if (Files.deleteIfExists(directory.resolve(ref))) {
                log.debug("Deleted evidence object {}", ref);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete evidence object " + ref, e);
        }
    }

    public boolean exists(String ref) {
        return ref != null && REF_PATTERN.matcher(ref).matches() && Files.exists(directory.resolve(ref));
    }
}
