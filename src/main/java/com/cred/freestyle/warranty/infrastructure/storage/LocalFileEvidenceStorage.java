package com.cred.freestyle.warranty.infrastructure.storage;

import com.cred.freestyle.warranty.exception.EvidenceStorageException;
import com.cred.freestyle.warranty.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Evidence storage on the local filesystem.
 *
 * Generated names follow {@code <prefix><yyyyMMdd'T'HHmmssSSS>_<8 hex chars>.<ext>}
 * and are written with create-new semantics, so an existing file is never
 * overwritten. References are plain file names; anything that could escape
 * the storage directory is rejected.
 *
 * @author Warranty Platform Team
 */
@Component
public class LocalFileEvidenceStorage implements EvidenceStorage {

    private static final Logger logger = LoggerFactory.getLogger(LocalFileEvidenceStorage.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS");
    private static final int MAX_NAME_ATTEMPTS = 3;

    private final Path storageDir;

    public LocalFileEvidenceStorage(@Value("${warranty.evidence.storage-dir:./uploads/bills}") String storageDir) {
        this.storageDir = Paths.get(storageDir).toAbsolutePath().normalize();
    }

    @Override
    public String store(String namePrefix, String extension, byte[] content) {
        try {
            Files.createDirectories(storageDir);
        } catch (IOException e) {
            throw new EvidenceStorageException("Could not create evidence directory " + storageDir, e);
        }

        String prefix = sanitize(namePrefix);
        String suffix = extension == null || extension.isBlank() ? "" : "." + sanitize(extension);

        for (int attempt = 1; attempt <= MAX_NAME_ATTEMPTS; attempt++) {
            String reference = prefix
                    + ZonedDateTime.now(ZoneOffset.UTC).format(TIMESTAMP_FORMAT)
                    + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8)
                    + suffix;
            Path target = storageDir.resolve(reference);
            try {
                writeNew(target, content);
                logger.info("Stored evidence {} ({} bytes)", reference, content.length);
                return reference;
            } catch (FileAlreadyExistsException e) {
                logger.warn("Evidence name collision on {}, generating a new name", reference);
            } catch (IOException e) {
                // No reference is returned, so no partial file may remain
                EvidenceStorageException failure = new EvidenceStorageException("Could not store evidence " + reference, e);
                try {
                    Files.deleteIfExists(target);
                } catch (IOException cleanup) {
                    logger.error("Could not remove partially written evidence {}", reference, cleanup);
                    failure.addSuppressed(cleanup);
                }
                throw failure;
            }
        }
        throw new EvidenceStorageException("Could not generate a unique evidence name for prefix " + prefix);
    }

    void writeNew(Path target, byte[] content) throws IOException {
        Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public byte[] load(String reference) {
        Path path = resolve(reference);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException("Evidence", reference);
        } catch (IOException e) {
            throw new EvidenceStorageException("Could not read evidence " + reference, e);
        }
    }

    @Override
    public boolean delete(String reference) {
        Path path = resolve(reference);
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                logger.info("Deleted evidence {}", reference);
            } else {
                logger.debug("Evidence {} already absent", reference);
            }
            return deleted;
        } catch (IOException e) {
            throw new EvidenceStorageException("Could not delete evidence " + reference, e);
        }
    }

    private Path resolve(String reference) {
        if (reference == null || reference.isBlank()
                || reference.contains("/") || reference.contains("\\") || reference.contains("..")) {
            throw new EvidenceStorageException("Invalid evidence reference: " + reference);
        }
        Path path = storageDir.resolve(reference).normalize();
        if (!path.startsWith(storageDir)) {
            throw new EvidenceStorageException("Invalid evidence reference: " + reference);
        }
        return path;
    }

    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
