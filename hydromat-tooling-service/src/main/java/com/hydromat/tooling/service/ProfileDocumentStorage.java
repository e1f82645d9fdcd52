package com.hydromat.tooling.service;

import com.hydromat.tooling.exception.DocumentStorageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * PDF documents of profiles, kept as plain files named {@code profile_0042_<name>.pdf}.
 */
@Component
public class ProfileDocumentStorage {

    private static final Logger logger = LoggerFactory.getLogger(ProfileDocumentStorage.class);

    static final int MAX_NAME_LENGTH = 50;
    private static final String PDF_EXTENSION = ".pdf";

    private final Path folder;

    public ProfileDocumentStorage(@Value("${app.documents.folder:./profile_pdfs}") String folder) {
        this.folder = Paths.get(folder).toAbsolutePath().normalize();
    }

    @PostConstruct
    void init() {
        try {
            Files.createDirectories(folder);
            logger.info("Profile documents folder: {}", folder);
        } catch (IOException e) {
            throw new DocumentStorageException("Cannot create documents folder " + folder, e);
        }
    }

    /**
     * Writes the document. An identical file already on disk is left untouched. Older documents of
     * the profile stay in place until {@link #deleteAllExcept} is called.
     *
     * @return the stored file
     */
    public Path store(long profileId, byte[] content, String originalFilename) {
        if (content == null || content.length == 0) {
            throw new DocumentStorageException("PDF data is empty", null);
        }
        Path target = folder.resolve(fileNameFor(profileId, originalFilename));
        try {
            Files.createDirectories(folder);
            if (Files.isRegularFile(target) && sha256(Files.readAllBytes(target)).equals(sha256(content))) {
                logger.info("PDF for profile {} unchanged, skipping write of {}", profileId, target.getFileName());
            } else {
                Files.write(target, content);
                logger.info("Stored PDF for profile {}: {} ({} bytes)", profileId, target.getFileName(), content.length);
            }
            return target;
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to store PDF for profile " + profileId, e);
        }
    }

    /**
     * Reads a stored document. A missing file yields empty rather than an error.
     */
    public Optional<byte[]> load(String storedPath) {
        if (storedPath == null || storedPath.isBlank()) {
            return Optional.empty();
        }
        Path path = Paths.get(storedPath);
        if (!Files.isRegularFile(path)) {
            logger.warn("PDF file not found: {}", storedPath);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to read PDF " + storedPath, e);
        }
    }

    /**
     * Removes every document of the profile.
     *
     * @return true when at least one file was deleted
     */
    public boolean deleteAll(long profileId) {
        boolean deleted = false;
        for (Path file : findProfileFiles(profileId)) {
            try {
                deleted |= Files.deleteIfExists(file);
                logger.info("Deleted PDF {}", file.getFileName());
            } catch (IOException e) {
                logger.warn("Could not delete PDF {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return deleted;
    }

    static String fileNameFor(long profileId, String originalFilename) {
        String prefix = String.format(Locale.ROOT, "profile_%04d", profileId);
        String safe = safeName(originalFilename);
        if (safe.isEmpty()) {
            return prefix + PDF_EXTENSION;
        }
        String name = prefix + "_" + safe;
        return name.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION) ? name : name + PDF_EXTENSION;
    }

    /**
     * Keeps letters, digits, space, '-', '_' and '.'; everything else becomes '_'.
     */
    static String safeName(String filename) {
        if (filename == null) {
            return "";
        }
        String base = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        StringBuilder builder = new StringBuilder(base.length());
        for (char c : base.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_' || c == '.') {
                builder.append(c);
            } else {
                builder.append('_');
            }
        }
        String safe = builder.toString();
        while (safe.contains("__")) {
            safe = safe.replace("__", "_");
        }
        if (safe.length() > MAX_NAME_LENGTH) {
            safe = safe.substring(0, MAX_NAME_LENGTH);
        }
        return strip(safe, " _-.");
    }

    /**
     * Removes the documents of the profile other than {@code keep}.
     */
    public void deleteAllExcept(long profileId, Path keep) {
        Path normalized = keep.toAbsolutePath().normalize();
        for (Path file : findProfileFiles(profileId)) {
            if (file.equals(normalized)) {
                continue;
            }
            try {
                Files.deleteIfExists(file);
                logger.info("Deleted old PDF: {}", file.getFileName());
            } catch (IOException e) {
                logger.warn("Could not delete old PDF {}: {}", file.getFileName(), e.getMessage());
            }
        }
    }

    /**
     * Removes a single stored file; used to discard a document whose profile change was rolled back.
     */
    public void delete(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Discarded PDF {}", file.getFileName());
            }
        } catch (IOException e) {
            logger.warn("Could not discard PDF {}: {}", file.getFileName(), e.getMessage());
        }
    }

    private List<Path> findProfileFiles(long profileId) {
        String exact = String.format(Locale.ROOT, "profile_%04d.pdf", profileId);
        String named = String.format(Locale.ROOT, "profile_%04d_", profileId);
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(folder)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                String lower = name.toLowerCase(Locale.ROOT);
                if (Files.isRegularFile(file) && lower.endsWith(PDF_EXTENSION)
                        && (name.equals(exact) || name.startsWith(named))) {
                    files.add(file.toAbsolutePath().normalize());
                }
            }
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to list PDFs of profile " + profileId, e);
        }
        files.sort(null);
        return files;
    }

    private static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    private static String sha256(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] encoded = digest.digest(data);
            StringBuilder builder = new StringBuilder(encoded.length * 2);
            for (byte b : encoded) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) builder.append('0');
                builder.append(hex);
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
