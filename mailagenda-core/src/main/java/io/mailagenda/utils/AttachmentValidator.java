package io.mailagenda.utils;

import io.mailagenda.core.ValidationException.Problem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Checks that an attachment reference points at a readable regular file within the size limit
 * most SMTP relays accept.
 */
public final class AttachmentValidator {

    public static final long MAX_ATTACHMENT_BYTES = 25L * 1024 * 1024;

    private AttachmentValidator() {
    }

    public static Optional<Problem> validate(String file) {
        if (file == null || file.isBlank()) {
            return Optional.of(Problem.of("attachments", "Attachment path can't be empty."));
        }

        Path path;
        try {
            path = Path.of(file);
        } catch (InvalidPathException e) {
            return Optional.of(Problem.of("attachments", "Invalid attachment path: " + file));
        }

        if (!Files.exists(path)) {
            return Optional.of(new Problem("attachments", "File not found: " + file,
                    "Double-check the path. Use absolute paths if unsure."));
        }
        if (!Files.isRegularFile(path)) {
            return Optional.of(Problem.of("attachments", "'" + file + "' is not a regular file."));
        }
        if (!Files.isReadable(path)) {
            return Optional.of(Problem.of("attachments", "File is not readable: " + file));
        }

        try {
            long size = Files.size(path);
            if (size > MAX_ATTACHMENT_BYTES) {
                return Optional.of(new Problem("attachments",
                        "'" + path.getFileName() + "' is " + (size / (1024 * 1024)) + " MB, over the 25 MB limit.",
                        "Share large files through a link instead."));
            }
        } catch (IOException e) {
            return Optional.of(Problem.of("attachments", "Can't read size of " + file + ": " + e.getMessage()));
        }
        return Optional.empty();
    }
}
