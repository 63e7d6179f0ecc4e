package org.timberline.pipeline.api.resources.storage;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/**
 * Thrown when an artifact cannot be written, read or deleted.
 * <p>
 * {@link #isRetryable()} tells whether the failure looks transient. Writers retry
 * transient failures a configured number of times; everything else is fatal for the
 * operation.
 */
public class ArtifactIOException extends IOException {

    private final boolean retryable;

    public ArtifactIOException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ArtifactIOException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Wraps an I/O failure, classifying it as retryable unless it is one of the
     * permanent file-system conditions (missing path, permissions, wrong file type).
     *
     * @param message context of the failed operation
     * @param cause   the underlying failure
     * @return the wrapped exception
     */
    public static ArtifactIOException wrap(String message, IOException cause) {
        if (cause instanceof ArtifactIOException artifactError) {
            return artifactError;
        }
        boolean permanent = cause instanceof AccessDeniedException
            || cause instanceof NoSuchFileException
            || cause instanceof FileAlreadyExistsException
            || cause instanceof NotDirectoryException;
        return new ArtifactIOException(message + ": " + cause.getMessage(), cause, !permanent);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
