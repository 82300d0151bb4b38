package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import com.williamcallahan.wpmarkdown.service.markdown.CaptionShapeException;
import com.williamcallahan.wpmarkdown.service.markdown.StructuralMarkupException;
import com.williamcallahan.wpmarkdown.service.markdown.UnsupportedMarkupException;
import com.williamcallahan.wpmarkdown.service.markdown.UnsupportedShortcodeException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Turns a per-document exception into an {@link ExportFailure} whose details say what to fix in the post.
 *
 * <p>Details read {@code Type: message (hint)} when the exception type, or one of its supertypes,
 * has a known remedy, and {@code Type: message; root cause Type: message} otherwise.</p>
 */
@Service
public class ExportFailureFactory {

    /** Phase name for HTML to markdown conversion. */
    public static final String PHASE_CONVERT = "convert";

    /** Phase name for writing the markdown file. */
    public static final String PHASE_WRITE = "write";

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final Map<Class<?>, String> REMEDIES = Map.of(
            StructuralMarkupException.class, "shortcode open/close tags do not nest",
            CaptionShapeException.class, "caption must wrap an image, optionally inside a link",
            UnsupportedShortcodeException.class, "shortcode is registered but has no rendering rule",
            UnsupportedMarkupException.class, "content contains markup that never belongs in a post",
            AccessDeniedException.class, "permission denied",
            FileSystemException.class, "file system rejected the write");

    /**
     * Records why {@code document} failed in {@code phase}.
     *
     * @param document the document that failed
     * @param phase {@link #PHASE_CONVERT} or {@link #PHASE_WRITE}
     * @param exception what went wrong
     * @return failure record
     */
    public ExportFailure failure(BlogDocument document, String phase, Exception exception) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(exception, "exception");

        String details = remedyFor(exception.getClass())
                .map(remedy -> describe(exception) + " (" + remedy + ")")
                .orElseGet(() -> withRootCause(exception));
        return new ExportFailure(document.id(), document.title(), phase, details);
    }

    private static Optional<String> remedyFor(Class<?> type) {
        for (Class<?> candidate = type; candidate != null; candidate = candidate.getSuperclass()) {
            String remedy = REMEDIES.get(candidate);
            if (remedy != null) {
                return Optional.of(remedy);
            }
        }
        return Optional.empty();
    }

    private static String withRootCause(Throwable exception) {
        Throwable root = exception;
        for (int depth = 0; depth < MAX_CAUSE_DEPTH && root.getCause() != null; depth++) {
            root = root.getCause();
        }
        return root == exception ? describe(exception) : describe(exception) + "; root cause " + describe(root);
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        String type = throwable.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
