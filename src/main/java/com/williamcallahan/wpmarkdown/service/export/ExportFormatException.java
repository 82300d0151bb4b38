package com.williamcallahan.wpmarkdown.service.export;

/**
 * Signals a WordPress export that cannot be turned into a blog at all.
 *
 * <p>Unlike per-document conversion failures this aborts the whole run before anything is written.</p>
 */
public class ExportFormatException extends RuntimeException {

    public ExportFormatException(String message) {
        super(message);
    }

    public ExportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
