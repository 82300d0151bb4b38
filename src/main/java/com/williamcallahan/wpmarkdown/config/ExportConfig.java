package com.williamcallahan.wpmarkdown.config;

import java.util.Locale;

/**
 * WordPress export run configuration.
 */
public class ExportConfig {

    private static final String OUTPUT_DIR_DEF = "posts";
    private static final String MEDIA_DIR_DEF = "wpmedia";
    private static final String REPORT_FILE_DEF = "export-report.json";
    private static final String INPUT_FILE_KEY = "app.export.input-file";
    private static final String OUTPUT_DIR_KEY = "app.export.output-dir";
    private static final String MEDIA_DIR_KEY = "app.export.media-dir";
    private static final String REPORT_FILE_KEY = "app.export.report-file";
    private static final String SELF_LINK_PREFIX_KEY = "app.export.self-link-prefix";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String RELATIVE_FMT = "%s must be a relative path inside the output directory.";

    private String inputFile = "";
    private String outputDir = OUTPUT_DIR_DEF;
    private String mediaDir = MEDIA_DIR_DEF;
    private boolean publishedOnly = true;
    private String reportFile = REPORT_FILE_DEF;
    private String selfLinkPrefix = "";

    /**
     * Creates export configuration.
     */
    public ExportConfig() {
    }

    /**
     * Validates export settings.
     */
    public void validateConfiguration() {
        if (outputDir.isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, OUTPUT_DIR_KEY));
        }
        if (mediaDir.isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, MEDIA_DIR_KEY));
        }
        if (reportFile.isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, REPORT_FILE_KEY));
        }
        if (mediaDir.startsWith("/") || mediaDir.contains("..")) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, RELATIVE_FMT, MEDIA_DIR_KEY));
        }
    }

    /**
     * Returns whether an export file is configured.
     *
     * @return true when there is something to export
     */
    public boolean hasInputFile() {
        return !inputFile.isBlank();
    }

    public String getInputFile() {
        return inputFile;
    }

    public void setInputFile(final String inputFile) {
        this.inputFile = requireNonNullText(INPUT_FILE_KEY, inputFile);
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(final String outputDir) {
        this.outputDir = requireNonNullText(OUTPUT_DIR_KEY, outputDir);
    }

    /**
     * Returns the media directory, relative to the output directory and to emitted markdown links.
     *
     * @return media directory name
     */
    public String getMediaDir() {
        return mediaDir;
    }

    public void setMediaDir(final String mediaDir) {
        this.mediaDir = requireNonNullText(MEDIA_DIR_KEY, mediaDir);
    }

    /**
     * Returns whether only published documents are written.
     *
     * @return true to skip drafts, pending and private documents
     */
    public boolean isPublishedOnly() {
        return publishedOnly;
    }

    public void setPublishedOnly(final boolean publishedOnly) {
        this.publishedOnly = publishedOnly;
    }

    public String getReportFile() {
        return reportFile;
    }

    public void setReportFile(final String reportFile) {
        this.reportFile = requireNonNullText(REPORT_FILE_KEY, reportFile);
    }

    /**
     * Returns the URL prefix of the blog's own site; unresolved links under it are reported.
     *
     * @return self-link prefix, empty to disable reporting
     */
    public String getSelfLinkPrefix() {
        return selfLinkPrefix;
    }

    public void setSelfLinkPrefix(final String selfLinkPrefix) {
        this.selfLinkPrefix = requireNonNullText(SELF_LINK_PREFIX_KEY, selfLinkPrefix);
    }

    private static String requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
        return text;
    }
}
