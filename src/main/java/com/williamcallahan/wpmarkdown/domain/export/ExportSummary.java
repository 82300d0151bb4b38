package com.williamcallahan.wpmarkdown.domain.export;

import java.util.List;

/**
 * Totals of one export run, serialized as the export report.
 *
 * @param documentsConverted documents whose HTML converted without error
 * @param documentsWritten markdown files written
 * @param documentsSkipped converted documents not written because they are unpublished
 * @param documentsFailed documents that failed conversion or writing
 * @param attachmentsReferenced attachments linked from converted content
 * @param unresolvedSelfLinks links under the blog's own prefix that matched no document or attachment
 * @param failures one entry per failed document
 */
public record ExportSummary(
        int documentsConverted,
        int documentsWritten,
        int documentsSkipped,
        int documentsFailed,
        int attachmentsReferenced,
        List<String> unresolvedSelfLinks,
        List<ExportFailure> failures) {

    public ExportSummary {
        unresolvedSelfLinks = List.copyOf(unresolvedSelfLinks);
        failures = List.copyOf(failures);
    }
}
