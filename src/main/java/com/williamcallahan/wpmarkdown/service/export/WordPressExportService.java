package com.williamcallahan.wpmarkdown.service.export;

import com.williamcallahan.wpmarkdown.config.AppProperties;
import com.williamcallahan.wpmarkdown.config.ExportConfig;
import com.williamcallahan.wpmarkdown.domain.export.Blog;
import com.williamcallahan.wpmarkdown.domain.export.BlogDocument;
import com.williamcallahan.wpmarkdown.domain.export.ConvertedDocument;
import com.williamcallahan.wpmarkdown.domain.export.DocumentOutcome;
import com.williamcallahan.wpmarkdown.domain.export.ExportChannel;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import com.williamcallahan.wpmarkdown.domain.export.ExportSummary;
import com.williamcallahan.wpmarkdown.service.markdown.HtmlToMarkdownConverter;
import com.williamcallahan.wpmarkdown.service.markdown.MarkupConversionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one WordPress export: read, assemble, convert every document, then write files and the report.
 *
 * <p>Export-level problems abort before anything is written. A document that fails conversion is
 * logged, recorded in the report and skipped; the rest of the blog is still exported.</p>
 */
@Service
public class WordPressExportService {
    private static final Logger log = LoggerFactory.getLogger(WordPressExportService.class);

    private final WxrExportReader exportReader;
    private final BlogAssembler blogAssembler;
    private final HtmlToMarkdownConverter converter;
    private final BlogExporter blogExporter;
    private final ExportReportWriter reportWriter;
    private final ExportFailureFactory failureFactory;
    private final ExportConfig exportConfig;
    private final Random attachmentNameRandom;

    public WordPressExportService(
            WxrExportReader exportReader,
            BlogAssembler blogAssembler,
            HtmlToMarkdownConverter converter,
            BlogExporter blogExporter,
            ExportReportWriter reportWriter,
            ExportFailureFactory failureFactory,
            AppProperties appProperties,
            Random attachmentNameRandom) {
        this.exportReader = Objects.requireNonNull(exportReader, "exportReader");
        this.blogAssembler = Objects.requireNonNull(blogAssembler, "blogAssembler");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.blogExporter = Objects.requireNonNull(blogExporter, "blogExporter");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
        this.exportConfig = Objects.requireNonNull(appProperties, "appProperties").getExport();
        this.attachmentNameRandom = Objects.requireNonNull(attachmentNameRandom, "attachmentNameRandom");
    }

    /**
     * Exports {@code exportFile} into {@code outputDir}.
     *
     * @param exportFile WordPress export XML
     * @param outputDir destination directory
     * @return run totals, also written as the JSON report
     * @throws ExportFormatException when the export itself is unusable
     * @throws UncheckedIOException when the output directory, manifest or report cannot be written
     */
    public ExportSummary export(Path exportFile, Path outputDir) {
        Objects.requireNonNull(exportFile, "exportFile");
        Objects.requireNonNull(outputDir, "outputDir");

        ExportChannel channel = exportReader.read(exportFile);
        Blog blog = blogAssembler.assemble(channel);
        ExportUrlRewriter urlRewriter = new ExportUrlRewriter(
                blog, exportConfig.getMediaDir(), exportConfig.getSelfLinkPrefix(), attachmentNameRandom);

        List<ExportFailure> failures = new ArrayList<>();
        List<ConvertedDocument> converted = new ArrayList<>();
        for (BlogDocument document : blog.documents()) {
            try {
                converted.add(new ConvertedDocument(document, converter.convert(document.contentHtml(), urlRewriter)));
            } catch (MarkupConversionException exception) {
                log.error("Failed to convert '{}' ({}): {}", document.title(), document.id(), exception.getMessage());
                failures.add(failureFactory.failure(document, ExportFailureFactory.PHASE_CONVERT, exception));
            }
        }

        int written = 0;
        int skipped = 0;
        Map<String, String> attachments = urlRewriter.referencedAttachments();
        try {
            Path mediaPath = blogExporter.prepare(outputDir, exportConfig.getMediaDir());
            for (ConvertedDocument document : converted) {
                DocumentOutcome outcome = blogExporter.export(outputDir, document, exportConfig.isPublishedOnly());
                if (outcome.written()) {
                    written++;
                } else if (outcome.failure().isPresent()) {
                    failures.add(outcome.failure().get());
                } else {
                    skipped++;
                }
            }
            blogExporter.writeManifest(mediaPath, attachments);

            ExportSummary summary = new ExportSummary(
                    converted.size(),
                    written,
                    skipped,
                    failures.size(),
                    attachments.size(),
                    new ArrayList<>(urlRewriter.unresolvedSelfLinks()),
                    failures);
            reportWriter.write(outputDir.resolve(exportConfig.getReportFile()), summary);
            return summary;
        } catch (IOException exception) {
            throw new UncheckedIOException("Failed to write export output to " + outputDir, exception);
        }
    }
}
