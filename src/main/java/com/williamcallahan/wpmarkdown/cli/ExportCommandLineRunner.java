package com.williamcallahan.wpmarkdown.cli;

import com.williamcallahan.wpmarkdown.config.AppProperties;
import com.williamcallahan.wpmarkdown.config.ExportConfig;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import com.williamcallahan.wpmarkdown.domain.export.ExportSummary;
import com.williamcallahan.wpmarkdown.service.export.WordPressExportService;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one export when {@code app.export.input-file} is set, for example
 * {@code java -jar wp-markdown.jar --app.export.input-file=blog.wordpress.xml}.
 */
@Component
public class ExportCommandLineRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ExportCommandLineRunner.class);

    private final WordPressExportService exportService;
    private final ExportConfig exportConfig;

    public ExportCommandLineRunner(WordPressExportService exportService, AppProperties appProperties) {
        this.exportService = Objects.requireNonNull(exportService, "exportService");
        this.exportConfig = Objects.requireNonNull(appProperties, "appProperties").getExport();
    }

    @Override
    public void run(String... args) {
        if (!exportConfig.hasInputFile()) {
            log.info("No export file configured; pass --app.export.input-file=<wordpress-export.xml> to convert a blog");
            return;
        }

        Path inputFile = Path.of(exportConfig.getInputFile());
        Path outputDir = Path.of(exportConfig.getOutputDir());
        log.info("===============================================");
        log.info("Starting WordPress export");
        log.info("===============================================");
        log.info("Export file: {}", inputFile);
        log.info("Output directory: {}", outputDir);
        log.info("Media directory: {}", outputDir.resolve(exportConfig.getMediaDir()));
        log.info("Published only: {}", exportConfig.isPublishedOnly());

        long startTime = System.currentTimeMillis();
        ExportSummary summary = exportService.export(inputFile, outputDir);
        long duration = System.currentTimeMillis() - startTime;

        log.info("===============================================");
        log.info("EXPORT COMPLETE in {} ms", duration);
        log.info("===============================================");
        log.info("Documents converted: {}", summary.documentsConverted());
        log.info("Documents written: {}", summary.documentsWritten());
        log.info("Documents skipped (unpublished): {}", summary.documentsSkipped());
        log.info("Documents failed: {}", summary.documentsFailed());
        log.info("Attachments referenced: {} (see {}/MANIFEST.txt)", summary.attachmentsReferenced(), exportConfig.getMediaDir());
        for (ExportFailure failure : summary.failures()) {
            log.warn("  {} [{}] {}", failure.documentId(), failure.phase(), failure.details());
        }
        log.info("Report: {}", outputDir.resolve(exportConfig.getReportFile()));
    }
}
