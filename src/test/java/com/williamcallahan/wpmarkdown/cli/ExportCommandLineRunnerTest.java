package com.williamcallahan.wpmarkdown.cli;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.williamcallahan.wpmarkdown.config.AppProperties;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import com.williamcallahan.wpmarkdown.domain.export.ExportSummary;
import com.williamcallahan.wpmarkdown.service.export.WordPressExportService;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies that the runner exports only when an input file is configured.
 */
class ExportCommandLineRunnerTest {

    private WordPressExportService exportService;
    private AppProperties appProperties;

    @BeforeEach
    void setUp() {
        exportService = mock(WordPressExportService.class);
        appProperties = new AppProperties();
    }

    @Test
    void doesNothingWithoutInputFile() {
        new ExportCommandLineRunner(exportService, appProperties).run();

        verifyNoInteractions(exportService);
    }

    @Test
    void exportsConfiguredFileIntoOutputDirectory() {
        appProperties.getExport().setInputFile("blog.xml");
        appProperties.getExport().setOutputDir("out");
        when(exportService.export(any(Path.class), any(Path.class))).thenReturn(new ExportSummary(
                1, 0, 0, 1, 0, List.of(), List.of(new ExportFailure("a", "A", "convert", "bad"))));

        new ExportCommandLineRunner(exportService, appProperties).run();

        verify(exportService).export(Path.of("blog.xml"), Path.of("out"));
    }
}
