package com.williamcallahan.wpmarkdown.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.williamcallahan.wpmarkdown.domain.export.ExportSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Serializes an export summary as an indented JSON report.
 */
@Service
public class ExportReportWriter {

    private final ObjectMapper reportMapper;

    /**
     * Creates a report writer from the application's ObjectMapper.
     */
    public ExportReportWriter(ObjectMapper objectMapper) {
        this.reportMapper = Objects.requireNonNull(objectMapper, "objectMapper")
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes the report, replacing an existing file.
     *
     * @param reportFile destination file
     * @param summary run totals
     * @throws IOException if the file cannot be written
     */
    public void write(Path reportFile, ExportSummary summary) throws IOException {
        Objects.requireNonNull(summary, "summary");
        if (reportFile.getParent() != null) {
            Files.createDirectories(reportFile.getParent());
        }
        reportMapper.writeValue(reportFile.toFile(), summary);
    }

    String toJson(ExportSummary summary) throws IOException {
        return reportMapper.writeValueAsString(summary);
    }
}
