package com.williamcallahan.wpmarkdown.service.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.wpmarkdown.domain.export.ExportFailure;
import com.williamcallahan.wpmarkdown.domain.export.ExportSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies the JSON export report.
 */
class ExportReportWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExportReportWriter reportWriter;
    private ExportSummary summary;

    @BeforeEach
    void setUp() {
        reportWriter = new ExportReportWriter(objectMapper);
        summary = new ExportSummary(3, 2, 1, 1, 4, List.of("http://blog.example.com/missing/"),
                List.of(new ExportFailure("broken", "Broken", "convert", "CaptionShapeException: bad")));
    }

    @Test
    void serializesTotalsAndFailures() throws IOException {
        JsonNode report = objectMapper.readTree(reportWriter.toJson(summary));

        assertEquals(3, report.get("documentsConverted").asInt());
        assertEquals(2, report.get("documentsWritten").asInt());
        assertEquals(1, report.get("documentsSkipped").asInt());
        assertEquals(1, report.get("documentsFailed").asInt());
        assertEquals(4, report.get("attachmentsReferenced").asInt());
        assertEquals("http://blog.example.com/missing/", report.get("unresolvedSelfLinks").get(0).asText());
        assertEquals("convert", report.get("failures").get(0).get("phase").asText());
    }

    @Test
    void writesIndentedReportFile(@TempDir Path tempDir) throws IOException {
        Path reportFile = tempDir.resolve("reports").resolve("export-report.json");

        reportWriter.write(reportFile, summary);

        String json = Files.readString(reportFile);
        assertTrue(json.contains("\n"), "Report should be pretty printed");
        assertEquals(2, objectMapper.readTree(json).get("documentsWritten").asInt());
    }
}
