package dk.trustworks.filebridge.transfer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchReport Tests")
class BatchReportTest {

    @Test
    @DisplayName("Should count outcomes by status")
    void shouldCountOutcomes() {
        BatchReport report = BatchReport.builder()
            .add(TransferOutcome.success("a", "a.txt", "s3://bucket/a"))
            .add(TransferOutcome.failed("b", "b.txt", "download failed", "UPSTREAM_UNAVAILABLE"))
            .add(TransferOutcome.skipped("c", "Docs", "not a file (may be a folder)", "ITEM_SKIPPED"))
            .add(TransferOutcome.success("d", "d.txt", "s3://bucket/d"))
            .build();

        assertEquals(4, report.totalFiles());
        assertEquals(2, report.successful());
        assertEquals(1, report.failed());
        assertEquals(1, report.skipped());
        assertEquals("c", report.outcomes().get(2).fileId());
    }

    @Test
    @DisplayName("Should report an empty batch")
    void shouldBuildEmptyReport() {
        BatchReport report = BatchReport.builder().build();

        assertEquals(0, report.totalFiles());
        assertTrue(report.outcomes().isEmpty());
    }

    @Test
    @DisplayName("Should write the snake_case wire format")
    void shouldSerializeWireFormat() {
        BatchReport report = BatchReport.builder()
            .add(TransferOutcome.success("a", "a.txt", "s3://bucket/a"))
            .add(TransferOutcome.skipped("c", "Docs", "not a file (may be a folder)", "ITEM_SKIPPED"))
            .build();

        JsonNode json = new ObjectMapper().valueToTree(report);

        assertEquals(2, json.get("total_files").asInt());
        JsonNode success = json.get("outcomes").get(0);
        assertEquals("a", success.get("file_id").asText());
        assertEquals("a.txt", success.get("file_name").asText());
        assertEquals("success", success.get("status").asText());
        assertEquals("s3://bucket/a", success.get("destination_path").asText());
        assertFalse(success.has("error"));

        JsonNode skipped = json.get("outcomes").get(1);
        assertEquals("skipped", skipped.get("status").asText());
        assertEquals("ITEM_SKIPPED", skipped.get("error_code").asText());
        assertFalse(skipped.has("destination_path"));
    }
}
