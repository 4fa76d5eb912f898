package dk.trustworks.filebridge.transfer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a transfer batch. {@code totalFiles == successful + failed + skipped == outcomes.size()},
 * outcomes in request order.
 */
public record BatchReport(
    @JsonProperty("total_files") int totalFiles,
    int successful,
    int failed,
    int skipped,
    List<TransferOutcome> outcomes
) {
    public BatchReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates outcomes; counters move together with the list.
     */
    public static final class Builder {

        private final List<TransferOutcome> outcomes = new ArrayList<>();
        private int successful;
        private int failed;
        private int skipped;

        private Builder() {
        }

        public synchronized Builder add(TransferOutcome outcome) {
            switch (outcome.status()) {
                case SUCCESS -> successful++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
            outcomes.add(outcome);
            return this;
        }

        public synchronized BatchReport build() {
            return new BatchReport(outcomes.size(), successful, failed, skipped, outcomes);
        }
    }
}
