package dk.trustworks.filebridge.transfer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TransferStatus {
    SUCCESS,
    FAILED,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
