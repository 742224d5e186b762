package com.ragengine.ingest;

public enum IndexingStatus {
    COMPLETED,
    VALIDATION_FAILED,
    CREDENTIAL_MISSING,
    SCHEMA_FAILED,
    SCAN_FAILED,
    TRANSACTION_FAILED
}
