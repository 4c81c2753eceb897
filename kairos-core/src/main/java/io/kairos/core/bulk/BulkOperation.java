package io.kairos.core.bulk;

public enum BulkOperation {
    ENABLE,
    DISABLE,
    DELETE
}
