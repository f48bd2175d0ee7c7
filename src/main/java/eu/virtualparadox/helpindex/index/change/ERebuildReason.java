package eu.virtualparadox.helpindex.index.change;

public enum ERebuildReason {
    UP_TO_DATE,
    FORCED,
    MISSING_METADATA,
    SOURCE_CHANGED,
    SCHEMA_CHANGED,
    INDEX_MISSING
}
