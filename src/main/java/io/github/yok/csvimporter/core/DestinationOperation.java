package io.github.yok.csvimporter.core;

/**
 * Destination operation during which a database failure occurred.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DestinationOperation {
    CONNECT, METADATA_FETCH, DDL, BATCH_INSERT
}
