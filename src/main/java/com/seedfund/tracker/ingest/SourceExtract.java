package com.seedfund.tracker.ingest;

/**
 * Raw bytes of one tracking extract (CSV, or a ZIP holding one) with its file name.
 */
public record SourceExtract(String fileName, byte[] content) {
}
