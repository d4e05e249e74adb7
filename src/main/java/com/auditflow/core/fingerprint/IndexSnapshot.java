package com.auditflow.core.fingerprint;

import com.auditflow.core.model.FileRecord;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * The persisted fingerprint index as loaded from disk.
 *
 * @param lastUpdated when the index was committed
 * @param files       relative path to its record
 */
public record IndexSnapshot(Instant lastUpdated, Map<String, FileRecord> files) {

    public Map<String, String> fingerprints() {
        var fingerprints = new TreeMap<String, String>();
        files.forEach((path, record) -> fingerprints.put(path, record.fingerprint()));
        return fingerprints;
    }
}
