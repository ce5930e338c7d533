package com.guardian.custody;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of verifying one bundle. A failing bundle is still evidence, so
 * every problem is reported here rather than thrown.
 *
 * @param perFile manifest path (and any unlisted archive entry) to digest check result
 * @param archiveValid whether the archive digest matched, null when the manifest declares none
 * @param chainValid whether every record re-hashed and linked correctly
 * @param finalPass all files pass, chain valid, archive valid and record count as declared
 * @param declaredRecordCount record count declared by the manifest, null if unreadable
 * @param actualRecordCount record entries present in the archive
 * @param brokenAtSequence first sequence whose chain check failed, null if none
 * @param invalidRecords every sequence invalidated by the break
 * @param notes human readable findings in discovery order
 */
public record VerificationReport(
    @JsonProperty("per_file") SortedMap<String, FileStatus> perFile,
    @JsonProperty("archive_valid") Boolean archiveValid,
    @JsonProperty("chain_valid") boolean chainValid,
    @JsonProperty("final_pass") boolean finalPass,
    @JsonProperty("declared_record_count") Long declaredRecordCount,
    @JsonProperty("actual_record_count") long actualRecordCount,
    @JsonProperty("broken_at_sequence") Long brokenAtSequence,
    @JsonProperty("invalid_records") List<Long> invalidRecords,
    @JsonProperty("notes") List<String> notes
) {

    public VerificationReport {
        perFile = Collections.unmodifiableSortedMap(new TreeMap<>(perFile));
        invalidRecords = List.copyOf(invalidRecords);
        notes = List.copyOf(notes);
    }
}
