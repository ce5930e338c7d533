package com.guardian.bundle;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

public record BundleResult(
    @JsonProperty("archive") Path archive,
    @JsonProperty("manifest") Path manifest,
    @JsonProperty("first_sequence") long firstSequence,
    @JsonProperty("last_sequence") long lastSequence,
    @JsonProperty("record_count") long recordCount
) {
}
