package com.guardian.custody;

import com.guardian.bundle.BundleExporter;
import com.guardian.bundle.BundleManifest;
import com.guardian.ledger.DecisionRecord;
import com.guardian.ledger.RecordCodec;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Offline chain-of-custody check over a bundle archive and its manifest.
 *
 * <ol>
 *   <li>Every manifest entry is re-digested from the archive; missing,
 *       mismatched or unlisted entries fail.</li>
 *   <li>Records are replayed in sequence order. Each must be byte-for-byte
 *       canonical and is re-hashed from its content and previous hash. The first break invalidates that record and
 *       all that follow it.</li>
 *   <li>The bundle passes only if every file passes, the chain is intact and
 *       the number of records equals the count the manifest declares.</li>
 * </ol>
 *
 * <p>The verifier never repairs and never throws for a bad bundle. Its output
 * depends on the input bytes alone.</p>
 */
public class CustodyVerifier {

    private final RecordCodec codec;

    public CustodyVerifier(RecordCodec codec) {
        this.codec = codec;
    }

    public VerificationReport verify(Path archive, Path manifest) {
        byte[] archiveBytes;
        byte[] manifestBytes;
        try {
            archiveBytes = Files.readAllBytes(archive);
        } catch (IOException ex) {
            return unreadable("cannot read archive " + archive.getFileName() + ": " + ex.getMessage());
        }
        try {
            manifestBytes = Files.readAllBytes(manifest);
        } catch (IOException ex) {
            return unreadable("cannot read manifest " + manifest.getFileName() + ": " + ex.getMessage());
        }
        return verify(archiveBytes, manifestBytes);
    }

    public VerificationReport verify(byte[] archiveBytes, byte[] manifestBytes) {
        List<String> notes = new ArrayList<>();
        BundleManifest manifest;
        try {
            manifest = BundleManifest.parse(new String(manifestBytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException ex) {
            return unreadable("manifest rejected: " + ex.getMessage());
        }

        Boolean archiveValid = null;
        if (manifest.archiveDigest() != null) {
            archiveValid = manifest.archiveDigest().equals(RecordCodec.sha256Hex(archiveBytes));
            if (!archiveValid) {
                notes.add("archive digest does not match manifest");
            }
        }

        ArchiveContents archive = readEntries(archiveBytes, notes);
        SortedMap<String, byte[]> entries = archive.entries();

        SortedMap<String, FileStatus> perFile = new TreeMap<>();
        for (Map.Entry<String, String> expected : manifest.entries().entrySet()) {
            String path = expected.getKey();
            byte[] content = entries.get(path);
            if (content == null) {
                perFile.put(path, FileStatus.FAIL);
                notes.add("missing from archive: " + path);
            } else if (!expected.getValue().equals(RecordCodec.sha256Hex(content))) {
                perFile.put(path, FileStatus.FAIL);
                notes.add("digest mismatch: " + path);
            } else {
                perFile.put(path, FileStatus.PASS);
            }
        }
        for (String path : entries.keySet()) {
            if (!manifest.entries().containsKey(path)) {
                perFile.put(path, FileStatus.FAIL);
                notes.add("not listed in manifest: " + path);
            }
        }
        for (String path : archive.duplicates()) {
            perFile.put(path, FileStatus.FAIL);
        }

        List<byte[]> records = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(BundleExporter.RECORDS_PREFIX)) {
                records.add(entry.getValue());
            }
        }
        ChainReplay replay = replay(records, manifest, notes);

        long actual = records.size();
        boolean countMatches = actual == manifest.recordCount();
        if (!countMatches) {
            notes.add("record count mismatch: manifest declares " + manifest.recordCount()
                + ", bundle contains " + actual);
        }

        boolean filesPass = perFile.values().stream().allMatch(s -> s == FileStatus.PASS);
        boolean finalPass = filesPass && archive.intact() && replay.valid() && countMatches
            && !Boolean.FALSE.equals(archiveValid);

        return new VerificationReport(perFile, archiveValid, replay.valid(), finalPass,
            manifest.recordCount(), actual, replay.brokenAt(), replay.invalid(), notes);
    }

    private ChainReplay replay(List<byte[]> records, BundleManifest manifest, List<String> notes) {
        long expectedSequence = manifest.firstSequence();
        String expectedPrevious = manifest.anchorHash();

        if (expectedSequence == 1 && !RecordCodec.GENESIS_HASH.equals(expectedPrevious)) {
            notes.add("bundle starts at sequence 1 but anchor is not the genesis hash");
            return ChainReplay.brokenFrom(1, records.size());
        }

        for (int i = 0; i < records.size(); i++) {
            DecisionRecord record;
            try {
                record = codec.decode(records.get(i));
            } catch (IOException ex) {
                notes.add("chain break at sequence " + expectedSequence + ": " + ex.getMessage());
                return ChainReplay.brokenFrom(expectedSequence, records.size() - i);
            }
            String problem = checkRecord(record, expectedSequence, expectedPrevious);
            if (problem != null) {
                notes.add("chain break at sequence " + expectedSequence + ": " + problem);
                return ChainReplay.brokenFrom(expectedSequence, records.size() - i);
            }
            expectedPrevious = record.hash();
            expectedSequence++;
        }
        return ChainReplay.intact();
    }

    /** Returns a description of the first problem with the record, or null if it checks out. */
    private String checkRecord(DecisionRecord record, long expectedSequence, String expectedPrevious) {
        if (record.sequence() != expectedSequence) {
            return "unexpected sequence " + record.sequence();
        }
        if (!expectedPrevious.equals(record.previousHash())) {
            return "previous hash does not link to the prior record";
        }
        if (!record.hash().equals(codec.hash(record))) {
            return "stored hash does not match recomputed hash";
        }
        return null;
    }

    private static ArchiveContents readEntries(byte[] archiveBytes, List<String> notes) {
        SortedMap<String, byte[]> entries = new TreeMap<>();
        Set<String> duplicates = new TreeSet<>();
        boolean intact = true;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archiveBytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                byte[] content = zip.readAllBytes();
                if (entries.put(entry.getName(), content) != null && duplicates.add(entry.getName())) {
                    notes.add("duplicate archive entry: " + entry.getName());
                }
            }
        } catch (IOException ex) {
            intact = false;
            notes.add("archive unreadable after " + entries.size() + " entries: " + ex.getMessage());
        }
        return new ArchiveContents(entries, duplicates, intact);
    }

    private static VerificationReport unreadable(String note) {
        return new VerificationReport(new TreeMap<>(), null, false, false, null, 0L, null,
            List.of(), List.of(note));
    }

    private record ArchiveContents(SortedMap<String, byte[]> entries, Set<String> duplicates, boolean intact) {
    }

    private record ChainReplay(boolean valid, Long brokenAt, List<Long> invalid) {

        static ChainReplay intact() {
            return new ChainReplay(true, null, List.of());
        }

        static ChainReplay brokenFrom(long brokenAt, int count) {
            List<Long> invalid = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                invalid.add(brokenAt + i);
            }
            return new ChainReplay(false, brokenAt, invalid);
        }
    }
}
