package com.guardian.bundle;

import com.guardian.ledger.DecisionLedger;
import com.guardian.ledger.DecisionRecord;
import com.guardian.ledger.FileDecisionLedger;
import com.guardian.ledger.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Snapshots a ledger slice into a zip archive plus a sidecar manifest so a
 * third party can re-verify it offline.
 *
 * <p>Archive entries are {@code records/record-<sequence>.json} holding the
 * exact canonical bytes of each evidence file. Entry timestamps are fixed so
 * the same slice always produces the same archive bytes.</p>
 */
public class BundleExporter {

    private static final Logger log = LoggerFactory.getLogger(BundleExporter.class);

    public static final String RECORDS_PREFIX = "records/";

    private static final DateTimeFormatter TS_FMT =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern MANIFEST_NAME =
        Pattern.compile("bundle-\\d{8}T\\d{6}Z-(\\d+)-(\\d+)\\.manifest");
    private static final long FIXED_ENTRY_TIME = 315532800000L; // 1980-01-01T00:00:00Z, the zip epoch

    private final DecisionLedger ledger;
    private final RecordCodec codec;
    private final Path directory;
    private final Clock clock;

    public BundleExporter(DecisionLedger ledger, RecordCodec codec, Path directory, Clock clock) {
        this.ledger = ledger;
        this.codec = codec;
        this.directory = directory;
        this.clock = clock;
    }

    /**
     * Exports records {@code fromInclusive..toInclusive}. Bounds are clipped to
     * the ledger; an empty slice produces no bundle.
     */
    public Optional<BundleResult> export(long fromInclusive, long toInclusive) {
        List<DecisionRecord> slice = ledger.read(fromInclusive, toInclusive);
        if (slice.isEmpty()) {
            return Optional.empty();
        }
        long first = slice.get(0).sequence();
        long last = slice.get(slice.size() - 1).sequence();
        String baseName = "bundle-" + TS_FMT.format(clock.instant()) + "-" + first + "-" + last;

        SortedMap<String, String> digests = new TreeMap<>();
        byte[] archiveBytes;
        try (ByteArrayOutputStream buffer = new ByteArrayOutputStream();
             ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (DecisionRecord record : slice) {
                String path = RECORDS_PREFIX + FileDecisionLedger.fileName(record.sequence());
                byte[] bytes = codec.toFileBytes(record);
                ZipEntry entry = new ZipEntry(path);
                entry.setTime(FIXED_ENTRY_TIME);
                zip.putNextEntry(entry);
                zip.write(bytes);
                zip.closeEntry();
                digests.put(path, RecordCodec.sha256Hex(bytes));
            }
            zip.finish();
            archiveBytes = buffer.toByteArray();
        } catch (IOException ex) {
            throw new UncheckedIOException("could not build bundle archive " + baseName, ex);
        }

        BundleManifest manifest = new BundleManifest(slice.size(), first, slice.get(0).previousHash(),
            RecordCodec.sha256Hex(archiveBytes), digests);

        Path archive = directory.resolve(baseName + ".zip");
        Path manifestPath = directory.resolve(baseName + ".manifest");
        try {
            Files.createDirectories(directory);
            writeAtomically(archive, archiveBytes);
            writeAtomically(manifestPath, manifest.toBytes());
        } catch (IOException ex) {
            throw new UncheckedIOException("could not write bundle " + baseName, ex);
        }
        log.info("Exported bundle {} covering records {}..{}", archive.getFileName(), first, last);
        return Optional.of(new BundleResult(archive, manifestPath, first, last, slice.size()));
    }

    /** Exports everything appended after {@code lastExportedSequence}. */
    public Optional<BundleResult> exportSince(long lastExportedSequence) {
        return export(lastExportedSequence + 1, ledger.size());
    }

    /**
     * Highest sequence already covered by a bundle in the output directory,
     * judged from manifest file names; 0 when there are none.
     */
    public long lastBundledSequence() {
        if (!Files.isDirectory(directory)) {
            return 0L;
        }
        long max = 0L;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "bundle-*.manifest")) {
            for (Path path : stream) {
                Matcher m = MANIFEST_NAME.matcher(path.getFileName().toString());
                if (m.matches()) {
                    max = Math.max(max, Long.parseLong(m.group(2)));
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("could not scan bundle directory " + directory, ex);
        }
        return max;
    }

    public Path directory() {
        return directory;
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(temp, bytes);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
