package com.guardian.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ledger backed by one evidence file per record under a local directory.
 *
 * <p>Appends go through a single lock. Inside it the record is sealed, written
 * to a temp file, forced to disk and atomically renamed to
 * {@code record-<sequence>.json}; only then does it become the in-memory head.
 * A crash can therefore lose at most a record that was never linked. Readers
 * see a copy-on-write snapshot and never a half-written record.</p>
 *
 * <p>On open, existing files are reloaded and the whole chain re-verified. A
 * broken chain is fatal.</p>
 */
public class FileDecisionLedger implements DecisionLedger {

    private static final Logger log = LoggerFactory.getLogger(FileDecisionLedger.class);

    private static final Pattern RECORD_FILE = Pattern.compile("record-(\\d{12})\\.json");
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final RecordCodec codec;
    private final ReentrantLock appendLock = new ReentrantLock();
    private final CopyOnWriteArrayList<DecisionRecord> records = new CopyOnWriteArrayList<>();

    private volatile String haltReason;

    public FileDecisionLedger(Path directory, RecordCodec codec) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.codec = Objects.requireNonNull(codec, "codec");
        open();
    }

    public static String fileName(long sequence) {
        return String.format(Locale.ROOT, "record-%012d.json", sequence);
    }

    @Override
    public LedgerAppendResult append(DecisionEntry entry, String previousHash) {
        Objects.requireNonNull(entry, "entry");
        appendLock.lock();
        try {
            ensureWritable();
            String head = headHash();
            if (!head.equals(previousHash)) {
                throw halt("supplied previous hash " + previousHash
                    + " does not match ledger head " + head + " at sequence " + records.size(), null);
            }
            long sequence = records.size() + 1L;
            DecisionRecord unsealed = entry.link(sequence, head);
            DecisionRecord sealed = unsealed.withHash(codec.hash(unsealed));
            persist(sealed);
            records.add(sealed);
            return new LedgerAppendResult(sequence, sealed.hash());
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public LedgerAppendResult record(DecisionEntry entry) {
        appendLock.lock();
        try {
            return append(entry, headHash());
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public List<DecisionRecord> read(long fromInclusive, long toInclusive) {
        DecisionRecord[] snapshot = records.toArray(new DecisionRecord[0]);
        long from = Math.max(1L, fromInclusive);
        long to = Math.min(snapshot.length, toInclusive);
        if (to < from) {
            return Collections.emptyList();
        }
        List<DecisionRecord> out = new ArrayList<>((int) (to - from + 1));
        for (long seq = from; seq <= to; seq++) {
            out.add(snapshot[(int) (seq - 1)]);
        }
        return out;
    }

    @Override
    public String headHash() {
        DecisionRecord[] snapshot = records.toArray(new DecisionRecord[0]);
        return snapshot.length == 0 ? RecordCodec.GENESIS_HASH : snapshot[snapshot.length - 1].hash();
    }

    @Override
    public long size() {
        return records.size();
    }

    @Override
    public boolean isHalted() {
        return haltReason != null;
    }

    public Path directory() {
        return directory;
    }

    /** Raw evidence file bytes, exactly as written to disk. */
    public byte[] readFileBytes(long sequence) throws IOException {
        return Files.readAllBytes(directory.resolve(fileName(sequence)));
    }

    private void ensureWritable() {
        if (haltReason != null) {
            throw new IntegrityException("ledger halted: " + haltReason);
        }
    }

    private IntegrityException halt(String reason, Throwable cause) {
        haltReason = reason;
        log.error("Ledger integrity failure, refusing further writes: {}", reason);
        return cause == null ? new IntegrityException(reason) : new IntegrityException(reason, cause);
    }

    private void persist(DecisionRecord record) {
        Path target = directory.resolve(fileName(record.sequence()));
        Path temp = directory.resolve(fileName(record.sequence()) + TEMP_SUFFIX);
        if (Files.exists(target)) {
            throw halt("evidence file already exists for sequence " + record.sequence(), null);
        }
        ByteBuffer buffer = ByteBuffer.wrap(codec.toFileBytes(record));
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw halt("could not persist record " + record.sequence() + ": " + ex.getMessage(), ex);
        }
        syncDirectory();
    }

    /** Makes the rename itself durable. Platforms that cannot open a directory for sync are skipped. */
    private void syncDirectory() {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException | UnsupportedOperationException ex) {
            log.debug("Directory sync not supported for {}: {}", directory, ex.toString());
        }
    }

    private void open() {
        List<Path> files = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path path : stream) {
                    String name = path.getFileName().toString();
                    if (name.endsWith(TEMP_SUFFIX)) {
                        log.warn("Discarding unlinked ledger tail file {}", name);
                        Files.delete(path);
                    } else if (RECORD_FILE.matcher(name).matches()) {
                        files.add(path);
                    }
                }
            }
        } catch (IOException ex) {
            throw new IntegrityException("cannot open ledger directory " + directory, ex);
        }
        files.sort(null);

        String previous = RecordCodec.GENESIS_HASH;
        long expectedSequence = 1L;
        for (Path file : files) {
            Matcher m = RECORD_FILE.matcher(file.getFileName().toString());
            m.matches();
            long fileSequence = Long.parseLong(m.group(1));
            if (fileSequence != expectedSequence) {
                throw new IntegrityException("ledger gap: expected record " + expectedSequence
                    + " but found " + file.getFileName());
            }
            DecisionRecord record;
            try {
                record = codec.decode(Files.readAllBytes(file));
            } catch (IOException ex) {
                throw new IntegrityException("unreadable ledger record " + file.getFileName()
                    + ": " + ex.getMessage(), ex);
            }
            if (record.sequence() != fileSequence) {
                throw new IntegrityException("record " + file.getFileName()
                    + " declares sequence " + record.sequence());
            }
            if (!previous.equals(record.previousHash())) {
                throw new IntegrityException("chain break at sequence " + fileSequence
                    + ": previous hash does not match record " + (fileSequence - 1));
            }
            String recomputed = codec.hash(record);
            if (!recomputed.equals(record.hash())) {
                throw new IntegrityException("chain break at sequence " + fileSequence
                    + ": stored hash does not match content");
            }
            records.add(record);
            previous = record.hash();
            expectedSequence++;
        }
        log.info("Ledger opened at {} with {} records, head={}", directory, records.size(), previous);
    }
}
