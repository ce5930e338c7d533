package com.guardian.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.guardian.ledger.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FileDecisionLedgerTest {

    @TempDir
    Path dir;

    private final RecordCodec codec = new RecordCodec();

    @Nested
    @DisplayName("Chain construction")
    class Chain {

        @Test
        void firstRecord_linksToGenesis() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);

            LedgerAppendResult result = ledger.record(entry(1));

            assertEquals(1L, result.sequence());
            DecisionRecord first = ledger.read(1, 1).get(0);
            assertEquals(RecordCodec.GENESIS_HASH, first.previousHash());
            assertEquals(result.hash(), first.hash());
            assertEquals(result.hash(), ledger.headHash());
        }

        @Test
        void everyRecord_linksToItsPredecessor() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            for (int i = 1; i <= 10; i++) {
                ledger.record(i % 3 == 0 ? haltEntry(i) : entry(i));
            }

            List<DecisionRecord> records = ledger.read(1, 10);
            assertEquals(10, records.size());
            for (int i = 1; i < records.size(); i++) {
                assertEquals(records.get(i - 1).hash(), records.get(i).previousHash());
                assertEquals(i + 1L, records.get(i).sequence());
            }
        }

        @Test
        void emptyLedger_headIsGenesis() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            assertEquals(RecordCodec.GENESIS_HASH, ledger.headHash());
            assertEquals(0L, ledger.size());
            assertTrue(ledger.read(1, 5).isEmpty());
        }

        @Test
        void recordFile_bytesMatchCanonicalEncoding() throws Exception {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            ledger.record(haltEntry(1));

            byte[] onDisk = ledger.readFileBytes(1);
            assertArrayEquals(codec.toFileBytes(ledger.read(1, 1).get(0)), onDisk);
            String json = new String(onDisk, StandardCharsets.UTF_8);
            assertTrue(json.contains("\"risk\":\"1.0000\""));
            assertTrue(json.contains("\"mhi\":\"0.0000\""));
            assertTrue(json.contains("\"protection_index\":null"));
        }
    }

    @Nested
    @DisplayName("Previous-hash discipline")
    class PreviousHash {

        @Test
        void appendWithCurrentHead_succeeds() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            LedgerAppendResult first = ledger.append(entry(1), RecordCodec.GENESIS_HASH);
            LedgerAppendResult second = ledger.append(entry(2), first.hash());
            assertEquals(2L, second.sequence());
        }

        @Test
        void staleHead_haltsLedger() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            ledger.record(entry(1));

            assertThrows(IntegrityException.class, () -> ledger.append(entry(2), RecordCodec.GENESIS_HASH));
            assertTrue(ledger.isHalted());

            IntegrityException refused = assertThrows(IntegrityException.class, () -> ledger.record(entry(3)));
            assertTrue(refused.getMessage().startsWith("ledger halted"));
            assertEquals(1L, ledger.size());
        }
    }

    @Nested
    @DisplayName("Recovery on open")
    class Recovery {

        @Test
        void reopen_restoresChain() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            for (int i = 1; i <= 5; i++) {
                ledger.record(entry(i));
            }
            String head = ledger.headHash();

            FileDecisionLedger reopened = new FileDecisionLedger(dir, codec);

            assertEquals(5L, reopened.size());
            assertEquals(head, reopened.headHash());
            assertEquals(ledger.read(1, 5), reopened.read(1, 5));
            assertEquals(6L, reopened.record(entry(6)).sequence());
        }

        @Test
        void tamperedRecord_isDetectedOnOpen() throws Exception {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            for (int i = 1; i <= 3; i++) {
                ledger.record(entry(i));
            }
            Path second = dir.resolve(FileDecisionLedger.fileName(2));
            String json = Files.readString(second).replace("\"status\":\"pass\"", "\"status\":\"halt\"");
            Files.writeString(second, json);

            IntegrityException ex = assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
            assertTrue(ex.getMessage().contains("sequence 2"));
        }

        @Test
        void duplicateKeyForgery_isDetectedOnOpen() throws Exception {
            Path second = writeThreeAndLocateSecond();
            String json = Files.readString(second);
            Files.writeString(second, "{\"status\":\"halt\"," + json.substring(1));

            IntegrityException ex = assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
            assertTrue(ex.getMessage().contains(FileDecisionLedger.fileName(2)));
        }

        @Test
        void reformattedRecord_isDetectedOnOpen() throws Exception {
            Path second = writeThreeAndLocateSecond();
            Files.writeString(second, Files.readString(second).replace(",", ", "));

            IntegrityException ex = assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
            assertTrue(ex.getMessage().contains("canonical form"));
        }

        @Test
        void extraField_isDetectedOnOpen() throws Exception {
            Path second = writeThreeAndLocateSecond();
            Files.writeString(second, "{\"annotation\":\"x\"," + Files.readString(second).substring(1));

            assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
        }

        @Test
        void missingTimestamp_failsAsIntegrityError() throws Exception {
            Path second = writeThreeAndLocateSecond();
            Files.writeString(second, Files.readString(second).replaceAll(",\"timestamp\":\"[^\"]*\"", ""));

            IntegrityException ex = assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
            assertTrue(ex.getMessage().contains(FileDecisionLedger.fileName(2)));
        }

        @Test
        void unknownStatus_failsAsIntegrityError() throws Exception {
            Path second = writeThreeAndLocateSecond();
            Files.writeString(second, Files.readString(second).replace("\"status\":\"pass\"", "\"status\":\"maybe\""));

            IntegrityException ex = assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
            assertTrue(ex.getMessage().contains("malformed"));
        }

        @Test
        void missingRecord_isDetectedOnOpen() throws Exception {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            for (int i = 1; i <= 3; i++) {
                ledger.record(entry(i));
            }
            Files.delete(dir.resolve(FileDecisionLedger.fileName(2)));

            assertThrows(IntegrityException.class, () -> new FileDecisionLedger(dir, codec));
        }

        @Test
        void appendedRecords_areDurableAcrossReopen() throws Exception {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            ledger.record(entry(1));
            ledger.record(haltEntry(2));

            FileDecisionLedger reopened = new FileDecisionLedger(dir, codec);

            assertEquals(ledger.headHash(), reopened.headHash());
            assertArrayEquals(codec.toFileBytes(reopened.read(2, 2).get(0)), ledger.readFileBytes(2));
        }

        private Path writeThreeAndLocateSecond() {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            for (int i = 1; i <= 3; i++) {
                ledger.record(entry(i));
            }
            return dir.resolve(FileDecisionLedger.fileName(2));
        }

        @Test
        void leftoverTempFile_isDiscarded() throws Exception {
            FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
            ledger.record(entry(1));
            Path temp = dir.resolve(FileDecisionLedger.fileName(2) + ".tmp");
            Files.writeString(temp, "{\"partial\":");

            FileDecisionLedger reopened = new FileDecisionLedger(dir, codec);

            assertFalse(Files.exists(temp));
            assertEquals(1L, reopened.size());
        }
    }

    @Test
    @DisplayName("Concurrent writers produce one contiguous, correctly linked chain")
    void concurrentRecords_formSingleChain() throws Exception {
        FileDecisionLedger ledger = new FileDecisionLedger(dir, codec);
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int offset = t * perThread;
                futures.add(pool.submit(() -> {
                    start.await();
                    List<Long> sequences = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        sequences.add(ledger.record(entry(offset + i)).sequence());
                    }
                    return sequences;
                }));
            }
            start.countDown();
            Set<Long> seen = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                seen.addAll(future.get(30, TimeUnit.SECONDS));
            }
            assertEquals(threads * perThread, seen.size());
        } finally {
            pool.shutdownNow();
        }

        List<DecisionRecord> records = ledger.read(1, ledger.size());
        assertEquals(threads * perThread, records.size());
        String previous = RecordCodec.GENESIS_HASH;
        for (DecisionRecord record : records) {
            assertEquals(previous, record.previousHash());
            assertEquals(codec.hash(record.withHash(null)), record.hash());
            previous = record.hash();
        }
        assertDoesNotThrow(() -> new FileDecisionLedger(dir, codec));
    }
}
