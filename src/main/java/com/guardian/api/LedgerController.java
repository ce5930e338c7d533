package com.guardian.api;

import com.guardian.bundle.BundleExporter;
import com.guardian.bundle.BundleResult;
import com.guardian.custody.CustodyVerifier;
import com.guardian.custody.VerificationReport;
import com.guardian.contract.ValidationException;
import com.guardian.ledger.DecisionLedger;
import com.guardian.ledger.DecisionRecord;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the ledger plus on-demand bundle export and verification.
 */
@RestController
public class LedgerController {

    static final int MAX_PAGE = 1000;

    private final DecisionLedger ledger;
    private final BundleExporter exporter;
    private final CustodyVerifier verifier;

    public LedgerController(DecisionLedger ledger, BundleExporter exporter, CustodyVerifier verifier) {
        this.ledger = ledger;
        this.exporter = exporter;
        this.verifier = verifier;
    }

    @GetMapping("/ledger")
    public List<DecisionRecord> read(@RequestParam(defaultValue = "1") long from,
                                     @RequestParam(required = false) Long to) {
        if (from < 1) {
            throw new ValidationException("from must be >= 1");
        }
        long upper = Math.min(to == null ? ledger.size() : to, from + MAX_PAGE - 1);
        if (upper < from) {
            return List.of();
        }
        return ledger.read(from, upper);
    }

    @GetMapping("/ledger/head")
    public Map<String, Object> head() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sequence", ledger.size());
        body.put("hash", ledger.headHash());
        body.put("halted", ledger.isHalted());
        return body;
    }

    @PostMapping("/bundles")
    public Map<String, Object> exportBundle() {
        Optional<BundleResult> result = exporter.exportSince(exporter.lastBundledSequence());
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isEmpty()) {
            body.put("status", "empty");
            return body;
        }
        BundleResult bundle = result.get();
        body.put("status", "exported");
        body.put("archive", bundle.archive().toString());
        body.put("manifest", bundle.manifest().toString());
        body.put("first_sequence", bundle.firstSequence());
        body.put("last_sequence", bundle.lastSequence());
        body.put("record_count", bundle.recordCount());
        return body;
    }

    /**
     * Verifies a bundle already on local disk. Expected body:
     * {@code {"archive": "...zip", "manifest": "...manifest"}}.
     */
    @PostMapping("/bundles/verify")
    public VerificationReport verifyBundle(@RequestBody Map<String, String> request) {
        String archive = request.get("archive");
        String manifest = request.get("manifest");
        if (archive == null || archive.isBlank() || manifest == null || manifest.isBlank()) {
            throw new ValidationException("archive and manifest paths are required");
        }
        return verifier.verify(Path.of(archive), Path.of(manifest));
    }
}
