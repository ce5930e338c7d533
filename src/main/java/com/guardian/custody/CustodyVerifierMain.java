package com.guardian.custody;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.guardian.ledger.RecordCodec;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Standalone verifier for third parties; needs no running gate.
 *
 * <pre>
 * java -cp guardian-gate.jar com.guardian.custody.CustodyVerifierMain bundle.zip bundle.manifest
 * </pre>
 *
 * Prints the JSON report. Exit code 0 when the bundle passes, 1 when it fails,
 * 2 on usage errors.
 */
public final class CustodyVerifierMain {

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_USAGE = 2;

    private CustodyVerifierMain() {
    }

    public static void main(String[] args) throws JsonProcessingException {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) throws JsonProcessingException {
        if (args.length != 2) {
            err.println("usage: CustodyVerifierMain <bundle.zip> <bundle.manifest>");
            return EXIT_USAGE;
        }
        VerificationReport report = new CustodyVerifier(new RecordCodec())
            .verify(Path.of(args[0]), Path.of(args[1]));
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        out.println(mapper.writeValueAsString(report));
        return report.finalPass() ? EXIT_PASS : EXIT_FAIL;
    }
}
