package com.provenant.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.provenant.core.model.BuilderResult;
import com.provenant.core.model.DiffReport;
import com.provenant.core.model.VerificationDecision;
import com.provenant.core.verification.VerificationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: provenant verify &lt;results.json&gt; --k N
 * <p>
 * Runs the verification engine offline over a JSON array of builder results. Exit code 0
 * on consensus, 1 otherwise, 2 if the file cannot be read.
 */
@Command(name = "verify", mixinStandardHelpOptions = true,
        description = "Decide consensus over a file of builder results")
@Component
public class VerifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON array of builder results")
    private File resultsFile;

    @Option(names = {"--k", "-k"}, required = true, description = "Number of builders that must agree")
    private int k;

    @Option(names = "--round", defaultValue = "0", description = "Verification round (default: ${DEFAULT-VALUE})")
    private int round;

    @Option(names = "--job-id", description = "Job id; defaults to the job id of the first result")
    private String jobId;

    private final VerificationEngine engine;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public VerifyCommand(VerificationEngine engine, ObjectMapper objectMapper, Clock clock) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        List<BuilderResult> results;
        try {
            results = objectMapper.readValue(resultsFile, new TypeReference<List<BuilderResult>>() {});
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + resultsFile + ": " + e.getMessage());
            return 2;
        }
        if (k < 1) {
            ConsoleOutput.error("--k must be at least 1");
            return 2;
        }
        String id = jobId != null ? jobId : results.stream().findFirst().map(BuilderResult::jobId).orElse("offline");

        VerificationDecision decision = engine.verify(id, round, k, results, clock.instant());
        ConsoleOutput.info("Decision " + decision.decisionId() + " for job " + id);
        if (decision.isConsensus()) {
            ConsoleOutput.success("CONSENSUS on " + decision.winningDigest() + " ("
                    + decision.agreeing().size() + " agreeing, " + k + " required)");
        } else {
            ConsoleOutput.error(decision.outcome() + " (" + decision.disagreeing().size()
                    + " successful builder(s), " + k + " required)");
        }
        for (DiffReport report : decision.diffReports()) {
            ConsoleOutput.diff(report);
        }
        return decision.isConsensus() ? 0 : 1;
    }
}
