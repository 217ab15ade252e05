package com.leakgate;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakgate.config.PolicyConfig;
import com.leakgate.config.PolicyConfigException;
import com.leakgate.config.PolicyConfigLoader;
import com.leakgate.model.Finding;
import com.leakgate.model.RepoContext;
import com.leakgate.pipeline.TriagePipeline;
import com.leakgate.pipeline.TriageResult;
import com.leakgate.policy.PolicyReportFormatter;
import com.leakgate.report.TriageReportWriter;
import com.leakgate.validate.ValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "leakgate", mixinStandardHelpOptions = true, version = "1.0",
        description = "Validates, classifies and scores secret-scanner findings, then enforces the repository policy")
public class LeakGate implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(LeakGate.class);

    static final int EXIT_PASSED = 0;
    static final int EXIT_POLICY_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--findings"}, description = "Detector output: JSON array of findings")
    private File findingsFile;

    @Option(names = {"-p", "--policy"}, description = "Policy file (default: .leakgate.yml in the repo root, else built-in)")
    private Path policyPath;

    @Option(names = {"-r", "--repo-root"}, defaultValue = ".", description = "Repository root used to locate the policy file")
    private Path repoRoot;

    @Option(names = {"--public"}, description = "Repository is public")
    private boolean publicRepo;

    @Option(names = {"--external-contributors"}, description = "Repository accepts external contributors")
    private boolean externalContributors;

    @Option(names = {"-o", "--output"}, description = "Write the JSON triage report to this file")
    private Path output;

    @Option(names = {"--init-policy"}, description = "Write the default policy to .leakgate.yml in the repo root and exit")
    private boolean initPolicy;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LeakGate()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PolicyConfigLoader loader = new PolicyConfigLoader();

        if (initPolicy) {
            try {
                Path destination = repoRoot.resolve(PolicyConfigLoader.REPO_POLICY_FILENAMES.get(0));
                loader.extractDefault(destination);
                System.out.println("Default policy written to: " + destination.toAbsolutePath());
                return EXIT_PASSED;
            } catch (PolicyConfigException e) {
                System.err.println("Error: " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }

        if (findingsFile == null) {
            throw new ParameterException(spec.commandLine(), "Missing required option: --findings");
        }

        PolicyConfig policy;
        try {
            policy = loader.resolve(policyPath, repoRoot);
        } catch (PolicyConfigException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        List<Finding> findings;
        try {
            findings = readFindings(findingsFile);
        } catch (IOException e) {
            System.err.println("Error: cannot read findings from " + findingsFile.getAbsolutePath() + ": " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        logger.info("Loaded {} findings from {}", findings.size(), findingsFile.getAbsolutePath());

        TriagePipeline pipeline = new TriagePipeline(ValidatorRegistry.withBuiltins(), policy);
        TriageResult result = pipeline.run(findings, new RepoContext(publicRepo, externalContributors));

        TriageReportWriter writer = new TriageReportWriter();
        if (output != null) {
            writer.write(result, output);
        }

        System.out.println(PolicyReportFormatter.format(result.getPolicyResult()));
        return result.getPolicyResult().isPassed() ? EXIT_PASSED : EXIT_POLICY_FAILED;
    }

    static List<Finding> readFindings(File file) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        List<Finding> findings = mapper.readValue(file, new TypeReference<List<Finding>>() {});
        return findings == null ? List.of() : findings;
    }
}
