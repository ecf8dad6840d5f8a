package io.github.hide212131.rayskillkit.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.rayskillkit.infra.config.RuntimeConfig;
import io.github.hide212131.rayskillkit.runtime.SkillKit;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SkillKitCliAppTest {

    @TempDir
    Path tempDir;

    private SkillKit kit;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        kit = SkillKit.builder(RuntimeConfig.defaults().withTelemetryDirectory(tempDir.resolve("telemetry")))
                .build()
                .start();
    }

    @Test
    void observabilityIsDisabledWithoutAnEndpoint() {
        assertThat(SkillKitCliApp.observabilityFor(RuntimeConfig.defaults()).isEnabled()).isFalse();
        assertThat(SkillKitCliApp.observabilityFor(new RuntimeConfig(null, tempDir, Map.of(), 1.0, false,
                null, " ")).isEnabled()).isFalse();
    }

    @Test
    void skillsCommandListsBundledSkills() {
        int exitCode = execute("skills");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("education_assistant  triggers: education, study, homework")
                .contains("14 skills");
    }

    @Test
    void routeCommandPrintsVectorDecisionAndSummary() {
        int exitCode = execute("route", "--skill", "education_assistant",
                "--payload", "{\"gradeLevel\":9,\"difficulty\":6}", "--metadata", "subject=化学");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Skill: education_assistant")
                .contains("Vector: [0.7500, 0.6000, ")
                .contains("Decision: education_assistant (confidence 1.00, gate 0.50)")
                .contains("Summary (en-US): Personalized study guidance prepared for 化学")
                .contains("Summary (zh-CN): 已为化学准备个性化学习指导");
    }

    @Test
    void routeAsksForLowConfidenceHealthResults() {
        int exitCode = execute("route", "--skill", "hc_gait_guard", "--payload", "{}", "--confidence", "0.5");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Decision: ask (confidence 0.50, gate 0.82)")
                .contains("Disclaimer (en-US): ")
                .contains("Disclaimer (zh-CN): ");
    }

    @Test
    void nullPayloadIsRoutedAsEmptyPayload() {
        int exitCode = execute("route", "--skill", "education_assistant", "--payload", "null");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Skill: education_assistant").contains("Vector: [");
        assertThat(err.toString()).doesNotContain("Routing failed");
    }

    @Test
    void routeFailuresExitWithRouteFailureCode() {
        assertThat(execute("route", "--skill", "ghost", "--payload", "{}"))
                .isEqualTo(SkillKitCliApp.EXIT_ROUTE_FAILURE);
        assertThat(err.toString()).contains("Routing failed [not_found]");

        assertThat(execute("route", "--trigger", "astrology", "--payload", "{}"))
                .isEqualTo(SkillKitCliApp.EXIT_ROUTE_FAILURE);
        assertThat(execute("route", "--trigger", "trip", "--payload", "{broken"))
                .isEqualTo(SkillKitCliApp.EXIT_ROUTE_FAILURE);
        assertThat(err.toString()).contains("Invalid payload JSON");
    }

    @Test
    void telemetryCommandPrintsRecordedEvents() {
        execute("route", "--trigger", "Trip", "--payload", "{\"distanceKm\":800}");

        int exitCode = execute("telemetry", "--prefix", "router.success");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("router.success.travel_planner").contains("1 events");
    }

    @Test
    void verifyManifestChecksSignature() throws Exception {
        KeyPair keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        byte[] encoded = keyPair.getPublic().getEncoded();
        String publicKey = Base64.getEncoder().encodeToString(Arrays.copyOfRange(encoded, 12, 44));
        byte[] manifest = "{\"version\":\"1.0.0\",\"files\":[\"skills.json\"]}".getBytes(StandardCharsets.UTF_8);
        Path manifestFile = Files.write(tempDir.resolve("manifest.json"), manifest);
        Signature signer = Signature.getInstance("Ed25519");
        signer.initSign(keyPair.getPrivate());
        signer.update(manifest);
        byte[] signature = signer.sign();
        Path signatureFile = Files.writeString(tempDir.resolve("manifest.sig"),
                Base64.getEncoder().encodeToString(signature) + "\n");

        assertThat(execute("verify-manifest", "--manifest", manifestFile.toString(),
                "--signature-file", signatureFile.toString(), "--public-key", publicKey)).isZero();
        assertThat(out.toString()).contains("Manifest verified: ");

        signature[0] ^= 0x01;
        assertThat(execute("verify-manifest", "--manifest", manifestFile.toString(),
                "--signature", Base64.getEncoder().encodeToString(signature), "--public-key", publicKey))
                .isEqualTo(SkillKitCliApp.EXIT_VERIFICATION_FAILURE);
        assertThat(err.toString()).contains("Manifest signature is invalid");
    }

    @Test
    void verifyManifestWithoutKeyIsConfigurationError() throws Exception {
        Path manifestFile = Files.writeString(tempDir.resolve("manifest.json"), "{}");

        assertThat(execute("verify-manifest", "--manifest", manifestFile.toString(), "--signature", "AAAA"))
                .isEqualTo(SkillKitCliApp.EXIT_CONFIGURATION_ERROR);
        assertThat(execute("verify-manifest", "--manifest", manifestFile.toString(), "--signature", "AAAA",
                "--public-key", "c2hvcnQ=")).isEqualTo(SkillKitCliApp.EXIT_CONFIGURATION_ERROR);
    }

    @Test
    void factoryFailuresAreReportedAsConfigurationErrors() {
        CommandLine commandLine = SkillKitCliApp.commandLineInstance(() -> {
            throw new IllegalStateException("RAYSKILLKIT_IDLE は true/false で指定してください: maybe");
        });
        commandLine.setErr(new PrintWriter(err, true));

        assertThat(commandLine.execute("skills")).isEqualTo(SkillKitCliApp.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("Configuration error: RAYSKILLKIT_IDLE");
    }

    private int execute(String... args) {
        CommandLine commandLine = SkillKitCliApp.commandLineInstance(() -> kit);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }
}
