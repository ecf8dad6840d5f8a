package io.github.hide212131.rayskillkit.app;

import io.github.hide212131.rayskillkit.infra.config.RuntimeConfig;
import io.github.hide212131.rayskillkit.infra.config.RuntimeConfigLoader;
import io.github.hide212131.rayskillkit.infra.observability.ObservabilityConfig;
import io.github.hide212131.rayskillkit.runtime.SkillKit;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * PicoCLI とスキルランタイムを結び付けるエントリポイント。
 */
@Command(name = "skillkit", mixinStandardHelpOptions = true, description = "Route payloads to on-device skills")
public final class SkillKitCliApp implements Runnable {

    static final int EXIT_ROUTE_FAILURE = 2;
    static final int EXIT_VERIFICATION_FAILURE = 3;
    static final int EXIT_CONFIGURATION_ERROR = 4;

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(SkillKitCliApp::createFromEnvironment);
    }

    static CommandLine commandLineInstance(SkillKitFactory factory) {
        CommandLine cmd = new CommandLine(new SkillKitCliApp());
        cmd.addSubcommand("skills", new SkillsCommand(factory));
        cmd.addSubcommand("route", new RouteCommand(factory));
        cmd.addSubcommand("verify-manifest", new VerifyManifestCommand(factory));
        cmd.addSubcommand("telemetry", new TelemetryCommand(factory));
        return cmd;
    }

    private static SkillKit createFromEnvironment() {
        RuntimeConfig config = new RuntimeConfigLoader().load();
        return SkillKit.builder(config)
                .observability(observabilityFor(config))
                .build()
                .start();
    }

    /** OTLP エンドポイントが設定されていればスパンを送出し、なければ無効にする。 */
    static ObservabilityConfig observabilityFor(RuntimeConfig config) {
        return config.otlpEndpointUrl()
                .map(ObservabilityConfig::forEndpoint)
                .orElseGet(ObservabilityConfig::disabled);
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
