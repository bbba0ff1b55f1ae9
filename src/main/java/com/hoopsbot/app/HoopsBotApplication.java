package com.hoopsbot.app;

import com.hoopsbot.config.Config;
import com.hoopsbot.core.RunTelemetry;
import com.hoopsbot.ingest.SnapshotException;
import com.hoopsbot.model.LineupRunOutcome;
import com.hoopsbot.output.LineupReportBuilder;
import com.hoopsbot.output.Mailer;
import com.hoopsbot.runner.LineupRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Command-line entry point. Exit codes: 0 success, 1 run failure, 2 usage error.
 */
public final class HoopsBotApplication {
    private static final Logger LOG = LogManager.getLogger(HoopsBotApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;
    private static final List<String> LOGGED_CONFIG_KEYS = List.of(
            "snapshot.path", "outputs.dir", "app.zone", "untouchables.weekday",
            "scores.cache.enabled", "email.enabled", "mail.dry_run"
    );

    private final Path workingDir;
    private final Clock clock;
    private final boolean routeStdStreams;

    public HoopsBotApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), Clock.systemUTC(), true);
    }

    public HoopsBotApplication(Path workingDir, Clock clock, boolean routeStdStreams) {
        this.workingDir = workingDir;
        this.clock = clock;
        this.routeStdStreams = routeStdStreams;
    }

    public static void main(String[] args) {
        int exit = new HoopsBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("hoopsbot", options);
            LOG.error("invalid arguments: {}", e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("hoopsbot", options);
            return 0;
        }

        Config config = Config.load(workingDir);
        if (routeStdStreams) {
            installLogRoutingIfNeeded(config);
        }
        logEffectiveConfig(config);
        Path snapshotPath = cmd.hasOption("snapshot")
                ? workingDir.resolve(cmd.getOptionValue("snapshot")).normalize()
                : config.getPath("snapshot.path");

        RunTelemetry telemetry = new RunTelemetry(cmd.hasOption("dry-run") ? "dry-run" : "manual", clock);
        try {
            LineupRunOutcome outcome = new LineupRunner(config, clock, telemetry).run(snapshotPath);

            telemetry.startStep(RunTelemetry.STEP_REPORT);
            LineupReportBuilder reportBuilder = new LineupReportBuilder();
            Path reportPath = reportBuilder.writeReport(config.getPath("outputs.dir"), outcome);
            telemetry.endStep(RunTelemetry.STEP_REPORT, 1, 1, 0);
            LOG.info("report written: {}", reportPath);

            if (cmd.hasOption("no-mail")) {
                LOG.info("--no-mail set, report not mailed");
            } else {
                Mailer mailer = new Mailer(clock);
                Mailer.Settings settings = mailer.loadSettings(config);
                if (cmd.hasOption("dry-run")) {
                    settings.dryRun = true;
                }
                telemetry.startStep(RunTelemetry.STEP_MAIL_SEND);
                boolean sent = mailer.send(
                        settings,
                        reportBuilder.buildSubject(settings.subjectPrefix, outcome),
                        reportBuilder.buildText(outcome)
                );
                telemetry.endStep(RunTelemetry.STEP_MAIL_SEND, 1, sent ? 1 : 0, 0);
            }
            return 0;
        } catch (SnapshotException e) {
            telemetry.incrementErrors(1);
            LOG.error("snapshot unusable: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            telemetry.incrementErrors(1);
            LOG.error("FATAL: {}", e.getMessage(), e);
            return 1;
        } finally {
            telemetry.finish();
            LOG.info("run summary\n{}", telemetry.getSummary());
        }
    }

    private static void logEffectiveConfig(Config config) {
        for (String key : LOGGED_CONFIG_KEYS) {
            Config.ResolvedValue resolved = config.resolve(key);
            LOG.info("config {}={} (source={})", resolved.key, resolved.value, resolved.source);
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (HoopsBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("hoopsbot.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialised before the swap so the console appender keeps the real streams.
                LogManager.getLogger(HoopsBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("log routing enabled, dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                LOG.warn("failed to initialize log routing: {}", e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("snapshot").hasArg().argName("file").desc("run snapshot JSON (default: snapshot.path)").build());
        options.addOption(Option.builder().longOpt("no-mail").desc("write the report but do not mail it").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("write the mail under mail.dry_run.dir instead of sending it").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
