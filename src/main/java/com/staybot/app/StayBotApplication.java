package com.staybot.app;

import com.staybot.agent.AgentStatus;
import com.staybot.agent.PassResult;
import com.staybot.agent.StayAgent;
import com.staybot.config.Config;
import com.staybot.config.ConfigException;
import com.staybot.db.StorageException;
import com.staybot.model.PruneResult;
import com.staybot.scheduler.TaskStatus;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

public final class StayBotApplication {
    private static final Logger LOG = LogManager.getLogger(StayBotApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exit = new StayBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("staybot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("staybot", options);
            return EXIT_OK;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        if (cmd.hasOption("create-config")) {
            return createConfig(workingDir.resolve(cmd.getOptionValue("create-config")).normalize());
        }

        StayAgent agent = null;
        try {
            String explicit = cmd.getOptionValue("config");
            Config config = Config.load(workingDir, explicit == null ? null : Path.of(explicit));
            installLogRoutingIfNeeded(config);
            agent = StayAgent.fromConfig(config);

            if (cmd.hasOption("daemon")) {
                return runDaemon(config, agent);
            }
            if (cmd.hasOption("status")) {
                printStatus(agent.status());
                return EXIT_OK;
            }
            if (cmd.hasOption("test-notify")) {
                boolean sent = agent.testNotify();
                System.out.println(sent ? "Test notification sent." : "Test notification failed.");
                return sent ? EXIT_OK : EXIT_FATAL;
            }
            if (cmd.hasOption("price-alerts")) {
                int announced = agent.runPriceAlerts();
                System.out.println("Price alerts announced: " + announced);
                return EXIT_OK;
            }
            if (cmd.hasOption("cleanup")) {
                PruneResult pruned = agent.cleanup();
                System.out.println("Cleanup finished. cutoff=" + pruned.cutoff
                        + " searches=" + pruned.searchesDeleted
                        + " observations=" + pruned.observationsDeleted
                        + " notifications=" + pruned.notificationsDeleted);
                return EXIT_OK;
            }

            PassResult pass = agent.runOnce();
            printPass(pass);
            return pass.completed() ? EXIT_OK : EXIT_FATAL;
        } catch (ConfigException e) {
            System.err.println("ERROR: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        } catch (StorageException e) {
            LOG.error("Storage failure", e);
            System.err.println("FATAL: " + e.getMessage());
            return EXIT_FATAL;
        } catch (Exception e) {
            LOG.error("Unexpected failure", e);
            System.err.println("FATAL: " + e.getMessage());
            return EXIT_FATAL;
        } finally {
            if (agent != null && !cmd.hasOption("daemon")) {
                agent.stopScheduler();
            }
        }
    }

    private int runDaemon(Config config, StayAgent agent) throws IOException, InterruptedException {
        Path pidFile = config.getPath("outputs.dir").resolve("staybot.pid");
        Files.createDirectories(pidFile.getParent());
        Files.writeString(pidFile, String.valueOf(ProcessHandle.current().pid()), StandardCharsets.UTF_8);

        if (!agent.startScheduler()) {
            System.err.println("ERROR: another scheduler is already running in this process.");
            Files.deleteIfExists(pidFile);
            return EXIT_FATAL;
        }
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested, stopping scheduler.");
            agent.stopScheduler();
            try {
                Files.deleteIfExists(pidFile);
            } catch (IOException e) {
                LOG.warn("Failed to remove pid file {}: {}", pidFile, e.getMessage());
            }
            stopped.countDown();
        }, "staybot-shutdown"));

        System.out.println("Daemon started. pid=" + ProcessHandle.current().pid() + " pid_file=" + pidFile);
        printStatus(agent.status());
        stopped.await();
        return EXIT_OK;
    }

    private int createConfig(Path target) {
        if (Files.exists(target)) {
            System.err.println("ERROR: refusing to overwrite existing file " + target);
            return EXIT_USAGE;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("# StayBot configuration. Every key is optional; unset keys use the built-in default.\n");
        String section = null;
        for (Map.Entry<String, String> entry : Config.defaults().entrySet()) {
            String prefix = entry.getKey().substring(0, Math.max(0, entry.getKey().indexOf('.')));
            if (!prefix.equals(section)) {
                sb.append('\n');
                section = prefix;
            }
            sb.append(entry.getKey()).append('=').append(escape(entry.getValue())).append('\n');
        }
        sb.append("\n# Recipients and SMTP credentials.\n");
        sb.append("email.smtp_user=\n");
        sb.append("email.smtp_pass=\n");
        sb.append("email.to=\n");
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, sb.toString(), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            System.err.println("FATAL: failed to write " + target + ": " + e.getMessage());
            return EXIT_FATAL;
        }
        System.out.println("Example configuration written to " + target);
        return EXIT_OK;
    }

    /**
     * Properties files are Latin-1, so non-ASCII characters become unicode escapes.
     */
    static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.toCharArray()) {
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c > 0x7e) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private void printPass(PassResult pass) {
        System.out.println("Search pass: fetched=" + pass.fetched
                + " kept=" + pass.filtered
                + " tracked=" + pass.itemIds.size()
                + " new=" + pass.newItems + (pass.newItemsNotified ? " (notified)" : "")
                + " price_drops=" + pass.priceDrops
                + " below_target=" + pass.belowTarget
                + " elapsed_ms=" + pass.durationMs);
        if (!pass.failedSources.isEmpty()) {
            System.out.println("Failed sources: " + String.join(", ", pass.failedSources));
        }
        if (!pass.completed()) {
            System.err.println("ERROR: pass aborted: " + pass.storageError);
        }
    }

    private void printStatus(AgentStatus status) {
        System.out.println("Destination: " + status.destination);
        System.out.println("Sources: " + String.join(", ", status.sources));
        System.out.println("Tracked items: " + (status.trackedItems < 0 ? "unavailable" : status.trackedItems));
        if (status.statistics != null) {
            System.out.println("Searches (7d): " + status.statistics.totalSearches
                    + ", avg results " + String.format("%.1f", status.statistics.averageResults)
                    + ", notifications " + status.statistics.notificationsSent);
            status.statistics.newItemsBySource.forEach((source, n) ->
                    System.out.println("  new from " + source + ": " + n));
        }
        if (status.storageError != null) {
            System.out.println("Store error: " + status.storageError);
        }
        System.out.println("Scheduler running: " + status.scheduler.running);
        for (TaskStatus task : status.scheduler.tasks) {
            System.out.println("  " + task.name
                    + " every " + task.cadence
                    + (task.enabled ? "" : " [disabled]")
                    + " runs=" + task.runCount
                    + " failures=" + task.failureCount
                    + " next=" + task.nextRun
                    + (task.lastError == null ? "" : " last_error=" + task.lastError));
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StayBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("staybot.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must initialise before the swap so the console appender keeps the real streams.
                LogManager.getLogger(StayBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | SecurityException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        OptionGroup modes = new OptionGroup();
        modes.addOption(Option.builder().longOpt("once").desc("run one search pass and exit (default)").build());
        modes.addOption(Option.builder().longOpt("daemon").desc("start the scheduler and keep running until stopped").build());
        modes.addOption(Option.builder().longOpt("status").desc("print tracked-item statistics and task status").build());
        modes.addOption(Option.builder().longOpt("test-notify").desc("send a test notification").build());
        modes.addOption(Option.builder().longOpt("price-alerts").desc("run the price-drop check once").build());
        modes.addOption(Option.builder().longOpt("cleanup").desc("back up the database and prune old history").build());
        modes.addOption(Option.builder().longOpt("create-config").hasArg().argName("path").desc("write an example config.properties and exit").build());
        options.addOptionGroup(modes);
        options.addOption(Option.builder().longOpt("config").hasArg().argName("path").desc("configuration file to load").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
