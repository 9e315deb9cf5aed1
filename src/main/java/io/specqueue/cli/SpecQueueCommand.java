package io.specqueue.cli;

import io.specqueue.config.ConfigStore;
import io.specqueue.config.ConfigValidationException;
import io.specqueue.config.QueueConfig;
import io.specqueue.config.SourceDefinition;
import io.specqueue.config.SpecQueuePaths;
import io.specqueue.executor.EchoTaskExecutor;
import io.specqueue.executor.ScriptTaskExecutor;
import io.specqueue.executor.TaskExecutor;
import io.specqueue.model.TaskOrigin;
import io.specqueue.model.TaskStatus;
import io.specqueue.observability.AuditLogger;
import io.specqueue.runtime.QueueDaemon;
import io.specqueue.runtime.TaskProcessor;
import io.specqueue.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "spec-queue",
        mixinStandardHelpOptions = true,
        description = "Crash-tolerant multi-source queue for task specification files",
        subcommands = {
                SpecQueueCommand.InitCommand.class,
                SpecQueueCommand.SourceCommand.class,
                SpecQueueCommand.LoadCommand.class,
                SpecQueueCommand.ProcessCommand.class,
                SpecQueueCommand.StatusCommand.class,
                SpecQueueCommand.QueueCommand.class,
                SpecQueueCommand.UnloadCommand.class,
                SpecQueueCommand.RunCommand.class,
                SpecQueueCommand.AuditVerifyCommand.class
        }
)
public final class SpecQueueCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_VALIDATION = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"--config"}, description = "Configuration file (default: ~/.config/spec-queue/config.json)")
    String config;

    @Option(names = {"--state-dir"}, description = "Queue state directory (default: <workspace>/.spec-queue)")
    String stateDir;

    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new SpecQueueCommand());
        commandLine.setExitCodeExceptionMapper(SpecQueueCommand::exitCodeFor);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", ex.getClass().getSimpleName());
            error.put("message", ex.getMessage());
            if (ex instanceof ConfigValidationException) {
                error.put("problems", ((ConfigValidationException) ex).problems());
            }
            cmd.getErr().println(Jsons.toJson(error));
            cmd.getErr().flush();
            return exitCodeFor(ex);
        });
        return commandLine;
    }

    static int exitCodeFor(Throwable ex) {
        return ex instanceof ConfigValidationException ? EXIT_VALIDATION : EXIT_FAILURE;
    }

    @Override
    public void run() {
        out().println("Use subcommands: init | source | load | process | status | queue | unload | run | audit-verify");
        out().flush();
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void print(Object value) {
        out().println(Jsons.toJson(value));
        out().flush();
    }

    ConfigStore configStore() {
        Path file = config == null || config.isBlank() ? SpecQueuePaths.defaultConfigFile() : Paths.get(config);
        return new ConfigStore(file);
    }

    SpecQueuePaths paths(QueueConfig queueConfig) {
        return SpecQueuePaths.resolve(stateDir, queueConfig.projectWorkspace());
    }

    TaskProcessor processor(QueueConfig queueConfig, TaskExecutor executor) {
        return new TaskProcessor(queueConfig, paths(queueConfig), executor);
    }

    TaskProcessor processor(QueueConfig queueConfig) {
        return processor(queueConfig, new EchoTaskExecutor());
    }

    static TaskExecutor executor(QueueConfig queueConfig, boolean dryRun) {
        if (dryRun) {
            return new EchoTaskExecutor();
        }
        List<String> command = queueConfig.settings().executorCommand();
        if (command.isEmpty()) {
            throw new ConfigValidationException("settings.executorCommand is not configured; set it or use --dry-run");
        }
        return new ScriptTaskExecutor(command, queueConfig.settings().executorTimeoutMs());
    }

    @Command(name = "init", description = "Set the project workspace and create the state directory")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Option(names = {"--workspace"}, required = true, description = "Project workspace, used as executor working directory")
        String workspace;

        @Override
        public Integer call() throws Exception {
            ConfigStore store = parent.configStore();
            store.setProjectWorkspace(workspace);
            SpecQueuePaths paths = parent.paths(store.config());
            Files.createDirectories(paths.stateDir());
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("configFile", store.configFile().toString());
            out.put("projectWorkspace", store.config().projectWorkspace());
            out.put("stateDir", paths.stateDir().toString());
            parent.print(out);
            return EXIT_OK;
        }
    }

    @Command(
            name = "source",
            description = "Manage source directories",
            subcommands = {
                    SourceCommand.AddCommand.class,
                    SourceCommand.RemoveCommand.class,
                    SourceCommand.ListCommand.class
            }
    )
    static final class SourceCommand implements Runnable {
        @ParentCommand
        SpecQueueCommand parent;

        @Override
        public void run() {
            parent.out().println("Use subcommands: add | remove | list");
            parent.out().flush();
        }

        @Command(name = "add", description = "Register a source root; its pending/ directory is created")
        static final class AddCommand implements Callable<Integer> {
            @ParentCommand
            SourceCommand source;

            @Parameters(index = "0", description = "Source id")
            String id;

            @Parameters(index = "1", description = "Source root directory")
            String path;

            @Option(names = {"--description"}, defaultValue = "", description = "Free-form description")
            String description;

            @Override
            public Integer call() {
                SourceDefinition added = source.parent.configStore().addSource(id, path, description);
                source.parent.print(added);
                return EXIT_OK;
            }
        }

        @Command(name = "remove", description = "Remove a source and unload its queue")
        static final class RemoveCommand implements Callable<Integer> {
            @ParentCommand
            SourceCommand source;

            @Parameters(index = "0", description = "Source id")
            String id;

            @Option(names = {"--keep-state"}, defaultValue = "false", description = "Keep the source's queue in the state file")
            boolean keepState;

            @Override
            public Integer call() {
                ConfigStore store = source.parent.configStore();
                boolean removed = store.removeSource(id);
                int unloaded = 0;
                if (!keepState) {
                    unloaded = source.parent.processor(store.config()).unloadSource(id);
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("sourceId", id);
                out.put("removed", removed);
                out.put("unloadedTasks", unloaded);
                source.parent.print(out);
                return removed ? EXIT_OK : EXIT_FAILURE;
            }
        }

        @Command(name = "list", description = "List configured sources")
        static final class ListCommand implements Callable<Integer> {
            @ParentCommand
            SourceCommand source;

            @Override
            public Integer call() {
                source.parent.print(source.parent.configStore().config().sources());
                return EXIT_OK;
            }
        }
    }

    @Command(name = "load", description = "Scan sources (or one file) and enqueue new or changed tasks")
    static final class LoadCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Option(names = {"--file"}, description = "Single specification file to load")
        String file;

        @Option(names = {"--source"}, description = "Source id; required with --file")
        String source;

        @Override
        public Integer call() {
            QueueConfig queueConfig = parent.configStore().validated();
            TaskProcessor processor = parent.processor(queueConfig);
            if (file != null && !file.isBlank()) {
                if (source == null || source.isBlank()) {
                    throw new ConfigValidationException("--source is required with --file");
                }
                boolean loaded = processor.loadSingleTask(Paths.get(file), source, TaskOrigin.MANUAL);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("file", file);
                out.put("sourceId", source);
                out.put("loaded", loaded);
                parent.print(out);
                return EXIT_OK;
            }
            TaskProcessor.LoadOutcome outcome = source == null || source.isBlank()
                    ? processor.loadTasks(TaskOrigin.LOAD)
                    : processor.loadTasks(List.of(source), TaskOrigin.LOAD);
            parent.print(outcome);
            return EXIT_OK;
        }
    }

    @Command(name = "process", description = "Execute pending tasks round-robin across sources, then exit")
    static final class ProcessCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Option(names = {"--max"}, defaultValue = "0", description = "Maximum tasks to execute; 0 for no limit")
        int max;

        @Option(names = {"--source"}, description = "Only execute tasks of this source")
        String source;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Use the echo executor instead of the configured command")
        boolean dryRun;

        @Override
        public Integer call() {
            QueueConfig queueConfig = parent.configStore().validated();
            TaskProcessor processor = parent.processor(queueConfig, executor(queueConfig, dryRun));
            TaskProcessor.ProcessRequest request = source == null || source.isBlank()
                    ? TaskProcessor.ProcessRequest.all(max)
                    : TaskProcessor.ProcessRequest.forSource(source, max);
            parent.print(processor.processTasks(request));
            return EXIT_OK;
        }
    }

    @Command(name = "status", description = "Show queue counters and per-source state")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Override
        public Integer call() {
            QueueConfig queueConfig = parent.configStore().config();
            parent.print(parent.processor(queueConfig).status());
            return EXIT_OK;
        }
    }

    @Command(name = "queue", description = "List task records in queue order")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Option(names = {"--source"}, description = "Filter by source id")
        String source;

        @Option(names = {"--status"}, description = "Filter by status: pending|running|completed|failed")
        String status;

        @Override
        public Integer call() {
            TaskStatus filter;
            try {
                filter = status == null || status.isBlank() ? null : TaskStatus.fromString(status);
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException("Unknown status filter: " + status);
            }
            QueueConfig queueConfig = parent.configStore().config();
            parent.print(parent.processor(queueConfig).tasks(source, filter));
            return EXIT_OK;
        }
    }

    @Command(name = "unload", description = "Remove all task records of a source from the queue state")
    static final class UnloadCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Parameters(index = "0", description = "Source id")
        String sourceId;

        @Override
        public Integer call() {
            QueueConfig queueConfig = parent.configStore().config();
            int removed = parent.processor(queueConfig).unloadSource(sourceId);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("sourceId", sourceId);
            out.put("unloadedTasks", removed);
            parent.print(out);
            return EXIT_OK;
        }
    }

    @Command(name = "run", description = "Run the queue daemon, or a single load-and-process cycle with --once")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Load, process everything pending, then exit")
        boolean once;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Use the echo executor instead of the configured command")
        boolean dryRun;

        @Override
        public Integer call() throws Exception {
            QueueConfig queueConfig = parent.configStore().validated();
            TaskProcessor processor = parent.processor(queueConfig, executor(queueConfig, dryRun));
            if (once) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("load", processor.loadTasks(TaskOrigin.LOAD));
                out.put("process", processor.processTasks(TaskProcessor.ProcessRequest.all(0)));
                parent.print(out);
                return EXIT_OK;
            }
            if (queueConfig.sources().isEmpty()) {
                throw new ConfigValidationException("No sources configured; use 'source add' first");
            }
            QueueDaemon daemon = new QueueDaemon(processor);
            daemon.installShutdownHook();
            daemon.start();
            daemon.awaitTermination();
            return EXIT_OK;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit journal")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        SpecQueueCommand parent;

        @Override
        public Integer call() {
            QueueConfig queueConfig = parent.configStore().config();
            AuditLogger.VerifyResult result = new AuditLogger(parent.paths(queueConfig).auditFile()).verify();
            parent.print(result);
            return result.valid() ? EXIT_OK : EXIT_FAILURE;
        }
    }
}
