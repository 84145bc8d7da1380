package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.FileVaultApplication;
import de.mirkosertic.filevault.config.ApplicationConfig;
import de.mirkosertic.filevault.config.LoggingConfigurator;
import de.mirkosertic.filevault.indexsync.IndexSyncError;
import de.mirkosertic.filevault.indexsync.IndexSyncException;
import de.mirkosertic.filevault.indexsync.IndexSyncStats;
import de.mirkosertic.filevault.indexsync.SyncMode;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import de.mirkosertic.filevault.task.IndexRebuildTask;
import de.mirkosertic.filevault.task.TaskResult;
import de.mirkosertic.filevault.task.TaskStatus;
import org.jspecify.annotations.Nullable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Reconcile the metadata index with the storage tree from the command line.
 * <p>
 * Exit codes: 0 when the run completed (whatever it found), 2 for an invalid mode or a
 * destructive mode without {@code --force}, 1 when the run itself failed.
 */
@Command(
        name = "rebuild-index",
        description = "Reconcile the metadata index with the files on disk",
        mixinStandardHelpOptions = true
)
public class RebuildIndexCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_STRUCTURAL = 2;

    private static final int MAX_ERRORS_SHOWN = 10;
    private static final String RULE = "=".repeat(60);

    @Spec
    private CommandSpec spec;

    @Option(names = "--mode", defaultValue = "audit", paramLabel = "<mode>",
            description = "audit (report only), sync (add missing), clean (remove orphans), full (sync + clean). Default: audit")
    private String mode;

    @Option(names = "--user-id", paramLabel = "<id>", description = "Only reconcile this user (default: all users)")
    private Long userId;

    @Option(names = "--org-id", paramLabel = "<id>",
            description = "Only reconcile this organization's shared storage (implies --shared)")
    private Long orgId;

    @Option(names = "--shared", description = "Reconcile organization shared storage instead of user storage")
    private boolean shared;

    @Option(names = "--dry-run", description = "Show what would be done without making changes")
    private boolean dryRun;

    @Option(names = "--force", description = "Confirm destructive modes (clean, full)")
    private boolean force;

    @Option(names = {"-v", "--verbosity"}, defaultValue = "1", paramLabel = "<level>",
            description = "0 = quiet, 1 = results, 2 = debug logging, 3 = trace logging. Default: 1")
    private int verbosity;

    @Nullable
    private final IndexRebuildTask rebuildTask;

    public RebuildIndexCommand() {
        this(null);
    }

    /**
     * Run against an existing task instead of starting the application.
     */
    public RebuildIndexCommand(@Nullable final IndexRebuildTask rebuildTask) {
        this.rebuildTask = rebuildTask;
    }

    @Override
    public Integer call() throws Exception {
        LoggingConfigurator.applyVerbosity(verbosity);
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final SyncRequest request;
        try {
            final boolean sharedStorage = shared || orgId != null;
            request = new SyncRequest(SyncMode.parse(mode), sharedStorage ? orgId : userId, sharedStorage, dryRun, force);
            request.checkForce();
        } catch (final IndexSyncException e) {
            err.println("Error [" + e.getCode() + "]: " + e.getMessage());
            err.flush();
            return EXIT_STRUCTURAL;
        }

        if (verbosity >= 1) {
            printHeader(out, request);
        }

        final TaskResult result;
        if (rebuildTask != null) {
            result = rebuildTask.run(request);
        } else {
            final FileVaultApplication app = new FileVaultApplication(ApplicationConfig.load());
            app.init();
            try {
                result = app.getRebuildTask().run(request);
            } finally {
                app.shutdown();
            }
        }

        if (result.status() == TaskStatus.FAILED || result.stats() == null) {
            err.println("Task failed!");
            for (final String error : result.errors()) {
                err.println(error);
            }
            err.flush();
            return EXIT_FAILED;
        }

        if (verbosity >= 1) {
            printStats(out, result.stats());
        }
        out.flush();
        return EXIT_OK;
    }

    private void printHeader(final PrintWriter out, final SyncRequest request) {
        out.println(RULE);
        out.println(request.shared() ? "Shared Storage Index Rebuild" : "Storage Index Rebuild");
        out.println(RULE);
        out.println();
        out.println("Mode: " + request.mode().value());
        if (request.ownerId() != null) {
            out.println((request.shared() ? "Organization ID: " : "User ID: ") + request.ownerId());
        }
        if (request.dryRun()) {
            out.println("DRY RUN: No changes will be made");
        }
        out.println();
    }

    static void printStats(final PrintWriter out, final IndexSyncStats stats) {
        out.println();
        out.println(RULE);
        out.println("Results");
        out.println(RULE);

        out.println("Users scanned: " + stats.usersScanned());
        out.println("Files on disk: " + stats.filesOnDisk());
        out.println("Files in index: " + stats.filesInIndex());
        out.println();

        // Discrepancies
        printIfPositive(out, "Missing in index: ", stats.missingInIndex());
        printIfPositive(out, "Stale in index: ", stats.staleInIndex());
        printIfPositive(out, "Orphaned in index: ", stats.orphanedInIndex());

        // Actions taken
        printIfPositive(out, "Records created: ", stats.recordsCreated());
        printIfPositive(out, "Records updated: ", stats.recordsUpdated());
        printIfPositive(out, "Records deleted: ", stats.recordsDeleted());
        printIfPositive(out, "Share links deleted: ", stats.dependentsDeleted());
        printIfPositive(out, "Records skipped: ", stats.recordsSkipped());

        final List<IndexSyncError> errors = stats.errors();
        if (!errors.isEmpty()) {
            out.println();
            out.println("Errors (" + errors.size() + "):");
            for (final IndexSyncError error : errors.subList(0, Math.min(MAX_ERRORS_SHOWN, errors.size()))) {
                out.println("  * " + error);
            }
            if (errors.size() > MAX_ERRORS_SHOWN) {
                out.println("  ... and " + (errors.size() - MAX_ERRORS_SHOWN) + " more");
            }
        }
        out.println();

        if (stats.cancelled()) {
            out.println("Run was cancelled, results are partial");
        } else if (stats.inSync()) {
            out.println("Index is in sync!");
        }
        out.printf("Finished in %d ms%n", stats.durationMs());
    }

    private static void printIfPositive(final PrintWriter out, final String label, final int value) {
        if (value > 0) {
            out.println(label + value);
        }
    }
}
