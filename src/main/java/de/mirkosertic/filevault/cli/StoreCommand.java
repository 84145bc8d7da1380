package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.MetadataStore;
import de.mirkosertic.filevault.config.ApplicationConfig;
import org.jspecify.annotations.Nullable;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base for commands that only read or write records of the metadata store.
 * Opens the configured store for the duration of the command unless one is handed in.
 */
abstract class StoreCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    @Spec
    private CommandSpec spec;

    @Nullable
    private final MetadataStore store;
    @Nullable
    private final ApplicationConfig config;

    StoreCommand(@Nullable final MetadataStore store, @Nullable final ApplicationConfig config) {
        this.store = store;
        this.config = config;
    }

    @Override
    public Integer call() throws Exception {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            if (store != null && config != null) {
                return execute(store, config, out, err);
            }
            final ApplicationConfig loaded = ApplicationConfig.load();
            final MetadataStore opened = new MetadataStore(loaded.getIndexPath(), loaded.getNrtRefreshIntervalMs());
            opened.init();
            try {
                return execute(opened, loaded, out, err);
            } finally {
                opened.close();
            }
        } finally {
            out.flush();
            err.flush();
        }
    }

    protected abstract int execute(MetadataStore store, ApplicationConfig config, PrintWriter out, PrintWriter err)
            throws IOException;
}
