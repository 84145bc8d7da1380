package de.mirkosertic.filevault.cli;

import de.mirkosertic.filevault.config.BuildInfo;
import picocli.CommandLine.IVersionProvider;

/**
 * Feeds {@code --version} from the build info.
 */
public class BuildInfoVersionProvider implements IVersionProvider {

    @Override
    public String[] getVersion() {
        return new String[]{BuildInfo.describe()};
    }
}
