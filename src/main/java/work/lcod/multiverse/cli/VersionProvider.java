package work.lcod.multiverse.cli;

import picocli.CommandLine;
import work.lcod.multiverse.api.Multiverse;

/**
 * Reports the engine version from the jar manifest and the Java runtime it runs on.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNPACKAGED_VERSION = "development";

    @Override
    public String[] getVersion() {
        var manifestVersion = Multiverse.class.getPackage().getImplementationVersion();
        return new String[] {
            "multiverse-run " + (manifestVersion == null ? UNPACKAGED_VERSION : manifestVersion),
            "Java " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
