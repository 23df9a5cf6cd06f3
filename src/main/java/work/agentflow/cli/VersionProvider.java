package work.agentflow.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        return new String[] {
            "agentflow " + version,
            "JVM: ${java.version} (${java.vendor})"
        };
    }
}
