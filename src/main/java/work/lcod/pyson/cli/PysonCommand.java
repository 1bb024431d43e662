package work.lcod.pyson.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "pyson",
    description = "Validate, query and convert pyson documents.",
    mixinStandardHelpOptions = true,
    versionProvider = PysonCommand.class,
    subcommands = {
        ValidateCommand.class,
        GetCommand.class,
        ToJsonCommand.class,
        FromJsonCommand.class
    }
)
final class PysonCommand implements Runnable, CommandLine.IVersionProvider {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /** Jar manifest version, or {@code development} when running from classes. */
    @Override
    public String[] getVersion() {
        var manifestVersion = PysonCommand.class.getPackage().getImplementationVersion();
        return new String[] { "pyson " + (manifestVersion == null ? "development" : manifestVersion) };
    }
}
