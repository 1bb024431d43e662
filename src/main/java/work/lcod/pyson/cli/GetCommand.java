package work.lcod.pyson.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pyson.io.PysonFiles;
import work.lcod.pyson.model.PysonValue;

@CommandLine.Command(
    name = "get",
    description = "Print the encoded value stored under a name.",
    mixinStandardHelpOptions = true
)
final class GetCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Pyson document.")
    private Path file;

    @CommandLine.Parameters(index = "1", paramLabel = "NAME", description = "Entry name.")
    private String name;

    @Override
    public Integer call() {
        PysonValue value = PysonFiles.readDocumentAsMap(file).get(name);
        if (value == null) {
            spec.commandLine().getErr().println("No entry named " + name + " in " + file);
            return 1;
        }
        spec.commandLine().getOut().println(value.encode());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
