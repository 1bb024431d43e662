package work.lcod.pyson.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pyson.io.PysonFiles;
import work.lcod.pyson.json.PysonJson;

@CommandLine.Command(
    name = "to-json",
    description = "Print a pyson document as JSON.",
    mixinStandardHelpOptions = true
)
final class ToJsonCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--map",
        description = "Emit an object keyed by name instead of an array of entries."
    )
    private boolean asMap;

    @CommandLine.Parameters(paramLabel = "FILE", description = "Pyson document.")
    private Path file;

    @Override
    public Integer call() {
        String json = asMap
            ? PysonJson.toJsonObject(PysonFiles.readDocumentAsMap(file))
            : PysonJson.toJson(PysonFiles.readDocument(file));
        spec.commandLine().getOut().println(json);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
