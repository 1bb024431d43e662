package work.lcod.pyson.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pyson.codec.DocumentCodec;
import work.lcod.pyson.io.PysonFiles;
import work.lcod.pyson.json.PysonJson;

@CommandLine.Command(
    name = "from-json",
    description = "Print a flat JSON object as a pyson document.",
    mixinStandardHelpOptions = true
)
final class FromJsonCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(paramLabel = "FILE", description = "JSON file holding a flat object.")
    private Path file;

    @Override
    public Integer call() {
        var entries = PysonJson.fromJson(PysonFiles.readText(file));
        spec.commandLine().getOut().println(DocumentCodec.encode(entries));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
