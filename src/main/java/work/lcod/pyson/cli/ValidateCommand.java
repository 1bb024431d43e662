package work.lcod.pyson.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pyson.codec.DocumentCodec;
import work.lcod.pyson.codec.PysonValidator;
import work.lcod.pyson.error.PysonException;
import work.lcod.pyson.io.PysonFiles;

@CommandLine.Command(
    name = "validate",
    description = "Check that files are well-formed pyson documents.",
    mixinStandardHelpOptions = true
)
final class ValidateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--strict",
        description = "Also require unique names and report the first failing line."
    )
    private boolean strict;

    @CommandLine.Parameters(paramLabel = "FILE", arity = "1..*", description = "Documents to check.")
    private List<Path> files = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = 0;
        for (Path file : files) {
            String status;
            try {
                status = strict ? checkStrict(file) : check(file);
            } catch (PysonException | UncheckedIOException ex) {
                status = ex.getMessage();
            }
            if (!"ok".equals(status)) {
                exitCode = 1;
            }
            out.println(file + ": " + status);
        }
        out.flush();
        return exitCode;
    }

    private String check(Path file) {
        return PysonValidator.isValidDocument(PysonFiles.readText(file)) ? "ok" : "invalid";
    }

    private String checkStrict(Path file) {
        DocumentCodec.parseDocument(PysonFiles.readText(file));
        return "ok";
    }
}
