package org.webmev.structures.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.webmev.structures.api.OperationValidator;
import org.webmev.structures.api.ValidationResult;
import org.webmev.structures.catalog.ResourceTypeCatalog;
import org.webmev.structures.catalog.ResourceTypeCatalogLoader;
import org.webmev.structures.shared.JsonSupport;
import picocli.CommandLine;

@CommandLine.Command(
    name = "mev-validate",
    description = "Validate MEV operation documents and input values.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {ValidateCommand.OperationCommand.class, ValidateCommand.ValueCommand.class}
)
final class ValidateCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: operation or value.");
    }

    @CommandLine.Command(
        name = "operation",
        description = "Validate operation documents (JSON or YAML) and print the normalised result.",
        mixinStandardHelpOptions = true,
        versionProvider = VersionProvider.class
    )
    static final class OperationCommand implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Operation documents to check.")
        private List<Path> files = new ArrayList<>();

        @CommandLine.Option(
            names = {"-r", "--resource-types"},
            paramLabel = "TOML",
            description = "Resource type catalogue (default: bundled catalogue)."
        )
        private Path resourceTypes;

        @CommandLine.Option(
            names = {"-f", "--format"},
            description = "Input format (${COMPLETION-CANDIDATES}); guessed from the file extension when omitted."
        )
        private JsonSupport.Format format;

        @Override
        public Integer call() {
            ResourceTypeCatalog catalog = resourceTypes == null
                ? ResourceTypeCatalogLoader.loadDefault()
                : ResourceTypeCatalogLoader.load(resourceTypes);
            var validator = new OperationValidator(catalog);
            int exitCode = 0;
            for (Path file : files) {
                ValidationResult result = format == null
                    ? validator.validateFile(file)
                    : validator.validate(readText(file), format, file.toString());
                exitCode = Math.max(exitCode, result.status().exitCode());
                spec.commandLine().getOut().println(result.toPrettyJson());
            }
            return exitCode;
        }

        private String readText(Path file) {
            try {
                return Files.readString(file);
            } catch (IOException ex) {
                throw new UncheckedIOException("Unable to read " + file + ": " + ex.getMessage(), ex);
            }
        }
    }

    @CommandLine.Command(
        name = "value",
        description = "Check a JSON value against a JSON input spec.",
        mixinStandardHelpOptions = true,
        versionProvider = VersionProvider.class
    )
    static final class ValueCommand implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = {"-s", "--spec"}, required = true, paramLabel = "JSON",
            description = "Input spec, e.g. {\"attribute_type\":\"PositiveInteger\"}.")
        private String specJson;

        @CommandLine.Option(names = {"-v", "--value"}, required = true, paramLabel = "JSON",
            description = "Candidate value as JSON (use null for no value).")
        private String valueJson;

        @CommandLine.Option(names = "--required", description = "Reject null values.")
        private boolean required;

        @CommandLine.Option(names = "--ignore-extra-keys",
            description = "Discard unrecognized keys in the value instead of failing.")
        private boolean ignoreExtraKeys;

        @Override
        public Integer call() {
            ValidationResult result = new OperationValidator(ResourceTypeCatalogLoader.loadDefault())
                .checkValue(specJson, valueJson, required, ignoreExtraKeys);
            spec.commandLine().getOut().println(result.toPrettyJson());
            return result.status().exitCode();
        }
    }
}
