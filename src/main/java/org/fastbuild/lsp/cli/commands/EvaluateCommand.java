package org.fastbuild.lsp.cli.commands;

import org.fastbuild.lsp.cli.CommandLineInterface;
import org.fastbuild.lsp.cli.json.EvaluationResultJson;
import org.fastbuild.lsp.evaluator.Evaluator;
import org.fastbuild.lsp.evaluator.EvaluatorSettings;
import org.fastbuild.lsp.evaluator.SettingsException;
import org.fastbuild.lsp.evaluator.api.EvaluatedData;
import org.fastbuild.lsp.evaluator.api.EvaluationResult;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.io.DiskFileSystem;
import org.fastbuild.lsp.evaluator.io.ParseDataProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "evaluate", description = "Evaluates a BFF file and prints a summary or the full data as JSON.")
public class EvaluateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The root BFF file.")
    private File file;

    @Option(names = {"-j", "--json"}, description = "Print the evaluated data as JSON.")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EvaluatorSettings settings;
        try {
            settings = EvaluatorSettings.fromConfig(parent.getConfig());
        } catch (SettingsException e) {
            err.println("Invalid settings: " + e.getMessage());
            return 2;
        }

        Evaluator evaluator = new Evaluator(settings, new ParseDataProvider(new DiskFileSystem()), System.getenv());
        EvaluationResult result = evaluator.evaluate(file.toPath());

        if (json) {
            out.println(EvaluationResultJson.toJson(result));
        } else {
            EvaluatedData data = result.getData();
            out.println("Evaluated variables:  " + data.getEvaluatedVariables().size());
            out.println("Variable definitions: " + data.getVariableDefinitions().size());
            out.println("Variable references:  " + data.getVariableReferences().size());
            out.println("Target definitions:   " + data.getTargetDefinitions().size());
            out.println("Target references:    " + data.getTargetReferences().size()
                    + " (" + data.getUnresolvedTargetReferences().size() + " unresolved)");
        }

        if (result.hasError()) {
            SourceException error = result.getError().get();
            err.println(error.getKind() + ": " + error.getMessage() + " at " + error.getRange());
            return 1;
        }
        return 0;
    }
}
