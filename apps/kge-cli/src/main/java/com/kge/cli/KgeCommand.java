package com.kge.cli;

import com.kge.completion.CompletionProvider;
import com.kge.completion.ZshCompletionScript;
import com.kge.events.EventFilter;
import com.kge.format.TimeStyle;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@TopCommand
@Command(
        name = "kge",
        sortOptions = false,
        versionProvider = KgeCommand.VersionProvider.class,
        description = {
                "View Kubernetes events",
                "",
                "Try `@|cyan kge -ea|@` to see all pods with abnormal events",
                "@|cyan source <(kge --completion=zsh)|@ to enable zsh completion for pods and namespaces"
        }
)
public class KgeCommand implements Callable<Integer> {

    private static final Logger LOGGER = Logger.getLogger("KGE.Command");

    public enum Shell {
        ZSH
    }

    @Parameters(index = "0", arity = "0..1", paramLabel = "POD", description = "Pod name to view events for")
    String pod;

    @Option(names = {"-a", "--all"}, description = "Get events for all pods")
    boolean all;

    @Option(names = {"-n", "--namespace"}, paramLabel = "NAMESPACE", description = "Specify namespace to use")
    String namespace;

    @Option(names = {"-e", "--exceptions-only"}, description = "Show only non-normal events")
    boolean exceptionsOnly;

    @Option(names = {"-r", "--reason"}, paramLabel = "REASON", description = "Only show events with this reason")
    String reason;

    @Option(names = {"-k", "--kind"}, paramLabel = "KIND", description = "Only show events for this object kind")
    String kind;

    @Option(names = {"-t", "--type"}, paramLabel = "TYPE", description = "Only show events of this type")
    String type;

    @Option(names = "--show-timestamps", description = "Show absolute timestamps instead of relative times")
    boolean showTimestamps;

    @Option(names = {"-o", "--output"}, paramLabel = "FORMAT", defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OutputFormat output;

    @Option(names = "--complete-pod", hidden = true)
    boolean completePod;

    @Option(names = "--complete-ns", hidden = true)
    boolean completeNamespaces;

    @Option(names = "--completion", hidden = true, paramLabel = "SHELL")
    Shell completion;

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "Show version information and exit")
    boolean versionRequested;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    boolean helpRequested;

    @Spec
    CommandSpec spec;

    @Inject
    EventBrowser browser;

    @Inject
    CompletionProvider completions;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (completePod) {
            out.println(completions.resourceWords(spec.commandLine().getParseResult().originalArgs()));
            out.flush();
            return EventBrowser.OK;
        }
        if (completeNamespaces) {
            out.println(completions.namespaceWords());
            out.flush();
            return EventBrowser.OK;
        }
        if (completion == Shell.ZSH) {
            out.print(ZshCompletionScript.SCRIPT);
            out.flush();
            return EventBrowser.OK;
        }

        boolean json = output == OutputFormat.JSON;
        Terminal terminal = new Terminal(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                out,
                json ? spec.commandLine().getErr() : out,
                json ? Ansi.OFF : Ansi.AUTO,
                true);
        try {
            return browser.run(invocation(), terminal);
        } catch (RuntimeException e) {
            LOGGER.debugv(e, "Unexpected failure: {0}", e.getMessage());
            terminal.messages().println(terminal.ansi().string("@|red Error: " + e.getMessage() + "|@"));
            terminal.messages().flush();
            return EventBrowser.FAILURE;
        }
    }

    Invocation invocation() {
        return new Invocation(
                Optional.ofNullable(pod),
                all,
                exceptionsOnly,
                Optional.ofNullable(namespace),
                new EventFilter(Optional.ofNullable(reason), Optional.ofNullable(kind), Optional.ofNullable(type)),
                showTimestamps ? TimeStyle.ABSOLUTE : TimeStyle.RELATIVE,
                output);
    }

    public static class VersionProvider implements IVersionProvider {

        @Override
        public String[] getVersion() {
            String version = ConfigProvider.getConfig()
                    .getOptionalValue("quarkus.application.version", String.class)
                    .orElse("unknown");
            return new String[] {"kge " + version};
        }
    }
}
