package com.kge.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kge.events.EventQueryService;
import com.kge.format.EventFormatter;
import com.kge.k8s.K8sConnectionException;
import com.kge.k8s.K8sQueryException;
import com.kge.model.K8sEvent;
import com.kge.namespace.NamespaceContext;
import com.kge.namespace.NamespaceResolver;
import com.kge.resources.ResourceCatalog;
import com.kge.selector.InteractiveSelector;
import com.kge.selector.Selection;
import com.kge.selector.SelectionMenu;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs one kge session: a direct pod query, all events of a namespace, or the interactive menu.
 * Returns the process exit status.
 */
@ApplicationScoped
public class EventBrowser {

    private static final Logger LOGGER = Logger.getLogger("KGE.Browser");

    public static final int OK = 0;
    public static final int FAILURE = 1;

    private final NamespaceResolver namespaces;
    private final ResourceCatalog catalog;
    private final EventQueryService queries;
    private final EventFormatter formatter;
    private final ObjectMapper mapper;
    private final int ruleWidth;

    @Inject
    public EventBrowser(NamespaceResolver namespaces,
            ResourceCatalog catalog,
            EventQueryService queries,
            EventFormatter formatter,
            ObjectMapper mapper,
            @ConfigProperty(name = "kge.output.rule-width", defaultValue = "40") int ruleWidth) {
        this.namespaces = namespaces;
        this.catalog = catalog;
        this.queries = queries;
        this.formatter = formatter;
        this.mapper = mapper;
        this.ruleWidth = ruleWidth;
    }

    public int run(Invocation invocation, Terminal terminal) {
        NamespaceContext context = namespaces.resolve(invocation.namespace());
        String namespace = context.namespace();
        LOGGER.debugv("Namespace {0} resolved from {1}", namespace, context.source());
        banner(terminal, invocation, "Using namespace: " + namespace);

        if (invocation.pod().isPresent()) {
            String pod = invocation.pod().get();
            return show(terminal, invocation, "Getting events for pod: " + pod, true,
                    () -> queries.eventsForPod(namespace, pod, invocation.exceptionsOnly()));
        }
        if (invocation.all()) {
            return show(terminal, invocation, "Getting events for all pods", true,
                    () -> queries.eventsForNamespace(namespace, invocation.exceptionsOnly()));
        }
        return browse(terminal, invocation, namespace);
    }

    private int browse(Terminal terminal, Invocation invocation, String namespace) {
        banner(terminal, invocation, "Fetching pods...");
        List<String> resources;
        try {
            resources = catalog.selectableResources(namespace);
        } catch (K8sConnectionException | K8sQueryException e) {
            return error(terminal, "Error fetching pods: ", e);
        }
        if (resources.isEmpty()) {
            terminal.messages().println(terminal.ansi().string("@|yellow No pods found in namespace " + namespace + "|@"));
            terminal.messages().flush();
            return OK;
        }

        var selector = new InteractiveSelector(terminal.in(), terminal.messages(), terminal.ansi(),
                terminal.guardInterrupts());
        Selection selection = selector.select(new SelectionMenu(resources));
        if (selection instanceof Selection.Quit) {
            return OK;
        }
        terminal.messages().println();
        if (selection instanceof Selection.NonNormalAll) {
            return show(terminal, invocation, "Getting non-normal events for all pods", false,
                    () -> queries.eventsForNamespace(namespace, true));
        }
        if (selection instanceof Selection.AllEvents) {
            return show(terminal, invocation, "Getting events for all pods", false,
                    () -> queries.eventsForNamespace(namespace, invocation.exceptionsOnly()));
        }
        if (selection instanceof Selection.Single single) {
            return show(terminal, invocation, "Getting events for pod: " + single.resource(), false,
                    () -> queries.eventsForPod(namespace, single.resource(), invocation.exceptionsOnly()));
        }
        throw new IllegalStateException("Unhandled selection " + selection);
    }

    private int show(Terminal terminal, Invocation invocation, String heading, boolean failWhenEmpty,
            Supplier<List<K8sEvent>> query) {
        banner(terminal, invocation, heading);
        banner(terminal, invocation, "-".repeat(ruleWidth));
        List<K8sEvent> events;
        try {
            events = invocation.filter().apply(query.get());
        } catch (K8sConnectionException e) {
            return error(terminal, "Error connecting to Kubernetes: ", e);
        } catch (K8sQueryException e) {
            return error(terminal, "Error getting events: ", e);
        }

        if (invocation.output() == OutputFormat.JSON) {
            terminal.out().println(toJson(events, invocation));
        } else {
            formatter.format(events, invocation.timeStyle()).stream()
                    .map(line -> line.render(terminal.ansi()))
                    .forEach(terminal.out()::println);
        }
        terminal.out().flush();
        return events.isEmpty() && failWhenEmpty ? FAILURE : OK;
    }

    private String toJson(List<K8sEvent> events, Invocation invocation) {
        try {
            return mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(formatter.rows(events, invocation.timeStyle()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to render events as JSON", e);
        }
    }

    private void banner(Terminal terminal, Invocation invocation, String text) {
        if (invocation.output() == OutputFormat.TEXT) {
            terminal.out().println(terminal.ansi().string("@|cyan " + text + "|@"));
        }
    }

    private int error(Terminal terminal, String prefix, RuntimeException e) {
        LOGGER.debugv(e, "Command failed: {0}", e.getMessage());
        terminal.messages().println(terminal.ansi().string("@|red " + prefix + e.getMessage() + "|@"));
        terminal.messages().flush();
        return FAILURE;
    }
}
