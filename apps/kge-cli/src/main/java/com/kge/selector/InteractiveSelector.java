package com.kge.selector;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Optional;
import org.jboss.logging.Logger;
import picocli.CommandLine.Help.Ansi;

/**
 * Shows a {@link SelectionMenu} and reads lines until one is a valid choice.
 * <p>
 * Invalid input re-prompts without limit; only a valid choice, {@code q}, end of input or an interrupt ends the
 * loop.
 */
public class InteractiveSelector {

    private static final Logger LOGGER = Logger.getLogger("KGE.Selector");

    static final String PROMPT = "Enter selection: ";
    static final String GOODBYE = "Exiting gracefully...";

    private final BufferedReader in;
    private final PrintWriter out;
    private final Ansi ansi;
    private final boolean guardInterrupts;

    public InteractiveSelector(BufferedReader in, PrintWriter out, Ansi ansi, boolean guardInterrupts) {
        this.in = in;
        this.out = out;
        this.ansi = ansi;
        this.guardInterrupts = guardInterrupts;
    }

    public Selection select(SelectionMenu menu) {
        menu.render(ansi).forEach(out::println);
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = readLine();
            if (line == null) {
                LOGGER.debug("Input closed while waiting for a selection");
                return quit();
            }
            Optional<Selection> selection = Selection.parse(line, menu);
            if (selection.isEmpty()) {
                out.println(rejection(line, menu));
                continue;
            }
            if (selection.get() instanceof Selection.Quit) {
                return quit();
            }
            LOGGER.debugv("Selected {0}", selection.get());
            return selection.get();
        }
    }

    private String readLine() {
        try (InterruptGuard guard = guardInterrupts ? InterruptGuard.install(out) : null) {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read the selection", e);
        }
    }

    private Selection quit() {
        out.println();
        out.println(GOODBYE);
        out.flush();
        return new Selection.Quit();
    }

    static String rejection(String line, SelectionMenu menu) {
        try {
            Integer.parseInt(line.strip());
            return "Invalid selection. Please enter a number between 1 and " + menu.size() + " or q to quit";
        } catch (NumberFormatException e) {
            return "Please enter a valid number, a, e or q to quit";
        }
    }
}
