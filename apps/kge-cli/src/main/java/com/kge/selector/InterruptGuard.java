package com.kge.selector;

import java.io.PrintWriter;
import java.util.function.IntConsumer;
import org.jboss.logging.Logger;

/**
 * Turns an interrupt (Ctrl-C) received while waiting for input into a graceful quit with exit status 0.
 * Registered for the duration of one prompt only.
 */
final class InterruptGuard implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger("KGE.Selector");

    static final int GRACEFUL_EXIT = 0;

    private final Thread hook;
    private boolean registered;

    private InterruptGuard(PrintWriter out, IntConsumer exit) {
        this.hook = new Thread(() -> onInterrupt(out, exit), "kge-interrupt");
    }

    static InterruptGuard install(PrintWriter out) {
        // nothing to unwind at the prompt, so skip the remaining shutdown work
        return install(out, Runtime.getRuntime()::halt);
    }

    static InterruptGuard install(PrintWriter out, IntConsumer exit) {
        InterruptGuard guard = new InterruptGuard(out, exit);
        Runtime.getRuntime().addShutdownHook(guard.hook);
        guard.registered = true;
        return guard;
    }

    static void onInterrupt(PrintWriter out, IntConsumer exit) {
        out.println();
        out.println(InteractiveSelector.GOODBYE);
        out.flush();
        exit.accept(GRACEFUL_EXIT);
    }

    Thread hook() {
        return hook;
    }

    @Override
    public void close() {
        if (registered) {
            registered = false;
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOGGER.debugv("Shutdown already in progress, leaving the exit to the hook: {0}", e.getMessage());
            }
        }
    }
}
