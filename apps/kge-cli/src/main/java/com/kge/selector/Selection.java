package com.kge.selector;

import java.util.Locale;
import java.util.Optional;

public sealed interface Selection permits Selection.AllEvents, Selection.NonNormalAll, Selection.Single, Selection.Quit {

    record AllEvents() implements Selection {
    }

    record NonNormalAll() implements Selection {
    }

    record Single(int index, String resource) implements Selection {
    }

    record Quit() implements Selection {
    }

    static Optional<Selection> parse(String input, SelectionMenu menu) {
        String choice = input.strip();
        if (choice.toLowerCase(Locale.ROOT).equals("q")) {
            return Optional.of(new Quit());
        }
        if (choice.equals("a")) {
            return Optional.of(new AllEvents());
        }
        if (choice.equals("e")) {
            return Optional.of(new NonNormalAll());
        }
        int index;
        try {
            index = Integer.parseInt(choice);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return menu.resourceAt(index).map(resource -> new Single(index, resource));
    }
}
