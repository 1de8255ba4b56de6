package com.kge.selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine.Help.Ansi;

public record SelectionMenu(List<String> resources) {

    public SelectionMenu {
        resources = List.copyOf(resources);
    }

    public int size() {
        return resources.size();
    }

    public Optional<String> resourceAt(int index) {
        if (index < 1 || index > resources.size()) {
            return Optional.empty();
        }
        return Optional.of(resources.get(index - 1));
    }

    public List<String> render(Ansi ansi) {
        List<String> lines = new ArrayList<>();
        lines.add(ansi.string("@|cyan Select a pod:|@"));
        lines.add("  " + ansi.string("@|green e|@") + ") Abnormal events for all pods");
        lines.add("  " + ansi.string("@|green a|@") + ") All pods, all events");
        for (int i = 0; i < resources.size(); i++) {
            String number = Integer.toString(i + 1);
            String padding = " ".repeat(Math.max(0, 3 - number.length()));
            lines.add(padding + ansi.string("@|green " + number + "|@") + ") " + resources.get(i));
        }
        lines.add("  " + ansi.string("@|green q|@") + ") Quit");
        return lines;
    }
}
