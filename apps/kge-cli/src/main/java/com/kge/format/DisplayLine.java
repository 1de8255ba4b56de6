package com.kge.format;

import picocli.CommandLine.Help.Ansi;

public record DisplayLine(EventRow row, String notice) {

    public static DisplayLine of(EventRow row) {
        return new DisplayLine(row, null);
    }

    public static DisplayLine notice(String text) {
        return new DisplayLine(null, text);
    }

    public boolean isNotice() {
        return row == null;
    }

    public String render(Ansi ansi) {
        if (isNotice()) {
            return ansi.string("@|yellow " + notice + "|@");
        }
        StringBuilder line = new StringBuilder()
                .append(ansi.string("@|cyan " + row.time() + "|@")).append(' ')
                .append(ansi.string((row.isNormal() ? "@|green " : "@|red ") + text(row.type()) + "|@")).append(' ')
                .append(ansi.string("@|bold " + objectRef() + "|@")).append(' ')
                .append(ansi.string("@|yellow " + text(row.reason()) + "|@")).append(": ")
                .append(text(row.message()));
        if (row.count() > 1) {
            line.append(" (x").append(row.count()).append(')');
        }
        return line.toString();
    }

    private String objectRef() {
        String name = text(row.name());
        return row.kind() == null || row.kind().isBlank() ? name : row.kind() + "/" + name;
    }

    private static String text(String value) {
        return value == null ? "<none>" : value;
    }
}
