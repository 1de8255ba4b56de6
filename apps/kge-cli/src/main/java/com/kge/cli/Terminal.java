package com.kge.cli;

import java.io.BufferedReader;
import java.io.PrintWriter;
import picocli.CommandLine.Help.Ansi;

// results go to out; menus, prompts and errors go to messages
public record Terminal(BufferedReader in, PrintWriter out, PrintWriter messages, Ansi ansi, boolean guardInterrupts) {

    public Terminal(BufferedReader in, PrintWriter out, Ansi ansi, boolean guardInterrupts) {
        this(in, out, out, ansi, guardInterrupts);
    }
}
