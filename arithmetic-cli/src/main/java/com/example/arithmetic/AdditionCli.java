package com.example.arithmetic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public final class AdditionCli {
    static final String FIRST_PROMPT = "Inserisci il primo numero: ";
    static final String SECOND_PROMPT = "Inserisci il secondo numero: ";

    private AdditionCli() {}

    public static void main(String[] args) {
        Launcher.launch(AdditionCli::run);
    }

    static int run(BufferedReader in, PrintStream out, PrintStream err) throws IOException {
        ConsoleInput console = new ConsoleInput(in, out);

        ParsedInteger first = console.readInteger(FIRST_PROMPT);
        if (!first.isValid()) {
            return Launcher.reject(out, err, first.error().getMessage());
        }
        ParsedInteger second = console.readInteger(SECOND_PROMPT);
        if (!second.isValid()) {
            return Launcher.reject(out, err, second.error().getMessage());
        }

        out.println(Addition.describe(first.value(), second.value()));
        return Launcher.EXIT_OK;
    }
}
