package com.example.arithmetic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public final class FactorialCli {
    static final String PROMPT = "Inserisci un numero intero positivo: ";

    private FactorialCli() {}

    public static void main(String[] args) {
        Launcher.launch(FactorialCli::run);
    }

    static int run(BufferedReader in, PrintStream out, PrintStream err) throws IOException {
        ParsedInteger parsed = new ConsoleInput(in, out).readInteger(PROMPT);
        if (!parsed.isValid()) {
            return Launcher.reject(out, err, parsed.error().getMessage());
        }

        int n = parsed.value();
        try {
            out.println(Factorial.describe(n));
            return Launcher.EXIT_OK;
        } catch (FactorialOverflowException e) {
            return Launcher.reject(out, err, String.format(
                    "Il fattoriale di %d non è rappresentabile: il valore massimo ammesso è %d.",
                    e.getInput(), e.getMaxInput()));
        }
    }
}
