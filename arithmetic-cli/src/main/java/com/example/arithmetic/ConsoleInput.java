package com.example.arithmetic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public class ConsoleInput {
    private static final String INTEGER_TEXT = "[+-]?[0-9]+";

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleInput(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public ParsedInteger readInteger(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        String line = in.readLine();
        if (line == null) {
            return ParsedInteger.failed(new InputParseError(null, "nessun input"));
        }
        return parse(line);
    }

    static ParsedInteger parse(String line) {
        String text = line.trim();
        if (text.isEmpty()) {
            return ParsedInteger.failed(new InputParseError(line, "riga vuota"));
        }
        if (!text.matches(INTEGER_TEXT)) {
            return ParsedInteger.failed(new InputParseError(line, "non è un numero intero"));
        }
        try {
            return ParsedInteger.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            return ParsedInteger.failed(new InputParseError(line, "fuori dall'intervallo di un intero a 32 bit"));
        }
    }
}
