package com.example.arithmetic;

import java.io.BufferedReader;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

final class Launcher {
    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_IO_ERROR = 2;

    @FunctionalInterface
    interface Command {
        int run(BufferedReader in, PrintStream out, PrintStream err) throws IOException;
    }

    private Launcher() {}

    static void launch(Command command) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintStream out = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8);
        int status = execute(command, in, out, err);
        out.flush();
        err.flush();
        System.exit(status);
    }

    static int reject(PrintStream out, PrintStream err, String message) {
        out.println();
        err.println(message);
        return EXIT_INVALID_INPUT;
    }

    static int execute(Command command, BufferedReader in, PrintStream out, PrintStream err) {
        try {
            return command.run(in, out, err);
        } catch (IOException e) {
            err.println("Errore di lettura dall'input: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }
}
