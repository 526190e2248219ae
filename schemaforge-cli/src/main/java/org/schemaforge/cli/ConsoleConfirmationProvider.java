package org.schemaforge.cli;

import org.schemaforge.classify.ConfirmationProvider;
import org.schemaforge.classify.DestructiveChange;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Prints the destructive changes and reads one line from the console.
 */
public class ConsoleConfirmationProvider implements ConfirmationProvider {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationProvider(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public Optional<String> confirm(List<DestructiveChange> destructiveChanges) {
        out.println("⚠️ Potentially destructive changes detected:");
        destructiveChanges.forEach(change -> out.println("   - " + change));
        out.print("Type anything to proceed, or press Enter to abort: ");
        out.flush();
        try {
            return Optional.ofNullable(in.readLine());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }
}
