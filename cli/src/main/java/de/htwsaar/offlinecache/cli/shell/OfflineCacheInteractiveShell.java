package de.htwsaar.offlinecache.cli.shell;

import de.htwsaar.offlinecache.cli.di.CliContext;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Objects;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.jline.utils.InfoCmp;
import picocli.CommandLine;
import picocli.shell.jline3.PicocliCommands;

/**
 * Interaktive Shell (REPL) für die Offline-Cache-CLI.
 *
 * <p>Eingaben werden als Picocli-Kommandos ausgeführt, mit Autovervollständigung über
 * {@link PicocliCommands}. Shell-eigene Befehle sind {@code clear} und {@code exit}.
 *
 * <p>Beenden:
 * - Ctrl+C: aktuelle Eingabe verwerfen.
 * - Ctrl+D oder {@code exit}/{@code quit}: Shell beenden.
 */
public final class OfflineCacheInteractiveShell {

    static final String HISTORY_FILE = ".offline-cache.history";

    private final CommandLine cmd;
    private final CliContext ctx;

    /**
     * @param cmd vorkonfiguriertes Picocli-Root-CommandLine-Objekt
     * @param ctx CLI-Kontext (Terminal + I/O)
     */
    public OfflineCacheInteractiveShell(CommandLine cmd, CliContext ctx) {
        this.cmd = Objects.requireNonNull(cmd, "cmd");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Startet die Shell-Schleife und blockiert bis zum Exit.
     */
    public void run() {
        Terminal terminal = ctx.terminal();
        PicocliCommands picocli = new PicocliCommands(cmd);

        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .completer(picocli.compileCompleters())
                .parser(new DefaultParser())
                .variable(LineReader.HISTORY_FILE, Path.of(HISTORY_FILE))
                .build();

        ctx.out().println("Offline Cache Shell. Type 'help', 'exit', 'clear'.");
        ctx.out().flush();

        String prompt = new AttributedStringBuilder()
                .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).bold())
                .append("offline-cache> ")
                .toAnsi(terminal);

        while (true) {
            String line;
            try {
                line = reader.readLine(prompt).trim();
            } catch (UserInterruptException e) {
                continue; // Ctrl+C
            } catch (EndOfFileException e) {
                break; // Ctrl+D
            }
            if (!handle(reader, terminal, line)) {
                break;
            }
        }
    }

    /**
     * Verarbeitet eine Eingabezeile.
     *
     * @return {@code false}, wenn die Shell beendet werden soll
     */
    boolean handle(LineReader reader, Terminal terminal, String line) {
        if (line.isBlank()) {
            return true;
        }
        if (equalsAnyIgnoreCase(line, "exit", "quit")) {
            return false;
        }
        if (equalsAnyIgnoreCase(line, "clear", "cls")) {
            terminal.puts(InfoCmp.Capability.clear_screen);
            terminal.flush();
            return true;
        }

        PrintWriter err = ctx.err();
        try {
            String[] argv = reader.getParser().parse(line, 0).words().toArray(new String[0]);
            int exitCode = cmd.execute(argv);
            if (exitCode != 0) {
                err.println("Command failed with exit code: " + exitCode);
                err.flush();
            }
        } catch (Exception ex) {
            err.println("Error executing command: " + ex.getMessage());
            err.flush();
        }
        return true;
    }

    private static boolean equalsAnyIgnoreCase(String input, String... candidates) {
        for (String c : candidates) {
            if (input.equalsIgnoreCase(c)) return true;
        }
        return false;
    }
}
