package de.htwsaar.offlinecache.cli.shell;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.offlinecache.cli.di.CliContext;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

class OfflineCacheInteractiveShellTest {

    private Terminal terminal;
    private StringWriter err;
    private LineReader reader;
    private OfflineCacheInteractiveShell shell;
    private final List<String> executed = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        terminal = new DumbTerminal(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream());
        err = new StringWriter();
        CliContext ctx = new CliContext(
                terminal,
                new PrintWriter(new StringWriter()),
                new PrintWriter(err, true),
                HttpClient.newHttpClient(),
                Duration.ofSeconds(1),
                CliContext.DEFAULT_PROXY_URL);
        reader = LineReaderBuilder.builder().terminal(terminal).build();
        CommandLine cmd = new CommandLine(new Root()).addSubcommand("echo", new Echo(executed));
        shell = new OfflineCacheInteractiveShell(cmd, ctx);
    }

    @Test
    void exitAndQuit_endTheLoop() {
        assertFalse(shell.handle(reader, terminal, "exit"));
        assertFalse(shell.handle(reader, terminal, "QUIT"));
        assertTrue(shell.handle(reader, terminal, ""));
    }

    @Test
    void argumentsReachTheSubcommand() {
        assertTrue(shell.handle(reader, terminal, "echo a b"));

        assertEquals(List.of("a", "b"), executed);
    }

    @Test
    void nonZeroExitCode_isReported() {
        shell.handle(reader, terminal, "echo fail");

        assertTrue(err.toString().contains("exit code: 3"), err.toString());
    }

    @Command(name = "root")
    static final class Root implements Runnable {
        @Override
        public void run() {}
    }

    @Command(name = "echo")
    static final class Echo implements Callable<Integer> {
        private final List<String> sink;

        @Parameters
        private List<String> words = new ArrayList<>();

        Echo(List<String> sink) {
            this.sink = sink;
        }

        @Override
        public Integer call() {
            sink.addAll(words);
            return words.contains("fail") ? 3 : 0;
        }
    }
}
