package de.htwsaar.offlinecache.cli.app;

import de.htwsaar.offlinecache.cli.command.root.OfflineCacheRootCommand;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.di.ContextFactory;
import de.htwsaar.offlinecache.cli.shell.OfflineCacheInteractiveShell;
import de.htwsaar.offlinecache.cli.util.UriUtils;
import java.io.PrintWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

/**
 * Einstiegspunkt der Offline-Cache-CLI.
 *
 * <p>Mit Argumenten wird genau ein Befehl ausgeführt und der Prozess mit dessen Exit-Code beendet,
 * ohne Argumente startet die interaktive Shell. Der Standard-Proxy kommt aus {@code OFFLINECACHE_PROXY_URL}.
 */
public final class OfflineCacheCliMain {

    private OfflineCacheCliMain() {}

    public static void main(String[] args) throws Exception {
        Terminal terminal = TerminalBuilder.builder().system(true).build();
        PrintWriter out = terminal.writer();
        PrintWriter err = terminal.writer();

        URI proxyUrl = UriUtils.parseHttpUri(System.getenv("OFFLINECACHE_PROXY_URL"))
                .orElse(CliContext.DEFAULT_PROXY_URL);

        CliContext ctx = new CliContext(
                terminal,
                out,
                err,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                Duration.ofSeconds(5),
                proxyUrl);

        CommandLine cmd = new CommandLine(OfflineCacheRootCommand.class, new ContextFactory(ctx));

        if (args != null && args.length > 0) {
            int rc = cmd.execute(args);
            System.exit(rc);
        }

        new OfflineCacheInteractiveShell(cmd, ctx).run();
    }
}
