package de.htwsaar.offlinecache.cli.command.root;

import de.htwsaar.offlinecache.cli.command.admin.AdminCommand;
import de.htwsaar.offlinecache.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Ohne Subcommand wird die Usage mit einem Hinweis auf die interaktive Shell ausgegeben.
 */
@Command(
        name = "offline-cache",
        description = "Offline cache admin CLI",
        mixinStandardHelpOptions = true,
        version = "offline-cache 1.0.0",
        subcommands = {AdminCommand.class, HelpCommand.class})
public final class OfflineCacheRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public OfflineCacheRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `offline-cache help <command>` oder starte ohne Args für die interaktive Shell.");
        ctx.out().flush();
    }
}
