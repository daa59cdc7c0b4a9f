package de.htwsaar.offlinecache.cli.command.admin;

import de.htwsaar.offlinecache.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-Level Admin-Command, gruppiert alle Admin-Subcommands.
 */
@Command(
        name = "admin",
        description = "Offline cache administration",
        subcommands = {
            AdminControlCommand.class,
            AdminPartitionsCommand.class,
            AdminLifecycleCommand.class,
            AdminConfigCommand.class,
            AdminStatsCommand.class,
            PingCommand.class
        })
public final class AdminCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public AdminCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }
}
