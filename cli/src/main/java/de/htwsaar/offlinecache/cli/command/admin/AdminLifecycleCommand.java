package de.htwsaar.offlinecache.cli.command.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.service.admin.AdminCacheService;
import de.htwsaar.offlinecache.cli.util.ConsoleUtils;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Zustand der Cache-Version anzeigen und eine gescheiterte Installation wiederholen.
 */
@Command(
        name = "lifecycle",
        description = "Show or retry the cache version lifecycle",
        mixinStandardHelpOptions = true,
        subcommands = {AdminLifecycleCommand.ShowCommand.class, AdminLifecycleCommand.InstallCommand.class})
public final class AdminLifecycleCommand implements Runnable {

    private final CliContext ctx;
    private final AdminCacheService service;

    @Spec
    private CommandSpec spec;

    public AdminLifecycleCommand(CliContext ctx, AdminCacheService service) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    int report(String operation, URI host, HttpCallResult result) {
        if (result.statusCode() == null) {
            ConsoleUtils.error(ctx.err(), "[ADMIN] Lifecycle %s failed: %s", operation, result.error());
            return 1;
        }
        JsonNode body;
        try {
            body = JacksonCodec.mapper().readTree(Objects.toString(result.body(), "{}"));
        } catch (JsonProcessingException ex) {
            ConsoleUtils.error(ctx.err(), "[ADMIN] Unexpected response from %s: HTTP %d", host, result.statusCode());
            return result.is2xx() ? 1 : 2;
        }
        String version = body.path("version").asText("?");
        String state = body.path("state").asText("?");
        if (result.is2xx()) {
            ConsoleUtils.info(ctx.out(), "[ADMIN] Version %s is %s", version, state);
            return 0;
        }
        ConsoleUtils.error(
                ctx.err(),
                "[ADMIN] Lifecycle %s failed: HTTP %d, version %s is %s %s",
                operation,
                result.statusCode(),
                version,
                state,
                body.path("error").asText(""));
        return 2;
    }

    /** Zeigt Version und Zustand. */
    @Command(name = "show", description = "Show cache version and lifecycle state")
    public static final class ShowCommand implements Callable<Integer> {

        @ParentCommand
        private AdminLifecycleCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Override
        public Integer call() {
            URI host = hostOption.resolve(parent.ctx);
            return parent.report("show", host, parent.service.lifecycle(host));
        }
    }

    /** Wiederholt Install (und bei Skip-Waiting Activate). */
    @Command(name = "install", description = "Retry installing the configured cache version")
    public static final class InstallCommand implements Callable<Integer> {

        @ParentCommand
        private AdminLifecycleCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Override
        public Integer call() {
            URI host = hostOption.resolve(parent.ctx);
            return parent.report("install", host, parent.service.install(host));
        }
    }
}
