package de.htwsaar.offlinecache.cli.command.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.ConfigPatchRequest;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.service.admin.AdminCacheService;
import de.htwsaar.offlinecache.cli.util.ConsoleUtils;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Live-Konfiguration des Proxys: Timeouts und Bild-Kapazität.
 *
 * <p>Hinweis: Diese Klasse ist ein "Group-Command". Ohne Subcommand wird nur die Usage angezeigt.
 */
@Command(
        name = "config",
        description = "Show or change the proxy's runtime configuration",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  offline-cache admin config show",
            "  offline-cache admin config set --api-timeout-ms 8000",
            "  offline-cache admin config set --image-max-entries 100 -H http://localhost:8080"
        },
        subcommands = {AdminConfigCommand.AdminConfigShowCommand.class, AdminConfigCommand.AdminConfigSetCommand.class})
public final class AdminConfigCommand implements Runnable {

    private final CliContext ctx;
    private final AdminCacheService service;

    @Spec
    private CommandSpec spec;

    public AdminConfigCommand(CliContext ctx, AdminCacheService service) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    int print(String prefix, HttpCallResult result) {
        if (!result.is2xx()) {
            ConsoleUtils.error(
                    ctx.err(),
                    "[ADMIN] %s failed: status=%s error=%s body=%s",
                    prefix,
                    result.statusCode(),
                    result.error(),
                    result.body());
            return result.exitCode();
        }
        JsonNode config;
        try {
            config = JacksonCodec.mapper().readTree(result.body());
        } catch (JsonProcessingException ex) {
            ConsoleUtils.error(ctx.err(), "[ADMIN] %s returned no JSON: %s", prefix, ex.getOriginalMessage());
            return 1;
        }
        PrintWriter out = ctx.out();
        out.printf("[ADMIN] %s%n", prefix);
        out.printf("  apiTimeoutMs        : %d%n", config.path("apiTimeoutMs").asLong());
        out.printf("  navigationTimeoutMs : %d%n", config.path("navigationTimeoutMs").asLong());
        out.printf("  imageMaxEntries     : %d%n", config.path("imageMaxEntries").asInt());
        out.flush();
        return 0;
    }

    /**
     * Zeigt die aktuelle Konfiguration.
     */
    @Command(name = "show", description = "Show the runtime configuration")
    public static final class AdminConfigShowCommand implements Callable<Integer> {

        @ParentCommand
        private AdminConfigCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Override
        public Integer call() {
            return parent.print("Runtime configuration", parent.service.config(hostOption.resolve(parent.ctx)));
        }
    }

    /**
     * Ändert einzelne Werte; nicht angegebene Werte bleiben unverändert.
     */
    @Command(name = "set", description = "Change one or more runtime configuration values")
    public static final class AdminConfigSetCommand implements Callable<Integer> {

        @ParentCommand
        private AdminConfigCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Option(names = "--api-timeout-ms", paramLabel = "MS", description = "Network timeout for API requests")
        private Long apiTimeoutMs;

        @Option(names = "--navigation-timeout-ms", paramLabel = "MS", description = "Network timeout for navigations")
        private Long navigationTimeoutMs;

        @Option(names = "--image-max-entries", paramLabel = "N", description = "Image partition capacity on cleanup")
        private Integer imageMaxEntries;

        @Override
        public Integer call() {
            ConfigPatchRequest patch = new ConfigPatchRequest(apiTimeoutMs, navigationTimeoutMs, imageMaxEntries);
            if (patch.isEmpty()) {
                ConsoleUtils.error(parent.ctx.err(), "[ADMIN] Nothing to change, pass at least one option");
                return 1;
            }
            HttpCallResult result = parent.service.patchConfig(hostOption.resolve(parent.ctx), patch);
            return parent.print("Updated configuration", result);
        }
    }
}
