package de.htwsaar.offlinecache.cli.command.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Sendet Steuerkommandos an den Steuerkanal des Proxys.
 *
 * <p>Der Proxy verarbeitet Kommandos asynchron und antwortet sofort mit 202. Ob ein Kommando etwas bewirkt
 * hat, zeigen erst {@code admin lifecycle show} bzw. {@code admin partitions}.
 *
 * <p>Exit-Codes: 0 angenommen, 2 HTTP-Fehlerstatus, 1 Netzwerkfehler.
 */
@Command(
        name = "control",
        description = "Send control commands to the proxy",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  offline-cache admin control force-activate",
            "  offline-cache admin control cleanup -H http://localhost:8080 --message-id nightly-42"
        },
        subcommands = {AdminControlCommand.ForceActivateCommand.class, AdminControlCommand.CleanupCommand.class})
public final class AdminControlCommand implements Runnable {

    private final CliContext ctx;
    private final AdminCacheService service;

    @Spec
    private CommandSpec spec;

    public AdminControlCommand(CliContext ctx, AdminCacheService service) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    int send(URI host, String action, String messageId) {
        HttpCallResult result = service.sendCommand(host, action, messageId);
        if (!result.is2xx()) {
            ConsoleUtils.error(
                    ctx.err(),
                    "[ADMIN] Command %s failed: status=%s error=%s body=%s",
                    action,
                    result.statusCode(),
                    result.error(),
                    result.body());
            return result.exitCode();
        }

        ConsoleUtils.info(
                ctx.out(),
                "[ADMIN] Command %s %s by %s (HTTP %d)",
                action,
                statusOf(result.body()),
                host,
                result.statusCode());
        return 0;
    }

    private static String statusOf(String body) {
        if (body == null || body.isBlank()) {
            return "accepted";
        }
        try {
            return JacksonCodec.mapper().readTree(body).path("status").asText("accepted");
        } catch (JsonProcessingException ex) {
            return "accepted (unreadable response)";
        }
    }

    /** Aktiviert eine installierte, wartende Version sofort. */
    @Command(name = "force-activate", description = "Activate an installed cache version immediately")
    public static final class ForceActivateCommand implements Callable<Integer> {

        @ParentCommand
        private AdminControlCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Option(names = "--message-id", paramLabel = "ID", description = "Optional ID for duplicate detection")
        private String messageId;

        @Override
        public Integer call() {
            return parent.send(hostOption.resolve(parent.ctx), "force-activate", messageId);
        }
    }

    /** Löscht dynamische Partitionen und kürzt die Bild-Partition auf ihre Kapazität. */
    @Command(name = "cleanup", description = "Purge dynamic partitions and trim the image partition")
    public static final class CleanupCommand implements Callable<Integer> {

        @ParentCommand
        private AdminControlCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Option(names = "--message-id", paramLabel = "ID", description = "Optional ID for duplicate detection")
        private String messageId;

        @Override
        public Integer call() {
            return parent.send(hostOption.resolve(parent.ctx), "cleanup", messageId);
        }
    }
}
