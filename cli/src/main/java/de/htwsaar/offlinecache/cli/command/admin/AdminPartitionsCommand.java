package de.htwsaar.offlinecache.cli.command.admin;

import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.dto.PartitionRow;
import de.htwsaar.offlinecache.cli.service.admin.AdminCacheService;
import de.htwsaar.offlinecache.cli.util.ConsoleUtils;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import de.htwsaar.offlinecache.common.serialization.OfflineCacheSerializationException;
import java.io.PrintWriter;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Listet alle Partitionen des Proxys mit Eintragsanzahl.
 *
 * <p>Exit-Codes: 0 OK, 2 HTTP-Fehlerstatus, 1 Netzwerk- oder Parse-Fehler.
 */
@Command(
        name = "partitions",
        description = "List cache partitions and their entry counts",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {"  offline-cache admin partitions", "  offline-cache admin partitions -H http://localhost:8080 --json"})
public final class AdminPartitionsCommand implements Callable<Integer> {

    private final CliContext ctx;
    private final AdminCacheService service;

    @Mixin
    private ProxyHostOption hostOption;

    @Option(names = "--json", defaultValue = "false", description = "Rohe JSON-Antwort ausgeben")
    private boolean printJson;

    public AdminPartitionsCommand(CliContext ctx, AdminCacheService service) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public Integer call() {
        URI host = hostOption.resolve(ctx);
        HttpCallResult result = service.listPartitions(host);
        if (!result.is2xx()) {
            ConsoleUtils.error(
                    ctx.err(),
                    "[ADMIN] Listing partitions failed: status=%s error=%s",
                    result.statusCode(),
                    result.error());
            return result.exitCode();
        }
        if (printJson) {
            ConsoleUtils.info(ctx.out(), "%s", result.body());
            return 0;
        }

        PartitionRow[] rows;
        try {
            rows = JacksonCodec.fromJson(result.body(), PartitionRow[].class);
        } catch (OfflineCacheSerializationException ex) {
            ConsoleUtils.error(ctx.err(), "[ADMIN] Unexpected response from %s: %s", host, ex.getMessage());
            return 1;
        }

        PrintWriter out = ctx.out();
        out.printf("[ADMIN] Partitions on %s (%d)%n", host, rows.length);
        if (rows.length == 0) {
            out.println("  (none)");
        }
        for (PartitionRow row : rows) {
            out.printf("  %-24s %6d  %s%n", row.name(), row.entries(), row.current() ? "current" : "stale");
        }
        out.flush();
        return 0;
    }
}
