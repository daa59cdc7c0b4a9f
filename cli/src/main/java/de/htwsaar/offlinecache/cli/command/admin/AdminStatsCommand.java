package de.htwsaar.offlinecache.cli.command.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.service.admin.AdminCacheService;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import java.io.PrintWriter;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Admin-Command zum Abruf der Proxy-Statistiken über die Admin-API.
 *
 * <p>Hinweis: Dieser Command selbst hat keine Default-Aktion und zeigt nur Usage an.
 * Für die eigentliche Ausführung {@code stats show} verwenden.
 */
@Command(
        name = "stats",
        description = "Show offline cache runtime statistics",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  offline-cache admin stats show -H http://localhost:8080",
            "  offline-cache admin stats show --window-sec 120",
            "  offline-cache admin stats show --json"
        },
        subcommands = {AdminStatsCommand.AdminStatsShowCommand.class})
public final class AdminStatsCommand implements Runnable {

    private final CliContext ctx;
    private final AdminCacheService service;

    @Spec
    private CommandSpec spec;

    public AdminStatsCommand(CliContext ctx, AdminCacheService service) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    /**
     * Ruft {@code GET /_cache/admin/stats} auf und gibt die Daten formatiert aus.
     *
     * <p>Exit-Codes:
     * - 0: OK
     * - 2: HTTP-Fehlerstatus (non-2xx)
     * - 1: Exception/Netzwerkfehler
     */
    @Command(name = "show", description = "Fetch and display cache statistics", mixinStandardHelpOptions = true)
    public static final class AdminStatsShowCommand implements Callable<Integer> {

        @ParentCommand
        private AdminStatsCommand parent;

        @Mixin
        private ProxyHostOption hostOption;

        @Option(
                names = "--window-sec",
                defaultValue = "60",
                paramLabel = "SECONDS",
                description = "Zeitfenster in Sekunden für die exakte Request-Zahl (min. 1)")
        private int windowSec;

        @Option(names = "--json", defaultValue = "false", description = "Vollständige JSON-Antwort pretty-printed ausgeben")
        private boolean printJson;

        @Override
        public Integer call() {
            PrintWriter out = parent.ctx.out();
            PrintWriter err = parent.ctx.err();
            int safeWindow = Math.max(1, windowSec);

            HttpCallResult result = parent.service.stats(hostOption.resolve(parent.ctx), safeWindow);
            if (!result.is2xx()) {
                err.printf("[ADMIN] Stats request failed: status=%s error=%s%n", result.statusCode(), result.error());
                if (result.body() != null && !result.body().isBlank()) {
                    err.println(result.body());
                }
                err.flush();
                return result.exitCode();
            }

            try {
                ObjectMapper mapper = JacksonCodec.mapper();
                JsonNode root = mapper.readTree(result.body());

                if (printJson) {
                    out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
                    out.flush();
                    return 0;
                }

                out.println("[ADMIN] Offline Cache Stats");
                out.printf("  windowSec            : %d%n", safeWindow);
                out.printf("  totalRequests        : %d%n", root.path("totalRequests").asLong());
                out.printf("  requestsPerWindow    : %d%n", root.path("requestsPerWindow").asLong());
                out.printf("  cacheHits            : %d%n", root.path("cacheHits").asLong());
                out.printf("  cacheMisses          : %d%n", root.path("cacheMisses").asLong());
                out.printf("  fallbacks            : %d%n", root.path("fallbacks").asLong());
                out.printf("  bypassed             : %d%n", root.path("bypassed").asLong());
                out.printf("  failedRequests       : %d%n", root.path("failedRequests").asLong());
                out.printf("  detachedTaskFailures : %d%n", root.path("detachedTaskFailures").asLong());
                out.printf(Locale.ROOT, "  cacheHitRatio        : %.4f%n", root.path("cacheHitRatio").asDouble());
                out.printf("  entriesCached        : %d%n", root.path("entriesCached").asLong());
                printByClassification(out, root.path("byClassification"));
                out.flush();
                return 0;
            } catch (Exception ex) {
                err.println("[ADMIN] Stats request failed: " + ex.getMessage());
                err.flush();
                return 1;
            }
        }

        private static void printByClassification(PrintWriter out, JsonNode byClassification) {
            out.println("  byClassification:");
            if (!byClassification.isObject() || byClassification.isEmpty()) {
                out.println("    (none)");
                return;
            }
            Map<String, Long> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = byClassification.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                sorted.put(entry.getKey(), Math.max(0L, entry.getValue().asLong(0L)));
            }
            sorted.forEach((classification, count) -> out.printf("    %-16s : %d%n", classification, count));
        }
    }
}
