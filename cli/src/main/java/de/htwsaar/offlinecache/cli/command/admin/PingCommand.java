package de.htwsaar.offlinecache.cli.command.admin;

import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.util.HttpUtils;
import de.htwsaar.offlinecache.cli.util.UriUtils;
import java.io.PrintWriter;
import java.net.URI;
import java.net.http.HttpRequest;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Health- bzw. Readiness-Check gegen den Proxy.
 *
 * <p>Exit-Codes:
 * - 0: HTTP 2xx
 * - 2: HTTP non-2xx (z. B. 503, solange die Cache-Version nicht aktiv ist)
 * - 1: Netzwerkfehler
 */
@Command(
        name = "ping",
        description = "Health check",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  offline-cache admin ping",
            "  offline-cache admin ping -H http://localhost:8080 -p _cache/ready"
        })
public final class PingCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Mixin
    private ProxyHostOption hostOption;

    @Option(
            names = {"-p", "--path"},
            defaultValue = "_cache/health",
            paramLabel = "PATH",
            description = "Path relative to host, default: _cache/health")
    private String path;

    public PingCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        PrintWriter out = ctx.out();
        PrintWriter err = ctx.err();

        URI url = UriUtils.resolve(hostOption.resolve(ctx), path);
        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(ctx.defaultRequestTimeout())
                .GET()
                .build();

        HttpCallResult result = HttpUtils.sendForStringBody(ctx.httpClient(), req);
        if (result.statusCode() == null) {
            err.println("[ADMIN] Ping failed: " + result.error());
            err.flush();
            return 1;
        }

        out.println("Status: " + result.statusCode());
        out.println(result.body());
        out.flush();
        return result.exitCode();
    }
}
