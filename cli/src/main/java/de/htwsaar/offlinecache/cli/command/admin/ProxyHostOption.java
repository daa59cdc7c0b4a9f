package de.htwsaar.offlinecache.cli.command.admin;

import de.htwsaar.offlinecache.cli.di.CliContext;
import java.net.URI;
import picocli.CommandLine.Option;

/**
 * Gemeinsame {@code --host}-Option aller Admin-Commands.
 */
public final class ProxyHostOption {

    @Option(
            names = {"-H", "--host"},
            paramLabel = "PROXY_URL",
            description = "Basis-URL des Proxys, Default: OFFLINECACHE_PROXY_URL oder http://localhost:8080")
    URI host;

    URI resolve(CliContext ctx) {
        return ctx.proxyUrl(host);
    }
}
