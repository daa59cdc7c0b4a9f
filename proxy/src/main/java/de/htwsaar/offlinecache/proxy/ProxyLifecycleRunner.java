package de.htwsaar.offlinecache.proxy;

import de.htwsaar.offlinecache.proxy.lifecycle.InstallFailedException;
import de.htwsaar.offlinecache.proxy.service.CacheRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Stößt beim Start Install und Activate der konfigurierten Version an.
 *
 * <p>Scheitert die Installation, läuft der Proxy im Pass-Through weiter. Ein neuer Versuch ist über
 * {@code POST /_cache/admin/lifecycle/install} möglich.</p>
 */
@Component
public class ProxyLifecycleRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProxyLifecycleRunner.class);

    private final CacheRouter router;
    private final boolean installOnStartup;

    public ProxyLifecycleRunner(
            CacheRouter router, @Value("${proxy.lifecycle.install-on-startup:true}") boolean installOnStartup) {
        this.router = router;
        this.installOnStartup = installOnStartup;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!installOnStartup) {
            log.info("Install on startup disabled, proxy stays in pass-through mode");
            return;
        }
        try {
            router.onInstall();
            log.info("Cache lifecycle state after startup: {}", router.lifecycle().state());
        } catch (InstallFailedException ex) {
            log.error("Install failed, serving pass-through until a retry succeeds: {}", ex.getMessage());
        }
    }
}
