package de.htwsaar.offlinecache.proxy;

import de.htwsaar.offlinecache.common.auth.SecurityConfig;
import de.htwsaar.offlinecache.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({LoggingConfig.class, SecurityConfig.class})
public class ProxyApp {
    public static void main(String[] args) {
        SpringApplication.run(ProxyApp.class, args);
    }
}
