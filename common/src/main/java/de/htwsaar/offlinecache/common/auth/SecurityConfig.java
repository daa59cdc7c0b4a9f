package de.htwsaar.offlinecache.common.auth;

import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecurityConfig {

    /** Alle Admin-Routen des Proxys liegen unterhalb dieses Prefixes. */
    public static final String ADMIN_PREFIX = "/_cache/admin";

    @Value("${offlinecache.admin.token:secret-token}")
    private String adminToken;

    @Bean
    public AdminAuthFilter adminAuthFilter() {
        return new AdminAuthFilter(adminToken, List.of(ADMIN_PREFIX));
    }
}
