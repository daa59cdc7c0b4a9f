package de.htwsaar.offlinecache.cli.di;

import de.htwsaar.offlinecache.cli.service.admin.AdminCacheService;
import java.lang.reflect.Constructor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import picocli.CommandLine;

/**
 * Picocli-Factory für Constructor Injection.
 *
 * <p>Injizierbar sind der {@link CliContext} und der daraus gebaute {@link AdminCacheService}. Gewählt wird
 * der Konstruktor mit den meisten Parametern, die alle auflösbar sind. Klassen ohne passenden Konstruktor
 * erzeugt die Picocli-Default-Factory.
 */
public final class ContextFactory implements CommandLine.IFactory {

    private final Map<Class<?>, Object> injectables = new LinkedHashMap<>();
    private final CommandLine.IFactory fallback;

    public ContextFactory(CliContext ctx) {
        this(ctx, new AdminCacheService(ctx.httpClient(), ctx.defaultRequestTimeout()));
    }

    /**
     * @param ctx CLI-Kontext
     * @param adminService Admin-Client, in Tests z. B. mit festem Token
     */
    public ContextFactory(CliContext ctx, AdminCacheService adminService) {
        this(ctx, adminService, CommandLine.defaultFactory());
    }

    ContextFactory(CliContext ctx, AdminCacheService adminService, CommandLine.IFactory fallback) {
        injectables.put(CliContext.class, Objects.requireNonNull(ctx, "ctx"));
        injectables.put(AdminCacheService.class, Objects.requireNonNull(adminService, "adminService"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        Constructor<?> best = null;
        for (Constructor<?> c : cls.getDeclaredConstructors()) {
            if (c.getParameterCount() == 0 || !isResolvable(c)) {
                continue;
            }
            if (best == null || c.getParameterCount() > best.getParameterCount()) {
                best = c;
            }
        }
        if (best == null) {
            return fallback.create(cls);
        }
        Class<?>[] types = best.getParameterTypes();
        Object[] args = new Object[types.length];
        for (int i = 0; i < types.length; i++) {
            args[i] = injectables.get(types[i]);
        }
        best.setAccessible(true);
        return cls.cast(best.newInstance(args));
    }

    private boolean isResolvable(Constructor<?> c) {
        for (Class<?> type : c.getParameterTypes()) {
            if (!injectables.containsKey(type)) {
                return false;
            }
        }
        return true;
    }
}
