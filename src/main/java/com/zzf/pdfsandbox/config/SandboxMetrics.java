package com.zzf.pdfsandbox.config;

import com.zzf.pdfsandbox.render.RegenerationDispatcher;
import com.zzf.pdfsandbox.session.SessionStore;
import com.zzf.pdfsandbox.sweep.ExpirySweeper;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Exposes session and regeneration counts on the actuator prometheus endpoint.
 */
@Component
public class SandboxMetrics implements MeterBinder {
    private final SessionStore sessionStore;
    private final ExpirySweeper expirySweeper;
    private final RegenerationDispatcher regenerationDispatcher;

    public SandboxMetrics(SessionStore sessionStore, ExpirySweeper expirySweeper,
                          RegenerationDispatcher regenerationDispatcher) {
        this.sessionStore = sessionStore;
        this.expirySweeper = expirySweeper;
        this.regenerationDispatcher = regenerationDispatcher;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("sandbox.sessions.active", sessionStore, SessionStore::activeCount)
                .description("Sessions currently registered")
                .register(registry);
        FunctionCounter.builder("sandbox.evictions.succeeded", expirySweeper, ExpirySweeper::getTotalEvicted)
                .register(registry);
        FunctionCounter.builder("sandbox.evictions.failed", expirySweeper, ExpirySweeper::getTotalFailed)
                .register(registry);
        FunctionCounter.builder("sandbox.regenerations.succeeded", regenerationDispatcher,
                        RegenerationDispatcher::getSucceededCount)
                .register(registry);
        FunctionCounter.builder("sandbox.regenerations.failed", regenerationDispatcher,
                        RegenerationDispatcher::getFailedCount)
                .register(registry);
    }
}
