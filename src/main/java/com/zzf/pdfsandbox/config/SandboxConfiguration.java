package com.zzf.pdfsandbox.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.pdfsandbox.bus.ArtifactEventBus;
import com.zzf.pdfsandbox.render.DocumentRenderer;
import com.zzf.pdfsandbox.render.ParametersLoader;
import com.zzf.pdfsandbox.render.PdfDocumentRenderer;
import com.zzf.pdfsandbox.render.PebbleTemplateEngine;
import com.zzf.pdfsandbox.render.RegenerationDispatcher;
import com.zzf.pdfsandbox.render.TemplateEngine;
import com.zzf.pdfsandbox.session.SessionStore;
import com.zzf.pdfsandbox.sweep.ExpirySweeper;
import com.zzf.pdfsandbox.watch.ChangeWatcher;
import com.zzf.pdfsandbox.watch.DebounceGate;
import com.zzf.pdfsandbox.watch.NativeWatchStrategy;
import com.zzf.pdfsandbox.watch.PollingWatchStrategy;
import com.zzf.pdfsandbox.watch.WatchStrategy;
import com.zzf.pdfsandbox.workspace.WorkspaceFactory;
import com.zzf.pdfsandbox.workspace.WorkspaceFileService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class SandboxConfiguration {

    @Bean
    public Clock sandboxClock() {
        return Clock.systemUTC();
    }

    @Bean
    public WorkspaceFactory workspaceFactory() {
        return new WorkspaceFactory();
    }

    @Bean
    public SessionStore sessionStore(SandboxProperties properties, WorkspaceFactory workspaceFactory, Clock sandboxClock) {
        Path workspacesRoot = SandboxPropertiesValidator.validate(properties);
        return new SessionStore(workspacesRoot, Paths.get(properties.getTemplateRoot()), workspaceFactory,
                properties.getSessionLifetime(), sandboxClock);
    }

    @Bean
    public WorkspaceFileService workspaceFileService(SandboxProperties properties) {
        return new WorkspaceFileService(Set.of(properties.getMainFile(), properties.getParamsFile()));
    }

    @Bean
    public ArtifactEventBus artifactEventBus() {
        return new ArtifactEventBus();
    }

    @Bean
    public TemplateEngine templateEngine() {
        return new PebbleTemplateEngine();
    }

    @Bean
    public DocumentRenderer documentRenderer() {
        return new PdfDocumentRenderer();
    }

    @Bean
    public ParametersLoader parametersLoader(ObjectMapper objectMapper) {
        return new ParametersLoader(objectMapper);
    }

    @Bean
    public RegenerationDispatcher regenerationDispatcher(SandboxProperties properties, TemplateEngine templateEngine,
                                                         DocumentRenderer documentRenderer, ParametersLoader parametersLoader,
                                                         ArtifactEventBus artifactEventBus, SessionStore sessionStore,
                                                         Clock sandboxClock) {
        RegenerationDispatcher dispatcher = new RegenerationDispatcher(templateEngine, documentRenderer, parametersLoader,
                artifactEventBus, properties.getMainFile(), properties.getParamsFile(), properties.getArtifactName(),
                sandboxClock);
        sessionStore.addEvictionListener(dispatcher::forget);
        return dispatcher;
    }

    @Bean
    public DebounceGate debounceGate(SessionStore sessionStore) {
        DebounceGate gate = new DebounceGate();
        sessionStore.addEvictionListener(gate::forget);
        return gate;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService regenerationExecutor(SandboxProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getRegenerationThreads()), r -> {
            Thread t = new Thread(r, "sandbox-regen-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public WatchStrategy watchStrategy(SandboxProperties properties) {
        if (properties.getWatch().getMode() == WatchMode.NATIVE) {
            return new NativeWatchStrategy();
        }
        return new PollingWatchStrategy(properties.getWatch().getPollInterval());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ChangeWatcher changeWatcher(SandboxProperties properties, SessionStore sessionStore, DebounceGate debounceGate,
                                       WatchStrategy watchStrategy, RegenerationDispatcher regenerationDispatcher,
                                       @Qualifier("regenerationExecutor") ExecutorService regenerationExecutor) {
        return new ChangeWatcher(sessionStore.getWorkspacesRoot(), properties.getWatch().normalizedExtensions(),
                properties.getDebounceInterval(), debounceGate, watchStrategy,
                workspace -> {
                    try {
                        regenerationExecutor.execute(() -> regenerationDispatcher.regenerate(workspace, true));
                    } catch (RejectedExecutionException e) {
                        log.warn("regen.rejected workspace={} reason=shutting_down", workspace.getFileName());
                    }
                });
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ExpirySweeper expirySweeper(SandboxProperties properties, SessionStore sessionStore) {
        return new ExpirySweeper(sessionStore, properties.getSessionLifetime(), properties.getCleanupInterval());
    }
}
