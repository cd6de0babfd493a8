package com.example.solarcast.ml;

import com.example.solarcast.config.ForecastProperties;
import com.example.solarcast.exception.ModelNotReadyException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds at most one {@link ArtifactPair} for the whole process.
 *
 * <h2>Lifecycle</h2>
 * {@code EMPTY -> LOADING -> READY}, and {@code UNLOADED} once the context shuts down.
 * A failed load never throws: the service keeps running and answers predictions with
 * 503 until the artifacts are fixed and the process restarted.
 *
 * <h2>Concurrency</h2>
 * Readers call {@link #current()} without locking and get either nothing or a fully built
 * pair; installation is a single reference swap. {@link #load(String)} and {@link #unload()}
 * are serialized against each other.
 */
@Component
@Slf4j
public class ModelRegistry {

    public enum State { EMPTY, LOADING, READY, UNLOADED }

    private final ArtifactStore store;
    private final ForecastProperties props;

    private final AtomicReference<ArtifactPair> active = new AtomicReference<>();
    private volatile State state = State.EMPTY;
    private volatile String lastFailure;

    public ModelRegistry(ArtifactStore store, ForecastProperties props) {
        this.store = store;
        this.props = props;
    }

    @PostConstruct
    void loadOnStartup() {
        var model = props.getModel();
        if (!model.isLoadOnStartup()) {
            log.info("Startup model load disabled; serving without a model");
            return;
        }
        log.info("Loading model artifacts version={} from {}", model.getVersion(), store.baseDir());
        load(model.getVersion());
    }

    /**
     * Loads {@code version} and swaps it in.
     *
     * @return {@code true} if the new pair is installed
     */
    public synchronized boolean load(String version) {
        if (state == State.UNLOADED) {
            log.warn("Ignoring load of version {}: registry already unloaded", version);
            return false;
        }
        state = State.LOADING;
        try {
            ArtifactPair pair = store.load(version);
            active.set(pair);
            lastFailure = null;
            state = State.READY;
            log.info("Model and scaler loaded: version={}, regressor={}", pair.version(), pair.regressor().algorithm());
            return true;
        } catch (Exception e) {
            lastFailure = e.getMessage();
            // a previously installed pair keeps serving
            state = active.get() != null ? State.READY : State.EMPTY;
            log.error("Error loading model version {}: {}", version, e.toString());
            return false;
        }
    }

    public boolean isReady() {
        return active.get() != null;
    }

    /** @throws ModelNotReadyException if nothing is installed */
    public ArtifactPair current() {
        ArtifactPair pair = active.get();
        if (pair == null) {
            throw new ModelNotReadyException();
        }
        return pair;
    }

    public Optional<ArtifactPair> snapshot() {
        return Optional.ofNullable(active.get());
    }

    @PreDestroy
    public synchronized void unload() {
        ArtifactPair dropped = active.getAndSet(null);
        state = State.UNLOADED;
        log.info("Models unloaded (was {})", dropped == null ? "empty" : dropped.version());
    }

    public State state() {
        return state;
    }

    public Optional<String> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }
}
