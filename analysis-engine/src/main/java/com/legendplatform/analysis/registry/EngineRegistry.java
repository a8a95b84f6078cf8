package com.legendplatform.analysis.registry;

import com.legendplatform.analysis.engine.LegendEngine;
import com.legendplatform.common.exception.DuplicateEngineException;
import com.legendplatform.common.exception.UnknownEngineException;
import com.legendplatform.common.model.EngineType;
import com.legendplatform.common.model.ReliabilityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Holds engines by unique name, in registration order.
 *
 * <p>The engine list is replaced wholesale on every registration, so a list returned by
 * {@link #snapshot()} is immutable and never observes a later registration. Readers take
 * no lock; only writers serialize on {@code lock}.
 */
public class EngineRegistry {

    private static final Logger log = LoggerFactory.getLogger(EngineRegistry.class);

    private final Object lock = new Object();
    private volatile List<LegendEngine> engines = List.of();

    public EngineRegistry() {}

    public EngineRegistry(Collection<? extends LegendEngine> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws DuplicateEngineException if an engine with the same name is already registered
     */
    public void register(LegendEngine engine) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(engine.name(), "engine name");
        Objects.requireNonNull(engine.reliabilityLevel(), "reliability level of " + engine.name());
        Objects.requireNonNull(engine.engineType(), "engine type of " + engine.name());
        synchronized (lock) {
            if (find(engine.name()).isPresent()) {
                throw new DuplicateEngineException(engine.name());
            }
            List<LegendEngine> next = new ArrayList<>(engines.size() + 1);
            next.addAll(engines);
            next.add(engine);
            engines = List.copyOf(next);
        }
        log.info("Engine registered. name={} type={} reliability={}",
                 engine.name(), engine.engineType(), engine.reliabilityLevel());
    }

    public List<LegendEngine> snapshot() {
        return engines;
    }

    public int size() {
        return engines.size();
    }

    public Optional<LegendEngine> find(String name) {
        return engines.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public List<LegendEngine> filterByType(EngineType type) {
        return engines.stream().filter(e -> e.engineType() == type).toList();
    }

    public List<LegendEngine> filterByMinimumReliability(ReliabilityLevel level) {
        return engines.stream().filter(e -> e.reliabilityLevel().isAtLeast(level)).toList();
    }

    /**
     * Engines named in {@code names}, in registration order. {@code null} selects every engine.
     *
     * @throws UnknownEngineException listing every name that is not registered
     */
    public List<LegendEngine> resolve(Collection<String> names) {
        List<LegendEngine> current = engines;
        if (names == null) {
            return current;
        }
        Set<String> wanted = new LinkedHashSet<>(names);
        List<String> missing = wanted.stream()
            .filter(n -> current.stream().noneMatch(e -> e.name().equals(n)))
            .toList();
        if (!missing.isEmpty()) {
            throw new UnknownEngineException(missing);
        }
        return current.stream().filter(e -> wanted.contains(e.name())).toList();
    }

    public List<EngineDescriptor> describe() {
        return engines.stream().map(EngineDescriptor::of).toList();
    }
}
