package com.platform.configdrift.drift;

import com.platform.configdrift.error.UnsupportedEngineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Engines by comparison method.
 */
@Slf4j
@Component
public class ComparisonEngineRegistry {

    private final Map<ComparisonMethod, ComparisonEngine> engines = new EnumMap<>(ComparisonMethod.class);

    public ComparisonEngineRegistry(List<ComparisonEngine> engines) {
        engines.forEach(engine -> this.engines.put(engine.getMethod(), engine));
        log.info("Registered comparison engines: {}", this.engines.keySet());
    }

    public ComparisonEngine getEngine(String methodName) {
        return getEngine(ComparisonMethod.fromName(methodName));
    }

    public ComparisonEngine getEngine(ComparisonMethod method) {
        ComparisonEngine engine = engines.get(method);
        if (engine == null) {
            throw new UnsupportedEngineException(method.getName());
        }
        return engine;
    }
}
