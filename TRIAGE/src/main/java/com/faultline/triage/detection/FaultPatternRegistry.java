package com.faultline.triage.detection;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.FaultExample;
import com.faultline.triage.domain.model.FaultPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory store of known fault patterns.
 * <p>
 * The pattern list is an immutable snapshot behind an {@link AtomicReference}. Writers build a new
 * list and swap it in, so readers never observe a partially applied update. Patterns handed out are
 * copies; mutating them does not touch the registry. Nothing is persisted across restarts.
 */
@Slf4j
@Component
public class FaultPatternRegistry {

    private final AtomicReference<List<FaultPattern>> patterns;
    private final int maxExamples;

    public FaultPatternRegistry(TriageProperties properties, Clock clock) {
        this.maxExamples = properties.getPatterns().getMaxExamples();
        this.patterns = new AtomicReference<>(List.copyOf(StarterPatterns.create(clock.instant())));
    }

    /**
     * Copies of all registered patterns, in registration order.
     */
    public List<FaultPattern> snapshot() {
        return patterns.get().stream().map(FaultPattern::copy).collect(Collectors.toList());
    }

    public Optional<FaultPattern> find(String patternId) {
        return patterns.get().stream()
                .filter(pattern -> pattern.getId().equals(patternId))
                .findFirst()
                .map(FaultPattern::copy);
    }

    public int size() {
        return patterns.get().size();
    }

    /**
     * Record that a pattern matched another incident: bump the frequency, set last-seen
     * and prepend the example, keeping the most recent examples only.
     *
     * @return the updated pattern, empty if no pattern has that id
     */
    public Optional<FaultPattern> recordOccurrence(String patternId, FaultExample example, Instant seenAt) {
        List<FaultPattern> updated = patterns.updateAndGet(current -> current.stream()
                .map(pattern -> pattern.getId().equals(patternId)
                        ? pattern.toBuilder()
                                .frequency(pattern.getFrequency() + 1)
                                .lastSeen(seenAt)
                                .indicators(new ArrayList<>(pattern.getIndicators()))
                                .examples(pattern.examplesWith(example, maxExamples))
                                .build()
                        : pattern)
                .collect(Collectors.toUnmodifiableList()));

        return updated.stream()
                .filter(pattern -> pattern.getId().equals(patternId))
                .findFirst()
                .map(FaultPattern::copy);
    }

    /**
     * Replace patterns by id, appending the ones not yet known, as a single atomic update.
     * Nothing is applied when any incoming pattern is invalid.
     *
     * @return copies of the resulting pattern set
     * @throws IllegalArgumentException if a pattern fails {@link FaultPatternValidator}
     */
    public List<FaultPattern> upsertAll(Collection<FaultPattern> incoming) {
        FaultPatternValidator.validate(incoming);
        List<FaultPattern> additions = incoming.stream().map(FaultPattern::copy).collect(Collectors.toList());

        List<FaultPattern> updated = patterns.updateAndGet(current -> {
            Map<String, FaultPattern> byId = new LinkedHashMap<>();
            current.forEach(pattern -> byId.put(pattern.getId(), pattern));
            additions.forEach(pattern -> byId.put(pattern.getId(), pattern));
            return List.copyOf(byId.values());
        });

        log.debug("Pattern registry now holds {} patterns", updated.size());
        return updated.stream().map(FaultPattern::copy).collect(Collectors.toList());
    }
}
