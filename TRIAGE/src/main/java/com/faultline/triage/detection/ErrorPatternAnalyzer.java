package com.faultline.triage.detection;

import com.faultline.triage.domain.model.ErrorEvent;
import com.faultline.triage.domain.model.ErrorPattern;
import com.faultline.triage.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Clusters error events by normalized message.
 */
@Slf4j
@Component
public class ErrorPatternAnalyzer {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern UUID = Pattern.compile(
            "[a-f0-9]{8}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{4}-[a-f0-9]{12}", Pattern.CASE_INSENSITIVE);
    private static final Pattern IP = Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b");
    private static final Pattern PATH = Pattern.compile("/\\S+");

    private static final int MIN_GROUP_SIZE = 2;
    private static final int MAX_EXAMPLES = 3;

    /**
     * Group errors by normalized message. Single occurrences are dropped.
     *
     * @return patterns sorted by frequency, most frequent first
     */
    public List<ErrorPattern> analyze(List<ErrorEvent> errors) {
        Map<String, List<ErrorEvent>> groups = new LinkedHashMap<>();
        for (ErrorEvent error : errors) {
            groups.computeIfAbsent(normalize(error.getMessage()), k -> new ArrayList<>()).add(error);
        }

        List<ErrorPattern> patterns = new ArrayList<>();
        for (Map.Entry<String, List<ErrorEvent>> group : groups.entrySet()) {
            List<ErrorEvent> members = group.getValue();
            if (members.size() < MIN_GROUP_SIZE) {
                continue;
            }

            List<Instant> timestamps = members.stream()
                    .map(ErrorEvent::getTimestamp)
                    .filter(Objects::nonNull)
                    .sorted()
                    .collect(Collectors.toList());
            List<String> entities = members.stream()
                    .map(ErrorEvent::getEntityGuid)
                    .distinct()
                    .collect(Collectors.toList());

            patterns.add(ErrorPattern.builder()
                    .pattern(group.getKey())
                    .frequency(members.size())
                    .firstSeen(timestamps.isEmpty() ? null : timestamps.get(0))
                    .lastSeen(timestamps.isEmpty() ? null : timestamps.get(timestamps.size() - 1))
                    .affectedEntities(entities)
                    .severity(severityFor(members.size(), entities.size()))
                    .category(categorize(group.getKey()))
                    .examples(new ArrayList<>(members.subList(0, Math.min(MAX_EXAMPLES, members.size()))))
                    .build());
        }

        patterns.sort(Comparator.comparingInt(ErrorPattern::getFrequency).reversed());
        log.debug("Grouped {} errors into {} patterns", errors.size(), patterns.size());
        return patterns;
    }

    /**
     * Replace volatile tokens with placeholders, in order: digits, UUIDs, IPv4 addresses, paths.
     */
    public static String normalize(String message) {
        String normalized = Objects.toString(message, "");
        normalized = DIGITS.matcher(normalized).replaceAll("N");
        normalized = UUID.matcher(normalized).replaceAll("UUID");
        normalized = IP.matcher(normalized).replaceAll("IP");
        return PATH.matcher(normalized).replaceAll("/PATH");
    }

    static Severity severityFor(int frequency, int entityCount) {
        if (frequency > 100 || entityCount > 5) {
            return Severity.CRITICAL;
        }
        if (frequency > 50 || entityCount > 3) {
            return Severity.HIGH;
        }
        if (frequency > 10 || entityCount > 1) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    static ErrorPattern.Category categorize(String pattern) {
        String text = pattern.toLowerCase(Locale.ROOT);
        if (text.contains("database") || text.contains("sql")) {
            return ErrorPattern.Category.DATABASE;
        }
        if (text.contains("network") || text.contains("timeout")) {
            return ErrorPattern.Category.NETWORK;
        }
        if (text.contains("memory") || text.contains("cpu")) {
            return ErrorPattern.Category.INFRASTRUCTURE;
        }
        return ErrorPattern.Category.APPLICATION;
    }
}
