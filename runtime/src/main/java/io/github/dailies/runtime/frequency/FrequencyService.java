package io.github.dailies.runtime.frequency;

import io.github.dailies.persistence.document.FrequencyDocument;
import io.github.dailies.persistence.document.TaskDocument;
import io.github.dailies.persistence.repository.FrequencyRepository;
import io.github.dailies.protocol.api.CreateFrequencyRequest;
import io.github.dailies.protocol.api.FrequencyDto;
import io.github.dailies.protocol.api.FrequencyTimerDto;
import io.github.dailies.protocol.api.UpdateFrequencyRequest;
import io.github.dailies.protocol.ws.NotificationMessage;
import io.github.dailies.protocol.ws.NotificationType;
import io.github.dailies.runtime.error.ConflictException;
import io.github.dailies.runtime.error.NotFoundException;
import io.github.dailies.runtime.error.ValidationException;
import io.github.dailies.runtime.mapping.Dtos;
import io.github.dailies.runtime.notify.EventPublisher;
import io.github.dailies.runtime.recurrence.InvalidRecurrenceException;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Frequency CRUD. Periods are stored even when they do not parse; such frequencies are reported
 * with {@code valid=false} and the reset scheduler skips their tasks.
 */
@Service
public class FrequencyService {

    private static final Logger log = LoggerFactory.getLogger(FrequencyService.class);

    private final FrequencyRepository frequencyRepository;
    private final MongoTemplate mongoTemplate;
    private final RecurrenceEvaluator evaluator;
    private final EventPublisher publisher;
    private final Clock clock;

    public FrequencyService(FrequencyRepository frequencyRepository, MongoTemplate mongoTemplate,
                            RecurrenceEvaluator evaluator, EventPublisher publisher, Clock clock) {
        this.frequencyRepository = frequencyRepository;
        this.mongoTemplate = mongoTemplate;
        this.evaluator = evaluator;
        this.publisher = publisher;
        this.clock = clock;
    }

    public List<FrequencyDto> list(String name) {
        List<FrequencyDocument> frequencies = name == null || name.isBlank()
                ? frequencyRepository.findAllByOrderByNameAsc()
                : frequencyRepository.findByNameContainingIgnoreCaseOrderByNameAsc(name.trim());
        return frequencies.stream().map(this::toDto).toList();
    }

    public FrequencyDto get(String id) {
        return toDto(find(id));
    }

    /** Countdown to the next reset of every frequency; invalid periods report no next reset. */
    public List<FrequencyTimerDto> timers() {
        Instant now = clock.instant();
        return frequencyRepository.findAllByOrderByNameAsc().stream()
                .map(f -> {
                    Optional<Instant> next;
                    try {
                        next = evaluator.nextBoundaryAfter(f.getPeriod(), f.getTimezone(), now);
                    } catch (InvalidRecurrenceException e) {
                        next = Optional.empty();
                    }
                    return new FrequencyTimerDto(
                            f.getFrequencyId(),
                            f.getName(),
                            f.getPeriod(),
                            next.orElse(null),
                            next.map(n -> RecurrenceEvaluator.formatRemaining(Duration.between(now, n)))
                                    .orElse(null));
                })
                .toList();
    }

    public FrequencyDto create(CreateFrequencyRequest req) {
        if (req == null || req.name() == null || req.name().isBlank()) {
            throw new ValidationException("Frequency name is required");
        }
        if (req.period() == null || req.period().isBlank()) {
            throw new ValidationException("Frequency period is required");
        }
        String name = req.name().trim();
        if (frequencyRepository.existsByName(name)) {
            throw new ConflictException("Frequency with this name already exists");
        }
        String period = req.period().trim();
        FrequencyDocument frequency = save(FrequencyDocument.create(
                name, period, normalizeTimezone(req.timezone()), clock.instant()));
        warnIfInvalid(frequency);

        FrequencyDto dto = toDto(frequency);
        publisher.publish(NotificationMessage.of(NotificationType.FREQUENCY_CREATE,
                "Frequency created: " + name, dto));
        return dto;
    }

    public FrequencyDto update(String id, UpdateFrequencyRequest req) {
        FrequencyDocument frequency = find(id);
        if (req.name() != null) {
            String name = req.name().trim();
            if (name.isEmpty()) throw new ValidationException("Frequency name must not be empty");
            if (!name.equals(frequency.getName()) && frequencyRepository.existsByName(name)) {
                throw new ConflictException("Frequency with this name already exists");
            }
            frequency.setName(name);
        }
        if (req.period() != null) {
            String period = req.period().trim();
            if (period.isEmpty()) throw new ValidationException("Frequency period must not be empty");
            if (!period.equals(frequency.getPeriod())) {
                evaluator.evict(frequency.getPeriod());
                frequency.setPeriod(period);
            }
        }
        if (req.timezone() != null) {
            frequency.setTimezone(normalizeTimezone(req.timezone()));
        }
        frequency.setUpdatedAt(clock.instant());
        frequency = save(frequency);
        warnIfInvalid(frequency);

        FrequencyDto dto = toDto(frequency);
        publisher.publish(NotificationMessage.of(NotificationType.FREQUENCY_UPDATE,
                "Frequency updated: " + frequency.getName(), dto));
        return dto;
    }

    /** Deletes the frequency; tasks that used it stop recurring. */
    public void delete(String id) {
        FrequencyDocument frequency = find(id);
        long detached = mongoTemplate.updateMulti(
                new Query(Criteria.where("frequencyId").is(id)),
                new Update().unset("frequencyId").set("updatedAt", clock.instant()).inc("version", 1),
                TaskDocument.class).getModifiedCount();
        frequencyRepository.delete(frequency);
        evaluator.evict(frequency.getPeriod());
        if (detached > 0) {
            log.info("Detached {} tasks from deleted frequency '{}'", detached, frequency.getName());
        }

        publisher.publish(NotificationMessage.of(NotificationType.FREQUENCY_DELETE,
                "Frequency deleted: " + frequency.getName(), toDto(frequency)));
    }

    private FrequencyDocument find(String id) {
        return frequencyRepository.findById(id).orElseThrow(() -> new NotFoundException("Frequency not found"));
    }

    private FrequencyDto toDto(FrequencyDocument frequency) {
        return Dtos.toDto(frequency, evaluator.isValid(frequency.getPeriod()));
    }

    private FrequencyDocument save(FrequencyDocument frequency) {
        try {
            return frequencyRepository.save(frequency);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Frequency with this name already exists", e);
        }
    }

    private void warnIfInvalid(FrequencyDocument frequency) {
        if (!evaluator.isValid(frequency.getPeriod())) {
            log.warn("Frequency '{}' has invalid period '{}', its tasks will not reset",
                    frequency.getName(), frequency.getPeriod());
        }
    }

    private static String normalizeTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) return null;
        try {
            return ZoneId.of(timezone.trim()).getId();
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid timezone: " + timezone);
        }
    }
}
