package com.subtrack.subbackend.subscription;

import com.subtrack.subbackend.error.SubscriptionNotFoundException;
import com.subtrack.subbackend.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * The subscription store contract: create, fetch, full replacement, delete and period listing.
 *
 * <p>Input is validated before the repository is called, so a rejected request never
 * touches storage. Storage failures are not retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository repo;

    public UUID create(SubscriptionInput input) {
        Subscription s = toSubscription(UUID.randomUUID(), input);
        repo.insert(s);
        log.info("💾 Subscription {} created for user {} ({})", s.id(), s.userId(), s.serviceName());
        return s.id();
    }

    public Subscription get(String id) {
        UUID uuid = parseId(id);
        return repo.findById(uuid).orElseThrow(() -> notFound(id));
    }

    /**
     * Full replacement: every field of {@code input} overwrites the stored row. The body is
     * checked before the id, so a bad body is reported even when the id is malformed too.
     */
    public Subscription update(String id, SubscriptionInput input) {
        Subscription replacement = toSubscription(null, input);
        UUID uuid = parseId(id);
        Subscription s = replacement.withId(uuid);
        if (repo.update(s) == 0) {
            throw notFound(id);
        }
        log.info("Subscription {} updated", uuid);
        return s;
    }

    public void delete(String id) {
        UUID uuid = parseId(id);
        if (repo.deleteById(uuid) == 0) {
            throw notFound(id);
        }
        log.info("🗑️ Subscription {} deleted", uuid);
    }

    /**
     * @param from inclusive lower bound on start month, {@code MM-YYYY}, or null
     * @param to inclusive upper bound on end month, {@code MM-YYYY}, or null; when present, ongoing
     *           subscriptions are left out
     */
    public List<Subscription> list(String from, String to) {
        return repo.findAll(PeriodFilter.parse(from, to));
    }

    private static Subscription toSubscription(UUID id, SubscriptionInput input) {
        if (input == null) {
            throw new ValidationException("subscription body is required");
        }
        if (isBlank(input.userId())) {
            throw new ValidationException("user_id is required");
        }
        if (isBlank(input.serviceName())) {
            throw new ValidationException("service_name is required");
        }
        if (input.price() == null) {
            throw new ValidationException("price is required");
        }
        if (input.price() < 0) {
            throw new ValidationException("price must not be negative");
        }

        YearMonth start = MonthFormat.parse(input.startDate(), "start_date");
        YearMonth end = input.endDate() == null ? null : MonthFormat.parse(input.endDate(), "end_date");

        return new Subscription(id, input.userId(), input.serviceName(), input.price(), start, end);
    }

    // A malformed id cannot match any row.
    private static UUID parseId(String id) {
        if (id == null) {
            throw notFound(null);
        }
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw notFound(id);
        }
    }

    private static SubscriptionNotFoundException notFound(String id) {
        log.debug("Subscription {} not found", id);
        return new SubscriptionNotFoundException(id);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
