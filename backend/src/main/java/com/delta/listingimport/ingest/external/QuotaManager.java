package com.delta.listingimport.ingest.external;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.QuotaExceededException;
import com.delta.listingimport.ingest.persistence.QuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Monthly request ceiling for the listings API, persisted per calendar month (UTC) so it survives restarts.
 * The increment is a single conditional UPDATE, so concurrent callers cannot push the total past the limit.
 */
@Service
public class QuotaManager {
    private static final Logger log = LoggerFactory.getLogger(QuotaManager.class);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    private final QuotaRepository repository;
    private final IngestProperties properties;
    private final Clock clock;

    public QuotaManager(QuotaRepository repository, IngestProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public QuotaTicket checkAndIncrement(String endpoint) {
        IngestProperties.Quota quota = properties.getQuota();
        int limit = quota.getMonthlyLimit();
        String month = currentMonthKey();
        repository.ensureMonth(month);
        if (!repository.tryIncrement(month, limit, clock.instant())) {
            int total = repository.find(month).map(QuotaRepository.QuotaRow::total).orElse(0);
            log.error("Listings API quota exceeded: {}/{} requests in {}", total, limit, month);
            throw new QuotaExceededException(
                "API quota exceeded: " + total + "/" + limit + " requests used this month"
            );
        }
        repository.adjustEndpoint(month, endpoint, 1);

        int total = repository.find(month).map(QuotaRepository.QuotaRow::total).orElse(0);
        double percent = percentUsed(total, limit);
        if (percent >= quota.getCriticalPercent()) {
            log.warn("Listings API quota at {}% ({}/{}) for {}", String.format("%.1f", percent), total, limit, month);
        } else if (percent >= quota.getWarnPercent()) {
            log.info("Listings API quota passed {}%: {}/{} for {}", quota.getWarnPercent(), total, limit, month);
        } else {
            log.debug("Listings API request logged: {}/{} ({})", total, limit, endpoint);
        }
        return new QuotaTicket(month, endpoint);
    }

    /**
     * Returns a previously admitted call to the pool.
     */
    public void refund(QuotaTicket ticket) {
        if (ticket == null) {
            return;
        }
        repository.decrement(ticket.month());
        repository.adjustEndpoint(ticket.month(), ticket.endpoint(), -1);
        log.debug("Refunded listings API call for {} ({})", ticket.endpoint(), ticket.month());
    }

    public QuotaUsage usage() {
        String month = currentMonthKey();
        int limit = properties.getQuota().getMonthlyLimit();
        QuotaRepository.QuotaRow row = repository.find(month)
            .orElse(new QuotaRepository.QuotaRow(month, 0, null));
        double percent = Math.round(percentUsed(row.total(), limit) * 100.0) / 100.0;
        return new QuotaUsage(
            month,
            row.total(),
            limit,
            Math.max(0, limit - row.total()),
            percent,
            repository.endpointCounts(month),
            row.lastRequestAt()
        );
    }

    public QuotaPolicy policy() {
        return properties.getQuota().getPolicy();
    }

    public String currentMonthKey() {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC)).format(MONTH_KEY);
    }

    private static double percentUsed(int total, int limit) {
        if (limit <= 0) {
            return 100.0;
        }
        return (total * 100.0) / limit;
    }
}
