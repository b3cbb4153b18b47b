package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Looks up the recovery strategy in a {@link RecoveryTable} and records every report.
 * A retry is only answered while the report's attempt count is within the strategy's budget;
 * afterwards the handler aborts.
 */
public class DefaultErrorHandler implements ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(DefaultErrorHandler.class);

    private final RecoveryTable table;
    private final List<ErrorReport> reports = new ArrayList<>();

    public DefaultErrorHandler(@NotNull RecoveryTable table) {
        this.table = table;
    }

    public DefaultErrorHandler() {
        this(RecoveryTable.defaults());
    }

    @Override
    public @NotNull RecoveryAction handle(@NotNull ErrorReport report) {
        synchronized (reports) {
            reports.add(report);
        }
        RecoveryStrategy strategy = table.lookup(report.category(), report.severity());
        RecoveryAction action = strategy.action();
        if (action == RecoveryAction.RETRY) {
            if (report.attempt() > strategy.maxRetries()) {
                log.warn("Giving up on {} after {} attempts: {}", report.phase(), report.attempt(), report.message());
                return RecoveryAction.ABORT;
            }
            sleep(strategy);
        }
        log.debug("{}/{} in {} -> {}", report.category(), report.severity(), report.phase(), action);
        return action;
    }

    /**
     * Every report handled so far, in order
     */
    public List<ErrorReport> reports() {
        synchronized (reports) {
            return List.copyOf(reports);
        }
    }

    private static void sleep(RecoveryStrategy strategy) {
        if (strategy.retryDelay().isZero()) {
            return;
        }
        try {
            Thread.sleep(strategy.retryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
