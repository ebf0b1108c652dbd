package chronobeat.beat;

import chronobeat.exception.DispatchUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate limits dispatch failure logging: one WARN when an outage starts, DEBUG
 * while it lasts, one INFO when dispatch works again.
 */
final class DispatchOutageLog {

    private static final Logger log = LoggerFactory.getLogger(DispatchOutageLog.class);

    private volatile boolean inOutage;
    private int failures;

    void failed(String taskName, DispatchUnavailableException e) {
        failures++;
        if (!inOutage) {
            inOutage = true;
            log.warn("Task dispatch unavailable, due entries will be retried: {}", e.getMessage());
        } else {
            log.debug("Dispatch of {} still unavailable ({} failures)", taskName, failures);
        }
    }

    void succeeded() {
        if (inOutage) {
            log.info("Task dispatch recovered after {} failed attempt(s)", failures);
            inOutage = false;
            failures = 0;
        }
    }

    boolean inOutage() {
        return inOutage;
    }
}
