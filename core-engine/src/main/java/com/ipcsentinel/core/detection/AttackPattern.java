package com.ipcsentinel.core.detection;

import com.ipcsentinel.core.model.Severity;

/**
 * A named heuristic over the recent security-event history.
 *
 * <p>
 * Unlike per-type thresholds, patterns look at the shape of the history:
 * how fast channels change, how regular the timing is, which events
 * dominate. Implementations are stateless and evaluated after every logged
 * event.
 * </p>
 */
public interface AttackPattern {

    /**
     * @return unique pattern name, used in alerts and for deduplication
     */
    String getName();

    /**
     * @return severity reported with the alert, {@code HIGH} or {@code CRITICAL}
     */
    Severity getSeverity();

    /**
     * @return how many trailing events the pattern inspects
     */
    int getLookback();

    /**
     * @param history recent events
     * @return {@code true} if the pattern matches
     */
    boolean detect(EventHistory history);
}
