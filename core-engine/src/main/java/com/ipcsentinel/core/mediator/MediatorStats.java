package com.ipcsentinel.core.mediator;

import com.ipcsentinel.core.model.SecurityEvent;
import com.ipcsentinel.core.ratelimit.RateLimiterStats;

import java.util.List;

/**
 * Snapshot returned by {@link IpcMediator#getStats()}.
 */
public final class MediatorStats {

    private final int registeredHandlerCount;
    private final RateLimiterStats rateLimiterStats;
    private final List<SecurityEvent> recentSecurityEvents;

    MediatorStats(int registeredHandlerCount, RateLimiterStats rateLimiterStats,
            List<SecurityEvent> recentSecurityEvents) {
        this.registeredHandlerCount = registeredHandlerCount;
        this.rateLimiterStats = rateLimiterStats;
        this.recentSecurityEvents = List.copyOf(recentSecurityEvents);
    }

    public int getRegisteredHandlerCount() {
        return registeredHandlerCount;
    }

    public RateLimiterStats getRateLimiterStats() {
        return rateLimiterStats;
    }

    public List<SecurityEvent> getRecentSecurityEvents() {
        return recentSecurityEvents;
    }

    @Override
    public String toString() {
        return "MediatorStats{" +
                "registeredHandlerCount=" + registeredHandlerCount +
                ", rateLimiterStats=" + rateLimiterStats +
                ", recentSecurityEvents=" + recentSecurityEvents.size() +
                '}';
    }
}
