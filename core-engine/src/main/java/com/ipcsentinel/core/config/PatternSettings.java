package com.ipcsentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of the built-in attack-pattern heuristics.
 *
 * <p>
 * Defaults reproduce the reference behaviour:
 * </p>
 * <ul>
 * <li>rapid channel switching – among the last 20 events, more than 10
 * distinct channels within 5 s (needs 10 events of history)</li>
 * <li>privilege escalation – more than 5 unauthorized-sender events on a
 * privileged channel among the last 50</li>
 * <li>DDoS – more than 50 rate-limit events among the last 100, the oldest
 * less than 60 s ago</li>
 * <li>automated attack – variance of the inter-arrival times of the last 10
 * events below 100 ms²</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PatternSettings {

    private RapidChannelSwitching rapidChannelSwitching = new RapidChannelSwitching();
    private PrivilegeEscalation privilegeEscalation = new PrivilegeEscalation();
    private Ddos ddos = new Ddos();
    private AutomatedAttack automatedAttack = new AutomatedAttack();

    List<String> problems() {
        List<String> errors = new ArrayList<>();
        if (rapidChannelSwitching == null || privilegeEscalation == null
                || ddos == null || automatedAttack == null) {
            errors.add("Every pattern section must be present when 'patterns' is given");
            return errors;
        }
        if (rapidChannelSwitching.lookback < 2) {
            errors.add("rapidChannelSwitching.lookback must be >= 2");
        }
        if (privilegeEscalation.lookback < 1) {
            errors.add("privilegeEscalation.lookback must be >= 1");
        }
        if (privilegeEscalation.privilegedPrefixes == null
                || privilegeEscalation.privilegedPrefixes.isEmpty()) {
            errors.add("privilegeEscalation.privilegedPrefixes must not be empty");
        }
        if (ddos.lookback < 1) {
            errors.add("ddos.lookback must be >= 1");
        }
        if (automatedAttack.lookback < 3) {
            errors.add("automatedAttack.lookback must be >= 3");
        }
        if (automatedAttack.maxVariance <= 0) {
            errors.add("automatedAttack.maxVariance must be > 0");
        }
        return errors;
    }

    public RapidChannelSwitching getRapidChannelSwitching() {
        return rapidChannelSwitching;
    }

    public void setRapidChannelSwitching(RapidChannelSwitching rapidChannelSwitching) {
        this.rapidChannelSwitching = rapidChannelSwitching;
    }

    public PrivilegeEscalation getPrivilegeEscalation() {
        return privilegeEscalation;
    }

    public void setPrivilegeEscalation(PrivilegeEscalation privilegeEscalation) {
        this.privilegeEscalation = privilegeEscalation;
    }

    public Ddos getDdos() {
        return ddos;
    }

    public void setDdos(Ddos ddos) {
        this.ddos = ddos;
    }

    public AutomatedAttack getAutomatedAttack() {
        return automatedAttack;
    }

    public void setAutomatedAttack(AutomatedAttack automatedAttack) {
        this.automatedAttack = automatedAttack;
    }

    // ---------------------------------------------------------------
    // Per-pattern sections
    // ---------------------------------------------------------------

    public static class RapidChannelSwitching {
        private int minEvents = 10;
        private int lookback = 20;
        private int minDistinctChannels = 10;
        private long maxSpanMs = 5_000;

        public int getMinEvents() {
            return minEvents;
        }

        public void setMinEvents(int minEvents) {
            this.minEvents = minEvents;
        }

        public int getLookback() {
            return lookback;
        }

        public void setLookback(int lookback) {
            this.lookback = lookback;
        }

        public int getMinDistinctChannels() {
            return minDistinctChannels;
        }

        public void setMinDistinctChannels(int minDistinctChannels) {
            this.minDistinctChannels = minDistinctChannels;
        }

        public long getMaxSpanMs() {
            return maxSpanMs;
        }

        public void setMaxSpanMs(long maxSpanMs) {
            this.maxSpanMs = maxSpanMs;
        }
    }

    public static class PrivilegeEscalation {
        private int lookback = 50;
        private int minAttempts = 5;
        private List<String> privilegedPrefixes = new ArrayList<>(List.of("admin:", "system:", "internal:"));

        public int getLookback() {
            return lookback;
        }

        public void setLookback(int lookback) {
            this.lookback = lookback;
        }

        public int getMinAttempts() {
            return minAttempts;
        }

        public void setMinAttempts(int minAttempts) {
            this.minAttempts = minAttempts;
        }

        public List<String> getPrivilegedPrefixes() {
            return privilegedPrefixes;
        }

        public void setPrivilegedPrefixes(List<String> privilegedPrefixes) {
            this.privilegedPrefixes = privilegedPrefixes != null ? new ArrayList<>(privilegedPrefixes) : null;
        }
    }

    public static class Ddos {
        private int lookback = 100;
        private int minRateLimitEvents = 50;
        private long maxSpanMs = 60_000;

        public int getLookback() {
            return lookback;
        }

        public void setLookback(int lookback) {
            this.lookback = lookback;
        }

        public int getMinRateLimitEvents() {
            return minRateLimitEvents;
        }

        public void setMinRateLimitEvents(int minRateLimitEvents) {
            this.minRateLimitEvents = minRateLimitEvents;
        }

        public long getMaxSpanMs() {
            return maxSpanMs;
        }

        public void setMaxSpanMs(long maxSpanMs) {
            this.maxSpanMs = maxSpanMs;
        }
    }

    public static class AutomatedAttack {
        private int minEvents = 10;
        private int lookback = 10;
        private double maxVariance = 100.0;

        public int getMinEvents() {
            return minEvents;
        }

        public void setMinEvents(int minEvents) {
            this.minEvents = minEvents;
        }

        public int getLookback() {
            return lookback;
        }

        public void setLookback(int lookback) {
            this.lookback = lookback;
        }

        public double getMaxVariance() {
            return maxVariance;
        }

        public void setMaxVariance(double maxVariance) {
            this.maxVariance = maxVariance;
        }
    }
}
