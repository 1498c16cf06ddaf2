package com.isweep.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "isweep.engine")
public class EngineProperties {

    /** Spring resource location of the JSON rules document. */
    private String rulesLocation = "classpath:isweep-rules.json";

    /** Upper bound on a preferences lookup before the request falls back to no action. */
    private Duration preferencesTimeout = Duration.ofMillis(500);

    /** Threads available for concurrent preferences lookups. */
    private int lookupThreads = 4;

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public Duration getPreferencesTimeout() {
        return preferencesTimeout;
    }

    public void setPreferencesTimeout(Duration preferencesTimeout) {
        this.preferencesTimeout = preferencesTimeout;
    }

    public int getLookupThreads() {
        return lookupThreads;
    }

    public void setLookupThreads(int lookupThreads) {
        this.lookupThreads = lookupThreads;
    }
}
