package com.logpanel.logs.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "logs.resilience")
public class LogsResilienceProperties {
    private int maxConcurrentRequests = 5;
    private long permitPollMs = 50;

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    public long getPermitPollMs() {
        return permitPollMs;
    }

    public void setPermitPollMs(long permitPollMs) {
        this.permitPollMs = permitPollMs;
    }
}
