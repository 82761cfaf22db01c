package com.chicu.riskwatch.engine;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return d -> Thread.sleep(d.toMillis());
    }
}
