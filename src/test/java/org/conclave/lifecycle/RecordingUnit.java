package org.conclave.lifecycle;

import org.conclave.lifecycle.api.IPausableUnit;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unit double that appends its lifecycle calls to a shared journal.
 */
class RecordingUnit implements IPausableUnit {

    private final String name;
    private final List<String> journal;
    final AtomicBoolean healthy = new AtomicBoolean(true);
    final AtomicBoolean failOnStart = new AtomicBoolean(false);
    final AtomicInteger starts = new AtomicInteger();
    final AtomicInteger stops = new AtomicInteger();
    final AtomicInteger healthChecks = new AtomicInteger();

    RecordingUnit(String name, List<String> journal) {
        this.name = name;
        this.journal = journal;
    }

    @Override
    public void start() {
        journal.add("start:" + name);
        starts.incrementAndGet();
        if (failOnStart.get()) {
            throw new IllegalStateException(name + " refused to start");
        }
    }

    @Override
    public void stop(Duration timeout) {
        journal.add("stop:" + name);
        stops.incrementAndGet();
    }

    @Override
    public boolean healthCheck() {
        healthChecks.incrementAndGet();
        return healthy.get();
    }

    @Override
    public void pause() {
        journal.add("pause:" + name);
    }

    @Override
    public void resume() {
        journal.add("resume:" + name);
    }
}
