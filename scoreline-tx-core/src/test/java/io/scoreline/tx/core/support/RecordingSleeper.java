package io.scoreline.tx.core.support;

import io.scoreline.tx.core.transaction.Sleeper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records requested delays instead of sleeping.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(long millis) {
        delays.add(millis);
    }

    public List<Long> getDelays() {
        return delays;
    }
}
