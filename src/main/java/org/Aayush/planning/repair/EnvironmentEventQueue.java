package org.Aayush.planning.repair;

import org.Aayush.planning.workspace.RegionUpdate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serialized channel from perception or execution threads to the planning thread.
 * <p>
 * Producers may submit from any thread; the planning thread drains updates between
 * iterations, in submission order.
 * </p>
 */
public final class EnvironmentEventQueue {
    private final LinkedBlockingQueue<RegionUpdate> pending = new LinkedBlockingQueue<>();
    private final AtomicLong submitted = new AtomicLong();

    public void submit(RegionUpdate update) {
        pending.add(Objects.requireNonNull(update, "update"));
        submitted.incrementAndGet();
    }

    /**
     * @return every update queued so far, oldest first.
     */
    public List<RegionUpdate> drain() {
        List<RegionUpdate> out = new ArrayList<>();
        pending.drainTo(out);
        return out;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    /**
     * @return updates ever submitted.
     */
    public long submittedCount() {
        return submitted.get();
    }
}
