package cli;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Progress / heartbeat logger for one batch run.
 *
 * <p>{@code [PROGRESS]} is printed every {@code logEvery} queries and after the last one;
 * {@code [HEARTBEAT]} is printed by a daemon thread while the run is alive.</p>
 */
public final class CliProgressMonitor {

    private static final long HEARTBEAT_MS = 30_000L;

    private final int total;
    private final int logEvery;
    private final long startNs = System.nanoTime();

    private final AtomicInteger currentIndex = new AtomicInteger(0);
    private final AtomicReference<String> currentKey = new AtomicReference<>("");
    private Thread heartbeat;

    public CliProgressMonitor(int total, int logEvery) {
        this.total = Math.max(0, total);
        this.logEvery = Math.max(1, logEvery);
    }

    /** Marks {@code key} as the query in flight; {@code index1Based} counts from 1. */
    public void setCurrent(String key, int index1Based) {
        currentKey.set(key == null ? "" : key);
        currentIndex.set(Math.max(0, index1Based));
    }

    public void startHeartbeat() {
        if (heartbeat != null) return;
        Thread t = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(HEARTBEAT_MS);
                    System.out.println("[HEARTBEAT] running... " + currentIndex.get() + "/" + total
                            + " last=" + currentKey.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "nl-sql-heartbeat");
        t.setDaemon(true);
        t.start();
        heartbeat = t;
    }

    public void stopHeartbeat() {
        if (heartbeat == null) return;
        heartbeat.interrupt();
        heartbeat = null;
    }

    /** Prints a {@code [PROGRESS]} line when {@code done} hits the interval or the end. */
    public void progress(int done, String tally) {
        if (done % logEvery != 0 && done != total) return;

        long elapsedMs = (System.nanoTime() - startNs) / 1_000_000L;
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        System.out.printf("[PROGRESS] %d/%d %s elapsed=%dms heap=%d/%dMB last=%s%n",
                done, total, tally, elapsedMs,
                heap.getUsed() / (1024 * 1024), heap.getMax() / (1024 * 1024), currentKey.get());
    }
}
