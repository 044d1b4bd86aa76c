package visualwatch.scheduler;

/**
 * Unit of work driven by a {@link TaskScheduler}. A thrown exception counts
 * as a failed run and lengthens the delay before the next one.
 */
@FunctionalInterface
public interface ScheduledTask {

    void run() throws Exception;
}
