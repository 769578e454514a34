package com.agentkernel.recovery;

/**
 * A periodic maintenance pass run at the start of every scheduler tick.
 */
public interface HousekeepingJob {

    String name();

    /**
     * @return number of tasks or instances the pass acted on
     */
    int run();

    /**
     * A job that runs {@code action} and reports nothing handled.
     */
    static HousekeepingJob of(String name, Runnable action) {
        return new HousekeepingJob() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public int run() {
                action.run();
                return 0;
            }
        };
    }
}
