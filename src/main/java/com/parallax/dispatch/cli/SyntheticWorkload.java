package com.parallax.dispatch.cli;

import com.parallax.core.model.TaskHandler;

/**
 * CPU-bound handler used by the CLI: burns a number of iterations proportional to the
 * task's cost and returns a checksum, or throws for tasks marked to fail.
 */
public class SyntheticWorkload implements TaskHandler<SyntheticWorkload.Unit, Long> {

    /** Iterations burned per unit of cost. */
    static final long ITERATIONS_PER_COST = 200_000L;

    /**
     * One synthetic task.
     *
     * @param index position in the submitted sequence
     * @param cost  amount of work, in cost units
     * @param fail  whether the task throws instead of returning
     */
    public record Unit(int index, double cost, boolean fail) {}

    @Override
    public Long execute(Unit unit) {
        long iterations = Math.max(1L, (long) (unit.cost() * ITERATIONS_PER_COST));
        long acc = unit.index() + 1L;
        for (long i = 0; i < iterations; i++) {
            acc = acc * 6364136223846793005L + 1442695040888963407L;
        }
        if (unit.fail()) {
            throw new IllegalStateException("synthetic failure of task " + unit.index());
        }
        return acc;
    }
}
