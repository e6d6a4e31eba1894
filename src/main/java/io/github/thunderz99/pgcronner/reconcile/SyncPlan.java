package io.github.thunderz99.pgcronner.reconcile;

import java.util.ArrayList;
import java.util.List;

import io.github.thunderz99.pgcronner.dto.SyncResult;
import io.github.thunderz99.pgcronner.job.Job;
import io.github.thunderz99.pgcronner.job.JobState;

/**
 * The diff between the registry and the jobs pg_cron holds under the registry's source tags.
 */
public class SyncPlan {

    /**
     * In the registry, not scheduled
     */
    public List<Job> toCreate = new ArrayList<>();

    /**
     * In the registry and scheduled with another definition (or scheduled more than once)
     */
    public List<Job> toUpdate = new ArrayList<>();

    /**
     * Scheduled under a known source tag, not in the registry
     */
    public List<String> toRemove = new ArrayList<>();

    /**
     * Same definition on both sides
     */
    public List<String> unchanged = new ArrayList<>();

    /**
     * @param name job name
     * @return where the name stands between the registry and pg_cron
     */
    public JobState stateOf(String name) {
        if (containsName(toCreate, name)) {
            return JobState.PENDING_CREATE;
        }
        if (containsName(toUpdate, name)) {
            return JobState.PENDING_UPDATE;
        }
        if (toRemove.contains(name)) {
            return JobState.PENDING_REMOVAL;
        }
        if (unchanged.contains(name)) {
            return JobState.SCHEDULED;
        }
        return JobState.ABSENT;
    }

    /**
     * @return true if a sync would not touch pg_cron
     */
    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toRemove.isEmpty();
    }

    /**
     * Express the plan as names per kind of change, the shape a sync reports.
     *
     * @return names per set
     */
    public SyncResult toResult() {
        var ret = new SyncResult();
        toCreate.forEach(job -> ret.created.add(job.getName()));
        toUpdate.forEach(job -> ret.updated.add(job.getName()));
        ret.removed.addAll(toRemove);
        ret.unchanged.addAll(unchanged);
        return ret;
    }

    static boolean containsName(List<Job> jobs, String name) {
        return jobs.stream().anyMatch(job -> job.getName().equals(name));
    }

    @Override
    public String toString() {
        return toResult().toString();
    }
}
