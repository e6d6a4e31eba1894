package io.github.thunderz99.pgcronner.reconcile;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import io.github.thunderz99.pgcronner.GatewayException;
import io.github.thunderz99.pgcronner.JobValidationException;
import io.github.thunderz99.pgcronner.SyncException;
import io.github.thunderz99.pgcronner.dto.ClearResult;
import io.github.thunderz99.pgcronner.dto.RefreshResult;
import io.github.thunderz99.pgcronner.dto.RemoteEntry;
import io.github.thunderz99.pgcronner.dto.SyncResult;
import io.github.thunderz99.pgcronner.gateway.SchedulerGateway;
import io.github.thunderz99.pgcronner.job.Job;
import io.github.thunderz99.pgcronner.job.JobBuilder;
import io.github.thunderz99.pgcronner.registry.JobRegistry;
import io.github.thunderz99.pgcronner.util.Checker;
import io.github.thunderz99.pgcronner.util.CronUtil;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles the {@link JobRegistry} with pg_cron.
 *
 * <ul>
 *     <li>sync: make pg_cron match the registry</li>
 *     <li>refresh: make the registry match pg_cron</li>
 *     <li>clear: unschedule and drop every owned job</li>
 * </ul>
 *
 * <p>
 * Only remote entries whose source tag the registry knows are ever listed, so entries of other owners are never
 * touched. sync and clear run under the {@link SyncLock}. The diff is always recomputed from the live remote table, so
 * running sync again after a partial failure converges.
 * </p>
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    final JobRegistry registry;

    final SchedulerGateway gateway;

    final SyncLock lock;

    final Duration defaultTimeout;

    public ReconciliationEngine(JobRegistry registry, SchedulerGateway gateway, SyncLock lock, Duration defaultTimeout) {
        this.registry = Checker.checkNotNull(registry, "registry");
        this.gateway = Checker.checkNotNull(gateway, "gateway");
        this.lock = Checker.checkNotNull(lock, "lock");
        this.defaultTimeout = Checker.checkPositive(defaultTimeout, "defaultTimeout");
    }

    public SyncResult sync() {
        return sync(defaultTimeout);
    }

    /**
     * Make pg_cron match the registry: unschedule removed and changed jobs, then schedule new and changed jobs.
     *
     * @param timeout max time for the whole sync, lock acquisition included
     * @return names created / updated / removed / unchanged
     * @throws SyncException if a step failed. the registry is untouched, pg_cron may be partially applied
     */
    public SyncResult sync(Duration timeout) {
        Checker.checkPositive(timeout, "timeout");
        var deadline = Deadline.after(timeout);

        SyncPlan plan = null;
        try (var held = lock.acquire(deadline.remaining("acquiring sync lock"))) {
            plan = plan(deadline);
            if (log.isDebugEnabled()) {
                log.debug("sync plan: toCreate:{}, toUpdate:{}, toRemove:{}", plan.toCreate, plan.toUpdate, plan.toRemove);
            }
            var result = apply(plan, deadline);
            log.info("sync finished. {}", result);
            return result;
        } catch (GatewayException e) {
            // nothing was applied if the lock or the listing failed
            var pending = plan == null ? new SyncResult() : plan.toResult();
            log.warn("sync failed before applying any change. statusCode:{}, message:{}", e.getStatusCode(), e.getMessage());
            throw new SyncException("sync", e, new SyncResult(), pending);
        }
    }

    /**
     * Compute what a sync would do, without the lock and without changing anything.
     *
     * @param timeout max time for listing the remote jobs
     * @return the diff
     * @throws GatewayException if listing failed
     */
    public SyncPlan plan(Duration timeout) {
        Checker.checkPositive(timeout, "timeout");
        return plan(Deadline.after(timeout));
    }

    public SyncPlan plan() {
        return plan(defaultTimeout);
    }

    SyncPlan plan(Deadline deadline) {
        var local = registry.all();
        var remote = gateway.list(registry.knownSources(), deadline.remaining("listing remote jobs"));
        return diff(local, remote);
    }

    /**
     * Compare by name. A name listed more than once remotely is collapsed: updated if registered, removed otherwise.
     *
     * @param local  registry jobs
     * @param remote owned remote entries
     * @return the diff
     */
    static SyncPlan diff(List<Job> local, List<RemoteEntry> remote) {
        var remoteByName = new LinkedHashMap<String, List<RemoteEntry>>();
        for (var entry : remote) {
            remoteByName.computeIfAbsent(entry.name, k -> new ArrayList<>()).add(entry);
        }

        var plan = new SyncPlan();
        var localNames = new LinkedHashSet<String>();
        for (var job : local) {
            localNames.add(job.getName());
            var entries = remoteByName.get(job.getName());
            if (entries == null) {
                plan.toCreate.add(job);
            } else if (entries.size() > 1 || !sameDefinition(job, entries.get(0))) {
                plan.toUpdate.add(job);
            } else {
                plan.unchanged.add(job.getName());
            }
        }

        for (var name : remoteByName.keySet()) {
            if (!localNames.contains(name)) {
                plan.toRemove.add(name);
            }
        }
        return plan;
    }

    /**
     * pg_cron keeps schedule and command as given, but whitespace may differ after a manual edit.
     */
    static boolean sameDefinition(Job job, RemoteEntry entry) {
        return Objects.equals(CronUtil.normalize(job.getSchedule()), CronUtil.normalize(entry.schedule))
                && Objects.equals(StringUtils.trim(job.getCommand()), StringUtils.trim(entry.command))
                && Objects.equals(job.getSource(), entry.source);
    }

    /**
     * unschedule (toRemove + toUpdate), then schedule (toCreate + toUpdate). Aborts on the first failure.
     */
    SyncResult apply(SyncPlan plan, Deadline deadline) {
        var completed = new SyncResult();
        var unscheduledUpdates = new LinkedHashSet<String>();
        try {
            for (var name : plan.toRemove) {
                gateway.unschedule(name, deadline.remaining("unscheduling " + name));
                completed.removed.add(name);
            }
            for (var job : plan.toUpdate) {
                gateway.unschedule(job.getName(), deadline.remaining("unscheduling " + job.getName()));
                unscheduledUpdates.add(job.getName());
            }
            for (var job : plan.toCreate) {
                gateway.schedule(job, deadline.remaining("scheduling " + job.getName()));
                completed.created.add(job.getName());
            }
            for (var job : plan.toUpdate) {
                gateway.schedule(job, deadline.remaining("scheduling " + job.getName()));
                completed.updated.add(job.getName());
            }
        } catch (GatewayException e) {
            var pending = plan.toResult();
            pending.removed.removeAll(completed.removed);
            pending.created.removeAll(completed.created);
            pending.updated.removeAll(completed.updated);
            pending.unchanged.clear();

            completed.unchanged.addAll(plan.unchanged);
            log.warn("sync aborted. completed:{}, pending:{}, unscheduled updates not yet rescheduled:{}, message:{}",
                    completed, pending, unscheduledUpdates.size() - completed.updated.size(), e.getMessage());
            throw new SyncException("sync", e, completed, pending);
        }
        completed.unchanged.addAll(plan.unchanged);
        return completed;
    }

    public RefreshResult refresh() {
        return refresh(defaultTimeout);
    }

    /**
     * Overwrite the registry with the jobs pg_cron holds under the known source tags. Malformed rows and repeated
     * names are skipped and reported.
     *
     * @param timeout max time for listing the remote jobs
     * @return loaded and skipped entries
     * @throws GatewayException if listing failed. the registry is untouched
     */
    public RefreshResult refresh(Duration timeout) {
        Checker.checkPositive(timeout, "timeout");
        var remote = gateway.list(registry.knownSources(), timeout);

        var result = new RefreshResult();
        var jobs = new LinkedHashMap<String, Job>();
        for (var entry : remote) {
            if (jobs.containsKey(entry.name)) {
                skip(result, entry, "duplicate name, keeping jobId of the first entry");
                continue;
            }
            try {
                jobs.put(entry.name, JobBuilder.fromRemote(entry));
            } catch (JobValidationException e) {
                skip(result, entry, e.getMessage());
            }
        }

        registry.replaceAll(List.copyOf(jobs.values()));
        result.loaded.addAll(jobs.keySet());
        log.info("refresh finished. {}", result);
        return result;
    }

    static void skip(RefreshResult result, RemoteEntry entry, String reason) {
        log.warn("refresh skipped remote job '{}'(jobId:{}): {}", entry.name, entry.jobId, reason);
        result.skipped.add(new RefreshResult.Skipped(entry.jobId, entry.name, reason));
    }

    public ClearResult clear() {
        return clear(defaultTimeout);
    }

    /**
     * Unschedule every job pg_cron holds under the known source tags, then empty the registry.
     *
     * @param timeout max time for the whole clear, lock acquisition included
     * @return names unscheduled and names dropped from the registry
     * @throws SyncException if a step failed. names still scheduled stay in the registry
     */
    public ClearResult clear(Duration timeout) {
        Checker.checkPositive(timeout, "timeout");
        var deadline = Deadline.after(timeout);

        var completed = new SyncResult();
        var owned = new LinkedHashSet<String>();
        try (var held = lock.acquire(deadline.remaining("acquiring sync lock"))) {
            for (var entry : gateway.list(registry.knownSources(), deadline.remaining("listing remote jobs"))) {
                owned.add(entry.name);
            }

            for (var name : owned) {
                gateway.unschedule(name, deadline.remaining("unscheduling " + name));
                completed.removed.add(name);
            }

            var result = new ClearResult();
            result.unscheduled.addAll(completed.removed);
            result.dropped.addAll(registry.clear());
            log.info("clear finished. {}", result);
            return result;

        } catch (GatewayException e) {
            var stillScheduled = new LinkedHashSet<>(owned);
            completed.removed.forEach(stillScheduled::remove);

            // keep the bookkeeping of what may still be scheduled. an unlisted registry is kept whole
            if (!owned.isEmpty()) {
                registry.retainOnly(stillScheduled);
            }

            var pending = new SyncResult();
            pending.removed.addAll(stillScheduled);
            log.warn("clear aborted. unscheduled:{}, still scheduled:{}, message:{}", completed.removed, stillScheduled, e.getMessage());
            throw new SyncException("clear", e, completed, pending);
        }
    }

    public JobRegistry getRegistry() {
        return registry;
    }
}
