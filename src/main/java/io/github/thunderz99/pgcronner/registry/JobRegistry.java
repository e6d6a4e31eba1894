package io.github.thunderz99.pgcronner.registry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.github.thunderz99.pgcronner.DuplicateJobException;
import io.github.thunderz99.pgcronner.JobNotFoundException;
import io.github.thunderz99.pgcronner.JobValidationException;
import io.github.thunderz99.pgcronner.dto.JobDefinition;
import io.github.thunderz99.pgcronner.job.Job;
import io.github.thunderz99.pgcronner.job.JobBuilder;
import io.github.thunderz99.pgcronner.util.Checker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The local, authoritative mapping of job name to {@link Job}. Never talks to the database.
 *
 * <p>
 * Besides the jobs, the registry remembers every source tag it has held. Removing the last job of a tag does not
 * forget the tag, so that the next sync still lists and unschedules the remote copy.
 * </p>
 *
 * <p>
 * All methods are thread safe and never block on I/O.
 * </p>
 */
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, Job> jobs = new LinkedHashMap<>();

    private final Set<String> knownSources = new LinkedHashSet<>();

    public JobRegistry() {
    }

    /**
     * Seed the registry from a declarative manifest. Every entry is validated, and a malformed one fails the whole
     * construction.
     *
     * @param manifest     job id to definition
     * @param ownedSources extra source tags this registry owns even without a job using them
     * @throws JobValidationException if an entry is malformed
     * @throws DuplicateJobException  if two entries use the same job name
     */
    public JobRegistry(Map<String, JobDefinition> manifest, Collection<String> ownedSources) {
        Checker.checkNotNull(manifest, "manifest");
        Checker.checkNoNullElements(ownedSources, "ownedSources");

        knownSources.addAll(ownedSources);
        for (var entry : manifest.entrySet()) {
            Checker.checkNotNull(entry.getValue(), "manifest entry " + entry.getKey());
            add(JobBuilder.fromDefinition(entry.getValue()));
        }
        log.info("JobRegistry seeded with {} jobs. sources: {}", jobs.size(), knownSources);
    }

    /**
     * @return all jobs in insertion order
     */
    public synchronized List<Job> all() {
        return List.copyOf(jobs.values());
    }

    /**
     * @param name job name
     * @return the job
     * @throws JobNotFoundException if absent
     */
    public synchronized Job one(String name) {
        var job = jobs.get(name);
        if (job == null) {
            throw new JobNotFoundException(name);
        }
        return job;
    }

    public synchronized boolean contains(String name) {
        return jobs.containsKey(name);
    }

    /**
     * Add a job. This is a local check only, the database is not consulted.
     *
     * @param job a job built by {@link JobBuilder}
     * @throws DuplicateJobException if the name is already present. The existing entry stays unchanged.
     */
    public synchronized void add(Job job) {
        Checker.checkNotNull(job, "job");
        if (jobs.containsKey(job.getName())) {
            throw new DuplicateJobException(job.getName());
        }
        jobs.put(job.getName(), job);
        knownSources.add(job.getSource());
        log.debug("added job: {}", job);
    }

    /**
     * @param name job name
     * @return the removed job
     * @throws JobNotFoundException if absent
     */
    public synchronized Job remove(String name) {
        var removed = jobs.remove(name);
        if (removed == null) {
            throw new JobNotFoundException(name);
        }
        log.debug("removed job: {}", removed);
        return removed;
    }

    /**
     * Empty the registry. Source tags stay known.
     *
     * @return names removed, in insertion order
     */
    public synchronized Set<String> clear() {
        var names = new LinkedHashSet<>(jobs.keySet());
        jobs.clear();
        return names;
    }

    /**
     * Keep only the given names, drop every other job.
     *
     * @param names names to keep
     * @return names dropped, in insertion order
     */
    public synchronized Set<String> retainOnly(Collection<String> names) {
        Checker.checkNotNull(names, "names");
        var dropped = new LinkedHashSet<String>();
        for (var it = jobs.keySet().iterator(); it.hasNext(); ) {
            var name = it.next();
            if (!names.contains(name)) {
                it.remove();
                dropped.add(name);
            }
        }
        return dropped;
    }

    /**
     * Swap the whole content at once. Used by refresh.
     *
     * @param replacement jobs with unique names
     * @throws IllegalArgumentException if two jobs share a name. the registry is untouched in that case
     */
    public synchronized void replaceAll(List<Job> replacement) {
        Checker.checkNoNullElements(replacement, "replacement");

        var next = new LinkedHashMap<String, Job>();
        for (var job : replacement) {
            Checker.check(next.put(job.getName(), job) == null, "replacement should not contain duplicate name: " + job.getName());
        }

        jobs.clear();
        jobs.putAll(next);
        next.values().forEach(job -> knownSources.add(job.getSource()));
    }

    /**
     * @return every source tag this registry has held, in the order first seen
     */
    public synchronized Set<String> knownSources() {
        return new LinkedHashSet<>(knownSources);
    }

    public synchronized int size() {
        return jobs.size();
    }
}
