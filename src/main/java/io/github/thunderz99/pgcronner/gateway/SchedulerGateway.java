package io.github.thunderz99.pgcronner.gateway;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import io.github.thunderz99.pgcronner.GatewayException;
import io.github.thunderz99.pgcronner.dto.RemoteEntry;
import io.github.thunderz99.pgcronner.job.Job;

/**
 * The operations used to read and write the remote job table. Every call takes the time it may spend.
 */
public interface SchedulerGateway {

    /**
     * List the scheduled jobs owned by one of the given source tags.
     *
     * @param sources source tags. an empty set lists nothing
     * @param timeout max time for the call
     * @return entries ordered by job id. names may repeat
     * @throws GatewayException if the database failed
     */
    List<RemoteEntry> list(Set<String> sources, Duration timeout) throws GatewayException;

    /**
     * Schedule a job and record its source tag.
     *
     * @param job     a validated job
     * @param timeout max time for the call
     * @return the scheduled entry
     * @throws GatewayException if pg_cron rejects the job, or the name is scheduled by a foreign owner(409)
     */
    RemoteEntry schedule(Job job, Duration timeout) throws GatewayException;

    /**
     * Unschedule a job by name and forget its source tag.
     *
     * @param name    job name
     * @param timeout max time for the call
     * @return true if a job was unscheduled, false if it was not scheduled
     * @throws GatewayException if the removal failed
     */
    boolean unschedule(String name, Duration timeout) throws GatewayException;
}
