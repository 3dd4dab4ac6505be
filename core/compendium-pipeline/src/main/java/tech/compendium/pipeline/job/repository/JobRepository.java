package tech.compendium.pipeline.job.repository;

import tech.compendium.pipeline.job.dto.JobFilter;
import tech.compendium.pipeline.job.entity.Job;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository interface for Job entities.
 *
 * Every write validates the job invariants; a job that violates them is never stored.
 */
public interface JobRepository {

    // Read operations
    Optional<Job> findById(String id);
    List<Job> findWithFilter(JobFilter filter);
    long count();

    // Write operations

    /**
     * Store a new job.
     *
     * @throws IllegalStateException if a job with the same ID exists or the job violates its invariants
     */
    Job insert(Job job);

    /**
     * Atomically replace a job with the result of {@code change}. The change sees the latest
     * stored version; exceptions it throws abort the update and propagate to the caller.
     *
     * @return the stored job, or empty if no job has the given ID
     */
    Optional<Job> update(String id, UnaryOperator<Job> change);

    boolean deleteById(String id);

    /**
     * @return the number of jobs removed
     */
    int deleteAll(Collection<String> ids);
}
