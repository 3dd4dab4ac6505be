package tech.compendium.pipeline.job.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.job.dto.JobFilter;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.repository.JobRepository;

import java.util.Collection;
import java.util.List;

@ApplicationScoped
public class JobQueryService {

    private static final Logger LOG = Logger.getLogger(JobQueryService.class);

    @Inject
    JobRepository jobRepository;

    public List<Job> list(JobFilter filter) {
        return jobRepository.findWithFilter(filter != null ? filter : JobFilter.all());
    }

    public Job get(String jobId) {
        return jobRepository.findById(jobId)
            .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Delete a job. Messages already queued for it are dropped by the workers.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public void delete(String jobId) {
        if (!jobRepository.deleteById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        LOG.infof("Deleted job [%s]", jobId);
    }

    /**
     * Delete every listed job that exists; unknown IDs are ignored.
     *
     * @return the number of jobs deleted
     */
    public int deleteAll(Collection<String> jobIds) {
        int deleted = jobRepository.deleteAll(jobIds);
        LOG.infof("Deleted %d of %d requested jobs", deleted, jobIds.size());
        return deleted;
    }
}
