package tech.compendium.pipeline.job.repository;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.job.dto.JobFilter;
import tech.compendium.pipeline.job.dto.SortOrder;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.statemachine.JobInvariants;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local job store.
 *
 * <p>Updates run inside {@link ConcurrentHashMap#computeIfPresent}, so transitions of one job
 * are serialized while different jobs update in parallel. Each stored change bumps the
 * job's version.
 */
@ApplicationScoped
public class InMemoryJobRepository implements JobRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryJobRepository.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<Job> findWithFilter(JobFilter filter) {
        Comparator<Job> order = switch (filter.sortBy()) {
            case DATE -> Comparator.comparing(Job::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()));
            case STATUS -> Comparator.comparing((Job job) -> job.status().getValue());
            case NAME -> Comparator.comparing(InMemoryJobRepository::displayName, String.CASE_INSENSITIVE_ORDER);
        };
        if (filter.sortOrder() == SortOrder.DESC) {
            order = order.reversed();
        }
        // Ties keep ID order, which follows creation time
        order = order.thenComparing(Job::id);

        return jobs.values().stream()
            .filter(job -> filter.status() == null || job.status() == filter.status())
            .sorted(order)
            .toList();
    }

    private static String displayName(Job job) {
        return job.deckName() != null ? job.deckName() : job.fileName();
    }

    @Override
    public long count() {
        return jobs.size();
    }

    @Override
    public Job insert(Job job) {
        JobInvariants.validate(job);
        Job stored = job.withVersion(1);
        if (jobs.putIfAbsent(job.id(), stored) != null) {
            throw new IllegalStateException("Job already exists: " + job.id());
        }
        LOG.debugf("Inserted job [%s]", job.id());
        return stored;
    }

    @Override
    public Optional<Job> update(String id, UnaryOperator<Job> change) {
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, current) -> {
            Job updated = change.apply(current);
            if (updated == current) {
                return current;
            }
            if (!key.equals(updated.id())) {
                throw new IllegalStateException("Job update changed the ID of " + key + " to " + updated.id());
            }
            JobInvariants.validate(updated);
            return updated.withVersion(current.version() + 1);
        }));
    }

    @Override
    public boolean deleteById(String id) {
        boolean removed = jobs.remove(id) != null;
        if (removed) {
            LOG.debugf("Deleted job [%s]", id);
        }
        return removed;
    }

    @Override
    public int deleteAll(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (deleteById(id)) {
                removed++;
            }
        }
        return removed;
    }
}
