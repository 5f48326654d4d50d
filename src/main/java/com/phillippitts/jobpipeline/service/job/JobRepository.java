package com.phillippitts.jobpipeline.service.job;

import com.phillippitts.jobpipeline.domain.Job;
import com.phillippitts.jobpipeline.domain.JobState;
import com.phillippitts.jobpipeline.exception.StoreUnavailableException;
import com.phillippitts.jobpipeline.store.CoordinationStore;
import com.phillippitts.jobpipeline.store.StoreKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Job records in the coordination store.
 *
 * <p>Every method propagates {@link StoreUnavailableException}; job bookkeeping never
 * fails open.
 */
@Repository
public class JobRepository {

    private static final Logger LOG = LogManager.getLogger(JobRepository.class);

    private final CoordinationStore store;
    private final JobRecordMapper mapper;
    private final Clock clock;

    public JobRepository(CoordinationStore store, JobRecordMapper mapper, Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Writes a new record and registers it in the job index and its owner's index.
     */
    public void create(Job job) {
        store.setHash(StoreKeys.job(job.id()), mapper.toFields(job), null);
        store.addToSet(StoreKeys.JOB_INDEX, job.id());
        store.addToSet(StoreKeys.ownerIndex(job.ownerId()), job.id());
    }

    /**
     * @return the job, or empty if unknown. A record that cannot be decoded is logged and
     *         reported as empty.
     */
    public Optional<Job> find(String jobId) {
        return store.getHash(StoreKeys.job(jobId)).flatMap(fields -> {
            try {
                return Optional.of(mapper.fromFields(fields));
            } catch (IllegalStateException | IllegalArgumentException e) {
                LOG.error("Unreadable job record {}", jobId, e);
                return Optional.empty();
            }
        });
    }

    /**
     * Applies {@code update} only if the job is currently in {@code expected}.
     *
     * @return true if the update was written
     */
    public boolean transition(String jobId, JobState expected, JobUpdate update) {
        return store.compareAndSetHash(StoreKeys.job(jobId), JobRecordMapper.STATE, expected.name(),
                mapper.toFields(update, clock.instant()));
    }

    /**
     * Jobs submitted by {@code ownerId}. Index entries whose record is gone are pruned.
     */
    public List<Job> findByOwner(String ownerId) {
        String ownerIndex = StoreKeys.ownerIndex(ownerId);
        List<Job> jobs = new ArrayList<>();
        for (String jobId : store.members(ownerIndex)) {
            Optional<Job> job = find(jobId);
            if (job.isPresent()) {
                jobs.add(job.get());
            } else {
                store.removeFromSet(ownerIndex, jobId);
            }
        }
        return jobs;
    }

    /**
     * Removes the record and its index entries.
     *
     * @return true if a record was removed
     */
    public boolean delete(Job job) {
        boolean removed = delete(job.id());
        store.removeFromSet(StoreKeys.ownerIndex(job.ownerId()), job.id());
        return removed;
    }

    /**
     * Removes a record whose owner is unknown, e.g. one that cannot be decoded. Its owner
     * index entry is pruned on the owner's next listing.
     *
     * @return true if a record was removed
     */
    public boolean delete(String jobId) {
        boolean removed = store.delete(StoreKeys.job(jobId));
        store.removeFromSet(StoreKeys.JOB_INDEX, jobId);
        return removed;
    }

    public Set<String> allIds() {
        return store.members(StoreKeys.JOB_INDEX);
    }
}
