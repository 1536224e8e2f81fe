package com.arpwatch.services;

import com.arpwatch.models.Job;

import io.vertx.core.Future;

import java.time.Instant;

import java.util.List;

/**
 * JobService - Monitoring job persistence

 * This interface provides:
 * - Job CRUD, whitelist included (stored in job_whitelist)
 * - Scheduler queries (non-manual jobs, next run updates)
 * - Startup recovery of jobs left running by a crash
 */
public interface JobService
{

    // ========================================
    // JOB MANAGEMENT OPERATIONS
    // ========================================

    /**
     * Insert a job and its whitelist.
     *
     * @param job job to create; id and timestamps are assigned by the store
     * @return Future containing the stored job
     */
    Future<Job> jobCreate(Job job);

    /**
     * Update a job's configuration and replace its whitelist.
     *
     * @param job job with id set
     * @return Future containing the stored job, failed with JobNotFoundException if absent
     */
    Future<Job> jobUpdate(Job job);

    /**
     * Delete a job. Whitelist, runs, known devices, history and notifications cascade.
     *
     * @param jobId job id
     * @return Future containing true if a row was deleted
     */
    Future<Boolean> jobDelete(String jobId);

    /**
     * @param jobId job id
     * @return Future containing the job with its whitelist, or null if absent
     */
    Future<Job> jobGetById(String jobId);

    Future<List<Job>> jobList();

    // ========================================
    // SCHEDULER OPERATIONS
    // ========================================

    /**
     * List jobs whose schedule is not manual, whatever their status.
     * FILTER: schedule <> 'manual'
     *
     * @return Future containing jobs
     */
    Future<List<Job>> jobListScheduled();

    /**
     * Persist the next due timestamp of a job.
     *
     * @param jobId job id
     * @param nextRun next due time, or null to clear it
     * @return Future completing when stored
     */
    Future<Void> jobUpdateNextRun(String jobId, Instant nextRun);

    /**
     * Flip every job left in status running back to active.
     *
     * @return Future containing the number of jobs reset
     */
    Future<Integer> jobResetStaleRunning();

}
