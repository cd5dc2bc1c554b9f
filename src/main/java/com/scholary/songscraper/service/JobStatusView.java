package com.scholary.songscraper.service;

import com.scholary.songscraper.job.JobSnapshot;
import com.scholary.songscraper.progress.PhaseProgressView;
import java.util.List;

/** A job together with the progress of each of its phases. */
public record JobStatusView(JobSnapshot job, List<PhaseProgressView> phases) {}
