package com.whereq.dispatch.poll;

import com.whereq.dispatch.model.JobId;
import com.whereq.dispatch.model.StatusSnapshot;

/**
 * Single status read used by {@link PollLoop}
 */
@FunctionalInterface
public interface StatusSource {
    StatusSnapshot fetch(JobId id);
}
