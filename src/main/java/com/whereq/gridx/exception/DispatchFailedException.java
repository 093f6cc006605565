package com.whereq.gridx.exception;

import com.whereq.gridx.executor.DispatchResult;
import lombok.Getter;

/**
 * Carries a failed dispatch outcome out of a job's execution function so the
 * job manager can record it
 */
@Getter
public class DispatchFailedException extends GridxException {

    private final DispatchResult result;

    public DispatchFailedException(DispatchResult result) {
        super(result.describeFailure());
        this.result = result;
    }
}
