package com.whereq.gridx.executor;

import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.exception.DispatchFailedException;
import com.whereq.gridx.exception.NoEligibleWorkerException;
import com.whereq.gridx.model.ExecutionJob;
import com.whereq.gridx.model.JobResult;
import com.whereq.gridx.model.WorkerHealth;
import com.whereq.gridx.worker.WorkerSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Runs a job's Python code on a worker agent.
 * Blocks the calling pool thread for the duration of the remote call.
 */
@Slf4j
@Service
public class RemoteJobExecutor implements JobExecutor {

    private final ExecDispatcher dispatcher;
    private final WorkerSelector selector;
    private final GridxProperties.DispatchConfig config;

    public RemoteJobExecutor(ExecDispatcher dispatcher, WorkerSelector selector, GridxProperties properties) {
        this.dispatcher = dispatcher;
        this.selector = selector;
        this.config = properties.getDispatch();
    }

    @Override
    public JobResult execute(ExecutionJob job) throws Exception {
        Duration timeout = job.getTimeout() != null ? job.getTimeout() : config.getMaxTimeout();
        String command = pythonCommand(job.getCode());

        DispatchResult result;
        String worker = job.getWorker();
        if (worker == null) {
            WorkerHealth best = selector.selectBest().block();
            if (best == null) {
                throw new NoEligibleWorkerException();
            }
            job.resolveWorker(best.getName());
            job.recordWorkerLoad(best.getStatus().cpuLoad(), best.getStatus().memoryLoad());
            log.info("Job {} assigned to worker {}", job.getJobId(), best.getName());
            if (job.isCancellationRequested()) {
                throw new CancellationException("Job " + job.getJobId() + " cancelled before dispatch");
            }
            DispatchResult dispatched = dispatcher.dispatch(best.getWorker(), command, timeout).block();
            result = dispatched != null ? dispatched.asAutoSelected() : null;
        } else {
            result = dispatcher.dispatch(worker, command, timeout).block();
        }

        if (result == null) {
            throw new IllegalStateException("Dispatch for job " + job.getJobId() + " produced no result");
        }
        if (!result.isSuccess()) {
            throw new DispatchFailedException(result);
        }
        return result.toJobResult();
    }

    /**
     * Shell command running {@code code} with the configured interpreter
     */
    public String pythonCommand(String code) {
        return config.getPythonBinary() + " -c " + shellQuote(code);
    }

    static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
