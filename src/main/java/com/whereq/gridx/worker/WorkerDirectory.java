package com.whereq.gridx.worker;

import com.whereq.gridx.model.Worker;

import java.util.List;

/**
 * Source of known workers. Implementations are read on every registry
 * refresh; the returned order is the registration order.
 */
public interface WorkerDirectory {

    List<Worker> loadWorkers();
}
