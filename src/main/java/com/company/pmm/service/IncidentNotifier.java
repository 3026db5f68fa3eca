package com.company.pmm.service;

import com.company.pmm.domain.Alert;
import com.company.pmm.domain.Signal;

/**
 * Bridge to the external incident management system. Implementations may block
 * or fail; they are only ever called from the async notification listener.
 */
public interface IncidentNotifier {

    void notifyAlert(Alert alert);

    void notifySignal(Signal signal);
}
