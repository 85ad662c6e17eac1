package org.example.aipacs.service;

import org.example.aipacs.exception.ArchiveRejectedException;
import org.example.aipacs.exception.TransportException;

public interface DeliverySender {
    /**
     * Sends a stored report to the archive. Returns normally once the archive accepted it.
     */
    void deliver(String reportId) throws TransportException, ArchiveRejectedException;
}
