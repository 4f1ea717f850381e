package com.sentinel.core.persist;

import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanSnapshot;

import java.io.IOException;

/**
 * Durable mirror of a scan's events, findings and terminal status.
 * The in-memory scan state stays authoritative; a failing implementation never affects a running scan.
 */
public interface ScanPersistence {

    void appendEvent(EventRecord event) throws IOException;

    void appendFinding(String scanId, Finding finding) throws IOException;

    void writeStatus(ScanSnapshot snapshot) throws IOException;

    /**
     * Persistence that stores nothing.
     */
    static ScanPersistence noOp() {
        return new ScanPersistence() {
            @Override
            public void appendEvent(EventRecord event) {
            }

            @Override
            public void appendFinding(String scanId, Finding finding) {
            }

            @Override
            public void writeStatus(ScanSnapshot snapshot) {
            }
        };
    }
}
