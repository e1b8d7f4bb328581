package com.scrapouille.dashboard.batch.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationControllerTest {

    @Test
    void onlyTheFirstCancelReportsTheTransition() {
        CancellationController cancellation = new CancellationController();
        assertFalse(cancellation.isCancelled());

        assertTrue(cancellation.cancel());
        assertFalse(cancellation.cancel());
        assertTrue(cancellation.isCancelled());
    }
}
