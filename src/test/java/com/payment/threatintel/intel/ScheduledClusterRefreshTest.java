package com.payment.threatintel.intel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledClusterRefreshTest {

    @Mock
    private RebuildCoordinator rebuildCoordinator;

    @InjectMocks
    private ScheduledClusterRefresh refresh;

    @Test
    void nightlyRefreshForcesRebuild() {
        when(rebuildCoordinator.forceRebuild()).thenReturn(RebuildSummary.skipped());

        refresh.refresh();

        verify(rebuildCoordinator).forceRebuild();
    }
}
