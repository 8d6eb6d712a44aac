package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.discovery.model.DiscoveryRunState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryRunTest {

    @Test
    void movesForwardThroughLifecycle() {
        DiscoveryRun run = new DiscoveryRun("run-1");
        assertThat(run.state()).isEqualTo(DiscoveryRunState.IDLE);

        run.startCollecting();
        run.startEnriching();
        run.complete();

        assertThat(run.state()).isEqualTo(DiscoveryRunState.COMPLETED);
    }

    @Test
    void rejectsBackwardAndSkippedTransitions() {
        DiscoveryRun run = new DiscoveryRun("run-2");
        assertThatThrownBy(run::startEnriching).isInstanceOf(IllegalStateException.class);

        run.startCollecting();
        run.startEnriching();
        assertThatThrownBy(run::startCollecting).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finishedRunCannotFail() {
        DiscoveryRun run = new DiscoveryRun("run-3");
        run.startCollecting();
        run.fail();

        assertThat(run.state()).isEqualTo(DiscoveryRunState.FAILED);
        assertThatThrownBy(run::fail).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(run::startEnriching).isInstanceOf(IllegalStateException.class);
    }
}
