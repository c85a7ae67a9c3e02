package com.example.mesh.common.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class ServiceLauncherTest {

  @Test
  void fatalOutcomeMapsToNonZeroExitCode() {
    final BootstrapOutcome outcome =
        BootstrapOutcome.fatal(BootstrapState.LISTENER_BOUND, new IOException("refused"));

    assertThat(ServiceLauncher.exitCodeFor(outcome)).isEqualTo(ServiceLauncher.EXIT_FATAL);
  }

  @Test
  void stoppedOutcomeMapsToZeroExitCode() {
    assertThat(ServiceLauncher.exitCodeFor(BootstrapOutcome.stopped()))
        .isEqualTo(ServiceLauncher.EXIT_OK);
  }

  @Test
  void serveRunsOrchestratorAndReturnsItsExitCode() {
    final BootstrapOrchestrator orchestrator = mock(BootstrapOrchestrator.class);
    when(orchestrator.run())
        .thenReturn(BootstrapOutcome.fatal(BootstrapState.DB_CONNECTING, null));

    assertThat(ServiceLauncher.serve(orchestrator)).isEqualTo(ServiceLauncher.EXIT_FATAL);
  }
}
