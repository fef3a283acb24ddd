package org.javai.jobguard.poll;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JobStateTest {

    @Test
    void exactlyOneTerminalSuccess() {
        assertThat(JobState.values()).filteredOn(JobState::isSuccess).containsExactly(JobState.COMPLETED);
    }

    @Test
    void terminalFailures() {
        assertThat(JobState.values()).filteredOn(JobState::isFailure)
                .containsExactly(JobState.FAILED, JobState.ABORTED, JobState.EXPIRED);
    }

    @Test
    void pendingAndRunning_areNotTerminal() {
        assertThat(JobState.PENDING.isTerminal()).isFalse();
        assertThat(JobState.RUNNING.isTerminal()).isFalse();
        assertThat(JobState.COMPLETED.isTerminal()).isTrue();
        assertThat(JobState.EXPIRED.isTerminal()).isTrue();
    }

    @Test
    void fromProviderStatus_mapsBackupAndRestoreStatuses() {
        assertThat(JobState.fromProviderStatus("CREATED")).isEqualTo(JobState.PENDING);
        assertThat(JobState.fromProviderStatus("pending")).isEqualTo(JobState.PENDING);
        assertThat(JobState.fromProviderStatus("RUNNING")).isEqualTo(JobState.RUNNING);
        assertThat(JobState.fromProviderStatus("ABORTING")).isEqualTo(JobState.RUNNING);
        assertThat(JobState.fromProviderStatus(" Completed ")).isEqualTo(JobState.COMPLETED);
        assertThat(JobState.fromProviderStatus("PARTIAL")).isEqualTo(JobState.FAILED);
        assertThat(JobState.fromProviderStatus("ABORTED")).isEqualTo(JobState.ABORTED);
        assertThat(JobState.fromProviderStatus("EXPIRED")).isEqualTo(JobState.EXPIRED);
    }

    @Test
    void fromProviderStatus_rejectsUnknownStatus() {
        assertThatThrownBy(() -> JobState.fromProviderStatus("HIBERNATING"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("HIBERNATING");
    }
}
