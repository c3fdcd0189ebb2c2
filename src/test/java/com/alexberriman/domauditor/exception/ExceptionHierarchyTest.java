package com.alexberriman.domauditor.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void domAuditorExceptionShouldIncludeMessage() {
        DomAuditorException ex = new DomAuditorException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void domAuditorExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        DomAuditorException ex = new DomAuditorException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void concurrencyExceptionKeepsMessageVerbatim() {
        ConcurrencyException ex = new ConcurrencyException("Task b failed", "b",
                ConcurrencyException.Kind.TASK_FAILED);

        assertThat(ex.getMessage()).isEqualTo("Task b failed");
        assertThat(ex.getTaskId()).isEqualTo("b");
        assertThat(ex.getKind()).isEqualTo(ConcurrencyException.Kind.TASK_FAILED);
        assertThat(ex).isInstanceOf(DomAuditorException.class);
    }

    @Test
    void concurrencyExceptionShouldIncludeCause() {
        IOException cause = new IOException("navigation failed");
        ConcurrencyException ex = new ConcurrencyException("Failed to execute tasks concurrently", null,
                ConcurrencyException.Kind.BATCH_FAILED, cause);

        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getTaskId()).isNull();
    }
}
