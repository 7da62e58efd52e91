package com.commandlab.engine.api;

import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.CommandRegistry;
import com.commandlab.engine.command.RiskTier;
import com.commandlab.engine.execution.CommandExecutionException;
import com.commandlab.engine.execution.CommandExecutor;
import com.commandlab.engine.execution.ExecutionContext;
import com.commandlab.engine.execution.ExecutionError;
import com.commandlab.engine.execution.ExecutionResult;
import com.commandlab.engine.execution.ExecutionState;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for ExecutionController; the executor is a mock.
 */
@WebMvcTest(ExecutionController.class)
class ExecutionControllerTest {

    static final CommandDescriptor DELETE = new CommandDescriptor(
            "workspace.deleteFile", "workspace", "file", "Delete File", "Delete.",
            RiskTier.DESTRUCTIVE, List.of(), null);

    @Autowired MockMvc mockMvc;
    @MockitoBean CommandRegistry registry;
    @MockitoBean CommandExecutor executor;

    @Test
    void execute_buildsContextFromRequest() throws Exception {
        when(registry.find(DELETE.id())).thenReturn(Optional.of(DELETE));
        Instant now = Instant.now();
        when(executor.execute(any(), anyBoolean(), any())).thenReturn(ExecutionResult.succeeded(
                DELETE.id(), Map.of("path", "a.txt"), now, now.plusMillis(12), Map.of("deleted", true), List.of(), "snapshot_1_1"));

        mockMvc.perform(post("/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"commandId":"workspace.deleteFile","parameters":{"path":"a.txt"},
                                 "timeoutMs":500,"createSnapshot":true,"confirmed":true,"notes":"cleanup"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.durationMs").value(12))
                .andExpect(jsonPath("$.snapshotId").value("snapshot_1_1"))
                .andExpect(jsonPath("$.returnValue.deleted").value(true));

        ArgumentCaptor<ExecutionContext> ctx = ArgumentCaptor.forClass(ExecutionContext.class);
        verify(executor).execute(ctx.capture(), eq(true), eq("cleanup"));
        assertThat(ctx.getValue().timeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(ctx.getValue().createSnapshot()).isTrue();
        assertThat(ctx.getValue().confirmed()).isTrue();
        assertThat(ctx.getValue().parameters()).containsEntry("path", "a.txt");
    }

    @Test
    void execute_failedAttempt_isStill200WithError() throws Exception {
        when(registry.find(DELETE.id())).thenReturn(Optional.of(DELETE));
        Instant now = Instant.now();
        when(executor.execute(any(), anyBoolean(), any())).thenReturn(ExecutionResult.failed(
                DELETE.id(), Map.of(), now, now,
                ExecutionError.from(CommandExecutionException.Kind.CONFIRMATION_REQUIRED,
                        new CommandExecutionException(CommandExecutionException.Kind.CONFIRMATION_REQUIRED,
                                "Destructive commands require explicit confirmation")),
                List.of(), null));

        mockMvc.perform(post("/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"commandId":"workspace.deleteFile"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("CONFIRMATION_REQUIRED"))
                .andExpect(jsonPath("$.error.recoverable").value(false));
    }

    @Test
    void execute_unknownCommand_returns404() throws Exception {
        when(registry.find("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"commandId":"nope"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void execute_missingCommandId_returns400() throws Exception {
        mockMvc.perform(post("/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void state_reportsCurrentPhase() throws Exception {
        when(executor.currentState()).thenReturn(ExecutionState.INVOKING);

        mockMvc.perform(get("/executions/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("INVOKING"));
    }
}
