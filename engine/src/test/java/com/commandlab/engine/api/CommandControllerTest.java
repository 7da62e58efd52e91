package com.commandlab.engine.api;

import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.CommandRegistry;
import com.commandlab.engine.command.ContextRequirement;
import com.commandlab.engine.command.ParameterSpec;
import com.commandlab.engine.command.ParameterType;
import com.commandlab.engine.command.RiskTier;
import com.commandlab.engine.validation.ParameterValidator;
import com.commandlab.engine.validation.ValidationCode;
import com.commandlab.engine.validation.ValidationIssue;
import com.commandlab.engine.validation.ValidationOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for CommandController; registry and validator are mocks.
 */
@WebMvcTest(CommandController.class)
class CommandControllerTest {

    static final CommandDescriptor WRITE = new CommandDescriptor(
            "workspace.writeFile", "workspace", "file", "Write File", "Write text.",
            RiskTier.MODERATE, List.of(ContextRequirement.OPEN_WORKSPACE),
            List.of(ParameterSpec.required("path", ParameterType.URI),
                    ParameterSpec.required("content", ParameterType.STRING)));

    static final CommandDescriptor OPAQUE = new CommandDescriptor(
            "host.opaque", "host", null, "Opaque", "No signature.", RiskTier.SAFE, List.of(), null);

    @Autowired MockMvc mockMvc;
    @MockitoBean CommandRegistry    registry;
    @MockitoBean ParameterValidator validator;

    @Test
    void list_returnsDescriptorsWithTypeNames() throws Exception {
        when(registry.descriptors()).thenReturn(List.of(OPAQUE, WRITE));

        mockMvc.perform(get("/commands"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].id").value("workspace.writeFile"))
                .andExpect(jsonPath("$[1].riskTier").value("MODERATE"))
                .andExpect(jsonPath("$[1].signature[0].type").value("uri"))
                .andExpect(jsonPath("$[1].contextRequirements[0]").value("OPEN_WORKSPACE"));
    }

    @Test
    void get_unknownCommand_returns404() throws Exception {
        when(registry.find("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/commands/{id}", "nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void validate_returnsErrorsAndWarnings() throws Exception {
        when(registry.find(WRITE.id())).thenReturn(Optional.of(WRITE));
        when(validator.validate(any(), anyMap())).thenReturn(new ValidationOutcome(false,
                List.of(new ValidationIssue("content", ValidationCode.REQUIRED_PARAMETER_MISSING,
                        "Required parameter 'content' is missing", "Provide a value of type 'string'")),
                List.of(), Map.of()));

        mockMvc.perform(post("/commands/{id}/validate", WRITE.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"parameters":{"path":"a.txt"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0].code").value("REQUIRED_PARAMETER_MISSING"));
    }

    @Test
    void validate_commandWithoutSignature_isAlwaysValid() throws Exception {
        when(registry.find(OPAQUE.id())).thenReturn(Optional.of(OPAQUE));

        mockMvc.perform(post("/commands/{id}/validate", OPAQUE.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"parameters":{"anything":1}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.coercedValues.anything").value(1));
        verifyNoInteractions(validator);
    }
}
