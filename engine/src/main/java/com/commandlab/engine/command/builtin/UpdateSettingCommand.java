package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import com.commandlab.engine.host.local.InMemoryEditorHost;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class UpdateSettingCommand implements HostCommand {

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "settings.update", "settings", "configuration", "Update Setting",
            "Set a host configuration value.",
            RiskTier.MODERATE,
            List.of(),
            List.of(ParameterSpec.required("key", ParameterType.STRING),
                    ParameterSpec.required("value", ParameterType.parse("string|number|boolean"))));

    private final InMemoryEditorHost editor;

    public UpdateSettingCommand(InMemoryEditorHost editor) {
        this.editor = editor;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        Object key = WorkspacePaths.arg(args, 0);
        if (key == null || key.toString().isBlank()) {
            throw new IllegalArgumentException("invalid parameter: setting key is required");
        }
        Object value = WorkspacePaths.arg(args, 1);
        Object previous = editor.getSetting(key.toString()).orElse(null);
        editor.updateSetting(key.toString(), value);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("key", key.toString());
        result.put("previous", previous);
        result.put("value", value);
        return result;
    }
}
