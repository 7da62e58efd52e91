package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import com.commandlab.engine.host.local.InMemoryEditorHost;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Replace the whole buffer of the active document; the file on disk is untouched. */
@Component
public class ReplaceActiveTextCommand implements HostCommand {

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "editor.replaceActiveText", "editor", "edit", "Replace Active Text",
            "Replace the text of the active editor document.",
            RiskTier.MODERATE,
            List.of(ContextRequirement.ACTIVE_EDITOR),
            List.of(ParameterSpec.required("text", ParameterType.STRING)));

    private final InMemoryEditorHost editor;

    public ReplaceActiveTextCommand(InMemoryEditorHost editor) {
        this.editor = editor;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        String uri = editor.getActiveDocument()
                .orElseThrow(() -> new IllegalStateException("No active editor"));
        Object text = WorkspacePaths.arg(args, 0);
        String previous = editor.getDocumentText(uri);
        editor.replaceDocumentText(uri, text == null ? "" : text.toString());
        return Map.of("uri", uri, "previousLength", previous.length());
    }
}
