package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.Selection;
import com.commandlab.engine.host.local.InMemoryEditorHost;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Open a workspace file in the editor and make it the active document. */
@Component
public class OpenDocumentCommand implements HostCommand {

    private static final Map<String, String> LANGUAGES = Map.of(
            "java", "java",
            "md", "markdown",
            "json", "json",
            "ts", "typescript",
            "js", "javascript",
            "py", "python",
            "yml", "yaml",
            "yaml", "yaml",
            "xml", "xml");

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "editor.openDocument", "editor", "document", "Open Document",
            "Open a workspace file in the editor and focus it.",
            RiskTier.SAFE,
            List.of(ContextRequirement.OPEN_WORKSPACE),
            List.of(ParameterSpec.required("path", ParameterType.URI),
                    ParameterSpec.optional("languageId", ParameterType.STRING)));

    private final WorkspacePaths     paths;
    private final InMemoryEditorHost editor;

    public OpenDocumentCommand(WorkspacePaths paths, InMemoryEditorHost editor) {
        this.paths  = paths;
        this.editor = editor;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        Path file = paths.resolve(WorkspacePaths.arg(args, 0));
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File not found: " + paths.relative(file));
        }
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + paths.relative(file), e);
        }
        Object language = WorkspacePaths.arg(args, 1);
        String uri = file.toUri().toString();
        DocumentInfo info = editor.openDocument(uri,
                language != null ? language.toString() : guessLanguage(file), text);
        editor.showDocument(uri, Selection.cursorAtStart());
        return info;
    }

    static String guessLanguage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "plaintext" : LANGUAGES.getOrDefault(name.substring(dot + 1).toLowerCase(), "plaintext");
    }
}
