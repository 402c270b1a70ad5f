package com.prettyprinter.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.prettyprinter.ast.Program;
import com.prettyprinter.util.LoggerUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Reads {@link Program} trees from JSON or YAML documents.
 *
 * <p>Every node object names its variant in a {@code node} property, for example
 * {@code {"node": "Ident", "pos": 9, "name": "main"}}. Enum values (tokens, channel
 * directions) are written by constant name.
 */
public class AstDocumentReader {
    private static final Logger logger = LoggerUtil.getLogger(AstDocumentReader.class);

    public enum Format {
        JSON,
        YAML
    }

    private final ObjectMapper jsonMapper = _configure(new ObjectMapper());
    private final ObjectMapper yamlMapper = _configure(new ObjectMapper(new YAMLFactory()));

    /**
     * Reads the document at {@code path}; the format is chosen by file extension.
     */
    public Program read(Path path) throws AstDocumentException {
        Format format = formatOf(path);
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AstDocumentException(path, "Failed to read AST document: " + e.getMessage(), e);
        }
        return read(path, content, format);
    }

    /**
     * Parses already loaded document content. {@code path} only names the document in errors.
     */
    public Program read(Path path, String content, Format format) throws AstDocumentException {
        if (content == null || content.isBlank()) {
            throw new AstDocumentException(path, "AST document is empty");
        }

        ObjectMapper mapper = format == Format.YAML ? yamlMapper : jsonMapper;
        Program program;
        try {
            program = mapper.readValue(content, Program.class);
        } catch (JsonProcessingException e) {
            throw new AstDocumentException(path, "Invalid AST document: " + e.getOriginalMessage(), e);
        }

        if (program == null || program.name() == null) {
            throw new AstDocumentException(path, "AST document has no package name");
        }

        logger.fine(() -> "Read package " + program.name().name() + " from " + path + " ("
                + program.declarations().size() + " declarations, "
                + program.comments().size() + " comments)");
        return program;
    }

    /**
     * Determines the document format from the file extension.
     *
     * @throws AstDocumentException if the extension is neither JSON nor YAML
     */
    public static Format formatOf(Path path) throws AstDocumentException {
        String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) {
            return Format.JSON;
        }
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) {
            return Format.YAML;
        }
        throw new AstDocumentException(path, "Unsupported AST document type: " + fileName);
    }

    private static ObjectMapper _configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }
}
