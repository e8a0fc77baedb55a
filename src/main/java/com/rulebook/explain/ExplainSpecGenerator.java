package com.rulebook.explain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rulebook.compiler.CompilationResult;
import com.rulebook.compiler.CompiledEntity;
import com.rulebook.compiler.CompiledField;
import com.rulebook.exception.RulebookException;
import com.rulebook.graph.ProvenanceGraph;
import com.rulebook.graph.TemplateHasher;
import com.rulebook.schema.EntitySchema;
import com.rulebook.schema.Field;
import com.rulebook.schema.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link ExplainSpec} of a compiled rulebook.
 * <p>
 * Entities without calculated fields are left out. A field whose graph failed to build
 * gets an error template; the rest of the document is still produced.
 */
public class ExplainSpecGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExplainSpecGenerator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public ExplainSpec generate(CompilationResult compilation) {
        Map<String, ExplainSpec.EntityExplanation> entities = new LinkedHashMap<>();
        for (CompiledEntity entity : compilation.entities().values()) {
            if (entity.fields().isEmpty()) {
                continue;
            }
            entities.put(entity.name(), explain(entity));
        }

        ExplainSpec.RulebookInfo rulebook = new ExplainSpec.RulebookInfo(
                compilation.rulebook().name(),
                TemplateHasher.documentHash(compilation.rulebook().document()));
        log.info("Generated explain spec for {}: {} entities", rulebook.name(), entities.size());
        return new ExplainSpec(ExplainSpec.SCHEMA_VERSION, rulebook, ExplainSpec.Semantics.DEFAULT, entities);
    }

    public String toJson(ExplainSpec spec) {
        try {
            return MAPPER.writeValueAsString(spec);
        } catch (JsonProcessingException e) {
            throw new RulebookException("Failed to serialize explain spec", e);
        }
    }

    public void write(ExplainSpec spec, Path path) {
        try {
            Files.writeString(path, toJson(spec));
        } catch (IOException e) {
            throw new RulebookException("Failed to write explain spec: " + path, e);
        }
        log.info("Wrote explain spec to {}", path);
    }

    private ExplainSpec.EntityExplanation explain(CompiledEntity entity) {
        EntitySchema schema = entity.schema();
        String idField = schema.idField().map(Field::name).orElse(null);

        Map<String, ExplainSpec.FieldInfo> fields = new LinkedHashMap<>();
        for (Field field : schema.fields()) {
            fields.put(field.name(), new ExplainSpec.FieldInfo(
                    field.datatype().rulebookName(), field.nullable(), field.kind().rulebookName()));
        }

        // templates follow schema order, like the fields map
        Map<String, ExplainSpec.ExpressionTemplate> templates = new LinkedHashMap<>();
        for (Field field : schema.calculatedFields()) {
            CompiledField compiled = entity.fields().get(field.name());
            templates.put(field.name(), template(field, compiled));
        }

        return new ExplainSpec.EntityExplanation(
                idField,
                idField == null ? null : Identifiers.toSnakeCase(idField),
                fields,
                entity.levels().calcOrder(),
                entity.levels().dependencyEdges(),
                templates);
    }

    private ExplainSpec.ExpressionTemplate template(Field field, CompiledField compiled) {
        if (compiled != null && compiled.graph().isSuccess()) {
            ProvenanceGraph graph = compiled.graph().orElseThrow();
            return new ExplainSpec.ExpressionTemplate(field.formula(), graph.templateHash(), null,
                    graph.rootNode(), graph.nodes(), graph.edges());
        }
        String error = compiled == null
                ? "Field was not compiled"
                : compiled.graph().getError().map(e -> e.message()).orElse("Unknown error");
        log.warn("Failed to build template for {}: {}", field.name(), error);
        return new ExplainSpec.ExpressionTemplate(field.formula(), ExplainSpec.ExpressionTemplate.ERROR_HASH,
                error, null, Map.of(), List.of());
    }
}
