package com.screenir.compiler.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.screenir.compiler.detection.DetectionResult;
import com.screenir.compiler.exception.DesignDocumentException;
import com.screenir.compiler.ir.SemanticType;
import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.CornerRadius;
import com.screenir.compiler.model.raw.Padding;
import com.screenir.compiler.normalize.SafeAreaInsets;
import com.screenir.compiler.styles.DesignTokens;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes compiler output (screen IR, detection hints, token mappings) as
 * indented JSON. Absent values are omitted. Map entries keep their insertion order,
 * so equal input gives byte-identical output on every platform ({@code \n} line ends).
 */
public class ScreenIrWriter {

    private static final Logger log = LoggerFactory.getLogger(ScreenIrWriter.class);

    static final String LINE_SEPARATOR = "\n";

    private final ObjectMapper objectMapper;

    public ScreenIrWriter() {
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setDefaultPrettyPrinter(new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", LINE_SEPARATOR)));
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.addMixIn(BoundingBox.class, BoundingBoxMixin.class);
        mapper.addMixIn(Padding.class, ZeroCheckMixin.class);
        mapper.addMixIn(SafeAreaInsets.class, ZeroCheckMixin.class);
        mapper.addMixIn(CornerRadius.class, CornerRadiusMixin.class);
        mapper.addMixIn(LayoutMeta.class, LayoutMetaMixin.class);
        mapper.addMixIn(DesignTokens.class, EmptyCheckMixin.class);
        mapper.addMixIn(DetectionResult.class, EmptyCheckMixin.class);
        mapper.addMixIn(SemanticType.class, SemanticTypeMixin.class);
        return mapper;
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DesignDocumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public void write(Path file, Object value) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, toJson(value) + LINE_SEPARATOR);
            log.debug("Wrote {}", file);
        } catch (IOException e) {
            throw new DesignDocumentException("Cannot write " + file, e);
        }
    }

    @JsonIgnoreProperties({"right", "bottom", "area"})
    private abstract static class BoundingBoxMixin {
    }

    @JsonIgnoreProperties({"zero"})
    private abstract static class ZeroCheckMixin {
    }

    @JsonIgnoreProperties({"zero", "uniform"})
    private abstract static class CornerRadiusMixin {
    }

    @JsonIgnoreProperties({"scrollable"})
    private abstract static class LayoutMetaMixin {
    }

    @JsonIgnoreProperties({"empty"})
    private abstract static class EmptyCheckMixin {
    }

    private abstract static class SemanticTypeMixin {
        @JsonValue
        abstract String getDisplayName();
    }
}
