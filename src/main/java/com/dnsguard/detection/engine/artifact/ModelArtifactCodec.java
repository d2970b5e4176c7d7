package com.dnsguard.detection.engine.artifact;

import com.dnsguard.detection.engine.scoring.OutlierModel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads and writes {@link ModelArtifact}s as JSON. Reading always goes through
 * {@link ModelArtifactUpgrader}, so callers only ever see the current shape.
 */
@Component
public class ModelArtifactCodec {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactCodec.class);

    private final ObjectMapper objectMapper;

    public ModelArtifactCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /** Makes an additional {@link OutlierModel} implementation readable under {@code typeName}. */
    public void registerModelType(Class<? extends OutlierModel> modelClass, String typeName) {
        objectMapper.registerSubtypes(new NamedType(modelClass, typeName));
    }

    public void write(ModelArtifact artifact, OutputStream out) {
        if (artifact.getModel() == null || !artifact.getModel().isFitted()) {
            throw new ModelArtifactException("Refusing to write an artifact without a fitted model");
        }
        try {
            objectMapper.writeValue(out, artifact);
        } catch (IOException e) {
            throw new ModelArtifactException("Failed to write model artifact", e);
        }
    }

    public ModelArtifact read(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ModelArtifactException("Model artifact is not valid JSON", e);
        }

        JsonNode current = ModelArtifactUpgrader.upgrade(root, objectMapper);
        ModelArtifact artifact;
        try {
            artifact = objectMapper.treeToValue(current, ModelArtifact.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ModelArtifactException("Model artifact does not match schema version "
                    + ModelArtifact.CURRENT_SCHEMA_VERSION, e);
        }

        if (artifact.getModel() == null || !artifact.getModel().isFitted()) {
            throw new ModelArtifactException("Model artifact carries no fitted model");
        }
        log.debug("Read {} model artifact (schema v{})", artifact.getModel().modelType(), artifact.getSchemaVersion());
        return artifact;
    }

    public byte[] toBytes(ModelArtifact artifact) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(artifact, out);
        return out.toByteArray();
    }

    public ModelArtifact fromBytes(byte[] bytes) {
        return read(new ByteArrayInputStream(bytes));
    }
}
