package com.dnsguard.detection.engine.artifact;

import com.dnsguard.detection.model.BaselineCalibration;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings any known artifact layout up to {@link ModelArtifact#CURRENT_SCHEMA_VERSION}.
 *
 * Layouts:
 *   v0  a bare model object (carries only the model's "type" discriminator)
 *   v1  {model, baselineScores: [raw...] | {min,max,mean,std}, thresholdSuspicious, thresholdHigh}
 *   v2  {schemaVersion: 2, model, baseline: {min,max,mean,std}, thresholds: {suspicious, high}, ...}
 */
final class ModelArtifactUpgrader {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactUpgrader.class);

    private ModelArtifactUpgrader() {}

    static ObjectNode upgrade(JsonNode root, ObjectMapper mapper) {
        if (root == null || !root.isObject()) {
            throw new ModelArtifactException("Model artifact must be a JSON object");
        }
        ObjectNode node = (ObjectNode) root;
        int version = detectVersion(node);

        if (version > ModelArtifact.CURRENT_SCHEMA_VERSION) {
            throw new ModelArtifactException("Unsupported model artifact schema version " + version
                    + " (newest supported: " + ModelArtifact.CURRENT_SCHEMA_VERSION + ")");
        }
        if (version == 0) {
            node = fromV0(node, mapper);
            version = 1;
        }
        if (version == 1) {
            node = fromV1(node, mapper);
        }
        return node;
    }

    static int detectVersion(ObjectNode node) {
        if (node.has("schemaVersion")) {
            return node.get("schemaVersion").asInt();
        }
        if (node.has("model")) {
            return 1;
        }
        if (node.has("type")) {
            return 0;
        }
        throw new ModelArtifactException("Unrecognised model artifact: no schemaVersion, model or type field");
    }

    private static ObjectNode fromV0(ObjectNode bareModel, ObjectMapper mapper) {
        ObjectNode v1 = mapper.createObjectNode();
        v1.put("schemaVersion", 1);
        v1.set("model", bareModel);
        log.info("Wrapped bare model artifact into schema version 1");
        return v1;
    }

    private static ObjectNode fromV1(ObjectNode v1, ObjectMapper mapper) {
        ObjectNode v2 = mapper.createObjectNode();
        v2.put("schemaVersion", 2);
        v2.set("model", v1.get("model"));

        JsonNode baseline = v1.get("baselineScores");
        if (baseline != null && baseline.isArray()) {
            ArrayNode raw = (ArrayNode) baseline;
            if (raw.isEmpty()) {
                log.warn("Legacy artifact has an empty baseline array; loading without calibration");
            } else {
                double[] scores = new double[raw.size()];
                for (int i = 0; i < scores.length; i++) {
                    scores[i] = raw.get(i).asDouble();
                }
                v2.set("baseline", mapper.valueToTree(BaselineCalibration.fromScores(scores)));
                log.info("Converted legacy baseline array ({} scores) to summary statistics", scores.length);
            }
        } else if (baseline != null && baseline.isObject()) {
            v2.set("baseline", baseline);
        }

        JsonNode suspicious = v1.get("thresholdSuspicious");
        JsonNode high = v1.get("thresholdHigh");
        if (suspicious != null && suspicious.isNumber() && high != null && high.isNumber()) {
            ObjectNode thresholds = mapper.createObjectNode();
            thresholds.put("suspicious", suspicious.asDouble());
            thresholds.put("high", high.asDouble());
            v2.set("thresholds", thresholds);
        }

        JsonNode samples = v1.get("trainingSamples");
        if (samples != null && samples.isNumber()) {
            v2.put("trainingSamples", samples.asInt());
        }
        return v2;
    }
}
