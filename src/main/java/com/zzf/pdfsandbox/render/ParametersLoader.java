package com.zzf.pdfsandbox.render;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the template parameters document. Never throws: a missing, malformed or non-object document
 * yields an empty mapping.
 */
@Slf4j
public class ParametersLoader {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ParametersLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> load(Path paramsFile) {
        if (paramsFile == null || !Files.isRegularFile(paramsFile)) {
            log.debug("params.missing file={}", paramsFile);
            return Collections.emptyMap();
        }
        try {
            JsonNode root = objectMapper.readTree(paramsFile.toFile());
            if (root == null || !root.isObject()) {
                log.warn("params.invalid file={} reason=not_an_object", paramsFile.getFileName());
                return Collections.emptyMap();
            }
            Map<String, Object> params = objectMapper.convertValue(root, MAP_TYPE);
            log.debug("params.loaded count={}", params.size());
            return params;
        } catch (Exception e) {
            log.warn("params.invalid file={} err={}", paramsFile.getFileName(), e.getMessage());
            return Collections.emptyMap();
        }
    }
}
