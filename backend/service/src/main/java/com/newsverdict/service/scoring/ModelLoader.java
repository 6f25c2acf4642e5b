package com.newsverdict.service.scoring;

import com.newsverdict.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ModelLoader {
    private ModelLoader() {
    }

    public static FabricationModel load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading model from " + path, e);
        }
    }

    public static FabricationModel loadResource(String resource) {
        try (InputStream in = ModelLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Model resource not found: " + resource);
            }
            return read(in);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading model from classpath:" + resource, e);
        }
    }

    private static FabricationModel read(InputStream in) throws IOException {
        return JsonUtils.objectMapper().readValue(in, ModelDefinition.class).toModel();
    }
}
