package org.fastbuild.lsp.cli.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.fastbuild.lsp.evaluator.api.EvaluationResult;
import org.fastbuild.lsp.evaluator.api.SourceException;
import org.fastbuild.lsp.evaluator.value.Value;

/**
 * Renders an {@link EvaluationResult} as pretty-printed JSON: the recorded data plus an {@code error}
 * member when evaluation stopped early.
 */
public final class EvaluationResultJson {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeHierarchyAdapter(Value.class, new ValueJsonSerializer())
            .setPrettyPrinting()
            .create();

    private EvaluationResultJson() {}

    public static String toJson(EvaluationResult result) {
        JsonObject root = new JsonObject();
        root.add("data", GSON.toJsonTree(result.getData()));
        if (result.getError().isPresent()) {
            SourceException error = result.getError().get();
            JsonObject errorJson = new JsonObject();
            errorJson.addProperty("kind", error.getKind());
            errorJson.addProperty("message", error.getMessage());
            errorJson.add("range", GSON.toJsonTree(error.getRange()));
            root.add("error", errorJson);
        }
        return GSON.toJson(root);
    }
}
