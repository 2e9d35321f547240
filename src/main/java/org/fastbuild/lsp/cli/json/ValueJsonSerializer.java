package org.fastbuild.lsp.cli.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import org.fastbuild.lsp.evaluator.value.StructMember;
import org.fastbuild.lsp.evaluator.value.Value;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * Writes a {@link Value} as its plain JSON counterpart: Booleans, Integers and Strings as primitives,
 * Arrays as arrays and Structs as objects keyed by member name.
 */
public class ValueJsonSerializer implements JsonSerializer<Value> {

    @Override
    public JsonElement serialize(Value value, Type typeOfSrc, JsonSerializationContext context) {
        return toJson(value);
    }

    static JsonElement toJson(Value value) {
        if (value instanceof Value.Bool bool) {
            return new JsonPrimitive(bool.value());
        }
        if (value instanceof Value.Int integer) {
            return new JsonPrimitive(integer.value());
        }
        if (value instanceof Value.Str str) {
            return new JsonPrimitive(str.value());
        }
        if (value instanceof Value.Array array) {
            JsonArray items = new JsonArray();
            for (Value item : array.items()) {
                items.add(toJson(item));
            }
            return items;
        }
        JsonObject members = new JsonObject();
        for (Map.Entry<String, StructMember> member : ((Value.Struct) value).members().entrySet()) {
            members.add(member.getKey(), toJson(member.getValue().value()));
        }
        return members;
    }
}
