package dumb.obligato.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;

import static dumb.obligato.util.Log.error;

public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static String str(Object obj) {
        try {
            return the.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            error("Error serializing object to JSON: " + e.getMessage());
            return "{}";
        }
    }

    public static JsonNode node(Object obj) {
        try {
            return the.valueToTree(obj);
        } catch (IllegalArgumentException e) {
            error("Error converting object to JsonNode: " + e.getMessage());
            return the.createObjectNode();
        }
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(InputStream json, Class<T> valueType) throws IOException {
        return the.readValue(json, valueType);
    }

    public static ObjectNode node() {
        return the.createObjectNode();
    }

    public static ArrayNode array() {
        return the.createArrayNode();
    }
}
