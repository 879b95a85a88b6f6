package com.userhealth.endpoints;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Utility methods shared across API endpoint handlers.
 *
 * <p>Provides request body reading, JSON parsing and path segment parsing.
 */
public final class ApiEndpointUtils {
    private static final Logger log = LogManager.getLogger(ApiEndpointUtils.class);

    /**
     * Shared Gson instance for response serialization.
     */
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private ApiEndpointUtils() {
        // Utility class - prevent instantiation.
    }

    /**
     * Returns the shared Gson instance.
     *
     * @return Gson instance.
     */
    public static Gson getGson() {
        return GSON;
    }

    /**
     * Reads the full request body into a string using UTF-8 encoding.
     *
     * @param is Input stream of the request body.
     * @return String content of the request body.
     * @throws IOException If an I/O error occurs while reading.
     */
    public static String readBody(InputStream is) throws IOException {
        try (is) {
            String s = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Read request body ({} bytes)", s.getBytes(StandardCharsets.UTF_8).length);
            return s;
        }
    }

    /**
     * Parses a request body as a JSON object.
     * <p>Parsing is strict: unquoted names or values, single quotes and trailing content are rejected.
     *
     * @param body Request body.
     * @return JsonObject, or null for a blank body.
     * @throws JsonParseException If the body is not valid JSON or not a JSON object.
     */
    public static JsonObject parseJsonObject(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonElement element;
        try {
            JsonReader reader = new JsonReader(new StringReader(body));
            reader.setStrictness(Strictness.STRICT);
            element = GSON.getAdapter(JsonElement.class).read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonParseException("Unexpected content after JSON value");
            }
        } catch (IOException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("Expected a JSON object");
        }
        return element.getAsJsonObject();
    }

    /**
     * Parses a positive numeric id path segment.
     *
     * @param segment Path segment.
     * @return Id, or -1 if the segment is not a positive decimal number that fits a long.
     */
    public static long parseId(String segment) {
        if (segment == null || segment.isEmpty() || segment.length() > 19) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            long id = Long.parseLong(segment);
            return id > 0 ? id : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
