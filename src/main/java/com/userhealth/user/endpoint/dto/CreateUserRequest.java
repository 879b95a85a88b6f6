package com.userhealth.user.endpoint.dto;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Request payload for user creation.
 *
 * <p>Fields that are absent or not JSON strings are read as null.
 */
public class CreateUserRequest {
    private final String name;
    private final String email;

    public CreateUserRequest(String name, String email) {
        this.name = name;
        this.email = email;
    }

    /**
     * Builds a request from a parsed JSON object.
     *
     * @param json JSON object, may be null for an empty body.
     * @return CreateUserRequest.
     */
    public static CreateUserRequest from(JsonObject json) {
        if (json == null) {
            return new CreateUserRequest(null, null);
        }
        return new CreateUserRequest(stringField(json, "name"), stringField(json, "email"));
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    private static String stringField(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }
        return element.getAsString();
    }
}
