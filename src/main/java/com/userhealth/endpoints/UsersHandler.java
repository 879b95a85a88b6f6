package com.userhealth.endpoints;

import com.google.gson.JsonParseException;
import com.userhealth.user.domain.User;
import com.userhealth.user.endpoint.dto.CreateUserRequest;
import com.userhealth.user.endpoint.dto.UserDto;
import com.userhealth.user.service.UserService;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Handler for the /users endpoint.
 *
 * <p>Provides user management API operations:
 * <ul>
 *   <li><b>GET /users</b>: Lists all users in insertion order.</li>
 *   <li><b>POST /users</b>: Creates a user from {@code {"name","email"}}, answers 201.</li>
 *   <li><b>GET /users/{id}</b>: Gets a user, 404 if absent.</li>
 *   <li><b>DELETE /users/{id}</b>: Deletes a user, answers {@code {"deleted": id}}, 404 if absent.</li>
 * </ul>
 */
public class UsersHandler implements ApiHandler {
    private static final Logger log = LogManager.getLogger(UsersHandler.class);
    private static final String PATH = "/users";

    private final HttpEndpoint endpoint;
    private final UserService service;

    /**
     * Constructs a new UsersHandler.
     *
     * @param endpoint The parent HTTP endpoint for response utilities.
     * @param service  User service.
     */
    public UsersHandler(HttpEndpoint endpoint, UserService service) {
        this.endpoint = endpoint;
        this.service = Objects.requireNonNull(service, "service");
    }

    @Override
    public String getPath() {
        return PATH;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        String tail = path.length() > PATH.length() ? path.substring(PATH.length()) : "";
        log.debug("Handling /users: method={}, uri={}, remote={}",
                method, exchange.getRequestURI(), exchange.getRemoteAddress());

        try {
            if (tail.isEmpty() || "/".equals(tail)) {
                if ("GET".equalsIgnoreCase(method)) {
                    handleList(exchange);
                } else if ("POST".equalsIgnoreCase(method)) {
                    handleCreate(exchange);
                } else {
                    endpoint.sendError(exchange, 405, "MethodNotAllowed", "Method Not Allowed");
                }
                return;
            }

            // Only /users/{id} remains; anything deeper or not slash separated is unknown.
            if (!tail.startsWith("/") || tail.indexOf('/', 1) >= 0) {
                endpoint.sendError(exchange, 404, "NotFound", "Not Found");
                return;
            }

            long id = ApiEndpointUtils.parseId(tail.substring(1));
            if (id <= 0) {
                endpoint.sendError(exchange, 404, "NotFound", "User not found");
                return;
            }

            if ("GET".equalsIgnoreCase(method)) {
                handleGet(exchange, id);
            } else if ("DELETE".equalsIgnoreCase(method)) {
                handleDelete(exchange, id);
            } else {
                endpoint.sendError(exchange, 405, "MethodNotAllowed", "Method Not Allowed");
            }
        } catch (Exception e) {
            log.error("Error processing {} {}: {}", method, path, e.getMessage(), e);
            endpoint.sendError(exchange, 400, "BadRequest", "Request could not be processed");
        }
    }

    /**
     * Handles GET /users request.
     *
     * @param exchange HTTP exchange containing request and response.
     * @throws IOException If an I/O error occurs.
     */
    private void handleList(HttpExchange exchange) throws IOException {
        List<UserDto> users = service.list().stream()
                .map(UserDto::from)
                .toList();
        endpoint.sendJson(exchange, 200, users);
    }

    /**
     * Handles POST /users request.
     *
     * @param exchange HTTP exchange containing request and response.
     * @throws IOException If an I/O error occurs.
     */
    private void handleCreate(HttpExchange exchange) throws IOException {
        String body = ApiEndpointUtils.readBody(exchange.getRequestBody());

        CreateUserRequest request;
        try {
            request = CreateUserRequest.from(ApiEndpointUtils.parseJsonObject(body));
        } catch (JsonParseException e) {
            log.warn("Invalid JSON body on POST /users: {}", e.getMessage());
            endpoint.sendError(exchange, 400, "BadRequest", "Invalid JSON body");
            return;
        }

        try {
            User user = service.create(request.getName(), request.getEmail());
            endpoint.sendJson(exchange, 201, UserDto.from(user));
        } catch (UserService.ValidationException e) {
            endpoint.sendError(exchange, 400, "ValidationError", e.getMessage());
        }
    }

    /**
     * Handles GET /users/{id} request.
     *
     * @param exchange HTTP exchange containing request and response.
     * @param id       User id.
     * @throws IOException If an I/O error occurs.
     */
    private void handleGet(HttpExchange exchange, long id) throws IOException {
        try {
            endpoint.sendJson(exchange, 200, UserDto.from(service.get(id)));
        } catch (UserService.NotFoundException e) {
            endpoint.sendError(exchange, 404, "NotFound", e.getMessage());
        }
    }

    /**
     * Handles DELETE /users/{id} request.
     *
     * @param exchange HTTP exchange containing request and response.
     * @param id       User id.
     * @throws IOException If an I/O error occurs.
     */
    private void handleDelete(HttpExchange exchange, long id) throws IOException {
        try {
            service.delete(id);
            endpoint.sendJson(exchange, 200, Map.of("deleted", id));
        } catch (UserService.NotFoundException e) {
            endpoint.sendError(exchange, 404, "NotFound", e.getMessage());
        }
    }
}
