package de.mirkosertic.filevault.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import de.mirkosertic.filevault.indexsync.IndexSyncException;
import de.mirkosertic.filevault.indexsync.SyncRequest;
import de.mirkosertic.filevault.model.Account;
import de.mirkosertic.filevault.task.IndexRebuildTask;
import de.mirkosertic.filevault.task.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * {@code POST /api/v1/admin/index/rebuild/}: run index reconciliation for an administrator.
 * <p>
 * Body: {@code {"mode": "audit", "user_id": null, "dry_run": false, "force": false}}, all optional.
 * Callers are authenticated and checked for admin rights before the engine is touched.
 */
public class IndexRebuildHandler implements HttpHandler {

    private static final Logger logger = LoggerFactory.getLogger(IndexRebuildHandler.class);

    private final ApiKeyAuthenticator authenticator;
    private final IndexRebuildTask rebuildTask;
    private final ObjectMapper objectMapper;

    public IndexRebuildHandler(final ApiKeyAuthenticator authenticator, final IndexRebuildTask rebuildTask,
                               final ObjectMapper objectMapper) {
        this.authenticator = authenticator;
        this.rebuildTask = rebuildTask;
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(final HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                send(exchange, 405, ApiError.of("METHOD_NOT_ALLOWED",
                        "Method " + exchange.getRequestMethod() + " not allowed"));
                return;
            }

            // Step 1: Authenticate and authorize before anything else
            final Optional<Account> account = authenticator.authenticate(
                    exchange.getRequestHeaders().getFirst("Authorization"));
            if (account.isEmpty()) {
                send(exchange, 401, ApiError.of("NOT_AUTHENTICATED", "Valid API key required"));
                return;
            }
            if (!account.get().admin()) {
                logger.warn("Index rebuild denied for non-admin user {}", account.get().username());
                send(exchange, 403, ApiError.of("PERMISSION_DENIED", "Administrator access required"));
                return;
            }

            // Step 2: Parse and validate the request
            final SyncRequest request;
            try {
                request = parseRequest(exchange);
                request.checkForce();
            } catch (final IndexSyncException e) {
                send(exchange, 400, ApiError.of(e.getCode().name(), e.getMessage(), e.getAllowed()));
                return;
            } catch (final InvalidRequestException | JsonProcessingException e) {
                send(exchange, 400, ApiError.of("INVALID_REQUEST", e.getMessage()));
                return;
            }

            // Step 3: Run
            logger.info("Index rebuild requested by {}: mode={}, scope={}, dryRun={}",
                    account.get().username(), request.mode(), request.describeScope(), request.dryRun());
            final TaskResult result = rebuildTask.run(request);
            send(exchange, 200, RebuildResponse.from(result));

        } catch (final Exception e) {
            logger.error("Index rebuild request failed", e);
            send(exchange, 500, ApiError.of("INTERNAL_ERROR", "Index rebuild failed: " + e.getMessage()));
        } finally {
            exchange.close();
        }
    }

    private SyncRequest parseRequest(final HttpExchange exchange)
            throws IOException, IndexSyncException, InvalidRequestException {
        final JsonNode body;
        try (final InputStream in = exchange.getRequestBody()) {
            final byte[] bytes = in.readAllBytes();
            body = bytes.length == 0 ? NullNode.getInstance() : objectMapper.readTree(bytes);
        }
        if (!body.isNull() && !body.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }

        final String mode = body.path("mode").isNull() || body.path("mode").isMissingNode()
                ? "audit"
                : body.path("mode").asText();
        final Long userId = parseUserId(body.path("user_id"));
        final boolean dryRun = body.path("dry_run").asBoolean(false);
        final boolean force = body.path("force").asBoolean(false);
        return SyncRequest.of(mode, userId, dryRun, force);
    }

    private static Long parseUserId(final JsonNode node) throws InvalidRequestException {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (final NumberFormatException e) {
                throw new InvalidRequestException("user_id must be an integer");
            }
        }
        throw new InvalidRequestException("user_id must be an integer");
    }

    private void send(final HttpExchange exchange, final int status, final Object body) throws IOException {
        final byte[] json = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, json.length);
        try (final OutputStream out = exchange.getResponseBody()) {
            out.write(json);
        }
    }

    static final class InvalidRequestException extends Exception {
        InvalidRequestException(final String message) {
            super(message);
        }
    }
}
