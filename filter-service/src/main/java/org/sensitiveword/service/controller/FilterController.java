package org.sensitiveword.service.controller;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.sensitiveword.core.registry.RebuildResult;
import org.sensitiveword.core.service.CheckResult;
import org.sensitiveword.core.service.FilterResult;
import org.sensitiveword.core.service.SensitiveWordService;
import org.sensitiveword.service.model.RebuildResponse;
import org.sensitiveword.service.model.StatusResponse;
import org.sensitiveword.service.model.TextRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

public class FilterController {
	private static final Logger logger = LoggerFactory.getLogger(FilterController.class);
	private static final Gson gson = new GsonBuilder()
			.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
			.serializeNulls()
			.create();
	private final SensitiveWordService sensitiveWordService;

	public FilterController(SensitiveWordService sensitiveWordService) {
		this.sensitiveWordService = sensitiveWordService;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/status", this::handleStatus);

		app.post("/check", this::handleCheck);

		app.post("/filter", this::handleFilter);

		app.post("/rebuild", this::handleRebuild);

		logger.info("Filter routes registered");
	}

	/**
	 * GET /health
	 * Health check endpoint
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "sensitive-word-filter");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /status
	 * Service state and active matcher statistics
	 */
	private void handleStatus(Context ctx) {
		try {
			StatusResponse response = StatusResponse.running(sensitiveWordService.getStats());
			ctx.status(200).result(gson.toJson(response));
		} catch (Exception e) {
			respondError(ctx, 500, "Failed to retrieve status: " + e.getMessage());
			logger.error("Failed to get status", e);
		}
	}

	/**
	 * POST /check
	 * Report whether the text contains sensitive words and which ones
	 */
	private void handleCheck(Context ctx) {
		String text = readText(ctx);
		if (text == null) {
			return;
		}

		try {
			CheckResult result = sensitiveWordService.check(text);
			ctx.status(200).result(gson.toJson(result));
			logger.debug("Check request: {} chars, {} matches", text.length(), result.words().size());
		} catch (Exception e) {
			respondError(ctx, 500, "Check failed: " + e.getMessage());
			logger.error("Check failed", e);
		}
	}

	/**
	 * POST /filter
	 * Return the text with sensitive words masked
	 */
	private void handleFilter(Context ctx) {
		String text = readText(ctx);
		if (text == null) {
			return;
		}

		try {
			FilterResult result = sensitiveWordService.filter(text);
			ctx.status(200).result(gson.toJson(result));
			logger.debug("Filter request: {} chars", text.length());
		} catch (Exception e) {
			respondError(ctx, 500, "Filter failed: " + e.getMessage());
			logger.error("Filter failed", e);
		}
	}

	/**
	 * POST /rebuild
	 * Reload the dictionary and swap in a freshly built matcher
	 */
	private void handleRebuild(Context ctx) {
		logger.info("Received index rebuild request");

		RebuildResult result = sensitiveWordService.rebuild();
		ctx.status(result.isSuccess() ? 200 : 500).result(gson.toJson(RebuildResponse.from(result)));

		if (result.isSuccess()) {
			logger.info("Index rebuild completed: {}", result.detail());
		} else {
			logger.warn("Index rebuild failed: {}", result.detail());
		}
	}

	/**
	 * Decode and validate the {@code {"text": ...}} body; responds with 400 and returns null if unusable.
	 */
	private String readText(Context ctx) {
		String body;
		try {
			body = StandardCharsets.UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(ctx.bodyAsBytes()))
					.toString();
		} catch (CharacterCodingException e) {
			respondError(ctx, 400, "Request body is not valid UTF-8.");
			logger.warn("Rejected request with invalid UTF-8 body");
			return null;
		}

		TextRequest request;
		try {
			request = gson.fromJson(body, TextRequest.class);
		} catch (JsonParseException e) {
			respondError(ctx, 400, "Request body must be JSON of the form {\"text\": \"...\"}.");
			logger.warn("Rejected malformed JSON request: {}", e.getMessage());
			return null;
		}

		if (request == null || request.text() == null) {
			respondError(ctx, 400, "Field 'text' is required.");
			return null;
		}
		return request.text();
	}

	private static void respondError(Context ctx, int status, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(status).result(gson.toJson(error));
	}
}
