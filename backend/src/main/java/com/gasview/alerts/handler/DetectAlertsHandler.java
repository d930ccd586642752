package com.gasview.alerts.handler;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.gasview.alerts.exception.InsufficientDataException;
import com.gasview.alerts.exception.NotReadyException;
import com.gasview.alerts.exception.ValidationException;
import com.gasview.alerts.model.*;
import com.gasview.alerts.service.*;
import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class DetectAlertsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final Gson gson = new Gson();
    private final SettingsLoader settingsLoader = new SettingsLoader();
    private final SeriesTableService tableService = new SeriesTableService();
    private final Map<String, String> environment;

    public DetectAlertsHandler() {
        this(System.getenv());
    }

    DetectAlertsHandler(Map<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        response.setHeaders(getCorsHeaders());

        try {
            String body = input.getBody();
            if (body == null || body.isBlank()) {
                return createErrorResponse(400, "Request body is required");
            }

            DetectionRequest request = gson.fromJson(body, DetectionRequest.class);
            if (request == null) {
                return createErrorResponse(400, "Request body is required");
            }

            String column = request.getColumn() != null && !request.getColumn().isBlank()
                    ? request.getColumn()
                    : SensorSeries.DEFAULT_COLUMN;

            SensorSeries series;
            if (request.getRows() != null) {
                series = tableService.toSeries(request.getRows(), column);
            } else if (request.getValues() != null) {
                series = tableService.toSeries(column, request.getValues());
            } else {
                return createErrorResponse(400, "Either rows or values is required");
            }

            // Deployment defaults first, then per-request overrides
            ConfigurationStore config = new ConfigurationStore();
            try {
                config.apply(settingsLoader.fromEnvironment(environment));
            } catch (ValidationException e) {
                context.getLogger().log("Invalid detector settings in environment: " + e.getMessage());
                return createErrorResponse(500, "Detector settings not configured correctly");
            }
            config.apply(request.getConfig());

            AlertDetector detector = new AlertDetector(config);
            detector.setData(series);

            AutoTuneResult tuning = null;
            if (isAutoTuneRequested(request, input.getQueryStringParameters())) {
                tuning = detector.autoTune();
            }

            Set<AlertRule> rules = resolveRules(request);
            DetectionReport report;
            if (rules.contains(AlertRule.COMBINED)) {
                report = detector.detectAll();
            } else {
                if (rules.contains(AlertRule.RUPTURE)) detector.detectMaxMinRupture();
                if (rules.contains(AlertRule.SLOPE)) detector.detectFastSlope();
                if (rules.contains(AlertRule.PLATEAU)) detector.detectPlateau();
                report = detector.getReport();
            }

            DetectionResponse detectionResponse = new DetectionResponse();
            detectionResponse.setColumn(column);
            detectionResponse.setSettings(report.getSettings());
            detectionResponse.setAutoTune(tuning);
            detectionResponse.setCounts(report.getCounts());
            detectionResponse.setSegments(report.getSegments());
            detectionResponse.setRows(tableService.annotate(request.getRows(), report));

            response.setStatusCode(200);
            response.setBody(gson.toJson(detectionResponse));

        } catch (JsonSyntaxException e) {
            return createErrorResponse(400, "Invalid request body: " + e.getMessage());
        } catch (ValidationException | InsufficientDataException e) {
            return createErrorResponse(400, e.getMessage());
        } catch (NotReadyException e) {
            return createErrorResponse(409, e.getMessage());
        } catch (Exception e) {
            context.getLogger().log("Error: " + e.getMessage());
            return createErrorResponse(500, "Internal server error: " + e.getMessage());
        }

        return response;
    }

    private boolean isAutoTuneRequested(DetectionRequest request, Map<String, String> queryParams) {
        if (Boolean.TRUE.equals(request.getAutoTune())) {
            return true;
        }
        return queryParams != null && Boolean.parseBoolean(queryParams.get("autoTune"));
    }

    /**
     * No rules (or "all") means the full pass with the combined alert column.
     */
    private Set<AlertRule> resolveRules(DetectionRequest request) {
        if (request.getRules() == null || request.getRules().isEmpty()) {
            return EnumSet.of(AlertRule.COMBINED);
        }
        Set<AlertRule> rules = EnumSet.noneOf(AlertRule.class);
        for (String key : request.getRules()) {
            rules.add(AlertRule.fromKey(key));
        }
        return rules;
    }

    private APIGatewayProxyResponseEvent createErrorResponse(int statusCode, String message) {
        APIGatewayProxyResponseEvent response = new APIGatewayProxyResponseEvent();
        response.setHeaders(getCorsHeaders());
        response.setStatusCode(statusCode);

        Map<String, String> body = new HashMap<>();
        body.put("error", message);
        response.setBody(gson.toJson(body));

        return response;
    }

    private Map<String, String> getCorsHeaders() {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Access-Control-Allow-Origin", "*");
        headers.put("Access-Control-Allow-Methods", "POST, OPTIONS");
        headers.put("Access-Control-Allow-Headers", "Content-Type");
        return headers;
    }
}
