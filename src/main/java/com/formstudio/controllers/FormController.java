package com.formstudio.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formstudio.AppLogger;
import com.formstudio.FormDesignerService;
import com.formstudio.FormDesignerService.PatchOutcome;
import com.formstudio.models.DesignerConfig;
import com.formstudio.models.FormPatchRequest;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Form listing, parsing and patching, plus designer settings.
 */
public class FormController implements Controller {

    private final FormDesignerService designerService;
    private final ObjectMapper objectMapper;

    public FormController(FormDesignerService designerService, ObjectMapper objectMapper) {
        this.designerService = designerService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/forms", this::listForms);
        app.get("/api/form", this::getForm);
        app.post("/api/form/patch", this::applyPatch);
        app.post("/api/form/patch/preview", this::previewPatch);
        app.get("/api/designer/config", this::getConfig);
        app.put("/api/designer/config", this::putConfig);
    }

    private void listForms(Context ctx) throws Exception {
        ctx.json(Map.of("forms", designerService.listForms()));
    }

    private void getForm(Context ctx) throws Exception {
        ctx.json(designerService.parse(Controller.requirePath(ctx)));
    }

    private void applyPatch(Context ctx) throws Exception {
        patch(ctx, false);
    }

    private void previewPatch(Context ctx) throws Exception {
        patch(ctx, true);
    }

    private void patch(Context ctx, boolean previewOnly) throws Exception {
        String path = Controller.requirePath(ctx);
        PatchOutcome outcome;
        try {
            FormPatchRequest request = objectMapper.readValue(ctx.body(), FormPatchRequest.class);
            outcome = previewOnly
                ? designerService.preview(path, request)
                : designerService.apply(path, request);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("Rejected patch request for " + path + ": " + e.getMessage());
            }
            ctx.status(400).json(Controller.errorBody(e));
            return;
        }
        if (!outcome.hasEdits()) {
            ctx.status(404);
        }
        ctx.json(outcome);
    }

    private void getConfig(Context ctx) {
        ctx.json(designerService.getConfig());
    }

    private void putConfig(Context ctx) throws Exception {
        DesignerConfig config;
        try {
            config = objectMapper.readValue(ctx.body(), DesignerConfig.class);
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Controller.errorBody(e));
            return;
        }
        ctx.json(designerService.saveConfig(config));
    }
}
