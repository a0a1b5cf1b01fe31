package com.phillippitts.leaderkey.presentation.controller;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.leaderkey.domain.ActionType;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.ValidationErrorType;
import com.phillippitts.leaderkey.service.config.ConfigCodec;
import com.phillippitts.leaderkey.service.config.ConfigStore;
import com.phillippitts.leaderkey.service.config.SaveResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local REST access to the config store: read the tree, reload it from disk, save it.
 */
@RestController
@RequestMapping("/api/config")
class ConfigController {

    private static final Logger LOG = LogManager.getLogger(ConfigController.class);

    private final ConfigStore store;
    private final ConfigCodec codec;

    ConfigController(ConfigStore store, ConfigCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @GetMapping
    ObjectNode config() {
        return codec.toJson(store.root());
    }

    /** Replaces the whole tree with the posted document; the change is saved debounced. */
    @PutMapping
    ResponseEntity<Map<String, Object>> replace(@RequestBody String document) {
        Group replacement = codec.decode(document);
        boolean changed = store.replaceSubtree(List.of(), replacement);
        LOG.info("Config replaced via API (changed={})", changed);
        return ResponseEntity.ok(Map.of(
                "changed", changed,
                "validationErrors", store.validationErrors().size()));
    }

    @GetMapping("/validation")
    Map<String, ValidationErrorType> validation() {
        return store.validationErrorsByPath();
    }

    /** Distinct values of all actions of the given kinds, e.g. {@code ?types=application,url}. */
    @GetMapping("/values")
    Set<String> values(@RequestParam(name = "types", required = false) List<String> types) {
        Set<ActionType> kinds = EnumSet.noneOf(ActionType.class);
        if (types == null || types.isEmpty()) {
            kinds.addAll(EnumSet.complementOf(EnumSet.of(ActionType.GROUP)));
        } else {
            for (String t : types) {
                kinds.add(ActionType.fromJsonName(t)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown action type: '" + t + "'")));
            }
        }
        return store.actionValues(kinds);
    }

    @PostMapping("/reload")
    ResponseEntity<Map<String, Object>> reload() {
        Group root = store.reloadFromFile().join();
        boolean loaded = !store.isInErrorState();
        return ResponseEntity
                .status(loaded ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of(
                        "loaded", loaded,
                        "items", root.children().size(),
                        "validationErrors", store.validationErrors().size()));
    }

    /**
     * Saves now. With {@code overwrite=true} external changes on disk are replaced without
     * a conflict check.
     */
    @PostMapping("/save")
    ResponseEntity<Map<String, Object>> save(@RequestParam(name = "overwrite", defaultValue = "false")
                                             boolean overwrite) {
        SaveResult result = overwrite ? store.saveOverwriting() : store.save();
        HttpStatus status = switch (result) {
            case WRITTEN, RELOADED -> HttpStatus.OK;
            case CANCELLED -> HttpStatus.CONFLICT;
            case SKIPPED -> HttpStatus.ACCEPTED;
            case FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(Map.of("result", result.name()));
    }
}
