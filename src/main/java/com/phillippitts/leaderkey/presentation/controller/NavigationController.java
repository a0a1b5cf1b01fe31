package com.phillippitts.leaderkey.presentation.controller;

import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.service.keys.Modifier;
import com.phillippitts.leaderkey.service.navigation.KeyOutcome;
import com.phillippitts.leaderkey.service.navigation.NavigationEngine;
import com.phillippitts.leaderkey.service.navigation.NavigationSnapshot;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * Drives the menu from local clients, the way the app's URL scheme does.
 */
@RestController
@RequestMapping("/api/navigation")
class NavigationController {

    private final NavigationEngine engine;

    NavigationController(NavigationEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    NavigationSnapshot state() {
        return engine.snapshot();
    }

    @PostMapping("/keys")
    KeyPressResponse press(@Valid @RequestBody KeyPressRequest request) {
        Set<Modifier> modifiers = Modifier.parseAll(request.modifiers());
        KeyOutcome outcome = engine.handleKey(request.key(), modifiers, request.shouldExecute());
        return respond(outcome);
    }

    @PostMapping("/back")
    KeyPressResponse back() {
        return respond(engine.goBack());
    }

    @PostMapping("/clear")
    KeyPressResponse clear() {
        return respond(engine.clear());
    }

    @PostMapping("/selection")
    KeyPressResponse moveSelection(@RequestParam(name = "delta", defaultValue = "1") int delta) {
        return respond(engine.moveSelection(delta));
    }

    private KeyPressResponse respond(KeyOutcome outcome) {
        Node node = outcome.node();
        return new KeyPressResponse(outcome.kind().name(), node == null ? null : node.displayName(),
                outcome.closesMenu(), engine.snapshot());
    }

    record KeyPressResponse(String outcome, String item, boolean closed, NavigationSnapshot state) { }
}
