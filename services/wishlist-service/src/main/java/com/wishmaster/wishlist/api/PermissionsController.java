package com.wishmaster.wishlist.api;

import com.wishmaster.observability.MetricFactory;
import com.wishmaster.security.AuthenticationResult;
import com.wishmaster.security.AuthorizationManager;
import com.wishmaster.security.Principal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lets the caller ask whether it holds a permission. */
@RestController
@RequestMapping("/api/v1/permissions")
public class PermissionsController {

    private final AuthorizationManager authorizationManager;
    private final MetricFactory metrics;

    public PermissionsController(AuthorizationManager authorizationManager, MetricFactory metrics) {
        this.authorizationManager = authorizationManager;
        this.metrics = metrics;
    }

    @GetMapping("/{name}")
    public PermissionCheck check(AuthenticationResult authentication, @PathVariable String name) {
        Principal principal = authentication.requireAuthenticated();
        boolean granted = metrics.timer(
                        UsersController.RESOLUTION_METRIC, "Effective permission resolution", "operation", "check")
                .record(() -> authorizationManager.hasPermission(principal, name));
        return new PermissionCheck(name, granted);
    }
}
