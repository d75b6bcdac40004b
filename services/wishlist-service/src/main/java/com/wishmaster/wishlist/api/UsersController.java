package com.wishmaster.wishlist.api;

import com.wishmaster.observability.MetricFactory;
import com.wishmaster.security.AuthenticationResult;
import com.wishmaster.security.AuthorizationManager;
import com.wishmaster.security.Group;
import com.wishmaster.security.Principal;
import com.wishmaster.security.PrincipalDirectory;
import com.wishmaster.wishlist.domain.PrincipalNotFoundException;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Principal endpoints. Both require an authenticated caller. */
@RestController
@RequestMapping("/api/v1/users")
public class UsersController {

    /** Permission needed to inspect another principal. */
    public static final String USERS_READ = "users:read";

    /** Timer around group, role and permission resolution. */
    public static final String RESOLUTION_METRIC = "wishmaster.permission.resolution";

    private final AuthorizationManager authorizationManager;
    private final PrincipalDirectory directory;
    private final MetricFactory metrics;

    public UsersController(
            AuthorizationManager authorizationManager, PrincipalDirectory directory, MetricFactory metrics) {
        this.authorizationManager = authorizationManager;
        this.directory = directory;
        this.metrics = metrics;
    }

    @GetMapping("/me")
    public PrincipalView me(AuthenticationResult authentication) {
        Principal principal = authentication.requireAuthenticated();
        List<String> groups = principal.groups().stream().map(Group::name).sorted().toList();
        return new PrincipalView(principal.id(), principal.status(), groups, sortedPermissions(principal));
    }

    @GetMapping("/{id}/permissions")
    public PrincipalPermissions permissionsOf(AuthenticationResult authentication, @PathVariable UUID id) {
        authorizationManager.requirePermission(authentication.requireAuthenticated(), USERS_READ);
        Principal principal = directory.findPrincipalById(id).orElseThrow(() -> new PrincipalNotFoundException(id));
        return new PrincipalPermissions(principal.id(), sortedPermissions(principal));
    }

    private List<String> sortedPermissions(Principal principal) {
        return metrics.timer(RESOLUTION_METRIC, "Effective permission resolution", "operation", "list")
                .record(() -> authorizationManager.effectivePermissions(principal))
                .stream()
                .sorted()
                .toList();
    }
}
