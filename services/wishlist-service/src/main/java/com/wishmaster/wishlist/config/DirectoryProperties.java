package com.wishmaster.wishlist.config;

import com.wishmaster.security.PrincipalStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Initial directory content bound from {@code wishmaster.directory.*}.
 *
 * <pre>
 * wishmaster:
 *   directory:
 *     groups:
 *       owners: [wishlist-editor]
 *     roles:
 *       wishlist-editor: [wishlist:read, wishlist:write]
 *     accounts:
 *       - email: demo@wishmaster.local
 *         password: demo-password
 *         groups: [owners]
 * </pre>
 *
 * @param groups role names granted to each group
 * @param roles permission names granted to each role
 * @param accounts login accounts to create
 */
@ConfigurationProperties(prefix = "wishmaster.directory")
@Validated
public record DirectoryProperties(
        Map<String, List<String>> groups,
        Map<String, List<String>> roles,
        @Valid List<Account> accounts) {

    public DirectoryProperties {
        groups = groups == null ? Map.of() : Map.copyOf(groups);
        roles = roles == null ? Map.of() : Map.copyOf(roles);
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    /**
     * A seeded login account.
     *
     * @param email login name, unique ignoring case
     * @param password raw password, hashed before it is stored
     * @param status principal status (default CONFIRMED)
     * @param groups group memberships
     */
    public record Account(
            @NotBlank String email,
            @NotBlank String password,
            PrincipalStatus status,
            List<String> groups) {

        public Account {
            if (status == null) {
                status = PrincipalStatus.CONFIRMED;
            }
            groups = groups == null ? List.of() : List.copyOf(groups);
        }

        @Override
        public String toString() {
            return "Account[email=%s, password=***, status=%s, groups=%s]"
                    .formatted(email, status, groups);
        }
    }
}
