package com.wishmaster.wishlist.infrastructure.directory;

import com.wishmaster.security.Group;
import com.wishmaster.security.InMemoryPrincipalStore;
import com.wishmaster.security.Permission;
import com.wishmaster.security.Role;
import com.wishmaster.wishlist.config.DirectoryProperties;
import com.wishmaster.wishlist.domain.UserAccount;
import com.wishmaster.wishlist.domain.UserAccountRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Loads groups, roles and accounts from {@link DirectoryProperties} into the in-memory stores
 * once the application has started. Each account gets a fresh principal id.
 */
@Component
public class DirectorySeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DirectorySeeder.class);

    private final DirectoryProperties properties;
    private final InMemoryPrincipalStore principalStore;
    private final UserAccountRepository accounts;
    private final PasswordEncoder passwordEncoder;

    public DirectorySeeder(
            DirectoryProperties properties,
            InMemoryPrincipalStore principalStore,
            UserAccountRepository accounts,
            PasswordEncoder passwordEncoder) {
        this.properties = properties;
        this.principalStore = principalStore;
        this.accounts = accounts;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    /** Populates the stores. Fails on a duplicate account email. */
    public void seed() {
        for (Map.Entry<String, List<String>> role : properties.roles().entrySet()) {
            for (String permission : role.getValue()) {
                principalStore.grantPermission(new Role(role.getKey()), new Permission(permission));
            }
        }
        for (Map.Entry<String, List<String>> group : properties.groups().entrySet()) {
            for (String role : group.getValue()) {
                principalStore.grantRole(new Group(group.getKey()), new Role(role));
            }
        }
        for (DirectoryProperties.Account account : properties.accounts()) {
            UUID principalId = UUID.randomUUID();
            accounts.save(new UserAccount(
                    account.email(), passwordEncoder.encode(account.password()), principalId));
            principalStore.savePrincipal(principalId, account.status());
            for (String group : account.groups()) {
                principalStore.addToGroup(principalId, new Group(group));
            }
            log.debug("Seeded account {} as principal {} ({})", account.email(), principalId, account.status());
        }
        log.info("Directory seeded: {} roles, {} groups, {} accounts",
                properties.roles().size(), properties.groups().size(), properties.accounts().size());
    }
}
