package com.coopvault.access;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Grants all roles to the configured bootstrap principal on a fresh installation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminBootstrap implements ApplicationRunner {

    private final AccessControlService accessControlService;

    @Value("${coop-vault.access.bootstrap-admin:}")
    private String bootstrapAdmin;

    @Override
    public void run(ApplicationArguments args) {
        if (bootstrapAdmin == null || bootstrapAdmin.isBlank()) {
            log.warn("No coop-vault.access.bootstrap-admin configured; role management needs an existing admin");
            return;
        }
        accessControlService.bootstrapAdmin(bootstrapAdmin);
    }
}
