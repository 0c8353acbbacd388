package com.smartbin.application.startup;

import com.smartbin.application.service.UserAdminService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Crea la cuenta administradora inicial al arrancar si todavía no existe.
 */
@Component
@Slf4j
public class DefaultAdminInitializer implements ApplicationRunner {

    private final UserAdminService userAdminService;

    @Value("${auth.bootstrap-admin.enabled:true}")
    private boolean enabled;

    @Value("${auth.bootstrap-admin.username:admin}")
    private String username;

    @Value("${auth.bootstrap-admin.password:admin123}")
    private String password;

    @Value("${auth.bootstrap-admin.name:Administrador}")
    private String name;

    @Value("${auth.bootstrap-admin.email:admin@lixeira.local}")
    private String email;

    public DefaultAdminInitializer(UserAdminService userAdminService) {
        this.userAdminService = userAdminService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Creación de administrador inicial deshabilitada");
            return;
        }
        if (!userAdminService.ensureAdmin(username, password, name, email)) {
            log.debug("Administrador '{}' ya existe", username);
        }
    }
}
