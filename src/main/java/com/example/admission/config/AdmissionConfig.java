package com.example.admission.config;

import com.example.admission.model.LimitPolicy;
import com.example.admission.service.AdmissionController;
import com.example.admission.service.AdmissionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionConfig {

    private static final Logger log = LoggerFactory.getLogger(AdmissionConfig.class);

    /**
     * One controller per configured group, each starting with the policy from configuration.
     * <p>
     * An invalid group fails startup with {@link com.example.admission.exception.InvalidPolicyException},
     * a tier naming an unknown group with {@link com.example.admission.exception.UnknownLimitGroupException}.
     */
    @Bean
    public AdmissionRegistry admissionRegistry(AdmissionProperties properties) {
        Map<String, AdmissionController> controllers = new LinkedHashMap<>();
        Map<String, List<String>> tiers = new LinkedHashMap<>();
        properties.getGroups().forEach((name, group) -> {
            AdmissionController controller = new AdmissionController(name, group.getRetention());
            controller.configure(new LimitPolicy(group.getMaxRequests(), group.getWindow()));
            controllers.put(name, controller);
            if (group.getTiers() != null && !group.getTiers().isEmpty()) {
                tiers.put(name, group.getTiers());
            }
        });

        AdmissionRegistry registry = new AdmissionRegistry(controllers, tiers);
        if (!registry.defaultController().isConfigured()) {
            log.warn("No policy for group '{}'; requests outside other groups will be rejected with 503",
                    AdmissionRegistry.DEFAULT_GROUP);
        }
        return registry;
    }

    /**
     * Clock used for every admission decision. Tests replace it with a controllable one.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
