package com.onboarding.core.protocol;

import com.onboarding.core.model.MissionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the configured seed protocols into a store. Projects that already
 * have a protocol are left untouched.
 */
public class ProtocolSeeder {

    private static final Logger log = LoggerFactory.getLogger(ProtocolSeeder.class);

    private static final String SEED_ACTOR = "system";

    private final ProtocolProperties properties;

    public ProtocolSeeder(ProtocolProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the number of protocols created
     */
    public int seed(ProtocolStore store) {
        int created = 0;
        for (var entry : properties.getSeeds().entrySet()) {
            String projectId = entry.getKey();
            var context = MissionContext.administrative(SEED_ACTOR, projectId);
            try {
                store.create(projectId, ProtocolProperties.toStepSpecs(entry.getValue()), context);
                created++;
            } catch (ProtocolAlreadyExistsException e) {
                log.info("Protocol for {} already present, seed skipped", projectId);
            }
        }
        log.info("Seeded {} of {} configured protocols", created, properties.getSeeds().size());
        return created;
    }
}
