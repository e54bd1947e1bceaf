package com.progression;

import com.progression.config.CatalogLoader;
import com.progression.engine.ProgressionEngine;
import com.progression.intent.BuildIntent;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.CharacterSnapshotFactory;
import com.progression.snapshot.PendingSelections;
import com.progression.spring.EnableProgression;
import com.progression.suggestion.RankedCandidate;
import com.progression.suggestion.RankedClass;
import com.progression.synergy.ActiveSynergy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ClassPathResource;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Example Spring Boot application demonstrating the progression engine.
 */
@SpringBootApplication
@EnableProgression
public class ProgressionApplication {

    private static final Logger log = LoggerFactory.getLogger(ProgressionApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ProgressionApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ProgressionEngine engine) {
        return args -> {
            log.info("=== Progression Demo Started ===");

            CharacterSnapshot snapshot;
            try (InputStream in = new ClassPathResource("progression/sample-character.json").getInputStream()) {
                snapshot = CharacterSnapshotFactory.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            CatalogLoader catalog = CatalogLoader.load("classpath:progression/sample-catalog.yaml");
            PendingSelections pending = PendingSelections.empty();

            BuildIntent intent = engine.analyzeBuildIntent(snapshot, pending);
            log.info("Primary themes: {}, combat style: {}", intent.getPrimaryThemes(), intent.getCombatStyle());

            for (ActiveSynergy synergy : engine.findActiveSynergies(snapshot)) {
                log.info("Active synergy: {} ({})", synergy.rule().name(), synergy.priority());
            }

            List<RankedCandidate> features = engine.rankFeatures(catalog.getFeatures(), snapshot, pending);
            for (RankedCandidate ranked : features) {
                if (ranked.suggestion() == null) {
                    continue;
                }
                log.info("{} -> tier {} {} ({})", ranked.candidate().getName(), ranked.tier(),
                        ranked.suggestion().reasonCode(), ranked.suggestion().reason());
            }

            for (RankedClass ranked : engine.rankClasses(catalog.getClasses(), snapshot, pending)) {
                log.info("{} -> {} {} ({})", ranked.candidate().getName(), ranked.tierWithBias(),
                        ranked.suggestion().reasonCode(), ranked.suggestion().reason());
            }

            log.info("=== Progression Demo Completed ===");
        };
    }
}
